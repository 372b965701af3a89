package com.z254.cxlens.radar.rca;

/**
 * L2-regularised logistic regression fitted by full-batch gradient descent.
 * <p>
 * Weights start at zero and the iteration count is fixed, so the fit is
 * bit-for-bit reproducible for the same input.
 */
final class LogisticModel {

    private static final int ITERATIONS = 400;
    private static final double LEARNING_RATE = 0.5;
    private static final double L2 = 1e-3;

    private final double[] weights;
    private final double intercept;

    private LogisticModel(double[] weights, double intercept) {
        this.weights = weights;
        this.intercept = intercept;
    }

    /**
     * @param x standardized features, one row per sample
     * @param y binary labels (0 or 1)
     */
    static LogisticModel fit(double[][] x, double[] y) {
        int n = x.length;
        int p = n == 0 ? 0 : x[0].length;
        double[] w = new double[p];
        double b = 0.0;

        for (int iter = 0; iter < ITERATIONS; iter++) {
            double[] gradW = new double[p];
            double gradB = 0.0;
            for (int i = 0; i < n; i++) {
                double err = sigmoid(dot(w, x[i]) + b) - y[i];
                for (int j = 0; j < p; j++) {
                    gradW[j] += err * x[i][j];
                }
                gradB += err;
            }
            for (int j = 0; j < p; j++) {
                w[j] -= LEARNING_RATE * (gradW[j] / n + L2 * w[j]);
            }
            b -= LEARNING_RATE * gradB / n;
        }
        return new LogisticModel(w, b);
    }

    double[] weights() {
        return weights.clone();
    }

    double intercept() {
        return intercept;
    }

    boolean isFinite() {
        if (!Double.isFinite(intercept)) {
            return false;
        }
        for (double w : weights) {
            if (!Double.isFinite(w)) {
                return false;
            }
        }
        return true;
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
