package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisTestResult;
import com.z254.cxlens.radar.domain.model.RcaReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders an RCA report as plain text for on-call channels.
 */
@Component
public class RcaReportFormatter {

    static final int MAX_CAUSES = 5;
    private static final String RULE = "=".repeat(60);
    private static final String SUB_RULE = "-".repeat(60);

    public String format(RcaReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("ROOT CAUSE ANALYSIS REPORT").append('\n');
        sb.append(RULE).append('\n');
        sb.append("Incident ID: ").append(report.getIncidentId()).append('\n');
        sb.append("Metric: ").append(report.getMetricName()).append('\n');
        sb.append("Direction: ").append(report.getDirection()).append('\n');
        sb.append("Generated: ").append(report.getGeneratedAt()).append('\n');
        sb.append('\n');

        section(sb, "SUMMARY", report.getSummary());
        section(sb, "NARRATIVE", report.getNarrative());

        sb.append("RANKED CAUSES").append('\n');
        sb.append(SUB_RULE).append('\n');
        List<HypothesisTestResult> causes = report.getRankedCauses();
        for (int i = 0; i < Math.min(MAX_CAUSES, causes.size()); i++) {
            HypothesisTestResult cause = causes.get(i);
            Hypothesis hypothesis = cause.getHypothesis();
            sb.append(i + 1).append(". ").append(hypothesis.getName()).append('\n');
            sb.append("   Category: ").append(hypothesis.getCategory().label()).append('\n');
            sb.append(String.format(Locale.ROOT, "   Confidence: %.0f%%\n", cause.getConfidence() * 100));
            sb.append(String.format(Locale.ROOT, "   Impact: %.2f\n", cause.getImpact()));
            sb.append(String.format(Locale.ROOT, "   Score: %.3f\n", cause.getCombinedScore()));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, String body) {
        sb.append(title).append('\n');
        sb.append(SUB_RULE).append('\n');
        sb.append(body).append('\n');
        sb.append('\n');
    }
}
