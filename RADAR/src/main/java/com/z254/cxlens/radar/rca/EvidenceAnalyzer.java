package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;

/**
 * One independent evidence signal for a hypothesis.
 * <p>
 * Insufficient data yields an inapplicable term, never an exception.
 */
public interface EvidenceAnalyzer {

    EvidenceMethod method();

    EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset);
}
