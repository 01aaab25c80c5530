package com.clinical.reasoner.evidence;

import com.clinical.reasoner.model.Finding;

/**
 * A finding paired with its rationale
 */
public final class ExplainedFinding {

    private final Finding finding;
    private final Rationale rationale;

    public ExplainedFinding(Finding finding, Rationale rationale) {
        this.finding = finding;
        this.rationale = rationale;
    }

    public Finding getFinding() {
        return finding;
    }

    public Rationale getRationale() {
        return rationale;
    }

    public boolean needsReview() {
        return !rationale.isAsserted();
    }
}
