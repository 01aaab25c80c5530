package com.clinical.reasoner.evidence;

import com.clinical.reasoner.model.ChangeEvent;

/**
 * A change event paired with its rationale. Low-confidence changes stay in the timeline
 * and are additionally queued for review.
 */
public final class ExplainedChange {

    private final ChangeEvent event;
    private final Rationale rationale;

    public ExplainedChange(ChangeEvent event, Rationale rationale) {
        this.event = event;
        this.rationale = rationale;
    }

    public ChangeEvent getEvent() {
        return event;
    }

    public Rationale getRationale() {
        return rationale;
    }

    public boolean needsReview() {
        return !rationale.isAsserted();
    }
}
