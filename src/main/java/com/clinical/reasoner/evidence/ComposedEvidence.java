package com.clinical.reasoner.evidence;

import java.util.List;

/**
 * Output of {@link EvidenceComposer}
 */
public final class ComposedEvidence {

    private final List<ExplainedFinding> headlineFindings;
    private final List<ExplainedChange> changes;
    private final ReviewQueue reviewQueue;

    public ComposedEvidence(List<ExplainedFinding> headlineFindings, List<ExplainedChange> changes,
                            ReviewQueue reviewQueue) {
        this.headlineFindings = List.copyOf(headlineFindings);
        this.changes = List.copyOf(changes);
        this.reviewQueue = reviewQueue;
    }

    /**
     * @return Findings at or above the review threshold, in finding order
     */
    public List<ExplainedFinding> getHeadlineFindings() {
        return headlineFindings;
    }

    /**
     * @return Every change event with its rationale, including those queued for review
     */
    public List<ExplainedChange> getChanges() {
        return changes;
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }
}
