package com.clinical.reasoner.evidence;

import java.util.List;

/**
 * Items whose confidence fell below the review threshold. They are not asserted as findings;
 * a clinician decides what they mean.
 */
public final class ReviewQueue {

    private final List<ExplainedFinding> findings;
    private final List<ExplainedChange> changes;

    public ReviewQueue(List<ExplainedFinding> findings, List<ExplainedChange> changes) {
        this.findings = List.copyOf(findings);
        this.changes = List.copyOf(changes);
    }

    public List<ExplainedFinding> getFindings() {
        return findings;
    }

    public List<ExplainedChange> getChanges() {
        return changes;
    }

    public int size() {
        return findings.size() + changes.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty() && changes.isEmpty();
    }
}
