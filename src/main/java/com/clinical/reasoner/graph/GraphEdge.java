package com.clinical.reasoner.graph;

import com.clinical.reasoner.model.Severity;

import java.util.List;

/**
 * A directed edge between two node indices. Evidence lists the record or rule ids that
 * support the edge; severity is set only for edges derived from findings.
 */
public final class GraphEdge {

    private final int source;
    private final int target;
    private final EdgeKind kind;
    private final List<String> evidence;
    private final Severity severity;

    public GraphEdge(int source, int target, EdgeKind kind, List<String> evidence, Severity severity) {
        this.source = source;
        this.target = target;
        this.kind = kind;
        this.evidence = List.copyOf(evidence);
        this.severity = severity;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return source + " -" + kind.label() + "-> " + target;
    }
}
