package com.clinical.reasoner.evaluator;

import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.FindingKind;

import java.util.List;

/**
 * Findings for one patient's active medication set, ordered by {@link Finding#ORDER}
 */
public final class SafetyEvaluation {

    private final List<Finding> findings;
    private final List<Diagnostic> diagnostics;

    public SafetyEvaluation(List<Finding> findings, List<Diagnostic> diagnostics) {
        this.findings = List.copyOf(findings);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public List<Finding> getFindings(FindingKind kind) {
        return findings.stream().filter(f -> f.getKind() == kind).toList();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
