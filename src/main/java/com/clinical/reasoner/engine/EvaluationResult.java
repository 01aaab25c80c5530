package com.clinical.reasoner.engine;

import com.clinical.reasoner.evidence.ExplainedChange;
import com.clinical.reasoner.evidence.ExplainedFinding;
import com.clinical.reasoner.evidence.ReviewQueue;
import com.clinical.reasoner.graph.KnowledgeGraph;
import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.RiskLevel;
import com.clinical.reasoner.model.TimelineSnapshot;
import com.clinical.reasoner.timeline.VisitComparison;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Everything one evaluation produced for one patient
 */
public final class EvaluationResult {

    private final String patientId;
    private final LocalDate asOfDate;
    private final String catalogVersion;
    private final TimelineSnapshot timeline;
    private final List<ExplainedChange> changes;
    private final List<ExplainedFinding> findings;
    private final List<ExplainedFinding> highPriorityFindings;
    private final ReviewQueue reviewQueue;
    private final List<Diagnostic> diagnostics;
    private final RiskLevel riskLevel;
    private final KnowledgeGraph graph;
    private final VisitComparison visitComparison;

    public EvaluationResult(String patientId, LocalDate asOfDate, String catalogVersion, TimelineSnapshot timeline,
                            List<ExplainedChange> changes, List<ExplainedFinding> findings,
                            List<ExplainedFinding> highPriorityFindings, ReviewQueue reviewQueue,
                            List<Diagnostic> diagnostics, RiskLevel riskLevel, KnowledgeGraph graph,
                            VisitComparison visitComparison) {
        this.patientId = patientId;
        this.asOfDate = asOfDate;
        this.catalogVersion = catalogVersion;
        this.timeline = timeline;
        this.changes = List.copyOf(changes);
        this.findings = List.copyOf(findings);
        this.highPriorityFindings = List.copyOf(highPriorityFindings);
        this.reviewQueue = reviewQueue;
        this.diagnostics = List.copyOf(diagnostics);
        this.riskLevel = riskLevel;
        this.graph = graph;
        this.visitComparison = visitComparison;
    }

    public String getPatientId() {
        return patientId;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public String getCatalogVersion() {
        return catalogVersion;
    }

    public TimelineSnapshot getTimeline() {
        return timeline;
    }

    public List<ExplainedChange> getChanges() {
        return changes;
    }

    /**
     * @return Change events only, in timeline order
     */
    public List<ChangeEvent> getChangeEvents() {
        return changes.stream().map(ExplainedChange::getEvent).toList();
    }

    /**
     * @return Headline findings: asserted, at or above the review threshold
     */
    public List<ExplainedFinding> getFindings() {
        return findings;
    }

    public List<Finding> getFindingList() {
        return findings.stream().map(ExplainedFinding::getFinding).toList();
    }

    /**
     * @return Headline findings of major or contraindicated severity
     */
    public List<ExplainedFinding> getHighPriorityFindings() {
        return highPriorityFindings;
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    /**
     * @return Comparison of the two latest visits, empty when fewer than two are on record
     */
    public Optional<VisitComparison> getVisitComparison() {
        return Optional.ofNullable(visitComparison);
    }
}
