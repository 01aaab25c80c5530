package com.clinical.reasoner.engine;

import com.clinical.reasoner.catalog.CatalogLoader;
import com.clinical.reasoner.catalog.RuleCatalog;
import com.clinical.reasoner.evaluator.SafetyEvaluation;
import com.clinical.reasoner.evaluator.SafetyEvaluator;
import com.clinical.reasoner.evidence.ComposedEvidence;
import com.clinical.reasoner.evidence.EvidenceComposer;
import com.clinical.reasoner.evidence.ExplainedFinding;
import com.clinical.reasoner.graph.KnowledgeGraph;
import com.clinical.reasoner.graph.KnowledgeGraphProjector;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.model.RiskLevel;
import com.clinical.reasoner.model.Severity;
import com.clinical.reasoner.timeline.BuiltTimeline;
import com.clinical.reasoner.timeline.ChangeDetector;
import com.clinical.reasoner.timeline.DetectedChanges;
import com.clinical.reasoner.timeline.TimelineBuilder;
import com.clinical.reasoner.timeline.VisitComparator;
import com.clinical.reasoner.timeline.VisitComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs the full reasoning pipeline for one patient: timeline, change detection, visit
 * comparison, safety evaluation, evidence composition and graph projection.
 * <p>
 * The engine holds only the immutable catalog and stateless stage objects, so one instance can
 * serve any number of concurrent evaluations. An evaluation performs no I/O.
 */
public class ClinicalReasoningEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalReasoningEngine.class);

    private final RuleCatalog catalog;
    private final TimelineBuilder timelineBuilder;
    private final ChangeDetector changeDetector;
    private final VisitComparator visitComparator;
    private final SafetyEvaluator safetyEvaluator;
    private final EvidenceComposer evidenceComposer;
    private final KnowledgeGraphProjector graphProjector;

    public ClinicalReasoningEngine(RuleCatalog catalog) {
        this(catalog, EngineConfig.defaults());
    }

    public ClinicalReasoningEngine(RuleCatalog catalog, EngineConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("RuleCatalog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("EngineConfig cannot be null");
        }
        this.catalog = catalog;
        this.timelineBuilder = new TimelineBuilder(
                config.getContinuityWindowDays(),
                config.isInferStopFromVisits(),
                config.getSameDayConflictPenalty(),
                config.getSignificantOverlapDays());
        this.changeDetector = new ChangeDetector(config.getIncomparableDosePenalty());
        this.visitComparator = new VisitComparator();
        this.safetyEvaluator = new SafetyEvaluator(catalog, config.getExactRuleConfidence(),
                config.getClassRuleConfidence());
        this.evidenceComposer = new EvidenceComposer(config.getReviewThreshold());
        this.graphProjector = new KnowledgeGraphProjector();
    }

    /**
     * Load the catalog named by the configuration and build an engine around it
     * @param config Engine configuration
     * @return Engine ready for evaluations
     * @throws com.clinical.reasoner.catalog.CatalogLoadException if the catalog cannot be loaded
     */
    public static ClinicalReasoningEngine fromConfig(EngineConfig config) {
        RuleCatalog catalog = new CatalogLoader().fromClasspath(config.getCatalogResource());
        return new ClinicalReasoningEngine(catalog, config);
    }

    /**
     * Evaluate one patient
     * @param patientId Patient identifier, used for the graph and the result
     * @param records Medication records in any order
     * @param context Allergies, chronic conditions and the as-of date
     * @return Timeline, explained changes, visit comparison, headline findings, review queue, diagnostics and graph
     */
    public EvaluationResult evaluate(String patientId, Collection<MedicationRecord> records, PatientContext context) {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("Patient id cannot be blank");
        }
        if (records == null) {
            throw new IllegalArgumentException("Medication records cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("PatientContext cannot be null");
        }

        BuiltTimeline timeline = timelineBuilder.build(records, context.getAsOfDate());
        DetectedChanges changes = changeDetector.detect(timeline.getSnapshot());
        VisitComparison visitComparison = visitComparator
                .compareLatestVisits(timeline.getAcceptedRecords(), context.getAsOfDate())
                .orElse(null);
        SafetyEvaluation safety = safetyEvaluator.evaluate(timeline.getSnapshot(), context);
        ComposedEvidence evidence = evidenceComposer.compose(safety.getFindings(), changes.getEvents(),
                timeline.getSnapshot());

        List<Finding> headline = evidence.getHeadlineFindings().stream()
                .map(ExplainedFinding::getFinding)
                .toList();
        List<ExplainedFinding> highPriority = evidence.getHeadlineFindings().stream()
                .filter(f -> f.getFinding().getSeverity().isAtLeast(Severity.MAJOR))
                .toList();
        KnowledgeGraph graph = graphProjector.project(patientId, timeline.getAcceptedRecords(), context, headline);

        List<Diagnostic> diagnostics = new ArrayList<>(timeline.getDiagnostics());
        diagnostics.addAll(changes.getDiagnostics());
        diagnostics.addAll(safety.getDiagnostics());
        diagnostics.sort(Diagnostic.ORDER);

        RiskLevel riskLevel = RiskLevel.assess(headline);
        logger.debug("Patient {}: {} findings ({} for review), {} diagnostics, risk {}",
                patientId, headline.size(), evidence.getReviewQueue().size(), diagnostics.size(), riskLevel);

        return new EvaluationResult(patientId, context.getAsOfDate(), catalog.getVersion(), timeline.getSnapshot(),
                evidence.getChanges(), evidence.getHeadlineFindings(), highPriority, evidence.getReviewQueue(),
                diagnostics, riskLevel, graph, visitComparison);
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }
}
