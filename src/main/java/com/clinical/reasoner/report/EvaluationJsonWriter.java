package com.clinical.reasoner.report;

import com.clinical.reasoner.engine.EvaluationResult;
import com.clinical.reasoner.evidence.EvidenceFact;
import com.clinical.reasoner.evidence.ExplainedChange;
import com.clinical.reasoner.evidence.ExplainedFinding;
import com.clinical.reasoner.evidence.Rationale;
import com.clinical.reasoner.graph.GraphEdge;
import com.clinical.reasoner.graph.GraphNode;
import com.clinical.reasoner.graph.KnowledgeGraph;
import com.clinical.reasoner.model.AllergyFinding;
import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.ConcurrentUse;
import com.clinical.reasoner.model.ContraindicationFinding;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.DuplicateTherapyFinding;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.InteractionFinding;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.PeriodOverlap;
import com.clinical.reasoner.model.TimelineSnapshot;
import com.clinical.reasoner.model.TreatmentGap;
import com.clinical.reasoner.timeline.VisitComparison;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializes evaluation results to JSON.
 * <p>
 * The document is assembled as ordered maps from the result's own accessors and written with
 * sorted keys, so equal results always serialize to identical bytes.
 */
public class EvaluationJsonWriter {

    private final ObjectMapper objectMapper;

    public EvaluationJsonWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serialize one evaluation
     * @param result Evaluation result
     * @return Pretty-printed JSON document
     */
    public String write(EvaluationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("EvaluationResult cannot be null");
        }
        return serialize(toDocument(result), result.getPatientId());
    }

    /**
     * Serialize several evaluations as one JSON array
     * @param results Evaluation results in output order
     * @return Pretty-printed JSON array
     */
    public String writeAll(List<EvaluationResult> results) {
        if (results == null) {
            throw new IllegalArgumentException("Results cannot be null");
        }
        List<Map<String, Object>> documents = new ArrayList<>();
        for (EvaluationResult result : results) {
            documents.add(toDocument(result));
        }
        return serialize(documents, results.size() + " patients");
    }

    /**
     * Build the document tree for one evaluation
     * @param result Evaluation result
     * @return Map of plain values, lists and nested maps
     */
    Map<String, Object> toDocument(EvaluationResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("patientId", result.getPatientId());
        doc.put("asOfDate", result.getAsOfDate());
        doc.put("catalogVersion", result.getCatalogVersion());
        doc.put("riskLevel", result.getRiskLevel().name());
        doc.put("timeline", timeline(result.getTimeline()));

        List<Map<String, Object>> changes = new ArrayList<>();
        for (ExplainedChange change : result.getChanges()) {
            changes.add(change(change));
        }
        doc.put("changes", changes);
        doc.put("visitComparison", result.getVisitComparison().map(this::visitComparison).orElse(null));

        doc.put("findings", findings(result.getFindings()));
        doc.put("highPriorityFindings", result.getHighPriorityFindings().stream()
                .map(f -> f.getFinding().getRuleId() + "|" + f.getFinding().involvedKey())
                .toList());

        Map<String, Object> review = new LinkedHashMap<>();
        review.put("findings", findings(result.getReviewQueue().getFindings()));
        List<Map<String, Object>> reviewChanges = new ArrayList<>();
        for (ExplainedChange change : result.getReviewQueue().getChanges()) {
            reviewChanges.add(change(change));
        }
        review.put("changes", reviewChanges);
        doc.put("reviewQueue", review);

        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("kind", diagnostic.getKind().name());
            d.put("subject", diagnostic.getSubject());
            d.put("message", diagnostic.getMessage());
            diagnostics.add(d);
        }
        doc.put("diagnostics", diagnostics);
        doc.put("graph", graph(result.getGraph()));
        return doc;
    }

    private Map<String, Object> timeline(TimelineSnapshot snapshot) {
        Map<String, Object> timeline = new LinkedHashMap<>();
        Map<String, Object> periodsByDrug = new LinkedHashMap<>();
        for (Map.Entry<String, List<MedicationPeriod>> entry : snapshot.getPeriodsByDrug().entrySet()) {
            List<Map<String, Object>> periods = new ArrayList<>();
            for (MedicationPeriod period : entry.getValue()) {
                Map<String, Object> p = new LinkedHashMap<>();
                p.put("start", period.getStartDate());
                p.put("end", period.getEndDate());
                p.put("endKind", period.getEndKind().name());
                p.put("dose", period.getDose().toString());
                p.put("frequency", period.getFrequency().getCode());
                p.put("route", period.getRoute().name());
                p.put("sourceRecordIds", period.getSourceRecordIds());
                p.put("conflictingRecordIds", period.getConflictingRecordIds());
                p.put("confidence", period.getConfidence());
                p.put("active", period.isActiveOn(snapshot.getAsOfDate()));
                periods.add(p);
            }
            periodsByDrug.put(entry.getKey(), periods);
        }
        timeline.put("periods", periodsByDrug);
        timeline.put("activeDrugs", new ArrayList<>(snapshot.getActiveDrugs()));

        List<Map<String, Object>> gaps = new ArrayList<>();
        for (TreatmentGap gap : snapshot.getTreatmentGaps()) {
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("drug", gap.getDrugIdentity());
            g.put("stoppedOn", gap.getStoppedOn());
            g.put("resumedOn", gap.getResumedOn());
            g.put("days", gap.getDays());
            gaps.add(g);
        }
        timeline.put("treatmentGaps", gaps);

        List<Map<String, Object>> overlaps = new ArrayList<>();
        for (PeriodOverlap overlap : snapshot.getOverlaps()) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("drug", overlap.getDrugIdentity());
            o.put("start", overlap.getOverlapStart());
            o.put("end", overlap.getOverlapEnd());
            overlaps.add(o);
        }
        timeline.put("overlaps", overlaps);

        List<Map<String, Object>> concurrent = new ArrayList<>();
        for (ConcurrentUse use : snapshot.getConcurrentUse()) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("drugA", use.getDrugA());
            c.put("drugB", use.getDrugB());
            c.put("start", use.getStart());
            c.put("end", use.getEnd());
            c.put("days", use.getDays());
            c.put("significant", use.isSignificant());
            concurrent.add(c);
        }
        timeline.put("concurrentUse", concurrent);
        return timeline;
    }

    private Map<String, Object> visitComparison(VisitComparison comparison) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("earlierVisit", comparison.getEarlierVisit());
        v.put("laterVisit", comparison.getLaterVisit());
        v.put("new", comparison.getNewDrugs());
        v.put("restarted", comparison.getRestartedDrugs());
        v.put("discontinued", comparison.getDiscontinuedDrugs());
        v.put("continued", comparison.getContinuedDrugs());
        List<Map<String, Object>> changes = new ArrayList<>();
        for (VisitComparison.RegimenChange change : comparison.getRegimenChanges()) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("drug", change.getDrugIdentity());
            c.put("aspect", change.getAspect().name());
            c.put("from", change.getFrom());
            c.put("to", change.getTo());
            changes.add(c);
        }
        v.put("changes", changes);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("newCount", comparison.getNewDrugs().size());
        summary.put("restartedCount", comparison.getRestartedDrugs().size());
        summary.put("discontinuedCount", comparison.getDiscontinuedDrugs().size());
        summary.put("continuedCount", comparison.getContinuedDrugs().size());
        summary.put("changeCount", comparison.getRegimenChanges().size());
        v.put("summary", summary);
        return v;
    }

    private Map<String, Object> change(ExplainedChange change) {
        ChangeEvent event = change.getEvent();
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("drug", event.getDrugIdentity());
        c.put("date", event.getDate());
        c.put("kind", event.getKind().name());
        c.put("previousValue", event.getPreviousValue());
        c.put("newValue", event.getNewValue());
        c.put("sourceRecordIds", event.getSourceRecordIds());
        c.put("ambiguous", event.isAmbiguous());
        c.put("overlapping", event.isOverlapping());
        c.put("visible", event.isVisible());
        c.put("rationale", rationale(change.getRationale()));
        return c;
    }

    private List<Map<String, Object>> findings(List<ExplainedFinding> explainedFindings) {
        List<Map<String, Object>> findings = new ArrayList<>();
        for (ExplainedFinding explained : explainedFindings) {
            Finding finding = explained.getFinding();
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("kind", finding.getKind().name());
            f.put("severity", finding.getSeverity().name());
            f.put("involvedEntities", finding.getInvolvedEntities());
            f.put("ruleId", finding.getRuleId());
            f.put("supportingRuleIds", finding.getSupportingRuleIds());
            f.put("sourceRecordIds", finding.getSourceRecordIds());
            f.put("summary", finding.summary());
            if (finding instanceof InteractionFinding interaction) {
                f.put("exactMatch", interaction.isExactMatch());
                f.put("classA", interaction.getClassA());
                f.put("classB", interaction.getClassB());
            } else if (finding instanceof AllergyFinding allergy) {
                f.put("allergy", allergy.getAllergy().toString());
                f.put("match", allergy.getMatch().name());
            } else if (finding instanceof ContraindicationFinding contraindication) {
                f.put("condition", contraindication.getCondition());
                f.put("matchedOn", contraindication.getMatchedOn());
            } else if (finding instanceof DuplicateTherapyFinding duplicate) {
                f.put("therapeuticClass", duplicate.getTherapeuticClass());
            }
            f.put("rationale", rationale(explained.getRationale()));
            findings.add(f);
        }
        return findings;
    }

    private Map<String, Object> rationale(Rationale rationale) {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put("explanation", rationale.getExplanation());
        r.put("mechanism", rationale.getMechanism());
        r.put("management", rationale.getManagement());
        r.put("confidence", rationale.getConfidence());
        r.put("band", rationale.getBand().name().toLowerCase(Locale.ROOT));
        r.put("asserted", rationale.isAsserted());
        List<Map<String, Object>> facts = new ArrayList<>();
        for (EvidenceFact fact : rationale.getFacts()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("kind", fact.getKind().name());
            f.put("reference", fact.getReference());
            f.put("detail", fact.getDetail());
            facts.add(f);
        }
        r.put("facts", facts);
        return r;
    }

    private Map<String, Object> graph(KnowledgeGraph graph) {
        Map<String, Object> g = new LinkedHashMap<>();
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (GraphNode node : graph.getNodes()) {
            Map<String, Object> n = new LinkedHashMap<>();
            n.put("index", node.getIndex());
            n.put("key", node.getKey());
            n.put("type", node.getType().name());
            n.put("label", node.getLabel());
            nodes.add(n);
        }
        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("source", edge.getSource());
            e.put("target", edge.getTarget());
            e.put("kind", edge.getKind().name());
            e.put("evidence", edge.getEvidence());
            e.put("severity", edge.getSeverity() != null ? edge.getSeverity().name() : null);
            edges.add(e);
        }
        g.put("nodes", nodes);
        g.put("edges", edges);
        return g;
    }

    private String serialize(Object document, String subject) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evaluation for " + subject, e);
        }
    }
}
