package com.clinical.reasoner.graph;

import com.clinical.reasoner.model.AllergyEntry;
import com.clinical.reasoner.model.AllergyFinding;
import com.clinical.reasoner.model.ContraindicationFinding;
import com.clinical.reasoner.model.Finding;
import com.clinical.reasoner.model.InteractionFinding;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Projects records, patient context and findings onto a node/edge graph for visualization.
 * <p>
 * Nodes are keyed by content ({@code drug:warfarin}, {@code condition:asthma}) and indexed in
 * key order, so the same inputs always give the same indices. Edges come only from source
 * records and findings; nothing is inferred.
 */
public class KnowledgeGraphProjector {

    /**
     * Project one patient's facts
     * @param patientId Patient identifier
     * @param records Medication records; records without a drug identity are ignored
     * @param context Allergies and chronic conditions
     * @param findings Asserted findings
     * @return The projected graph
     */
    public KnowledgeGraph project(String patientId, Collection<MedicationRecord> records,
                                  PatientContext context, List<? extends Finding> findings) {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("Patient id cannot be blank");
        }
        if (records == null || context == null || findings == null) {
            throw new IllegalArgumentException("Records, context and findings cannot be null");
        }

        Builder builder = new Builder();
        String patientKey = builder.node(NodeType.PATIENT, patientId);

        for (MedicationRecord record : records) {
            if (record == null || record.getDrugIdentity() == null) {
                continue;
            }
            String evidence = record.getSourcePrescriptionId() != null ? record.getSourcePrescriptionId() : "";
            String drugKey = builder.node(NodeType.MEDICATION, record.getDrugIdentity());
            builder.edge(patientKey, EdgeKind.TAKES, drugKey, evidence, null);
            for (String diagnosis : record.getDiagnoses()) {
                builder.edge(drugKey, EdgeKind.PRESCRIBED_FOR, builder.node(NodeType.CONDITION, diagnosis), evidence, null);
            }
            for (String symptom : record.getSymptoms()) {
                builder.edge(drugKey, EdgeKind.PRESCRIBED_FOR, builder.node(NodeType.SYMPTOM, symptom), evidence, null);
            }
        }

        for (String condition : context.getChronicConditions()) {
            builder.edge(patientKey, EdgeKind.HAS_CONDITION, builder.node(NodeType.CONDITION, condition), "", null);
        }
        for (AllergyEntry allergy : context.getAllergies()) {
            builder.edge(patientKey, EdgeKind.HAS_ALLERGY, builder.node(NodeType.ALLERGY, allergy.getSubstance()),
                    allergy.toString(), null);
        }

        for (Finding finding : findings) {
            if (finding instanceof InteractionFinding interaction) {
                builder.edge(builder.node(NodeType.MEDICATION, interaction.getDrugA()), EdgeKind.INTERACTS_WITH,
                        builder.node(NodeType.MEDICATION, interaction.getDrugB()), finding.getRuleId(),
                        finding.getSeverity());
            } else if (finding instanceof ContraindicationFinding contraindication) {
                builder.edge(builder.node(NodeType.MEDICATION, contraindication.getDrug()), EdgeKind.CONTRAINDICATED_BY,
                        builder.node(NodeType.CONDITION, contraindication.getCondition()), finding.getRuleId(),
                        finding.getSeverity());
            } else if (finding instanceof AllergyFinding allergy) {
                builder.edge(builder.node(NodeType.MEDICATION, allergy.getDrug()), EdgeKind.ALLERGIC_TO,
                        builder.node(NodeType.ALLERGY, allergy.getAllergy().getSubstance()), finding.getRuleId(),
                        finding.getSeverity());
            }
        }

        return builder.build();
    }

    /**
     * Collects nodes and edges by key, then assigns indices in key order
     */
    private static final class Builder {
        private final SortedMap<String, NodeType> nodeTypes = new TreeMap<>();
        private final SortedMap<String, String> nodeLabels = new TreeMap<>();
        private final SortedMap<String, EdgeDraft> edges = new TreeMap<>();

        String node(NodeType type, String identity) {
            String key = type.keyFor(identity);
            nodeTypes.putIfAbsent(key, type);
            nodeLabels.putIfAbsent(key, identity);
            return key;
        }

        void edge(String sourceKey, EdgeKind kind, String targetKey, String evidence, Severity severity) {
            EdgeDraft draft = edges.computeIfAbsent(sourceKey + "|" + kind + "|" + targetKey,
                    k -> new EdgeDraft(sourceKey, kind, targetKey));
            if (evidence != null && !evidence.isEmpty()) {
                draft.evidence.add(evidence);
            }
            if (severity != null && (draft.severity == null || severity.isAtLeast(draft.severity))) {
                draft.severity = severity;
            }
        }

        KnowledgeGraph build() {
            List<GraphNode> nodes = new ArrayList<>();
            Map<String, Integer> indexByKey = new HashMap<>();
            for (Map.Entry<String, NodeType> entry : nodeTypes.entrySet()) {
                int index = nodes.size();
                indexByKey.put(entry.getKey(), index);
                nodes.add(new GraphNode(index, entry.getKey(), entry.getValue(), nodeLabels.get(entry.getKey())));
            }

            List<GraphEdge> result = new ArrayList<>();
            for (EdgeDraft draft : edges.values()) {
                result.add(new GraphEdge(indexByKey.get(draft.sourceKey), indexByKey.get(draft.targetKey), draft.kind,
                        new ArrayList<>(draft.evidence), draft.severity));
            }
            result.sort(Comparator.comparingInt(GraphEdge::getSource)
                    .thenComparingInt(GraphEdge::getTarget)
                    .thenComparing(GraphEdge::getKind));
            return new KnowledgeGraph(nodes, result);
        }
    }

    private static final class EdgeDraft {
        private final String sourceKey;
        private final EdgeKind kind;
        private final String targetKey;
        private final TreeSet<String> evidence = new TreeSet<>();
        private Severity severity;

        EdgeDraft(String sourceKey, EdgeKind kind, String targetKey) {
            this.sourceKey = sourceKey;
            this.kind = kind;
            this.targetKey = targetKey;
        }
    }
}
