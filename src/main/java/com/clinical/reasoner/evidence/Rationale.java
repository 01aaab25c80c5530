package com.clinical.reasoner.evidence;

import java.util.List;

/**
 * Why a finding or change was reported: the facts consulted, the catalog text and the
 * propagated confidence. A rationale that is not asserted carries the consulted facts and
 * confidence only; its explanation is a review note, never a clinical claim.
 */
public final class Rationale {

    private final List<EvidenceFact> facts;
    private final String explanation;
    private final String mechanism;
    private final String management;
    private final double confidence;
    private final ConfidenceBand band;
    private final boolean asserted;

    public Rationale(List<EvidenceFact> facts, String explanation, String mechanism, String management,
                     double confidence, boolean asserted) {
        this.facts = List.copyOf(facts);
        this.explanation = explanation != null ? explanation : "";
        this.mechanism = mechanism != null ? mechanism : "";
        this.management = management != null ? management : "";
        this.confidence = confidence;
        this.band = ConfidenceBand.of(confidence);
        this.asserted = asserted;
    }

    public List<EvidenceFact> getFacts() {
        return facts;
    }

    public List<EvidenceFact> getFacts(EvidenceFact.Kind kind) {
        return facts.stream().filter(f -> f.getKind() == kind).toList();
    }

    public String getExplanation() {
        return explanation;
    }

    public String getMechanism() {
        return mechanism;
    }

    public String getManagement() {
        return management;
    }

    public double getConfidence() {
        return confidence;
    }

    public ConfidenceBand getBand() {
        return band;
    }

    public boolean isAsserted() {
        return asserted;
    }
}
