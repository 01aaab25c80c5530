package com.clinical.reasoner.graph;

/**
 * Node types of the patient knowledge graph; the prefix forms the content-addressed node key
 */
public enum NodeType {
    PATIENT("patient"),
    MEDICATION("drug"),
    CONDITION("condition"),
    SYMPTOM("symptom"),
    ALLERGY("allergy");

    private final String keyPrefix;

    NodeType(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public String keyFor(String identity) {
        return keyPrefix + ":" + identity;
    }
}
