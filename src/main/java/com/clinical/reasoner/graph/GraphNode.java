package com.clinical.reasoner.graph;

/**
 * A node addressed both by its content key ("drug:warfarin") and by its index in the
 * key-sorted node list
 */
public final class GraphNode {

    private final int index;
    private final String key;
    private final NodeType type;
    private final String label;

    public GraphNode(int index, String key, NodeType type, String label) {
        this.index = index;
        this.key = key;
        this.type = type;
        this.label = label;
    }

    public int getIndex() {
        return index;
    }

    public String getKey() {
        return key;
    }

    public NodeType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return index + ":" + key;
    }
}
