package org.carball.placement.model.analysis;

public enum BlockingAction {
    BLOCK_IMMEDIATELY("BLOCK IMMEDIATELY"),
    BLOCK("BLOCK");

    private final String label;

    BlockingAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
