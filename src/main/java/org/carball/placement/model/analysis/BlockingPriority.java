package org.carball.placement.model.analysis;

public enum BlockingPriority {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    SUPPLEMENTARY("Supplementary");

    private final String displayName;

    BlockingPriority(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
