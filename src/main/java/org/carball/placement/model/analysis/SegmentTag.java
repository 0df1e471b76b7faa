package org.carball.placement.model.analysis;

public enum SegmentTag {
    EFFECTIVE("A", "Effective"),
    MEDIUM("B", "Medium"),
    INEFFECTIVE("C", "Ineffective");

    private final String category;
    private final String displayName;

    SegmentTag(String category, String displayName) {
        this.category = category;
        this.displayName = displayName;
    }

    public String getCategory() {
        return category;
    }

    public String getDisplayName() {
        return displayName;
    }
}
