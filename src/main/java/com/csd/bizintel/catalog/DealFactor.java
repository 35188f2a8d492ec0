package com.csd.bizintel.catalog;

/**
 * The five deal features in feature-vector order, with their static importance weights.
 */
public enum DealFactor {
    DEAL_VALUE("Deal Value", 0.2),
    DESCRIPTION_DETAIL("Description Detail", 0.1),
    PARTNER_COMPATIBILITY("Partner Compatibility", 0.4),
    URGENCY("Urgency", 0.1),
    TIMELINE("Timeline", 0.2);

    public static final double REPORTING_THRESHOLD = 0.15;

    private final String displayName;
    private final double importance;

    DealFactor(String displayName, double importance) {
        this.displayName = displayName;
        this.importance = importance;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getImportance() {
        return importance;
    }

    public boolean isReported() {
        return importance > REPORTING_THRESHOLD;
    }
}
