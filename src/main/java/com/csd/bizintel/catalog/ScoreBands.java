package com.csd.bizintel.catalog;

/**
 * Qualitative labels derived from numeric scores. Thresholds are inclusive lower bounds and
 * apply to the unrounded score.
 */
public final class ScoreBands {
    private ScoreBands() {}

    public static String compatibilityLevel(double matchScore) {
        if (matchScore >= 80) return "Excellent";
        if (matchScore >= 70) return "Very Good";
        if (matchScore >= 60) return "Good";
        if (matchScore >= 40) return "Fair";
        return "Poor";
    }

    public static String matchRecommendation(double matchScore) {
        if (matchScore >= 75) return "Highly recommended connection";
        if (matchScore >= 60) return "Promising networking opportunity";
        if (matchScore >= 40) return "Consider context before connecting";
        return "Low compatibility - proceed with caution";
    }

    public static String meetingGrade(double probability) {
        if (probability >= 85) return "A+";
        if (probability >= 75) return "A";
        if (probability >= 65) return "B+";
        if (probability >= 55) return "B";
        return "C";
    }

    public static String dealRiskLevel(double probability) {
        if (probability >= 70) return "Low";
        if (probability >= 50) return "Medium";
        return "High";
    }

    public static String dealRecommendedAction(double probability) {
        if (probability >= 70) return "Proceed with confidence";
        if (probability >= 50) return "Proceed with standard precautions";
        return "Consider additional risk mitigation";
    }
}
