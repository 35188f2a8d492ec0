package com.csd.bizintel.catalog;

import java.util.Locale;
import java.util.Map;

/**
 * Directed affinity between industries. The table is asymmetric: the row is the
 * first profile's industry, the column the second's.
 */
public final class IndustryAffinity {
    public static final double UNKNOWN_PAIR = 0.5;

    private static final Map<String, Map<String, Double>> TABLE = Map.of(
            "technology", Map.of("finance", 0.8, "healthcare", 0.7, "technology", 0.9, "marketing", 0.75),
            "finance", Map.of("technology", 0.8, "real-estate", 0.9, "finance", 0.6, "consulting", 0.85),
            "healthcare", Map.of("technology", 0.7, "pharmaceuticals", 0.9, "healthcare", 0.5, "research", 0.8),
            "marketing", Map.of("technology", 0.75, "retail", 0.8, "media", 0.9, "marketing", 0.6),
            "consulting", Map.of("finance", 0.85, "technology", 0.75, "healthcare", 0.7, "consulting", 0.5)
    );

    private IndustryAffinity() {}

    public static double of(String from, String to) {
        if (from == null || to == null) return UNKNOWN_PAIR;
        Map<String, Double> row = TABLE.get(from.toLowerCase(Locale.ROOT));
        if (row == null) return UNKNOWN_PAIR;
        return row.getOrDefault(to.toLowerCase(Locale.ROOT), UNKNOWN_PAIR);
    }

    public static Map<String, Map<String, Double>> table() {
        return TABLE;
    }
}
