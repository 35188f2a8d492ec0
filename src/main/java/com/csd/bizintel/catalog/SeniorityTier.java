package com.csd.bizintel.catalog;

import java.util.List;
import java.util.Locale;

/**
 * Organizational level inferred from keywords in a job title. Tiers are declared from
 * highest to lowest and the first tier with a matching keyword wins.
 */
public enum SeniorityTier {
    EXECUTIVE(5, List.of("ceo", "founder", "president", "owner")),
    DIRECTOR(4, List.of("director", "vp", "vice president", "head")),
    MANAGER(3, List.of("manager", "lead", "principal")),
    SENIOR(2, List.of("senior", "sr")),
    INDIVIDUAL(1, List.of());

    private final int level;
    private final List<String> keywords;

    SeniorityTier(int level, List<String> keywords) {
        this.level = level;
        this.keywords = keywords;
    }

    public int getLevel() {
        return level;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    // keywords match as substrings, so "Sr. Analyst" and "Head of Sales" both resolve
    public static SeniorityTier fromTitle(String title) {
        if (title == null || title.isBlank()) return INDIVIDUAL;
        String lower = title.toLowerCase(Locale.ROOT);
        for (SeniorityTier tier : values()) {
            if (tier.keywords.stream().anyMatch(lower::contains)) {
                return tier;
            }
        }
        return INDIVIDUAL;
    }
}
