package com.csd.bizintel.service;

import com.csd.bizintel.catalog.IndustryAffinity;
import com.csd.bizintel.catalog.SeniorityTier;
import com.csd.bizintel.model.MatchBreakdown;
import com.csd.bizintel.model.MeetingContext;
import com.csd.bizintel.model.Profile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Pairwise compatibility between two profiles and the likelihood that a meeting between them
 * leads to a business outcome. Stateless; safe for concurrent use.
 */
@Slf4j
@Service
public class CompatibilityEngine {

    static final double INDUSTRY_WEIGHT = 0.25;
    static final double TITLE_WEIGHT = 0.20;
    static final double BIO_WEIGHT = 0.20;
    static final double NETWORK_WEIGHT = 0.15;
    static final double LOCATION_WEIGHT = 0.20;

    static final double MEETING_MATCH_WEIGHT = 0.40;
    static final double MEETING_CONTEXT_WEIGHT = 0.25;
    static final double MEETING_REPUTATION_WEIGHT = 0.20;
    static final double MEETING_HISTORY_WEIGHT = 0.15;
    static final double HISTORICAL_SUCCESS_RATE = 0.65;
    static final double DEFAULT_CONTEXT_SCORE = 0.7;
    static final double DEFAULT_REPUTATION = 50;
    static final double FALLBACK_MEETING_PROBABILITY = 50.0;

    private static final Set<String> PRODUCTIVE_MEETING_TYPES = Set.of("business", "networking");
    private static final Set<String> PROFESSIONAL_VENUES = Set.of("office", "conference", "coffee_shop");

    private final BioKeywordExtractor keywordExtractor;

    public CompatibilityEngine(BioKeywordExtractor keywordExtractor) {
        this.keywordExtractor = keywordExtractor;
    }

    /**
     * Weighted match score in [0,100]. Never throws; any failure scores 0.
     */
    public double calculateMatchScore(Profile first, Profile second) {
        try {
            return analyzeMatch(first, second).getOverall();
        } catch (Exception e) {
            log.error("Error calculating match score: {}", e.getMessage(), e);
            return 0.0;
        }
    }

    public MatchBreakdown analyzeMatch(Profile first, Profile second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Both profiles are required for a match");
        }
        double industry = industryCompatibility(first.getIndustry(), second.getIndustry());
        double title = titleSynergy(first.getTitle(), second.getTitle());
        double bio = bioSimilarity(first.getBio(), second.getBio());
        double network = networkValueCompatibility(first.getNetworkValue(), second.getNetworkValue());
        double location = locationProximity(first.getLocation(), second.getLocation());

        double weighted = industry * INDUSTRY_WEIGHT
                + title * TITLE_WEIGHT
                + bio * BIO_WEIGHT
                + network * NETWORK_WEIGHT
                + location * LOCATION_WEIGHT;
        double overall = clamp(weighted * 100, 0, 100);
        log.debug("Match sub-scores industry={} title={} bio={} network={} location={} -> {}",
                industry, title, bio, network, location, overall);

        return MatchBreakdown.builder()
                .industry(industry)
                .title(title)
                .bio(bio)
                .network(network)
                .location(location)
                .overall(overall)
                .build();
    }

    /**
     * Probability in [0,100] that a meeting between the two profiles succeeds. A missing
     * context contributes a fixed default. Never throws; any failure yields 50.
     */
    public double predictMeetingSuccess(Profile first, Profile second, MeetingContext context) {
        try {
            double compatibility = calculateMatchScore(first, second) / 100;
            double contextScore = context == null || context.isEmpty()
                    ? DEFAULT_CONTEXT_SCORE
                    : contextScore(context);
            double averageReputation = (reputation(first) + reputation(second)) / 2 / 100;

            double probability = (compatibility * MEETING_MATCH_WEIGHT
                    + contextScore * MEETING_CONTEXT_WEIGHT
                    + averageReputation * MEETING_REPUTATION_WEIGHT
                    + HISTORICAL_SUCCESS_RATE * MEETING_HISTORY_WEIGHT) * 100;
            return clamp(probability, 0, 100);
        } catch (Exception e) {
            log.error("Error predicting meeting success: {}", e.getMessage(), e);
            return FALLBACK_MEETING_PROBABILITY;
        }
    }

    double industryCompatibility(String first, String second) {
        return IndustryAffinity.of(nullToEmpty(first), nullToEmpty(second));
    }

    double titleSynergy(String first, String second) {
        int gap = Math.abs(SeniorityTier.fromTitle(first).getLevel() - SeniorityTier.fromTitle(second).getLevel());
        if (gap >= 1 && gap <= 2) return 0.8; // mentoring distance
        if (gap == 0) return 0.6;
        return 0.4;
    }

    double bioSimilarity(String first, String second) {
        if (isBlank(first) || isBlank(second)) return 0.5;
        try {
            Set<String> keywords1 = keywordExtractor.extract(first);
            Set<String> keywords2 = keywordExtractor.extract(second);
            if (keywords1.isEmpty() || keywords2.isEmpty()) return 0.5;

            Set<String> intersection = new HashSet<>(keywords1);
            intersection.retainAll(keywords2);
            Set<String> union = new HashSet<>(keywords1);
            union.addAll(keywords2);
            return (double) intersection.size() / union.size();
        } catch (Exception e) {
            log.error("Error calculating bio similarity: {}", e.getMessage());
            return 0.5;
        }
    }

    double networkValueCompatibility(Double first, Double second) {
        double a = first == null ? 0 : first;
        double b = second == null ? 0 : second;
        if (a <= 0 || b <= 0) return 0.3;
        double ratio = Math.min(a, b) / Math.max(a, b);
        return ratio * 0.8 + 0.2;
    }

    double locationProximity(String first, String second) {
        if (isBlank(first) || isBlank(second)) return 0.5;
        String a = first.toLowerCase(Locale.ROOT);
        String b = second.toLowerCase(Locale.ROOT);
        if (a.equals(b)) return 1.0;
        for (String word : a.trim().split("\\s+")) {
            if (b.contains(word)) return 0.8;
        }
        return 0.3;
    }

    double contextScore(MeetingContext context) {
        String type = context.getType() == null ? "business" : context.getType();
        String venue = context.getLocation() == null ? "office" : context.getLocation();
        String timing = context.getTiming() == null ? "business_hours" : context.getTiming();

        double score = 0.5;
        if (PRODUCTIVE_MEETING_TYPES.contains(type)) score += 0.2;
        if (PROFESSIONAL_VENUES.contains(venue)) score += 0.15;
        if ("business_hours".equals(timing)) score += 0.15;
        return Math.min(score, 1.0);
    }

    private static double reputation(Profile profile) {
        return profile == null || profile.getReputation() == null ? DEFAULT_REPUTATION : profile.getReputation();
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
