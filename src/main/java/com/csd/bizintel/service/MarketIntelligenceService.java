package com.csd.bizintel.service;

import com.csd.bizintel.catalog.MarketCatalog;
import com.csd.bizintel.model.Opportunity;
import com.csd.bizintel.model.Profile;
import com.csd.bizintel.model.TrendsBundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Industry trend summaries, cached per industry and location, and opportunity suggestions
 * for a single profile.
 */
@Slf4j
@Service
public class MarketIntelligenceService {

    static final double BASE_CONFIDENCE = 0.85;
    static final double CONFIDENCE_JITTER = 0.05;
    static final double FALLBACK_CONFIDENCE = 0.3;
    static final int MAX_OPPORTUNITIES = 5;

    private final TrendsCache trendsCache;
    private final Clock clock;

    public MarketIntelligenceService(TrendsCache trendsCache, Clock clock) {
        this.trendsCache = trendsCache;
        this.clock = clock;
    }

    /**
     * Trend bundle for the industry, served from cache while fresh. Falls back to a fixed,
     * low-confidence bundle that is never cached.
     */
    public TrendsBundle analyzeMarketTrends(String industry, String location) {
        if (industry == null || industry.isBlank()) {
            log.warn("Market trends requested without an industry; returning default trends");
            return defaultTrends();
        }
        try {
            return trendsCache.getOrCompute(TrendsCache.Key.of(industry, location), key -> buildTrends(key.getIndustry()));
        } catch (Exception e) {
            log.error("Error analyzing market trends for industry={} location={}: {}", industry, location, e.getMessage(), e);
            return defaultTrends();
        }
    }

    public List<Opportunity> predictBusinessOpportunities(Profile profile) {
        if (profile == null) return Collections.emptyList();
        try {
            String industry = profile.getIndustry() == null ? "" : profile.getIndustry();
            double networkValue = profile.getNetworkValue() == null ? 0 : profile.getNetworkValue();

            List<Opportunity> opportunities = new ArrayList<>();
            if (industry.toLowerCase(Locale.ROOT).contains("technology")) {
                opportunities.addAll(MarketCatalog.TECHNOLOGY_OPPORTUNITIES);
            }
            if (networkValue > MarketCatalog.INVESTOR_NETWORK_THRESHOLD) {
                opportunities.add(MarketCatalog.ANGEL_INVESTMENT);
            }
            return opportunities.stream()
                    .sorted(Comparator.comparingDouble(Opportunity::getConfidence).reversed())
                    .limit(MAX_OPPORTUNITIES)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.error("Error predicting business opportunities: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    TrendsBundle buildTrends(String industry) {
        return TrendsBundle.builder()
                .industryGrowth(MarketCatalog.growthFor(industry))
                .emergingTrends(MarketCatalog.emergingTrendsFor(industry))
                .competitorAnalysis(MarketCatalog.COMPETITORS)
                .investmentOpportunities(MarketCatalog.investmentOpportunitiesFor(industry))
                .marketDemand(MarketCatalog.DEMAND_FORECAST)
                .priceOptimization(MarketCatalog.PRICING_STRATEGIES)
                .lastUpdated(Instant.now(clock))
                .confidence(BASE_CONFIDENCE + ThreadLocalRandom.current().nextGaussian() * CONFIDENCE_JITTER)
                .build();
    }

    TrendsBundle defaultTrends() {
        return TrendsBundle.builder()
                .industryGrowth(MarketCatalog.DEFAULT_GROWTH)
                .emergingTrends(MarketCatalog.FALLBACK_TRENDS)
                .competitorAnalysis(List.of())
                .investmentOpportunities(List.of())
                .marketDemand(MarketCatalog.FALLBACK_DEMAND)
                .confidence(FALLBACK_CONFIDENCE)
                .build();
    }
}
