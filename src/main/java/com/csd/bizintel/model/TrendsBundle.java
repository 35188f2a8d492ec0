package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Market intelligence for one industry. Instances are shared through the trends cache and
 * must stay immutable once built.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendsBundle {
    IndustryGrowth industryGrowth;
    List<String> emergingTrends;
    List<Competitor> competitorAnalysis;
    List<InvestmentOpportunity> investmentOpportunities;
    MarketDemand marketDemand;
    List<PricingStrategy> priceOptimization; // absent on the default bundle
    Instant lastUpdated;                      // absent on the default bundle
    double confidence;

    @Value
    public static class IndustryGrowth {
        double rate;
        String trajectory;
    }

    @Value
    public static class Competitor {
        String name;
        @JsonProperty("market_share")
        double marketShare;
        @JsonProperty("threat_level")
        String threatLevel;
    }

    @Value
    public static class InvestmentOpportunity {
        String sector;
        String potential;
        String risk;
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class MarketDemand {
        @JsonProperty("short_term")
        String shortTerm;
        @JsonProperty("long_term")
        String longTerm;
        List<String> factors;
    }

    @Value
    public static class PricingStrategy {
        String strategy;
        String impact;
    }
}
