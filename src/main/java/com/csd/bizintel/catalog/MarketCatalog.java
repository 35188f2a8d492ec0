package com.csd.bizintel.catalog;

import com.csd.bizintel.model.Opportunity;
import com.csd.bizintel.model.TrendsBundle.Competitor;
import com.csd.bizintel.model.TrendsBundle.IndustryGrowth;
import com.csd.bizintel.model.TrendsBundle.InvestmentOpportunity;
import com.csd.bizintel.model.TrendsBundle.MarketDemand;
import com.csd.bizintel.model.TrendsBundle.PricingStrategy;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static market data used to assemble trend bundles and opportunity lists.
 */
public final class MarketCatalog {

    public static final IndustryGrowth DEFAULT_GROWTH = new IndustryGrowth(0.05, "stable");

    private static final Map<String, IndustryGrowth> GROWTH = Map.of(
            "technology", new IndustryGrowth(0.23, "accelerating"),
            "finance", new IndustryGrowth(0.08, "stable"),
            "healthcare", new IndustryGrowth(0.15, "steady"),
            "marketing", new IndustryGrowth(0.12, "evolving"),
            "consulting", new IndustryGrowth(0.06, "mature")
    );

    public static final List<String> DEFAULT_TRENDS = List.of("Digital transformation", "Sustainability focus");

    private static final Map<String, List<String>> EMERGING_TRENDS = Map.of(
            "technology", List.of("AI/ML adoption", "Edge computing", "Quantum computing"),
            "finance", List.of("DeFi growth", "Digital banking", "Regulatory tech"),
            "healthcare", List.of("Telemedicine", "Precision medicine", "Health AI"),
            "marketing", List.of("Influencer marketing", "Privacy-first advertising", "AR/VR experiences")
    );

    public static final List<Competitor> COMPETITORS = List.of(
            new Competitor("Market Leader", 0.35, "high"),
            new Competitor("Emerging Player", 0.15, "medium"),
            new Competitor("Niche Specialist", 0.08, "low")
    );

    public static final MarketDemand DEMAND_FORECAST = new MarketDemand(
            "increasing", "strong", List.of("digital transformation", "remote work trends"));

    public static final List<PricingStrategy> PRICING_STRATEGIES = List.of(
            new PricingStrategy("Value-based pricing", "+15% revenue"),
            new PricingStrategy("Dynamic pricing", "+8% efficiency")
    );

    // fallback bundle parts
    public static final List<String> FALLBACK_TRENDS = List.of("Digital transformation");
    public static final MarketDemand FALLBACK_DEMAND = new MarketDemand("stable", "unknown", List.of());

    public static final List<Opportunity> TECHNOLOGY_OPPORTUNITIES = List.of(
            Opportunity.builder()
                    .type("partnership")
                    .title("AI Integration Partnership")
                    .description("Growing demand for AI solutions in traditional industries")
                    .potentialValue("$250K - $2M")
                    .confidence(0.78)
                    .timeline("3-6 months")
                    .build(),
            Opportunity.builder()
                    .type("market_expansion")
                    .title("Healthcare Tech Expansion")
                    .description("Digital health market growing 23% annually")
                    .potentialValue("$500K - $5M")
                    .confidence(0.85)
                    .timeline("6-12 months")
                    .build()
    );

    public static final double INVESTOR_NETWORK_THRESHOLD = 10_000;

    public static final Opportunity ANGEL_INVESTMENT = Opportunity.builder()
            .type("investment")
            .title("Angel Investment Opportunities")
            .description("Your network positions you well for early-stage investments")
            .potentialValue("$50K - $500K investment rounds")
            .confidence(0.72)
            .timeline("1-3 months")
            .build();

    private MarketCatalog() {}

    public static IndustryGrowth growthFor(String industry) {
        return GROWTH.getOrDefault(industry.toLowerCase(Locale.ROOT), DEFAULT_GROWTH);
    }

    public static List<String> emergingTrendsFor(String industry) {
        return EMERGING_TRENDS.getOrDefault(industry.toLowerCase(Locale.ROOT), DEFAULT_TRENDS);
    }

    public static List<InvestmentOpportunity> investmentOpportunitiesFor(String industry) {
        return List.of(
                new InvestmentOpportunity(industry + " startups", "high", "medium"),
                new InvestmentOpportunity(industry + " infrastructure", "medium", "low")
        );
    }
}
