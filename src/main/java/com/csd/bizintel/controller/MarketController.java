package com.csd.bizintel.controller;

import com.csd.bizintel.exception.BadRequestException;
import com.csd.bizintel.model.MarketTrendsResponse;
import com.csd.bizintel.model.Opportunity;
import com.csd.bizintel.model.OpportunitiesResponse;
import com.csd.bizintel.model.Profile;
import com.csd.bizintel.model.TrendsBundle;
import com.csd.bizintel.service.MarketIntelligenceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api")
public class MarketController {

    static final Duration OPPORTUNITY_REFRESH = Duration.ofHours(24);

    private final MarketIntelligenceService marketIntelligenceService;
    private final Clock clock;

    public MarketController(MarketIntelligenceService marketIntelligenceService, Clock clock) {
        this.marketIntelligenceService = marketIntelligenceService;
        this.clock = clock;
    }

    @GetMapping("/market-trends")
    public MarketTrendsResponse marketTrends(@RequestParam(defaultValue = "technology") String industry,
                                             @RequestParam(required = false) String location) {
        if (industry.isBlank()) {
            throw new BadRequestException("industry must not be blank");
        }
        TrendsBundle trends = marketIntelligenceService.analyzeMarketTrends(industry, location);
        return MarketTrendsResponse.builder()
                .success(true)
                .industry(industry)
                .location(location)
                .data(trends)
                .generatedAt(Instant.now(clock))
                .build();
    }

    @PostMapping("/opportunities")
    public OpportunitiesResponse opportunities(@Valid @RequestBody Profile profile) {
        List<Opportunity> opportunities = marketIntelligenceService.predictBusinessOpportunities(profile);
        Instant now = Instant.now(clock);
        return OpportunitiesResponse.builder()
                .success(true)
                .opportunities(opportunities)
                .totalCount(opportunities.size())
                .generatedAt(now)
                .nextRefresh(now.plus(OPPORTUNITY_REFRESH))
                .build();
    }
}
