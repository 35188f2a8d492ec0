package com.csd.bizintel.controller;

import com.csd.bizintel.service.DealOutcomePredictor;
import com.csd.bizintel.service.TrendsCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class StatusController {

    private final DealOutcomePredictor dealOutcomePredictor;
    private final TrendsCache trendsCache;
    private final Clock clock;
    private final String version;

    public StatusController(DealOutcomePredictor dealOutcomePredictor,
                            TrendsCache trendsCache,
                            Clock clock,
                            @Value("${bizintel.version:2.0.0}") String version) {
        this.dealOutcomePredictor = dealOutcomePredictor;
        this.trendsCache = trendsCache;
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/")
    public Map<String, Object> status() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/api/match", "POST - Calculate match score between users");
        endpoints.put("/api/match/breakdown", "POST - Per-factor match sub-scores");
        endpoints.put("/api/predict-meeting", "POST - Predict meeting success probability");
        endpoints.put("/api/market-trends", "GET - Get market intelligence");
        endpoints.put("/api/predict-deal", "POST - Predict deal success");
        endpoints.put("/api/opportunities", "POST - Generate business opportunities");
        endpoints.put("/health", "GET - Service health check");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "BizIntel Engine");
        body.put("version", version);
        body.put("status", "active");
        body.put("capabilities", List.of(
                "Business Matching",
                "Meeting Success Prediction",
                "Market Intelligence Analysis",
                "Deal Success Prediction",
                "Business Opportunity Detection"));
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> services = new LinkedHashMap<>();
        services.put("matching_engine", "online");
        services.put("market_intelligence", "online");
        services.put("deal_predictor", dealOutcomePredictor.isTrained() ? "online" : "warming_up");
        services.put("cached_trend_entries", trendsCache.size());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now(clock));
        body.put("services", services);
        return body;
    }
}
