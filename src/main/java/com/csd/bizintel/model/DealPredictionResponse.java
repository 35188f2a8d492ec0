package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DealPredictionResponse {
    private boolean success;
    private DealPrediction prediction;
    @JsonProperty("deal_analysis")
    private DealAnalysis dealAnalysis;

    @Data
    @Builder
    public static class DealAnalysis {
        @JsonProperty("risk_level")
        private String riskLevel;
        @JsonProperty("recommended_action")
        private String recommendedAction;
    }
}
