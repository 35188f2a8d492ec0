package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class MarketTrendsResponse {
    private boolean success;
    private String industry;
    private String location;
    private TrendsBundle data;
    @JsonProperty("generated_at")
    private Instant generatedAt;
}
