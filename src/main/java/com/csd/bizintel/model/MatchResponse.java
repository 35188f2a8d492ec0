package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MatchResponse {
    private boolean success;
    @JsonProperty("match_score")
    private double matchScore;
    @JsonProperty("compatibility_level")
    private String compatibilityLevel;
    private String recommendation;
}
