package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class OpportunitiesResponse {
    private boolean success;
    private List<Opportunity> opportunities;
    @JsonProperty("total_count")
    private int totalCount;
    @JsonProperty("generated_at")
    private Instant generatedAt;
    @JsonProperty("next_refresh")
    private Instant nextRefresh;
}
