package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DealPrediction {
    @JsonProperty("success_probability")
    double successProbability;
    double confidence;
    @JsonProperty("key_factors")
    List<KeyFactor> keyFactors;
    List<String> recommendations;
}
