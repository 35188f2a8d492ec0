package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Opportunity {
    String type;
    String title;
    String description;
    @JsonProperty("potential_value")
    String potentialValue;
    double confidence;
    String timeline;
}
