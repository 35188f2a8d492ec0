package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KeyFactor {
    String factor;
    double importance;
    @JsonProperty("current_value")
    double currentValue;
    String impact; // positive / negative
}
