package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealRecord {
    @PositiveOrZero(message = "must not be negative")
    private Double value;
    private String description;
    @JsonProperty("match_score")
    @DecimalMin(value = "0", message = "must be between 0 and 100")
    @DecimalMax(value = "100", message = "must be between 0 and 100")
    private Double matchScore;
    @JsonProperty("duration_months")
    @PositiveOrZero(message = "must not be negative")
    private Double durationMonths;
}
