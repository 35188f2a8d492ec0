package com.csd.bizintel.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A professional profile as received from the caller. Every field may be absent;
 * the engine applies its own defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile {
    private String industry;
    private String title;
    private String bio;
    @PositiveOrZero(message = "must not be negative")
    private Double networkValue;
    private String location;
    @DecimalMin(value = "0", message = "must be between 0 and 100")
    @DecimalMax(value = "100", message = "must be between 0 and 100")
    private Double reputation; // defaults to 50
}
