package com.csd.bizintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingContext {
    private String type;     // business, networking, ...
    private String location; // office, conference, coffee_shop, ...
    private String timing;   // business_hours, ...

    public boolean isEmpty() {
        return type == null && location == null && timing == null;
    }
}
