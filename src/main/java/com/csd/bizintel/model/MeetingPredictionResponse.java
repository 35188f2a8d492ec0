package com.csd.bizintel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class MeetingPredictionResponse {
    private boolean success;
    @JsonProperty("success_probability")
    private double successProbability;
    private double confidence;
    @JsonProperty("meeting_grade")
    private String meetingGrade;
    private List<String> recommendations;
}
