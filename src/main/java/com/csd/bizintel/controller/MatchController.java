package com.csd.bizintel.controller;

import com.csd.bizintel.catalog.ScoreBands;
import com.csd.bizintel.model.MatchBreakdown;
import com.csd.bizintel.model.MatchResponse;
import com.csd.bizintel.model.MeetingContext;
import com.csd.bizintel.model.MeetingPredictionResponse;
import com.csd.bizintel.model.Profile;
import com.csd.bizintel.service.CompatibilityEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@RestController
@RequestMapping("/api")
@Slf4j
public class MatchController {

    static final double MEETING_CONFIDENCE = 87.5;
    static final List<String> MEETING_TIPS = List.of(
            "Schedule during optimal business hours (10-11 AM)",
            "Meet in professional environment (office/conference room)",
            "Prepare specific collaboration proposals",
            "Research common industry interests beforehand"
    );

    private final CompatibilityEngine compatibilityEngine;

    public MatchController(CompatibilityEngine compatibilityEngine) { this.compatibilityEngine = compatibilityEngine; }

    @PostMapping("/match")
    public MatchResponse match(@Valid @RequestBody MatchRequest request) {
        double score = compatibilityEngine.calculateMatchScore(request.getUser1(), request.getUser2());
        return MatchResponse.builder()
                .success(true)
                .matchScore(round(score, 2))
                .compatibilityLevel(ScoreBands.compatibilityLevel(score))
                .recommendation(ScoreBands.matchRecommendation(score))
                .build();
    }

    @PostMapping("/match/breakdown")
    public MatchBreakdown breakdown(@Valid @RequestBody MatchRequest request) {
        return compatibilityEngine.analyzeMatch(request.getUser1(), request.getUser2());
    }

    @PostMapping("/predict-meeting")
    public MeetingPredictionResponse predictMeeting(@Valid @RequestBody MeetingRequest request) {
        double probability = compatibilityEngine.predictMeetingSuccess(
                orEmpty(request.getUser1()), orEmpty(request.getUser2()), request.getContext());
        log.debug("Meeting success probability {}", probability);
        return MeetingPredictionResponse.builder()
                .success(true)
                .successProbability(round(probability, 1))
                .confidence(MEETING_CONFIDENCE)
                .meetingGrade(ScoreBands.meetingGrade(probability))
                .recommendations(MEETING_TIPS)
                .build();
    }

    // half-even on the exact binary value of the score
    static double round(double value, int places) {
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Profile orEmpty(Profile profile) {
        return profile == null ? new Profile() : profile;
    }

    @Data
    public static class MatchRequest {
        @Valid
        @NotNull(message = "is required")
        private Profile user1;
        @Valid
        @NotNull(message = "is required")
        private Profile user2;
    }

    @Data
    public static class MeetingRequest {
        @Valid
        private Profile user1;
        @Valid
        private Profile user2;
        private MeetingContext context;
    }
}
