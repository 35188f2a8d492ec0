package com.csd.bizintel.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScoreBandsTest {

    @Test
    void compatibilityLevelBoundariesAreInclusive() {
        assertEquals("Excellent", ScoreBands.compatibilityLevel(80));
        assertEquals("Very Good", ScoreBands.compatibilityLevel(79.999));
        assertEquals("Very Good", ScoreBands.compatibilityLevel(70));
        assertEquals("Good", ScoreBands.compatibilityLevel(60));
        assertEquals("Fair", ScoreBands.compatibilityLevel(40));
        assertEquals("Poor", ScoreBands.compatibilityLevel(39.99));
        assertEquals("Poor", ScoreBands.compatibilityLevel(0));
    }

    @Test
    void matchRecommendation() {
        assertEquals("Highly recommended connection", ScoreBands.matchRecommendation(75));
        assertEquals("Promising networking opportunity", ScoreBands.matchRecommendation(74.9));
        assertEquals("Consider context before connecting", ScoreBands.matchRecommendation(40));
        assertEquals("Low compatibility - proceed with caution", ScoreBands.matchRecommendation(10));
    }

    @Test
    void meetingGrade() {
        assertEquals("A+", ScoreBands.meetingGrade(85));
        assertEquals("A", ScoreBands.meetingGrade(84.9));
        assertEquals("B+", ScoreBands.meetingGrade(65));
        assertEquals("B", ScoreBands.meetingGrade(56.85));
        assertEquals("C", ScoreBands.meetingGrade(54.99));
    }

    @Test
    void dealBands() {
        assertEquals("Low", ScoreBands.dealRiskLevel(70));
        assertEquals("Medium", ScoreBands.dealRiskLevel(50));
        assertEquals("High", ScoreBands.dealRiskLevel(49.9));
        assertEquals("Proceed with confidence", ScoreBands.dealRecommendedAction(92));
        assertEquals("Proceed with standard precautions", ScoreBands.dealRecommendedAction(69.9));
        assertEquals("Consider additional risk mitigation", ScoreBands.dealRecommendedAction(12));
    }
}
