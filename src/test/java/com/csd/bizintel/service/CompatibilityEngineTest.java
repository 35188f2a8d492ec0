package com.csd.bizintel.service;

import com.csd.bizintel.model.MatchBreakdown;
import com.csd.bizintel.model.MeetingContext;
import com.csd.bizintel.model.Profile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CompatibilityEngineTest {

    private final CompatibilityEngine engine = new CompatibilityEngine(new BioKeywordExtractor());

    private static Profile alice() {
        return Profile.builder()
                .industry("technology")
                .title("Senior Software Engineer")
                .bio("Expert in machine learning and data analysis")
                .networkValue(25_000.0)
                .location("San Francisco")
                .reputation(85.0)
                .build();
    }

    private static Profile bob() {
        return Profile.builder()
                .industry("Technology")
                .title("CEO")
                .bio("Founder. Machine learning and data analysis for retail")
                .networkValue(50_000.0)
                .location("San Francisco Bay Area")
                .reputation(78.0)
                .build();
    }

    @Test
    void matchScoreStaysInRange() {
        double score = engine.calculateMatchScore(alice(), bob());
        assertTrue(score >= 0 && score <= 100, "score " + score);
        double reverse = engine.calculateMatchScore(bob(), alice());
        assertTrue(reverse >= 0 && reverse <= 100, "score " + reverse);
    }

    @Test
    void sameIndustryScoresAtLeastUnknownPair() {
        Profile tech = Profile.builder().industry("technology").build();
        Profile otherTech = Profile.builder().industry("technology").build();
        Profile unknown = Profile.builder().industry("agriculture").build();
        assertTrue(engine.calculateMatchScore(tech, otherTech) >= engine.calculateMatchScore(tech, unknown));
        assertEquals(0.9, engine.industryCompatibility("technology", "TECHNOLOGY"), 1e-9);
        assertEquals(0.5, engine.industryCompatibility("technology", "agriculture"), 1e-9);
    }

    @Test
    void industryAffinityIsDirectional() {
        assertEquals(0.9, engine.industryCompatibility("finance", "real-estate"), 1e-9);
        assertEquals(0.5, engine.industryCompatibility("real-estate", "finance"), 1e-9);
    }

    @Test
    void locationProximityLevels() {
        assertEquals(1.0, engine.locationProximity("San Francisco", "san francisco"), 1e-9);
        assertEquals(0.8, engine.locationProximity("San Francisco", "South San Francisco"), 1e-9);
        assertEquals(0.8, engine.locationProximity("Berlin", "Berlin, Germany"), 1e-9);
        assertEquals(0.3, engine.locationProximity("Berlin", "London"), 1e-9);
        assertEquals(0.5, engine.locationProximity("", "London"), 1e-9);
        assertEquals(0.5, engine.locationProximity("Berlin", null), 1e-9);
    }

    @Test
    void titleSynergyFavoursModerateGaps() {
        assertEquals(0.8, engine.titleSynergy("CEO", "Engineering Manager"), 1e-9);
        assertEquals(0.8, engine.titleSynergy("Senior Engineer", "Engineer"), 1e-9);
        assertEquals(0.6, engine.titleSynergy("Engineer", "Designer"), 1e-9);
        assertEquals(0.4, engine.titleSynergy("Founder", "Engineer"), 1e-9);
        assertEquals(0.6, engine.titleSynergy(null, ""), 1e-9);
    }

    @Test
    void networkValueCompatibility() {
        assertEquals(0.3, engine.networkValueCompatibility(0.0, 5000.0), 1e-9);
        assertEquals(0.3, engine.networkValueCompatibility(null, 5000.0), 1e-9);
        assertEquals(1.0, engine.networkValueCompatibility(5000.0, 5000.0), 1e-9);
        assertEquals(0.4, engine.networkValueCompatibility(100.0, 400.0), 1e-9);
    }

    @Test
    void bioSimilarityUsesKeywordOverlap() {
        String bio = "Expert in machine learning and data analysis";
        assertEquals(1.0, engine.bioSimilarity(bio, bio), 1e-9);
        assertEquals(0.5, engine.bioSimilarity(bio, ""), 1e-9);
        assertEquals(0.5, engine.bioSimilarity(null, bio), 1e-9);
        assertEquals(0.0, engine.bioSimilarity(bio, "Chef running two bakeries"), 1e-9);
        // stop words only: no keywords on one side
        assertEquals(0.5, engine.bioSimilarity(bio, "the and of"), 1e-9);
    }

    @Test
    void partialProfileStillScores() {
        Profile sparse = Profile.builder().industry("technology").build();
        Profile full = Profile.builder()
                .industry("finance")
                .title("CEO")
                .bio("Investor in fintech startups")
                .networkValue(40_000.0)
                .location("London")
                .reputation(90.0)
                .build();
        // 0.8*0.25 + 0.4*0.20 + 0.5*0.20 + 0.3*0.15 + 0.5*0.20
        assertEquals(52.5, engine.calculateMatchScore(sparse, full), 1e-9);
    }

    @Test
    void breakdownMatchesScore() {
        MatchBreakdown breakdown = engine.analyzeMatch(alice(), bob());
        double expected = (breakdown.getIndustry() * 0.25
                + breakdown.getTitle() * 0.20
                + breakdown.getBio() * 0.20
                + breakdown.getNetwork() * 0.15
                + breakdown.getLocation() * 0.20) * 100;
        assertEquals(expected, breakdown.getOverall(), 1e-9);
        assertEquals(0.9, breakdown.getIndustry(), 1e-9);
        assertEquals(0.4, breakdown.getTitle(), 1e-9); // tier 2 vs tier 5
        assertEquals(0.8, breakdown.getLocation(), 1e-9);
        assertEquals(0.6, breakdown.getNetwork(), 1e-9);
        // {machine learning, data analysis} shared out of five distinct phrases
        assertEquals(0.4, breakdown.getBio(), 1e-9);
    }

    @Test
    void missingProfileScoresZero() {
        assertEquals(0.0, engine.calculateMatchScore(null, alice()));
        assertEquals(0.0, engine.calculateMatchScore(alice(), null));
    }

    @Test
    void meetingSuccessWithoutContextUsesDefault() {
        Profile empty = new Profile();
        // match 49: 0.5*0.25 + 0.6*0.20 + 0.5*0.20 + 0.3*0.15 + 0.5*0.20
        assertEquals(49.0, engine.calculateMatchScore(empty, empty), 1e-9);
        // 0.49*0.40 + 0.7*0.25 + 0.5*0.20 + 0.65*0.15
        assertEquals(56.85, engine.predictMeetingSuccess(empty, empty, null), 1e-9);
        assertEquals(56.85, engine.predictMeetingSuccess(empty, empty, new MeetingContext()), 1e-9);
    }

    @Test
    void meetingContextAdjustsProbability() {
        Profile empty = new Profile();
        MeetingContext ideal = MeetingContext.builder().type("networking").location("conference").timing("business_hours").build();
        MeetingContext poor = MeetingContext.builder().type("social").location("home").timing("evening").build();
        assertEquals(64.35, engine.predictMeetingSuccess(empty, empty, ideal), 1e-9);
        assertEquals(51.85, engine.predictMeetingSuccess(empty, empty, poor), 1e-9);
    }

    @Test
    void contextScoreDefaultsMissingFieldsAndCaps() {
        assertEquals(1.0, engine.contextScore(MeetingContext.builder().type("business").build()), 1e-9);
        assertEquals(0.65, engine.contextScore(MeetingContext.builder().type("other").timing("night").build()), 1e-9);
    }

    @Test
    void meetingSuccessStaysInRange() {
        Profile top = alice();
        top.setReputation(100.0);
        double probability = engine.predictMeetingSuccess(top, bob(),
                MeetingContext.builder().type("business").location("office").timing("business_hours").build());
        assertTrue(probability >= 0 && probability <= 100, "probability " + probability);
    }

    @Test
    void reputationDefaultsToFifty() {
        Profile noReputation = alice();
        noReputation.setReputation(null);
        Profile fifty = alice();
        fifty.setReputation(50.0);
        assertEquals(engine.predictMeetingSuccess(fifty, fifty, null),
                engine.predictMeetingSuccess(noReputation, noReputation, null), 1e-9);
    }
}
