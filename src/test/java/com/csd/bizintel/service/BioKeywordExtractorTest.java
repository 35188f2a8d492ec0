package com.csd.bizintel.service;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class BioKeywordExtractorTest {

    private final BioKeywordExtractor extractor = new BioKeywordExtractor();

    @Test
    void joinsAdjacentContentWords() throws Exception {
        Set<String> keywords = extractor.extract("Expert in machine learning and data analysis");
        assertEquals(Set.of("expert", "machine learning", "data analysis"), keywords);
    }

    @Test
    void hyphenatedWordsStayInOnePhrase() throws Exception {
        Set<String> keywords = extractor.extract("Passionate about AI and full-stack development");
        assertTrue(keywords.contains("ai"));
        assertTrue(keywords.contains("full stack development"));
        assertFalse(keywords.stream().anyMatch(k -> k.contains("passionate")));
    }

    @Test
    void punctuationEndsPhrase() throws Exception {
        Set<String> keywords = extractor.extract("Investor, Board Advisor; Fintech.");
        assertEquals(Set.of("investor", "board advisor", "fintech"), keywords);
    }

    @Test
    void blankTextHasNoKeywords() throws Exception {
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("the of and").isEmpty());
    }

    @Test
    void stopwordListLoadsFromClasspath() {
        Set<String> words = BioKeywordExtractor.loadStopwords("/text/bio-stopwords.txt");
        assertTrue(words.contains("about"));
        assertFalse(words.stream().anyMatch(w -> w.startsWith("#")));
        assertTrue(BioKeywordExtractor.loadStopwords("/text/missing.txt").isEmpty());
    }
}
