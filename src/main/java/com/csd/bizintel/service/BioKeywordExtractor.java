package com.csd.bizintel.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts noun-phrase-like keywords from free text. Content words that follow each other
 * directly form one phrase; a removed stop word or clause punctuation ends the phrase.
 */
@Slf4j
@Component
public class BioKeywordExtractor {

    private static final Pattern CLAUSE_BREAK = Pattern.compile("[.,;:!?()\\[\\]\"/|]");
    private static final String FIELD = "bio";
    private static final String STOPWORDS_RESOURCE = "/text/bio-stopwords.txt";

    private final Analyzer analyzer;

    public BioKeywordExtractor() {
        CharArraySet stopwords = new CharArraySet(EnglishAnalyzer.getDefaultStopSet(), true);
        stopwords.addAll(loadStopwords(STOPWORDS_RESOURCE));
        this.analyzer = new StandardAnalyzer(CharArraySet.unmodifiableSet(stopwords));
        log.info("Bio keyword extractor ready with {} stop words", stopwords.size());
    }

    public Set<String> extract(String text) throws IOException {
        Set<String> phrases = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return phrases;

        List<String> current = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = stream.addAttribute(OffsetAttribute.class);
            PositionIncrementAttribute posInc = stream.addAttribute(PositionIncrementAttribute.class);
            stream.reset();
            int lastEnd = -1;
            while (stream.incrementToken()) {
                boolean gap = posInc.getPositionIncrement() > 1
                        || (lastEnd >= 0 && CLAUSE_BREAK.matcher(text.substring(lastEnd, offset.startOffset())).find());
                if (gap) {
                    flush(current, phrases);
                }
                current.add(term.toString());
                lastEnd = offset.endOffset();
            }
            stream.end();
        }
        flush(current, phrases);
        log.debug("Extracted {} keyword phrases from {} chars", phrases.size(), text.length());
        return phrases;
    }

    private static void flush(List<String> words, Set<String> phrases) {
        if (words.isEmpty()) return;
        String phrase = String.join(" ", words);
        // lone one-letter tokens and bare numbers carry no topical signal
        if (phrase.length() > 1 && !phrase.chars().allMatch(Character::isDigit)) {
            phrases.add(phrase);
        }
        words.clear();
    }

    static Set<String> loadStopwords(String path) {
        Set<String> words = new LinkedHashSet<>();
        try (InputStream in = BioKeywordExtractor.class.getResourceAsStream(path)) {
            if (in == null) {
                log.warn("Stop word list {} not found on classpath; using Lucene defaults only", path);
                return words;
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (!line.isEmpty() && !line.startsWith("#")) {
                        words.add(line.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stop word list " + path, e);
        }
        return words;
    }

    @PreDestroy
    void close() {
        analyzer.close();
    }
}
