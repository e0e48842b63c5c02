package com.trendsentinel.core.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {
    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void emitsHashtagsFirstThenSurvivingWordsInOrder() {
        List<String> tokens = tokenizer.tokenize("Rocket launch delayed again #SpaceX #NASA");

        assertEquals(List.of("#spacex", "#nasa", "rocket", "launch", "delayed", "spacex", "nasa"), tokens);
    }

    @Test
    void hashtagsBypassLengthAndStopwordFilters() {
        List<String> tokens = tokenizer.tokenize("#the #ai news");

        assertEquals(List.of("#the", "#ai", "news"), tokens);
    }

    @Test
    void stripsUrlsMentionsAndBracketedSpans() {
        List<String> tokens = tokenizer.tokenize(
                "Election results https://example.com/polling @reporter [removed words] (parenthetical aside) tonight"
        );

        assertEquals(List.of("election", "results", "tonight"), tokens);
    }

    @Test
    void dropsStopwordsShortWordsAndNonAlphabeticRuns() {
        List<String> tokens = tokenizer.tokenize("This is what they said about cats in 2024 and dog42 robots");

        assertEquals(List.of("cats", "robots"), tokens);
    }

    @Test
    void emptyOrMissingTextYieldsNoTokens() {
        assertEquals(List.of(), tokenizer.tokenize(null));
        assertEquals(List.of(), tokenizer.tokenize(""));
        assertEquals(List.of(), tokenizer.tokenize("   "));
    }

    @Test
    void keepsRepetitionForFrequencyCounting() {
        assertEquals(List.of("rocket", "rocket", "rocket"), tokenizer.tokenize("Rocket ROCKET rocket"));
    }

    @Test
    void plainWordsAlwaysSatisfyInclusionRule() {
        String text = "Breaking: Markets RALLY as the Fed holds rates; crypto #Bitcoin jumps (again) "
                + "while @analyst warns [citation needed] https://t.co/x of a bubble. Über-bubbles café résumé.";
        Set<String> stopwords = tokenizer.stopwords().asSet();

        for (String token : tokenizer.tokenize(text)) {
            if (token.startsWith("#")) {
                continue;
            }
            assertTrue(token.length() >= Tokenizer.MIN_WORD_LENGTH, token);
            assertEquals(token.toLowerCase(Locale.ROOT), token);
            assertTrue(token.chars().allMatch(c -> c >= 'a' && c <= 'z'), token);
            assertFalse(stopwords.contains(token), token);
        }
    }

    @Test
    void tokenizationIsRepeatable() {
        String text = "Same #input twice gives identical output, twice over";

        assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
    }

    @Test
    void extraStopwordsAreHonored() {
        Tokenizer custom = new Tokenizer(Stopwords.defaults().withExtras(List.of("Rocket")));

        assertEquals(List.of("launch"), custom.tokenize("rocket launch"));
    }
}
