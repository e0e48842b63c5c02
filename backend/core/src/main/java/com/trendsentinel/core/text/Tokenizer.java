package com.trendsentinel.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one document's text into trend tokens: hashtags first, in the order found, then
 * plain words. Hashtags bypass the stopword and length filters. URLs, {@code @}-mentions and
 * bracketed or parenthesized spans never contribute plain words.
 */
public class Tokenizer {
    public static final int MIN_WORD_LENGTH = 4;

    private static final Pattern HASHTAG = Pattern.compile("#\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NOISE = Pattern.compile(
            "http\\S+|@\\w+|\\[.*?]|\\(.*?\\)",
            Pattern.UNICODE_CHARACTER_CLASS
    );
    private static final Pattern CANDIDATE_WORD = Pattern.compile(
            "\\b[a-zA-Z]{3,}\\b",
            Pattern.UNICODE_CHARACTER_CLASS
    );

    private final Stopwords stopwords;

    public Tokenizer() {
        this(Stopwords.defaults());
    }

    public Tokenizer(Stopwords stopwords) {
        this.stopwords = Objects.requireNonNull(stopwords, "stopwords is required");
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>(findAll(HASHTAG, lowered));

        String cleaned = NOISE.matcher(lowered).replaceAll("");
        for (String word : findAll(CANDIDATE_WORD, cleaned)) {
            if (word.length() >= MIN_WORD_LENGTH && !stopwords.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    public Stopwords stopwords() {
        return stopwords;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }
}
