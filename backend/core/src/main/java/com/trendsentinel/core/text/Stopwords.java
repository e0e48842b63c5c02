package com.trendsentinel.core.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable stopword set. The bundled list lives in {@value #DEFAULT_RESOURCE} and is read
 * once per process; callers that need extra words get a new merged instance.
 */
public final class Stopwords {
    public static final String DEFAULT_RESOURCE = "/stopwords-en.txt";

    private static volatile Stopwords defaults;

    private final Set<String> words;

    private Stopwords(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static Stopwords defaults() {
        Stopwords loaded = defaults;
        if (loaded == null) {
            synchronized (Stopwords.class) {
                loaded = defaults;
                if (loaded == null) {
                    loaded = new Stopwords(readResource(DEFAULT_RESOURCE));
                    defaults = loaded;
                }
            }
        }
        return loaded;
    }

    public static Stopwords of(Collection<String> words) {
        return new Stopwords(normalize(words));
    }

    public Stopwords withExtras(Collection<String> extras) {
        if (extras == null || extras.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(words);
        merged.addAll(normalize(extras));
        return new Stopwords(merged);
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    public int size() {
        return words.size();
    }

    public Set<String> asSet() {
        return words;
    }

    static Set<String> readResource(String resource) {
        try (InputStream in = Stopwords.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Stopword resource not found: " + resource);
            }
            Set<String> out = new HashSet<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (!line.isEmpty() && !line.startsWith("#")) {
                        out.add(line.toLowerCase(Locale.ROOT));
                    }
                }
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading stopwords from " + resource, e);
        }
    }

    private static Set<String> normalize(Collection<String> words) {
        Set<String> out = new HashSet<>();
        if (words == null) {
            return out;
        }
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                out.add(word.strip().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }
}
