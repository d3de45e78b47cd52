package com.profile.matching.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of lower-cased word tokens.
 * The default tokenizer splits on anything that is not a letter or digit, so
 * punctuation in profile documents ("Python, SQL.") does not hide shared words.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private final Pattern tokenPattern;

    public JaccardSimilarity() {
        this("[^\\p{L}\\p{N}]+");
    }

    public JaccardSimilarity(String tokenPattern) {
        this.tokenPattern = Pattern.compile(tokenPattern);
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokenSet = new HashSet<>();
        for (String token : tokenPattern.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
