package com.phillippitts.speakwell.service.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for tokenizing a target sentence into target words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Convert to lowercase</li>
 *   <li>Split on Unicode whitespace, including no-break and em spaces</li>
 *   <li>Drop empty tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>Punctuation stays attached to its word, so "dog." and "dog" are different tokens.
 */
public final class SentenceTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private SentenceTokenizer() {
        // Prevent instantiation
    }

    /**
     * Tokenizes a sentence into lowercase words.
     *
     * @param sentence input sentence (may be null or blank)
     * @return immutable list of lowercase tokens (empty if no tokens)
     */
    public static List<String> tokenize(String sentence) {
        if (sentence == null) {
            return List.of();
        }
        String[] parts = WHITESPACE.split(sentence.toLowerCase(Locale.ROOT));
        List<String> tokens = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
