package com.factgate.core.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into word tokens on whitespace and punctuation.
 *
 * <p>
 * A word is a run of letters or digits. Inner apostrophes, hyphens, periods
 * and commas between two word characters are kept, so {@code don't},
 * {@code e-mail} and {@code 1,000.50} each count as one token.
 * </p>
 *
 * @since 1.0.0
 */
public final class WordTokenizer {

    private static final Pattern WORD = Pattern.compile(
            "[\\p{L}\\p{N}]+(?:['’.,\\-][\\p{L}\\p{N}]+)*");

    private static final Pattern HAS_DIGIT = Pattern.compile("\\p{Nd}");

    private WordTokenizer() {
        // utility class — not instantiable
    }

    /**
     * @param text text to tokenize; {@code null} is treated as empty
     * @return unmodifiable list of tokens in text order
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            tokens.add(m.group());
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * @param tokens tokens from {@link #tokenize(String)}
     * @return {@code true} if at least one token contains a digit
     */
    public static boolean containsNumericToken(List<String> tokens) {
        for (String token : tokens) {
            if (HAS_DIGIT.matcher(token).find()) {
                return true;
            }
        }
        return false;
    }
}
