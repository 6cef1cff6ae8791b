package com.factgate.core.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numeric literals in text.
 *
 * <p>
 * Recognised forms: integers, decimals, thousands-separated numbers,
 * currency-prefixed amounts ({@code €25}, {@code $ 1,000}), currency-suffixed
 * amounts ({@code 25 €}, {@code 25 EUR}, {@code 25 euros}) and percentages
 * ({@code 15%}, {@code 15 percent}). A number glued to a preceding letter or
 * digit ({@code v2}, {@code H2O}) is not reported. When a literal's separators
 * cannot be read as one number ({@code 1,2,3}) each digit run is reported on
 * its own.
 * </p>
 *
 * @since 1.0.0
 */
public final class NumberScanner {

    private static final Pattern NUMBER = Pattern.compile(
            "(?<![\\p{L}\\p{N}_])(?<!\\d[.,])"
                    + "(?<prefix>[€$£][ \\u00A0]?)?"
                    + "(?<literal>\\d+(?:[.,]\\d+)*)"
                    + "(?<suffix>[ \\u00A0]?(?:%|€|\\$|£)|[ \\u00A0](?i:percent|prozent|eur|euros?|usd|gbp)\\b)?");

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    private NumberScanner() {
        // utility class — not instantiable
    }

    /**
     * Scan text for numeric literals.
     *
     * @param text text to scan; {@code null} is treated as empty
     * @return unmodifiable list of tokens in text order, offsets relative to
     *         {@code text}
     */
    public static List<NumericToken> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<NumericToken> tokens = new ArrayList<>();
        Matcher m = NUMBER.matcher(text);
        while (m.find()) {
            String literal = m.group("literal");
            boolean decorated = m.group("prefix") != null || m.group("suffix") != null;
            Optional<String> normalized = NumberNormalizer.normalizeLiteral(literal);
            if (normalized.isPresent()) {
                tokens.add(new NumericToken(m.group(), literal, normalized.get(),
                        m.start(), m.start("literal"), decorated));
            } else {
                Matcher runs = DIGIT_RUN.matcher(literal);
                while (runs.find()) {
                    int at = m.start("literal") + runs.start();
                    NumberNormalizer.normalizeLiteral(runs.group()).ifPresent(n ->
                            tokens.add(new NumericToken(runs.group(), runs.group(), n, at, at, false)));
                }
            }
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Scan a sentence and report offsets relative to the enclosing body.
     *
     * @param sentence a sentence produced by {@link SentenceSplitter}
     * @return tokens with body-relative offsets
     */
    public static List<NumericToken> scan(Sentence sentence) {
        List<NumericToken> local = scan(sentence.getText());
        if (sentence.getStart() == 0) {
            return local;
        }
        List<NumericToken> shifted = new ArrayList<>(local.size());
        for (NumericToken token : local) {
            shifted.add(token.shift(sentence.getStart()));
        }
        return Collections.unmodifiableList(shifted);
    }
}
