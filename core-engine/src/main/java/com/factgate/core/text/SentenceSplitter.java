package com.factgate.core.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Heuristic sentence splitter.
 *
 * <p>
 * A sentence ends at a run of terminal punctuation ({@code . ! ?}) followed by
 * whitespace or the end of the text, or at a blank line (so headings and list
 * blocks without punctuation do not run into the next paragraph). A period
 * between digits, as in {@code 2.5}, does not end a sentence. Abbreviations
 * are not recognised.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentenceSplitter {

    private SentenceSplitter() {
        // utility class — not instantiable
    }

    /**
     * Split body text into sentences.
     *
     * @param text body text; {@code null} is treated as empty
     * @return unmodifiable list of non-blank sentences in text order
     */
    public static List<Sentence> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Sentence> sentences = new ArrayList<>();
        int n = text.length();
        int sentenceStart = 0;
        int i = 0;

        while (i < n) {
            char c = text.charAt(i);
            if (isTerminal(c)) {
                int j = i;
                while (j < n && isTerminal(text.charAt(j))) {
                    j++;
                }
                if (j == n || Character.isWhitespace(text.charAt(j))) {
                    emit(text, sentenceStart, j, sentences);
                    sentenceStart = j;
                }
                i = j;
                continue;
            }
            if (c == '\n') {
                int k = i + 1;
                while (k < n && (text.charAt(k) == ' ' || text.charAt(k) == '\t' || text.charAt(k) == '\r')) {
                    k++;
                }
                if (k < n && text.charAt(k) == '\n') {
                    emit(text, sentenceStart, i, sentences);
                    sentenceStart = k;
                    i = k;
                    continue;
                }
            }
            i++;
        }
        emit(text, sentenceStart, n, sentences);
        return Collections.unmodifiableList(sentences);
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static void emit(String text, int from, int to, List<Sentence> out) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            out.add(new Sentence(text.substring(start, end), start));
        }
    }
}
