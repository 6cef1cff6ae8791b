package com.factgate.core.text;

import com.factgate.core.model.FieldDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Precompiled whole-word patterns for the aliases of every declared field.
 *
 * <p>
 * Built once per rule configuration and safe to share across threads: the
 * compiled {@link Pattern}s are immutable and a fresh {@link Matcher} is
 * created per lookup.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldMentions {

    private final Map<String, List<Pattern>> patternsByField;

    public FieldMentions(List<FieldDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        Map<String, List<Pattern>> map = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : descriptors) {
            List<Pattern> patterns = new ArrayList<>();
            for (String alias : descriptor.getAliases()) {
                patterns.add(wholeWord(alias));
            }
            map.put(descriptor.getName(), Collections.unmodifiableList(patterns));
        }
        this.patternsByField = Collections.unmodifiableMap(map);
    }

    /**
     * Compile a case-insensitive pattern matching {@code phrase} only where it
     * is not part of a longer word.
     *
     * @param phrase literal phrase
     * @return compiled pattern
     */
    public static Pattern wholeWord(String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Find the declared fields mentioned in a piece of text, ordered by the
     * position of their first mention.
     *
     * @param text     text to search
     * @param eligible filter on field names (e.g. fields present in the work
     *                 product)
     * @return unmodifiable list of field names
     */
    public List<String> mentionedIn(String text, Predicate<String> eligible) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Map.Entry<String, Integer>> hits = new ArrayList<>();
        for (Map.Entry<String, List<Pattern>> entry : patternsByField.entrySet()) {
            if (!eligible.test(entry.getKey())) {
                continue;
            }
            int first = -1;
            for (Pattern pattern : entry.getValue()) {
                Matcher m = pattern.matcher(text);
                if (m.find() && (first < 0 || m.start() < first)) {
                    first = m.start();
                }
            }
            if (first >= 0) {
                hits.add(Map.entry(entry.getKey(), first));
            }
        }
        // stable: ties keep declaration order
        hits.sort(Map.Entry.comparingByValue());
        List<String> fields = new ArrayList<>(hits.size());
        for (Map.Entry<String, Integer> hit : hits) {
            fields.add(hit.getKey());
        }
        return Collections.unmodifiableList(fields);
    }
}
