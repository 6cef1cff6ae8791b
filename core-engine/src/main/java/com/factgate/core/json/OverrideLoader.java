package com.factgate.core.json;

import com.factgate.core.model.OverrideRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@link OverrideRecord}s persisted outside the engine.
 *
 * <p>
 * Two layouts are accepted:
 * </p>
 * <ul>
 * <li>a JSON array of override objects; {@code type} may be omitted</li>
 * <li>a JSON-lines change log, one entry per line; only entries whose
 * {@code type} is {@code override} are read, field change entries and
 * untyped entries are skipped</li>
 * </ul>
 *
 * <p>
 * An override missing its rule, field, reason, approver or expiry date fails
 * the whole load; all problems are listed in one
 * {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class OverrideLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OverrideLoader.class);

    private OverrideLoader() {
        // utility class — not instantiable
    }

    /**
     * @param path JSON or JSON-lines file; must not be {@code null}
     * @return unmodifiable list of overrides in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalStateException    if any entry is invalid
     */
    public static List<OverrideRecord> fromFile(Path path) {
        Objects.requireNonNull(path, "Overrides path must not be null");
        String content;
        try {
            content = Files.readString(path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Overrides file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read overrides file: " + path, e);
        }
        List<OverrideRecord> overrides = fromString(content);
        LOG.info("Loaded {} override(s) from {}", overrides.size(), path);
        return overrides;
    }

    /**
     * @param content JSON array or JSON-lines text; must not be {@code null}
     * @return unmodifiable list of overrides in input order
     * @throws IllegalStateException if any entry is invalid
     */
    public static List<OverrideRecord> fromString(String content) {
        Objects.requireNonNull(content, "Overrides content must not be null");
        List<String> errors = new ArrayList<>();
        List<JsonNode> entries = new ArrayList<>();
        String trimmed = content.strip();
        boolean changeLog = !trimmed.startsWith("[");

        if (!changeLog) {
            JsonNode array = readTree(trimmed, "array", errors);
            if (array != null) {
                array.forEach(entries::add);
            }
        } else {
            String[] lines = content.split("\\R");
            for (int i = 0; i < lines.length; i++) {
                if (!lines[i].isBlank()) {
                    JsonNode node = readTree(lines[i], "line " + (i + 1), errors);
                    if (node != null) {
                        entries.add(node);
                    }
                }
            }
        }

        List<OverrideRecord> overrides = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (!entry.isObject()) {
                errors.add("Override entry must be a JSON object, got: " + entry);
                continue;
            }
            if (!isOverride(entry, changeLog)) {
                LOG.trace("Skipping change-log entry: {}", entry);
                continue;
            }
            try {
                OverrideRecord override = JsonMappers.mapper().treeToValue(entry, OverrideRecord.class);
                override.validate();
                overrides.add(override);
            } catch (JsonProcessingException e) {
                errors.add("Invalid override " + entry + ": " + e.getOriginalMessage());
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Override loading failed:\n  - " + String.join("\n  - ", errors));
        }
        return Collections.unmodifiableList(overrides);
    }

    // Change-log lines must be typed; array entries may omit the type.
    private static boolean isOverride(JsonNode entry, boolean changeLog) {
        JsonNode type = entry.get("type");
        if (type == null) {
            return !changeLog;
        }
        return OverrideRecord.TYPE.equals(type.asText());
    }

    private static JsonNode readTree(String json, String where, List<String> errors) {
        try {
            return JsonMappers.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            errors.add("Invalid JSON at " + where + ": " + e.getOriginalMessage());
            return null;
        }
    }
}
