package com.factgate.core.json;

import com.factgate.core.model.MalformedDocumentException;
import com.factgate.core.model.WorkProduct;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Parses work product documents from JSON.
 *
 * <p>
 * A malformed document is never dropped or treated as empty: invalid JSON
 * and a top level that is not an object both raise
 * {@link MalformedDocumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkProductReader {

    private static final Logger LOG = LoggerFactory.getLogger(WorkProductReader.class);

    private WorkProductReader() {
        // utility class — not instantiable
    }

    /**
     * @param json JSON text; must not be {@code null}
     * @return the work product
     * @throws MalformedDocumentException if the text is not a JSON object
     */
    public static WorkProduct fromJson(String json) {
        Objects.requireNonNull(json, "JSON text must not be null");
        Object parsed;
        try {
            parsed = JsonMappers.mapper().readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Work product is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return WorkProduct.of(parsed);
    }

    /**
     * @param path path to a JSON file; must not be {@code null}
     * @return the work product
     * @throws IllegalArgumentException   if the file does not exist
     * @throws UncheckedIOException       if the file cannot be read
     * @throws MalformedDocumentException if the file is not a JSON object
     */
    public static WorkProduct fromFile(Path path) {
        Objects.requireNonNull(path, "Work product path must not be null");
        String json;
        try {
            json = Files.readString(path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Work product file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read work product file: " + path, e);
        }
        WorkProduct workProduct = fromJson(json);
        LOG.debug("Read work product {} with {} top-level key(s)", path, workProduct.getFields().size());
        return workProduct;
    }
}
