package uk.gegc.examgen.features.content.domain.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A document as read from a {@link DocumentStore}. Top-level entries are read-only; JSON
 * {@code null} values are kept.
 */
public record StoredDocument(String id, Map<String, Object> data) {

    public StoredDocument {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
