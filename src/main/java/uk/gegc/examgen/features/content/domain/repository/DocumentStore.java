package uk.gegc.examgen.features.content.domain.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key/collection document store. Write semantics are last-write-wins per id.
 */
public interface DocumentStore {

    /**
     * Stores the document under {@code id}, or under a freshly generated id when {@code id} is null.
     *
     * @return the id the document was stored under
     */
    String put(String collection, String id, Map<String, Object> document);

    Optional<StoredDocument> get(String collection, String id);

    List<StoredDocument> query(String collection, Predicate<Map<String, Object>> filter);
}
