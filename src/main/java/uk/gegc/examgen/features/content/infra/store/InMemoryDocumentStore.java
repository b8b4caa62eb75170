package uk.gegc.examgen.features.content.infra.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import uk.gegc.examgen.features.content.domain.repository.DocumentStore;
import uk.gegc.examgen.features.content.domain.repository.StoredDocument;
import uk.gegc.examgen.shared.util.IdGenerator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local {@link DocumentStore}. Collections keep insertion order so queries are stable.
 * Documents are deep-copied through JSON on the way in and on the way out, so neither the
 * writer nor a reader shares nested lists or maps with the stored state.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryDocumentStore implements DocumentStore {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    @Override
    public String put(String collection, String id, Map<String, Object> document) {
        String documentId = id != null ? id : IdGenerator.newId();
        Map<String, Object> copy = deepCopy(document);
        Map<String, Map<String, Object>> documents = collections.computeIfAbsent(collection, key -> new LinkedHashMap<>());
        synchronized (documents) {
            documents.put(documentId, copy);
        }
        log.debug("Stored document {} in collection {}", documentId, collection);
        return documentId;
    }

    @Override
    public Optional<StoredDocument> get(String collection, String id) {
        Map<String, Map<String, Object>> documents = collections.get(collection);
        if (documents == null) {
            return Optional.empty();
        }
        synchronized (documents) {
            return Optional.ofNullable(documents.get(id)).map(data -> new StoredDocument(id, deepCopy(data)));
        }
    }

    @Override
    public List<StoredDocument> query(String collection, Predicate<Map<String, Object>> filter) {
        Map<String, Map<String, Object>> documents = collections.get(collection);
        if (documents == null) {
            return List.of();
        }
        synchronized (documents) {
            return documents.entrySet().stream()
                    .map(entry -> new StoredDocument(entry.getKey(), deepCopy(entry.getValue())))
                    .filter(document -> filter.test(document.data()))
                    .toList();
        }
    }

    private Map<String, Object> deepCopy(Map<String, Object> document) {
        return objectMapper.convertValue(objectMapper.valueToTree(document), DOCUMENT_TYPE);
    }
}
