package uk.gegc.examgen.features.content.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.ai.application.ContentIngestionService;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.RejectionReason;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.GeneratedReadingMaterial;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.repository.DocumentStore;
import uk.gegc.examgen.features.content.domain.repository.StoredDocument;
import uk.gegc.examgen.features.content.infra.mapping.ContentDocumentMapper;
import uk.gegc.examgen.shared.exception.ResourceNotFoundException;
import uk.gegc.examgen.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hands accepted content to the {@link DocumentStore}. Every write re-validates the entity and
 * every read goes back through the ingestion pipeline, so nothing invalid crosses the store
 * boundary in either direction.
 */
@Slf4j
@Service
public class ContentStorageService {

    public static final String QUESTIONS_COLLECTION = "questions";

    private final DocumentStore documentStore;
    private final ContentDocumentMapper documentMapper;
    private final ContentValidator contentValidator;
    private final ContentIngestionService contentIngestionService;

    public ContentStorageService(DocumentStore documentStore,
                                 ContentDocumentMapper documentMapper,
                                 ContentValidator contentValidator,
                                 ContentIngestionService contentIngestionService) {
        this.documentStore = documentStore;
        this.documentMapper = documentMapper;
        this.contentValidator = contentValidator;
        this.contentIngestionService = contentIngestionService;
    }

    /**
     * @return the freshly assigned document id
     */
    public String saveQuestion(Question question) {
        contentValidator.requireValid(question);
        String id = documentStore.put(QUESTIONS_COLLECTION, null, documentMapper.toDocument(documentMapper.toNode(question)));
        log.info("Saved {} question {}", question.getQuestionType(), id);
        return id;
    }

    /**
     * Assets are stored under their own {@code assetId}; saving again overwrites.
     */
    public String saveAsset(Asset asset) {
        contentValidator.requireValid(asset);
        String id = documentStore.put(asset.getAssetType().collection(), asset.getAssetId(),
                documentMapper.toDocument(documentMapper.toNode(asset)));
        log.info("Saved {} asset {}", asset.getAssetType(), id);
        return id;
    }

    /**
     * Stores the passage and each question separately; the aggregate itself has no document.
     */
    public SavedReadingMaterial saveReadingMaterial(GeneratedReadingMaterial material) {
        PassageAsset passage = material.passageAsset();
        contentValidator.requireValid(passage);
        material.questions().forEach(contentValidator::requireValid);

        String passageId = saveAsset(passage);
        List<String> questionIds = new ArrayList<>();
        for (Question question : material.questions()) {
            questionIds.add(saveQuestion(question));
        }
        return new SavedReadingMaterial(passageId, questionIds);
    }

    public Question loadQuestion(String id) {
        StoredDocument document = documentStore.get(QUESTIONS_COLLECTION, id)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + id + " not found"));
        return readQuestion(document)
                .getEntity();
    }

    public Asset loadAsset(AssetType type, String assetId) {
        StoredDocument document = documentStore.get(type.collection(), assetId)
                .orElseThrow(() -> new ResourceNotFoundException(type + " asset " + assetId + " not found"));
        IngestionOutcome<Asset> outcome = contentIngestionService.ingestAssetNode(
                documentMapper.fromDocument(document.data()), IngestionContext.forAsset(type));
        if (!outcome.isAccepted()) {
            throw readBackFailure(type + " asset " + assetId, outcome.getFailure());
        }
        return outcome.getEntity();
    }

    /**
     * Stored questions that reference the asset. Documents that no longer validate are skipped.
     */
    public List<Question> findQuestionsForAsset(String assetId) {
        return documentStore.query(QUESTIONS_COLLECTION, data -> assetId.equals(referencedAssetId(data)))
                .stream()
                .map(this::readQuestionLeniently)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Passages no stored question references. Linear scan of both collections.
     */
    public List<PassageAsset> findPassagesWithoutQuestions() {
        Set<String> referenced = new HashSet<>();
        documentStore.query(QUESTIONS_COLLECTION, data -> true).stream()
                .map(document -> referencedAssetId(document.data()))
                .filter(Objects::nonNull)
                .forEach(referenced::add);

        List<PassageAsset> unreferenced = new ArrayList<>();
        for (StoredDocument document : documentStore.query(AssetType.PASSAGE.collection(), data -> true)) {
            if (referenced.contains(document.id())) {
                continue;
            }
            IngestionOutcome<Asset> outcome = contentIngestionService.ingestAssetNode(
                    documentMapper.fromDocument(document.data()), IngestionContext.forAsset(AssetType.PASSAGE));
            if (outcome.isAccepted()) {
                unreferenced.add((PassageAsset) outcome.getEntity());
            } else {
                log.warn("Skipping stored passage {}: {}", document.id(), outcome.getFailure().message());
            }
        }
        log.debug("{} passage(s) without questions", unreferenced.size());
        return unreferenced;
    }

    private IngestionOutcome<Question> readQuestion(StoredDocument document) {
        IngestionOutcome<Question> outcome = contentIngestionService.ingestQuestionNode(
                documentMapper.fromDocument(document.data()), IngestionContext.empty());
        if (!outcome.isAccepted()) {
            throw readBackFailure("Stored question " + document.id(), outcome.getFailure());
        }
        return outcome;
    }

    private Optional<Question> readQuestionLeniently(StoredDocument document) {
        IngestionOutcome<Question> outcome = contentIngestionService.ingestQuestionNode(
                documentMapper.fromDocument(document.data()), IngestionContext.empty());
        if (!outcome.isAccepted()) {
            log.warn("Skipping stored question {}: {}", document.id(), outcome.getFailure().message());
        }
        return outcome.entity();
    }

    private static String referencedAssetId(Map<String, Object> data) {
        Object reference = data.get("contentAssetId");
        if (reference == null) {
            reference = data.get("imageAssetId");
        }
        return reference instanceof String id ? id : null;
    }

    private static RuntimeException readBackFailure(String subject, IngestionFailure failure) {
        if (failure.reason() == RejectionReason.INVARIANT_VIOLATION) {
            return new ValidationException(subject, failure.violations());
        }
        return new IllegalStateException(subject + " could not be read back: " + failure.message());
    }
}
