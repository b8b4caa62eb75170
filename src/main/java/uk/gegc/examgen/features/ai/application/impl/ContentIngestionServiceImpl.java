package uk.gegc.examgen.features.ai.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.ai.application.ContentIngestionService;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.ElementRejection;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionFailure;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.IngestionState;
import uk.gegc.examgen.features.ai.domain.model.LinkResult;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.ai.domain.model.RejectionReason;
import uk.gegc.examgen.features.ai.infra.linker.CrossReferenceLinker;
import uk.gegc.examgen.features.ai.infra.parser.AssetParserFactory;
import uk.gegc.examgen.features.ai.infra.parser.FieldReader;
import uk.gegc.examgen.features.ai.infra.parser.QuestionParserFactory;
import uk.gegc.examgen.features.content.application.ContentValidator;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.ContentKind;
import uk.gegc.examgen.features.content.domain.model.GeneratedReadingMaterial;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ValidationResult;
import uk.gegc.examgen.shared.config.GenerationProperties;
import uk.gegc.examgen.shared.exception.AIResponseParseException;
import uk.gegc.examgen.shared.exception.UnknownVariantException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
public class ContentIngestionServiceImpl implements ContentIngestionService {

    static final String QUESTIONS_LIST_FIELD = "questions_list";
    static final String PASSAGE_ASSET_FIELD = "passageAsset";

    private final ObjectReader strictReader;
    private final QuestionParserFactory questionParserFactory;
    private final AssetParserFactory assetParserFactory;
    private final ContentValidator contentValidator;
    private final CrossReferenceLinker crossReferenceLinker;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    public ContentIngestionServiceImpl(ObjectMapper objectMapper,
                                       QuestionParserFactory questionParserFactory,
                                       AssetParserFactory assetParserFactory,
                                       ContentValidator contentValidator,
                                       CrossReferenceLinker crossReferenceLinker,
                                       GenerationProperties generationProperties,
                                       Clock clock) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.questionParserFactory = questionParserFactory;
        this.assetParserFactory = assetParserFactory;
        this.contentValidator = contentValidator;
        this.crossReferenceLinker = crossReferenceLinker;
        this.generationProperties = generationProperties;
        this.clock = clock;
    }

    @Override
    public IngestionOutcome<?> ingest(ContentKind kind, String rawText, IngestionContext context) {
        return switch (kind) {
            case QUESTION -> ingestQuestion(rawText, context);
            case ASSET -> ingestAsset(rawText, context);
        };
    }

    @Override
    public IngestionOutcome<Question> ingestQuestion(String rawText, IngestionContext context) {
        Optional<IngestionFailure> receiveFailure = checkReceived(rawText);
        if (receiveFailure.isPresent()) {
            return reject(receiveFailure.get());
        }
        ObjectNode root;
        try {
            root = parseStrict(rawText);
        } catch (AIResponseParseException e) {
            return reject(parseFailure(e, rawText));
        }
        return buildQuestion(root, context, Instant.now(clock), rawText);
    }

    @Override
    public IngestionOutcome<Asset> ingestAsset(String rawText, IngestionContext context) {
        Optional<IngestionFailure> receiveFailure = checkReceived(rawText);
        if (receiveFailure.isPresent()) {
            return reject(receiveFailure.get());
        }
        ObjectNode root;
        try {
            root = parseStrict(rawText);
        } catch (AIResponseParseException e) {
            return reject(parseFailure(e, rawText));
        }
        return buildAsset(root, context, Instant.now(clock), rawText);
    }

    @Override
    public IngestionOutcome<Question> ingestQuestionNode(JsonNode node, IngestionContext context) {
        if (node == null || !node.isObject()) {
            return reject(notAnObject(node));
        }
        return buildQuestion((ObjectNode) node, context, Instant.now(clock), node.toString());
    }

    @Override
    public IngestionOutcome<Asset> ingestAssetNode(JsonNode node, IngestionContext context) {
        if (node == null || !node.isObject()) {
            return reject(notAnObject(node));
        }
        return buildAsset((ObjectNode) node, context, Instant.now(clock), node.toString());
    }

    @Override
    public BatchIngestionResult ingestQuestionBatch(String rawText, int requested, IngestionContext context) {
        Optional<IngestionFailure> receiveFailure = checkReceived(rawText);
        if (receiveFailure.isPresent()) {
            return failedBatch(requested, receiveFailure.get());
        }
        ObjectNode root;
        try {
            root = parseStrict(rawText);
        } catch (AIResponseParseException e) {
            return failedBatch(requested, parseFailure(e, rawText));
        }
        return ingestElements(root, requested, context, Instant.now(clock), rawText);
    }

    @Override
    public ReadingMaterialResult ingestReadingMaterial(String rawText, int requested, IngestionContext context) {
        Optional<IngestionFailure> receiveFailure = checkReceived(rawText);
        if (receiveFailure.isPresent()) {
            return rejectedMaterial(requested, receiveFailure.get());
        }
        ObjectNode root;
        try {
            root = parseStrict(rawText);
        } catch (AIResponseParseException e) {
            return rejectedMaterial(requested, parseFailure(e, rawText));
        }

        JsonNode passageNode = root.get(PASSAGE_ASSET_FIELD);
        if (passageNode == null || !passageNode.isObject()) {
            return rejectedMaterial(requested, logged(IngestionFailure.of(RejectionReason.JSON_PARSE_ERROR,
                    IngestionState.PARSE_FAILED, "payload has no '" + PASSAGE_ASSET_FIELD + "' object", rawText)));
        }

        Instant receivedAt = Instant.now(clock);
        IngestionContext passageContext = context.toBuilder().expectedAssetType(AssetType.PASSAGE).build();
        IngestionOutcome<Asset> passageOutcome = buildAsset((ObjectNode) passageNode, passageContext, receivedAt,
                passageNode.toString());
        if (!passageOutcome.isAccepted()) {
            return rejectedMaterial(requested, passageOutcome.getFailure());
        }
        PassageAsset passage = (PassageAsset) passageOutcome.getEntity();

        IngestionContext questionContext = context.toBuilder()
                .expectedQuestionType(context.getExpectedQuestionType() != null
                        ? context.getExpectedQuestionType()
                        : QuestionType.READING_COMPREHENSION)
                .difficulty(passage.getDifficulty())
                .build();
        BatchIngestionResult batch = ingestElements(root, requested, questionContext, receivedAt, rawText);
        LinkResult linkResult = crossReferenceLinker.link(passage, batch.accepted());

        GeneratedReadingMaterial material = linkResult.linked().isEmpty()
                ? null
                : new GeneratedReadingMaterial(passage, linkResult.linked());
        if (material == null) {
            log.warn("Reading material rejected: passage {} accepted but no question linked ({} of {} requested survived)",
                    passage.getAssetId(), batch.acceptedCount(), requested);
        } else {
            log.debug("Reading material accepted: passage {} with {} of {} requested questions",
                    passage.getAssetId(), material.questions().size(), requested);
        }
        return new ReadingMaterialResult(material, null, batch, linkResult.mismatches());
    }

    private BatchIngestionResult ingestElements(ObjectNode root,
                                                int requested,
                                                IngestionContext context,
                                                Instant receivedAt,
                                                String rawText) {
        JsonNode list = root.get(QUESTIONS_LIST_FIELD);
        if (list == null || !list.isArray()) {
            return failedBatch(requested, logged(IngestionFailure.of(RejectionReason.JSON_PARSE_ERROR,
                    IngestionState.PARSE_FAILED, "payload has no '" + QUESTIONS_LIST_FIELD + "' array", rawText)));
        }

        List<Question> accepted = new ArrayList<>();
        List<ElementRejection> rejections = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            JsonNode element = list.get(i);
            IngestionOutcome<Question> outcome = ingestElement(element, context, receivedAt);
            if (outcome.isAccepted()) {
                accepted.add(outcome.getEntity());
            } else {
                log.warn("Dropping batch element {}: {}", i, outcome.getFailure().message());
                rejections.add(new ElementRejection(i, outcome.getFailure()));
            }
        }

        if (list.size() != requested) {
            log.warn("Batch returned {} elements, {} were requested", list.size(), requested);
        }
        log.info("Batch ingestion accepted {} of {} requested questions", accepted.size(), requested);
        return new BatchIngestionResult(requested, accepted, rejections, null);
    }

    /**
     * An element may be an object, or a string holding embedded JSON that must itself decode strictly.
     */
    private IngestionOutcome<Question> ingestElement(JsonNode element, IngestionContext context, Instant receivedAt) {
        if (element.isTextual()) {
            String embedded = element.asText();
            Optional<IngestionFailure> receiveFailure = checkReceived(embedded);
            if (receiveFailure.isPresent()) {
                return reject(receiveFailure.get());
            }
            try {
                return buildQuestion(parseStrict(embedded), context, receivedAt, embedded);
            } catch (AIResponseParseException e) {
                return reject(parseFailure(e, embedded));
            }
        }
        if (!element.isObject()) {
            return reject(notAnObject(element));
        }
        return buildQuestion((ObjectNode) element, context, receivedAt, element.toString());
    }

    private IngestionOutcome<Question> buildQuestion(ObjectNode node,
                                                     IngestionContext context,
                                                     Instant receivedAt,
                                                     String rawText) {
        QuestionType type;
        try {
            type = resolve(node, ContentKind.QUESTION, context.getExpectedQuestionType(), QuestionType::fromTag);
        } catch (UnknownVariantException e) {
            return reject(resolutionFailure(e, rawText));
        }
        log.debug("Discriminator resolved to {}", type);

        FieldReader reader = new FieldReader(node);
        Question question = questionParserFactory.getParser(type).parse(reader, context, receivedAt);
        ValidationResult<Question> result = contentValidator.validate(question);
        return finish(question, reader.violations(), result.violations(), type.tag() + " question", rawText);
    }

    private IngestionOutcome<Asset> buildAsset(ObjectNode node,
                                               IngestionContext context,
                                               Instant receivedAt,
                                               String rawText) {
        AssetType type;
        try {
            type = resolve(node, ContentKind.ASSET, context.getExpectedAssetType(), AssetType::fromTag);
        } catch (UnknownVariantException e) {
            return reject(resolutionFailure(e, rawText));
        }
        log.debug("Discriminator resolved to {}", type);

        FieldReader reader = new FieldReader(node);
        Asset asset = assetParserFactory.getParser(type).parse(reader, context, receivedAt);
        ValidationResult<Asset> result = contentValidator.validate(asset);
        return finish(asset, reader.violations(), result.violations(), type.tag() + " asset", rawText);
    }

    private <T> IngestionOutcome<T> finish(T entity,
                                           List<InvariantViolation> coercion,
                                           List<InvariantViolation> invariants,
                                           String subject,
                                           String rawText) {
        List<InvariantViolation> violations = merge(coercion, invariants);
        if (!violations.isEmpty()) {
            String message = subject + " failed validation with " + violations.size() + " violation(s)";
            return reject(logged(new IngestionFailure(RejectionReason.INVARIANT_VIOLATION,
                    IngestionState.VALIDATION_FAILED, message, violations, rawText)));
        }
        log.debug("Accepted {}", subject);
        return IngestionOutcome.accepted(entity);
    }

    /**
     * Coercion problems come first. An invariant violation on the exact field whose value
     * failed coercion only restates the problem and is dropped. Rules on an enclosing field,
     * such as the correct-choice count of a list, are kept.
     */
    static List<InvariantViolation> merge(List<InvariantViolation> coercion, List<InvariantViolation> invariants) {
        List<InvariantViolation> merged = new ArrayList<>(coercion);
        for (InvariantViolation violation : invariants) {
            boolean restated = coercion.stream()
                    .anyMatch(c -> c.field().equals(violation.field()));
            if (!restated) {
                merged.add(violation);
            }
        }
        return merged;
    }

    private <E> E resolve(ObjectNode node, ContentKind kind, E expected, Function<String, Optional<E>> lookup) {
        String field = kind.discriminatorField();
        JsonNode tagNode = node.get(field);
        if (tagNode == null || tagNode.isNull()) {
            if (expected == null) {
                throw new UnknownVariantException("payload has no '" + field + "' and no type was expected", null);
            }
            return expected;
        }
        if (!tagNode.isTextual()) {
            throw new UnknownVariantException("'" + field + "' must be a string", tagNode.toString());
        }
        String tag = tagNode.asText();
        E resolved = lookup.apply(tag)
                .orElseThrow(() -> new UnknownVariantException("unknown " + field + " '" + tag + "'", tag));
        if (expected != null && expected != resolved) {
            throw new UnknownVariantException(
                    field + " '" + tag + "' does not match the requested type " + expected, tag);
        }
        return resolved;
    }

    private ObjectNode parseStrict(String rawText) {
        JsonNode root;
        try {
            root = strictReader.readTree(rawText);
        } catch (JsonProcessingException e) {
            throw new AIResponseParseException("response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new AIResponseParseException("response must be a single JSON object");
        }
        return (ObjectNode) root;
    }

    private Optional<IngestionFailure> checkReceived(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Optional.of(logged(IngestionFailure.of(RejectionReason.EMPTY_RESPONSE,
                    IngestionState.RAW_RECEIVED, "response is empty", rawText)));
        }
        return Optional.empty();
    }

    private IngestionFailure parseFailure(AIResponseParseException e, String rawText) {
        return logged(IngestionFailure.of(RejectionReason.JSON_PARSE_ERROR, IngestionState.PARSE_FAILED,
                e.getMessage(), rawText));
    }

    private IngestionFailure resolutionFailure(UnknownVariantException e, String rawText) {
        return logged(IngestionFailure.of(RejectionReason.UNKNOWN_DISCRIMINATOR, IngestionState.RESOLUTION_FAILED,
                e.getMessage(), rawText));
    }

    private IngestionFailure notAnObject(JsonNode node) {
        String kind = node == null ? "nothing" : node.getNodeType().name().toLowerCase();
        return logged(IngestionFailure.of(RejectionReason.JSON_PARSE_ERROR, IngestionState.PARSE_FAILED,
                "expected a JSON object, got " + kind, node == null ? null : node.toString()));
    }

    private IngestionFailure logged(IngestionFailure failure) {
        log.warn("Ingestion rejected [{}] at {}: {} | raw: {}",
                failure.reason(), failure.failedAt(), failure.message(),
                failure.snippet(generationProperties.getRawSnippetLength()));
        return failure;
    }

    private BatchIngestionResult failedBatch(int requested, IngestionFailure failure) {
        return BatchIngestionResult.failed(requested, failure);
    }

    private ReadingMaterialResult rejectedMaterial(int requested, IngestionFailure failure) {
        return new ReadingMaterialResult(null, failure, BatchIngestionResult.failed(requested, failure), List.of());
    }

    private static <T> IngestionOutcome<T> reject(IngestionFailure failure) {
        return IngestionOutcome.rejected(failure);
    }
}
