package uk.gegc.examgen.features.ai.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.examgen.features.ai.domain.model.BatchIngestionResult;
import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.ai.domain.model.IngestionOutcome;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialResult;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.ContentKind;
import uk.gegc.examgen.features.content.domain.model.Question;

/**
 * Parse, resolve, validate and accept or reject untrusted structured input. No method throws
 * for bad input; every failure comes back as a rejected outcome with a structured reason.
 */
public interface ContentIngestionService {

    /**
     * Runs one raw payload through the pipeline as the given family.
     */
    IngestionOutcome<?> ingest(ContentKind kind, String rawText, IngestionContext context);

    IngestionOutcome<Question> ingestQuestion(String rawText, IngestionContext context);

    IngestionOutcome<Asset> ingestAsset(String rawText, IngestionContext context);

    /**
     * Entry point for already-decoded documents, e.g. storage read-back. Starts at discriminator
     * resolution.
     */
    IngestionOutcome<Question> ingestQuestionNode(JsonNode node, IngestionContext context);

    IngestionOutcome<Asset> ingestAssetNode(JsonNode node, IngestionContext context);

    /**
     * Ingests a {@code {"questions_list": [...]}} envelope; each element runs independently.
     *
     * @param requested number of questions the caller asked for
     */
    BatchIngestionResult ingestQuestionBatch(String rawText, int requested, IngestionContext context);

    /**
     * Ingests a {@code {"passageAsset": {...}, "questions_list": [...]}} payload and links the
     * questions to the passage.
     */
    ReadingMaterialResult ingestReadingMaterial(String rawText, int requested, IngestionContext context);
}
