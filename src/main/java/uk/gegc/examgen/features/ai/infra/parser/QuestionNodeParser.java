package uk.gegc.examgen.features.ai.infra.parser;

import uk.gegc.examgen.features.ai.domain.model.IngestionContext;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.time.Instant;
import java.util.List;

/**
 * Builds one question variant from a parsed payload. Construction never fails: coercion
 * problems are left on the {@link FieldReader} for the pipeline to report.
 */
public abstract class QuestionNodeParser {

    /**
     * Returns the question type that this parser builds
     */
    public abstract QuestionType supportedType();

    public abstract Question parse(FieldReader reader, IngestionContext context, Instant receivedAt);

    /**
     * Fills the fields every variant shares. Payload values win over context defaults.
     */
    protected void readCommon(Question.QuestionBuilder<?, ?> builder,
                              FieldReader reader,
                              IngestionContext context,
                              Instant receivedAt) {
        DifficultyDetail difficulty = reader.has("difficulty")
                ? reader.difficulty("difficulty")
                : context.getDifficulty();
        List<String> learningObjectives = reader.has("learningObjectives")
                ? reader.strings("learningObjectives")
                : context.getLearningObjectives();
        Instant createdAt = reader.has("createdAt") ? reader.instant("createdAt") : receivedAt;
        Instant updatedAt = reader.has("updatedAt") ? reader.instant("updatedAt") : createdAt;

        builder.difficulty(difficulty)
                .questionText(reader.text("questionText"))
                .explanation(reader.explanation())
                .createdAt(createdAt)
                .updatedAt(updatedAt);
        if (learningObjectives != null) {
            builder.learningObjectives(List.copyOf(learningObjectives));
        }
    }

    protected static String textOrDefault(FieldReader reader, String field, String fallback) {
        return reader.has(field) ? reader.text(field) : fallback;
    }
}
