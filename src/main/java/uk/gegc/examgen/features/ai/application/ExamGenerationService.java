package uk.gegc.examgen.features.ai.application;

import uk.gegc.examgen.features.ai.domain.model.GenerationRequest;
import uk.gegc.examgen.features.ai.domain.model.PassageReport;
import uk.gegc.examgen.features.ai.domain.model.QuestionBatchReport;
import uk.gegc.examgen.features.ai.domain.model.ReadingMaterialReport;

/**
 * Request, prompt, model call (or example payload), ingestion and linking for one generation
 * unit. One model call per unit, never one per question.
 */
public interface ExamGenerationService {

    QuestionBatchReport generateQuestion(GenerationRequest request);

    QuestionBatchReport generateQuestions(GenerationRequest request);

    PassageReport generatePassage(GenerationRequest request);

    ReadingMaterialReport generateReadingMaterial(GenerationRequest request);
}
