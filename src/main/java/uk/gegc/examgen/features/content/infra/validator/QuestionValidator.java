package uk.gegc.examgen.features.content.infra.validator;

import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;

import java.util.List;

/**
 * Rule set of one question variant. Common fields are checked here; the variant's own
 * cross-field rules live in {@link #validateVariant}.
 */
public abstract class QuestionValidator<T extends Question> {

    private final Class<T> questionClass;

    protected QuestionValidator(Class<T> questionClass) {
        this.questionClass = questionClass;
    }

    /**
     * Returns the question type that this validator supports
     */
    public abstract QuestionType supportedType();

    public List<InvariantViolation> validate(Question question) {
        if (!questionClass.isInstance(question)) {
            throw new IllegalArgumentException(
                    supportedType() + " validator cannot check " + question.getClass().getSimpleName());
        }
        ViolationCollector collector = new ViolationCollector();
        collector.requireDifficulty("difficulty", question.getDifficulty());
        if (collector.require("learningObjectives", question.getLearningObjectives())) {
            collector.checkEntries("learningObjectives", question.getLearningObjectives());
        }
        collector.checkLocalized("explanation", question.getExplanation());
        collector.require("createdAt", question.getCreatedAt());
        collector.require("updatedAt", question.getUpdatedAt());
        validateVariant(questionClass.cast(question), collector);
        return collector.violations();
    }

    protected abstract void validateVariant(T question, ViolationCollector collector);
}
