package uk.gegc.examgen.features.content.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.Question;
import uk.gegc.examgen.features.content.domain.validation.InvariantViolation;
import uk.gegc.examgen.features.content.domain.validation.ValidationResult;
import uk.gegc.examgen.features.content.infra.factory.AssetValidatorFactory;
import uk.gegc.examgen.features.content.infra.factory.QuestionValidatorFactory;
import uk.gegc.examgen.shared.exception.ValidationException;

import java.util.List;

/**
 * Entry point of the invariant rules. The same checks run for model output, manual entry and
 * storage read-back. Validation is pure: calling it twice on one entity yields identical lists.
 */
@Service
@RequiredArgsConstructor
public class ContentValidator {

    private final QuestionValidatorFactory questionValidatorFactory;
    private final AssetValidatorFactory assetValidatorFactory;

    public <T extends Question> ValidationResult<T> validate(T question) {
        List<InvariantViolation> violations = questionValidatorFactory
                .getValidator(question.getQuestionType())
                .validate(question);
        return ValidationResult.of(question, violations);
    }

    public <T extends Asset> ValidationResult<T> validate(T asset) {
        List<InvariantViolation> violations = assetValidatorFactory
                .getValidator(asset.getAssetType())
                .validate(asset);
        return ValidationResult.of(asset, violations);
    }

    /**
     * @throws ValidationException carrying every violation when the question is not valid
     */
    public <T extends Question> T requireValid(T question) {
        ValidationResult<T> result = validate(question);
        if (!result.isValid()) {
            throw new ValidationException(question.getQuestionType().tag() + " question", result.violations());
        }
        return question;
    }

    /**
     * @throws ValidationException carrying every violation when the asset is not valid
     */
    public <T extends Asset> T requireValid(T asset) {
        ValidationResult<T> result = validate(asset);
        if (!result.isValid()) {
            throw new ValidationException(asset.getAssetType().tag() + " asset " + asset.getAssetId(), result.violations());
        }
        return asset;
    }
}
