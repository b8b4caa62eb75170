package uk.gegc.examgen.features.content.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.infra.validator.QuestionValidator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class QuestionValidatorFactory {
    private final Map<QuestionType, QuestionValidator<?>> validatorMap = new EnumMap<>(QuestionType.class);

    public QuestionValidatorFactory(List<QuestionValidator<?>> validators) {
        log.info("Initializing QuestionValidatorFactory with {} validators", validators.size());

        validators.forEach(validator -> validatorMap.put(validator.supportedType(), validator));

        log.info("QuestionValidatorFactory initialized with validators for types: {}", validatorMap.keySet());
    }

    public QuestionValidator<?> getValidator(QuestionType type) {
        QuestionValidator<?> validator = validatorMap.get(type);
        if (validator == null) {
            throw new UnsupportedOperationException("No validator for type " + type);
        }
        return validator;
    }
}
