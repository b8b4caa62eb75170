package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.ReadingComprehensionQuestion;

@Component
public class ReadingComprehensionValidator extends ComprehensionQuestionValidator<ReadingComprehensionQuestion> {

    public ReadingComprehensionValidator() {
        super(ReadingComprehensionQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.READING_COMPREHENSION;
    }
}
