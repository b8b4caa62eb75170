package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.ListeningComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

@Component
public class ListeningComprehensionValidator extends ComprehensionQuestionValidator<ListeningComprehensionQuestion> {

    public ListeningComprehensionValidator() {
        super(ListeningComprehensionQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.LISTENING_COMPREHENSION;
    }
}
