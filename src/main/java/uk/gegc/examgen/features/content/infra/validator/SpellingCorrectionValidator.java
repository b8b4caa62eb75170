package uk.gegc.examgen.features.content.infra.validator;

import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.QuestionType;
import uk.gegc.examgen.features.content.domain.model.SpellingCorrectionQuestion;
import uk.gegc.examgen.features.content.domain.validation.ViolationCode;

import java.util.List;

/**
 * Word-choice mode and sentence mode are mutually exclusive; {@code correctWord} is needed by both.
 */
@Component
public class SpellingCorrectionValidator extends QuestionValidator<SpellingCorrectionQuestion> {

    public SpellingCorrectionValidator() {
        super(SpellingCorrectionQuestion.class);
    }

    @Override
    public QuestionType supportedType() {
        return QuestionType.SPELLING_CORRECTION;
    }

    @Override
    protected void validateVariant(SpellingCorrectionQuestion question, ViolationCollector collector) {
        boolean wordMode = question.hasWordChoiceMode();
        boolean sentenceMode = question.hasSentenceMode();
        if (wordMode == sentenceMode) {
            collector.add("wordChoices", ViolationCode.SPELLING_MODE_EXCLUSIVE,
                    wordMode
                            ? "'wordChoices' cannot be combined with the sentence fields"
                            : "either 'wordChoices' or 'sentenceWithMisspelledWord' must be set");
            return;
        }

        String correctWord = question.getCorrectWord();
        collector.require("correctWord", correctWord);
        if (wordMode) {
            List<String> wordChoices = question.getWordChoices();
            collector.requireAnswers("wordChoices", wordChoices);
            if (correctWord != null && !wordChoices.contains(correctWord)) {
                collector.add("correctWord", ViolationCode.CORRECT_WORD_NOT_IN_CHOICES,
                        "'" + correctWord + "' is not one of the word choices");
            }
        } else {
            collector.require("sentenceWithMisspelledWord", question.getSentenceWithMisspelledWord());
            collector.require("misspelledWordInSentence", question.getMisspelledWordInSentence());
        }
    }
}
