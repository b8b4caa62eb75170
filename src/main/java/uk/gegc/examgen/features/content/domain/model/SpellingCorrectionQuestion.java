package uk.gegc.examgen.features.content.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Either a word-choice task ({@code wordChoices} + {@code correctWord}) or a sentence task
 * ({@code sentenceWithMisspelledWord} + {@code misspelledWordInSentence} + {@code correctWord}).
 */
@Getter
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SpellingCorrectionQuestion extends Question {

    private final List<String> wordChoices;

    private final String correctWord;

    private final String sentenceWithMisspelledWord;

    private final String misspelledWordInSentence;

    public List<String> getWordChoices() {
        return ContentLists.readOnly(wordChoices);
    }

    @Override
    public QuestionType getQuestionType() {
        return QuestionType.SPELLING_CORRECTION;
    }

    public boolean hasWordChoiceMode() {
        return wordChoices != null;
    }

    public boolean hasSentenceMode() {
        return sentenceWithMisspelledWord != null || misspelledWordInSentence != null;
    }
}
