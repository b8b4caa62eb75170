package uk.gegc.examgen.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import uk.gegc.examgen.features.ai.application.impl.ContentIngestionServiceImpl;
import uk.gegc.examgen.features.ai.infra.linker.CrossReferenceLinker;
import uk.gegc.examgen.features.ai.infra.parser.AssetParserFactory;
import uk.gegc.examgen.features.ai.infra.parser.AudioAssetParser;
import uk.gegc.examgen.features.ai.infra.parser.FillInTheBlankParser;
import uk.gegc.examgen.features.ai.infra.parser.ImageAssetParser;
import uk.gegc.examgen.features.ai.infra.parser.ListeningComprehensionParser;
import uk.gegc.examgen.features.ai.infra.parser.PassageAssetParser;
import uk.gegc.examgen.features.ai.infra.parser.PictureDescriptionParser;
import uk.gegc.examgen.features.ai.infra.parser.QuestionParserFactory;
import uk.gegc.examgen.features.ai.infra.parser.ReadingComprehensionParser;
import uk.gegc.examgen.features.ai.infra.parser.SpellingCorrectionParser;
import uk.gegc.examgen.features.ai.infra.parser.TranslationParser;
import uk.gegc.examgen.features.content.application.ContentValidator;
import uk.gegc.examgen.features.content.application.DifficultyCatalog;
import uk.gegc.examgen.features.content.domain.model.AnswerInputType;
import uk.gegc.examgen.features.content.domain.model.AudioAsset;
import uk.gegc.examgen.features.content.domain.model.ChoiceDetail;
import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.FillInTheBlankQuestion;
import uk.gegc.examgen.features.content.domain.model.ImageAsset;
import uk.gegc.examgen.features.content.domain.model.ListeningComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.model.LocalizedString;
import uk.gegc.examgen.features.content.domain.model.PassageAsset;
import uk.gegc.examgen.features.content.domain.model.PictureDescriptionQuestion;
import uk.gegc.examgen.features.content.domain.model.ReadingComprehensionQuestion;
import uk.gegc.examgen.features.content.domain.model.SpellingCorrectionQuestion;
import uk.gegc.examgen.features.content.domain.model.Stage;
import uk.gegc.examgen.features.content.domain.model.TargetLanguage;
import uk.gegc.examgen.features.content.domain.model.TranslationQuestion;
import uk.gegc.examgen.features.content.infra.factory.AssetValidatorFactory;
import uk.gegc.examgen.features.content.infra.factory.QuestionValidatorFactory;
import uk.gegc.examgen.features.content.infra.validator.AudioAssetValidator;
import uk.gegc.examgen.features.content.infra.validator.FillInTheBlankValidator;
import uk.gegc.examgen.features.content.infra.validator.ImageAssetValidator;
import uk.gegc.examgen.features.content.infra.validator.ListeningComprehensionValidator;
import uk.gegc.examgen.features.content.infra.validator.PassageAssetValidator;
import uk.gegc.examgen.features.content.infra.validator.PictureDescriptionValidator;
import uk.gegc.examgen.features.content.infra.validator.ReadingComprehensionValidator;
import uk.gegc.examgen.features.content.infra.validator.SpellingCorrectionValidator;
import uk.gegc.examgen.features.content.infra.validator.TranslationValidator;
import uk.gegc.examgen.shared.config.GenerationProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Valid sample content and hand-wired pipeline components for tests that do not start a
 * Spring context.
 */
public final class ContentFixtures {

    public static final Instant NOW = Instant.parse("2025-03-01T09:30:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final String PASSAGE_ID = "passage-001";
    public static final String AUDIO_ID = "audio-001";
    public static final String IMAGE_ID = "image-001";

    private ContentFixtures() {
    }

    public static DifficultyDetail difficulty() {
        return DifficultyCatalog.detailFor(Stage.JUNIOR_HIGH, 1, 4);
    }

    public static LocalizedString explanation() {
        return LocalizedString.of("Because the passage says so.", "因為文章這樣說。");
    }

    public static List<ChoiceDetail> choices() {
        return List.of(
                ChoiceDetail.wrong("A cat"),
                ChoiceDetail.correct("A dog"),
                ChoiceDetail.wrong("A bird"),
                ChoiceDetail.wrong("A fish"));
    }

    // Components

    public static ContentValidator contentValidator() {
        return new ContentValidator(
                new QuestionValidatorFactory(List.of(
                        new FillInTheBlankValidator(),
                        new TranslationValidator(),
                        new PictureDescriptionValidator(),
                        new ReadingComprehensionValidator(),
                        new ListeningComprehensionValidator(),
                        new SpellingCorrectionValidator())),
                new AssetValidatorFactory(List.of(
                        new PassageAssetValidator(),
                        new AudioAssetValidator(),
                        new ImageAssetValidator())));
    }

    public static QuestionParserFactory questionParserFactory() {
        return new QuestionParserFactory(List.of(
                new FillInTheBlankParser(),
                new TranslationParser(),
                new PictureDescriptionParser(),
                new ReadingComprehensionParser(),
                new ListeningComprehensionParser(),
                new SpellingCorrectionParser()));
    }

    public static AssetParserFactory assetParserFactory() {
        return new AssetParserFactory(List.of(
                new PassageAssetParser(),
                new AudioAssetParser(),
                new ImageAssetParser()));
    }

    public static ContentIngestionServiceImpl ingestionService(ObjectMapper objectMapper) {
        return new ContentIngestionServiceImpl(
                objectMapper,
                questionParserFactory(),
                assetParserFactory(),
                contentValidator(),
                new CrossReferenceLinker(),
                new GenerationProperties(),
                CLOCK);
    }

    // Assets

    public static PassageAsset passage(String assetId) {
        return PassageAsset.builder()
                .assetId(assetId)
                .title(LocalizedString.of("A Day at the Zoo", "動物園的一天"))
                .description(LocalizedString.of("A class trip to the zoo.", "班級到動物園的校外教學。"))
                .difficulty(difficulty())
                .tags(List.of("animals", "school"))
                .content("On Friday our class went to the zoo. My favourite animal was a dog that helped the keepers.")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static AudioAsset audio(String assetId) {
        return AudioAsset.builder()
                .assetId(assetId)
                .title(LocalizedString.of("At the Station", "在車站"))
                .difficulty(difficulty())
                .audioUrl("https://cdn.example.com/audio/station.mp3")
                .durationSeconds(42.5)
                .transcript("Excuse me, which platform does the train to Tainan leave from?")
                .speakerInfo(List.of("woman", "station clerk"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static ImageAsset image(String assetId) {
        return ImageAsset.builder()
                .assetId(assetId)
                .title(LocalizedString.of("Morning Market", "早市"))
                .description(LocalizedString.of("People buying vegetables at a market.", "人們在市場買菜。"))
                .difficulty(difficulty())
                .imageUrl("https://cdn.example.com/images/market.png")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    // Questions

    public static ReadingComprehensionQuestion readingMultipleChoice(String passageId) {
        return ReadingComprehensionQuestion.builder()
                .difficulty(difficulty())
                .questionText("Which animal helped the keepers?")
                .explanation(explanation())
                .contentAssetId(passageId)
                .choices(choices())
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static ReadingComprehensionQuestion readingTextInput(String passageId) {
        return ReadingComprehensionQuestion.builder()
                .difficulty(difficulty())
                .questionText("When did the class go to the zoo?")
                .contentAssetId(passageId)
                .acceptableAnswers(List.of("On Friday", "Friday"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static ListeningComprehensionQuestion listening(String audioId) {
        return ListeningComprehensionQuestion.builder()
                .difficulty(difficulty())
                .questionText("Where is the woman going?")
                .contentAssetId(audioId)
                .choices(List.of(ChoiceDetail.correct("Tainan"), ChoiceDetail.wrong("Taipei")))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static FillInTheBlankQuestion fillInTheBlankMultipleChoice() {
        return FillInTheBlankQuestion.builder()
                .difficulty(difficulty())
                .questionText("My brother ____ to school by bus.")
                .answerInputType(AnswerInputType.MULTIPLE_CHOICE)
                .choices(List.of(ChoiceDetail.wrong("go"), ChoiceDetail.correct("goes"), ChoiceDetail.wrong("going")))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static FillInTheBlankQuestion fillInTheBlankTextInput() {
        return FillInTheBlankQuestion.builder()
                .difficulty(difficulty())
                .questionText("Yesterday I ____ (buy) a notebook.")
                .answerInputType(AnswerInputType.TEXT_INPUT)
                .acceptableAnswers(List.of("bought"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static TranslationQuestion translation() {
        return TranslationQuestion.builder()
                .difficulty(difficulty())
                .questionText("Translate into Traditional Chinese.")
                .sourceText(LocalizedString.of("It is raining.", "正在下雨。"))
                .targetLanguage(TargetLanguage.ZH_TW)
                .acceptableTranslations(List.of("正在下雨。", "在下雨。"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static PictureDescriptionQuestion pictureDescription(String imageId) {
        return PictureDescriptionQuestion.builder()
                .difficulty(difficulty())
                .questionText("Describe what the people are doing.")
                .imageAssetId(imageId)
                .suggestedKeywords(List.of("market", "buying"))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static SpellingCorrectionQuestion spellingWordChoices() {
        return SpellingCorrectionQuestion.builder()
                .difficulty(difficulty())
                .questionText("Choose the correctly spelled word.")
                .wordChoices(List.of("recieve", "receive", "receeve"))
                .correctWord("receive")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static SpellingCorrectionQuestion spellingSentence() {
        return SpellingCorrectionQuestion.builder()
                .difficulty(difficulty())
                .questionText("Find the misspelled word.")
                .sentenceWithMisspelledWord("My freind lives next door.")
                .misspelledWordInSentence("freind")
                .correctWord("friend")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
