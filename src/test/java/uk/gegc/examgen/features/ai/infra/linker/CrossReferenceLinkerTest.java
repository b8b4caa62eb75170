package uk.gegc.examgen.features.ai.infra.linker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examgen.features.ai.domain.model.LinkResult;
import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.examgen.testsupport.ContentFixtures.AUDIO_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.IMAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.PASSAGE_ID;
import static uk.gegc.examgen.testsupport.ContentFixtures.audio;
import static uk.gegc.examgen.testsupport.ContentFixtures.image;
import static uk.gegc.examgen.testsupport.ContentFixtures.listening;
import static uk.gegc.examgen.testsupport.ContentFixtures.passage;
import static uk.gegc.examgen.testsupport.ContentFixtures.pictureDescription;
import static uk.gegc.examgen.testsupport.ContentFixtures.readingMultipleChoice;
import static uk.gegc.examgen.testsupport.ContentFixtures.readingTextInput;
import static uk.gegc.examgen.testsupport.ContentFixtures.translation;

class CrossReferenceLinkerTest {

    private final CrossReferenceLinker linker = new CrossReferenceLinker();

    @Test
    @DisplayName("questions that name the passage are linked in order")
    void linksMatchingQuestions() {
        Question first = readingMultipleChoice(PASSAGE_ID);
        Question second = readingTextInput(PASSAGE_ID);

        LinkResult result = linker.link(passage(PASSAGE_ID), List.of(first, second));

        assertThat(result.linked()).containsExactly(first, second);
        assertThat(result.mismatches()).isEmpty();
    }

    @Test
    @DisplayName("a valid question naming another passage is excluded, the rest are kept")
    void excludesOtherPassage() {
        Question stray = readingMultipleChoice("passage-999");
        Question kept = readingTextInput(PASSAGE_ID);

        LinkResult result = linker.link(passage(PASSAGE_ID), List.of(stray, kept));

        assertThat(result.linked()).containsExactly(kept);
        assertThat(result.mismatches()).singleElement().satisfies(mismatch -> {
            assertThat(mismatch.question()).isSameAs(stray);
            assertThat(mismatch.referencedAssetId()).isEqualTo("passage-999");
            assertThat(mismatch.expectedAssetId()).isEqualTo(PASSAGE_ID);
        });
    }

    @Test
    @DisplayName("a reading question cannot link to an audio asset even with the same id")
    void wrongAssetType() {
        LinkResult result = linker.link(audio(AUDIO_ID), List.of(readingMultipleChoice(AUDIO_ID)));

        assertThat(result.linked()).isEmpty();
        assertThat(result.mismatches()).hasSize(1);
        assertThat(result.mismatches().get(0).message()).contains("PASSAGE");
    }

    @Test
    @DisplayName("listening and picture questions link to their own asset types")
    void otherVariants() {
        assertThat(linker.link(audio(AUDIO_ID), List.of(listening(AUDIO_ID))).linked()).hasSize(1);
        assertThat(linker.link(image(IMAGE_ID), List.of(pictureDescription(IMAGE_ID))).linked()).hasSize(1);
    }

    @Test
    @DisplayName("variants without an asset reference never link")
    void unreferencedVariant() {
        LinkResult result = linker.link(passage(PASSAGE_ID), List.of(translation()));

        assertThat(result.linked()).isEmpty();
        assertThat(result.mismatches()).singleElement()
                .satisfies(mismatch -> assertThat(mismatch.referencedAssetId()).isNull());
    }
}
