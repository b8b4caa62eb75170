package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.List;

/**
 * Result of generating a question batch.
 *
 * @param questions accepted questions that also linked to the request's asset, if it had one
 */
public record QuestionBatchReport(GenerationSource source,
                                  BatchIngestionResult batch,
                                  List<Question> questions,
                                  List<LinkMismatch> linkMismatches) {

    public QuestionBatchReport {
        questions = List.copyOf(questions);
        linkMismatches = List.copyOf(linkMismatches);
    }

    public int requested() {
        return batch.requested();
    }

    public int acceptedCount() {
        return questions.size();
    }

    public boolean isAccepted() {
        return !questions.isEmpty();
    }

    public boolean needsTopUp() {
        return questions.size() < batch.requested();
    }
}
