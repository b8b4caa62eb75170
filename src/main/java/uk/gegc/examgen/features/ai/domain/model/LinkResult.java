package uk.gegc.examgen.features.ai.domain.model;

import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.List;

public record LinkResult(List<Question> linked, List<LinkMismatch> mismatches) {

    public LinkResult {
        linked = List.copyOf(linked);
        mismatches = List.copyOf(mismatches);
    }
}
