package uk.gegc.examgen.features.content.application;

import java.util.List;

public record SavedReadingMaterial(String passageId, List<String> questionIds) {

    public SavedReadingMaterial {
        questionIds = List.copyOf(questionIds);
    }
}
