package uk.gegc.examgen.features.content.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Read-only list handling for entity fields. Absent lists stay null and null entries are kept,
 * because the validator reports both.
 */
final class ContentLists {

    private ContentLists() {
    }

    static <T> List<T> readOnly(List<T> values) {
        return values == null ? null : Collections.unmodifiableList(values);
    }
}
