package uk.gegc.examgen.shared.util;

import java.util.UUID;

public final class IdGenerator {

    private IdGenerator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * 32-character lowercase hex id for store documents.
     */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
