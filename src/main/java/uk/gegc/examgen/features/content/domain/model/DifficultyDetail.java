package uk.gegc.examgen.features.content.domain.model;

/**
 * Difficulty of a question or asset. Always copied into the owning entity, never shared by reference.
 *
 * @param stage educational stage
 * @param grade grade within the stage, 1 or higher
 * @param level overall difficulty on a 1-10 scale
 * @param name  human-readable name, e.g. "Junior High - Grade 1" / "國中一年級"
 */
public record DifficultyDetail(Stage stage, int grade, int level, LocalizedString name) {

    public static final int MIN_GRADE = 1;
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 10;
}
