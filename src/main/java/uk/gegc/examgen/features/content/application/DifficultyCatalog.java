package uk.gegc.examgen.features.content.application;

import uk.gegc.examgen.features.content.domain.model.DifficultyDetail;
import uk.gegc.examgen.features.content.domain.model.LocalizedString;
import uk.gegc.examgen.features.content.domain.model.Stage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link DifficultyDetail} values with their display names. The English name is
 * {@code "<Stage Title> - Grade <n>"}; the Traditional Chinese name comes from a fixed table
 * and falls back to the English name outside it.
 */
public final class DifficultyCatalog {

    private static final Map<Stage, List<String>> ZH_TW_NAMES = new EnumMap<>(Stage.class);

    static {
        ZH_TW_NAMES.put(Stage.ELEMENTARY, List.of(
                "國小一年級", "國小二年級", "國小三年級", "國小四年級", "國小五年級", "國小六年級"));
        ZH_TW_NAMES.put(Stage.JUNIOR_HIGH, List.of("國中一年級", "國中二年級", "國中三年級"));
        ZH_TW_NAMES.put(Stage.SENIOR_HIGH, List.of("高中一年級", "高中二年級", "高中三年級"));
    }

    private DifficultyCatalog() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static DifficultyDetail detailFor(Stage stage, int grade, int level) {
        return new DifficultyDetail(stage, grade, level, nameFor(stage, grade));
    }

    public static LocalizedString nameFor(Stage stage, int grade) {
        String en = stage.title() + " - Grade " + grade;
        List<String> zhNames = ZH_TW_NAMES.getOrDefault(stage, List.of());
        String zhTw = grade >= 1 && grade <= zhNames.size() ? zhNames.get(grade - 1) : en;
        return LocalizedString.of(en, zhTw);
    }
}
