package uk.gegc.examgen.features.content.domain.model;

/**
 * Paired English / Traditional Chinese text. Both halves must be present; either may be empty.
 */
public record LocalizedString(String en, String zhTw) {

    public static LocalizedString of(String en, String zhTw) {
        return new LocalizedString(en, zhTw);
    }

    public boolean isComplete() {
        return en != null && zhTw != null;
    }
}
