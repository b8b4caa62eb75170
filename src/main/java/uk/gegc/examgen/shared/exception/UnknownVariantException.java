package uk.gegc.examgen.shared.exception;

/**
 * Thrown when a discriminator tag is absent or outside the closed set of variants
 */
public class UnknownVariantException extends RuntimeException {

    private final String tag;

    public UnknownVariantException(String message, String tag) {
        super(message);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
