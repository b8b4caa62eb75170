package uk.gegc.examgen.shared.exception;

/**
 * Thrown when raw model text is not exactly one JSON object
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
