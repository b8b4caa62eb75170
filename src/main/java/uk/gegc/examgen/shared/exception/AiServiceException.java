package uk.gegc.examgen.shared.exception;

/**
 * Thrown when the model-call collaborator fails: network error, timeout, empty reply or
 * exhausted retries.
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
