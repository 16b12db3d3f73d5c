package ai.classtalk.backend.service.exception;

/**
 * A submitted segment is missing required fields or has inconsistent timing.
 */
public class InvalidSegmentException extends RuntimeException {

    public InvalidSegmentException(String message) {
        super(message);
    }
}
