package ai.classtalk.backend.service.exception;

/**
 * The caller does not own the requested session.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
