package ai.classtalk.backend.service.exception;

/**
 * Generic failure of the session/moderation services.
 * Carries a client-safe message so storage internals are not disclosed.
 */
public class ModerationServiceException extends RuntimeException {

    public ModerationServiceException(String message) {
        super(message);
    }

    public ModerationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
