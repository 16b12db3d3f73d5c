package ai.classtalk.backend.service.exception;

import ai.classtalk.backend.model.entity.SessionStatus;

/**
 * The session is no longer accepting the requested mutation.
 */
public class SessionClosedException extends RuntimeException {

    private final SessionStatus status;

    public SessionClosedException(String message, SessionStatus status) {
        super(message);
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
