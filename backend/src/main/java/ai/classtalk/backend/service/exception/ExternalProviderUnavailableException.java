package ai.classtalk.backend.service.exception;

/**
 * The speech-to-text provider could not deliver the authoritative transcript.
 * Callers are expected to degrade to the locally accumulated transcript.
 */
public class ExternalProviderUnavailableException extends Exception {

    public ExternalProviderUnavailableException(String message) {
        super(message);
    }

    public ExternalProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
