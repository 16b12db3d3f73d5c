package ai.classtalk.backend.client;

/**
 * Save state reported to the recording UI.
 */
public enum SaveStatus {
    /** Every buffered segment has been acknowledged. */
    SAVED,
    /** An append is in flight or waiting to retry. */
    SAVING,
    /** Retries are exhausted or the session rejected the append. Terminal. */
    FAILED
}
