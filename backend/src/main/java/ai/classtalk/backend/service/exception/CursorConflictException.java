package ai.classtalk.backend.service.exception;

/**
 * Thrown when an append was based on a stale cursor.
 * The caller should resubmit its unsent tail starting at {@link #getActual()}.
 */
public class CursorConflictException extends RuntimeException {

    private final int expected;
    private final int actual;

    public CursorConflictException(int expected, int actual) {
        super(String.format("Index mismatch: expected %d, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
