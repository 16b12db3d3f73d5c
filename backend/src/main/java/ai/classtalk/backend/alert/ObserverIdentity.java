package ai.classtalk.backend.alert;

/**
 * Identity of an authenticated observer connection.
 */
public class ObserverIdentity {

    private final String userId;
    private final String displayName;

    public ObserverIdentity(String userId, String displayName) {
        this.userId = userId;
        this.displayName = displayName;
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }
}
