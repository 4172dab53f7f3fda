package warden.core.model.denylist;

/**
 * Raised when the deny-list feed cannot be fetched.
 */
public class DenyListFeedException extends RuntimeException {

    private final int status;

    public DenyListFeedException(String url, int status) {
        super("Failed to fetch deny-list from " + url + ": HTTP " + status);
        this.status = status;
    }

    public DenyListFeedException(String url, Throwable cause) {
        super("Failed to fetch deny-list from " + url, cause);
        this.status = -1;
    }

    /** Returns the HTTP status, or -1 when no response arrived. */
    public int getStatus() {
        return status;
    }
}
