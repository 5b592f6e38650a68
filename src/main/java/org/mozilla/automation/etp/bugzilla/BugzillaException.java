package org.mozilla.automation.etp.bugzilla;

/**
 * Bugzilla rejected a request, or returned something we could not use.
 * Transient failures are reported as {@link org.mozilla.automation.etp.TransientException} instead.
 */
public class BugzillaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public BugzillaException(String message) {
        this(message, -1, null);
    }

    public BugzillaException(String message, int status, Throwable cause) {
        super(status > 0 ? "%s (HTTP %d)".formatted(message, status) : message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
