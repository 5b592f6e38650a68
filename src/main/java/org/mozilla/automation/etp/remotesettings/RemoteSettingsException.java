package org.mozilla.automation.etp.remotesettings;

/**
 * Remote Settings rejected a request, or returned something we could not use.
 * Transient failures are reported as {@link org.mozilla.automation.etp.TransientException} instead.
 */
public class RemoteSettingsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public RemoteSettingsException(String message) {
        this(message, -1, null);
    }

    public RemoteSettingsException(String message, int status, Throwable cause) {
        super(status > 0 ? "%s (HTTP %d)".formatted(message, status) : message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    /**
     * @return true if the server refused the write because of a conflicting record
     */
    public boolean isConflict() {
        return status == 409 || status == 412;
    }
}
