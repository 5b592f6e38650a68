package org.mozilla.automation.etp;

import java.net.HttpURLConnection;
import java.util.List;

/**
 * A failure talking to Bugzilla or Remote Settings that may succeed if tried again:
 * I/O errors, timeouts, throttling and gateway errors.
 * <p>
 * Only this exception is retried by {@link RetryingCaller}.
 */
public class TransientException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    static final List<Integer> TRANSIENT_STATUS = List.of(
            HttpURLConnection.HTTP_CLIENT_TIMEOUT,
            429, // too many requests
            HttpURLConnection.HTTP_BAD_GATEWAY,
            HttpURLConnection.HTTP_UNAVAILABLE,
            HttpURLConnection.HTTP_GATEWAY_TIMEOUT);

    private final int status;

    public TransientException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransientException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return HTTP status of the failed response, or -1 for connection-level failures
     */
    public int status() {
        return status;
    }

    public static boolean isTransientStatus(int status) {
        return TRANSIENT_STATUS.contains(status);
    }
}
