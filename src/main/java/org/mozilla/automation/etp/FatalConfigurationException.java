package org.mozilla.automation.etp;

/**
 * Required process configuration is missing or invalid.
 * <p>
 * Thrown before any bug is processed; the run is aborted.
 */
public class FatalConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FatalConfigurationException(String message) {
        super(message);
    }
}
