package org.mozilla.automation.etp.config;

import org.mozilla.automation.etp.FatalConfigurationException;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

/**
 * Settings for a single reconciliation run.
 * <p>
 * Passed explicitly to every component involved in the run.
 *
 * @param environment target Remote Settings environment
 * @param serverLocation Remote Settings server URL
 * @param authToken Remote Settings credentials
 * @param dryRun compute and report plans without mutating Bugzilla or Remote Settings
 * @param force allow taking over records owned by other bugs, and re-creating unpublished records
 */
public record RunOptions(
        ServerEnvironment environment,
        String serverLocation,
        String authToken,
        boolean dryRun,
        boolean force) {

    public RemoteSettingsTarget target() {
        return new RemoteSettingsTarget(environment, serverLocation, authToken);
    }

    /**
     * Verify required configuration before anything is processed.
     *
     * @param bugzillaApiKeyPresent true if a Bugzilla API key is configured
     * @throws FatalConfigurationException if something required is missing
     */
    public void validate(boolean bugzillaApiKeyPresent) {
        if (environment == null) {
            throw new FatalConfigurationException("Target environment (--server) is required");
        }
        if (serverLocation == null || serverLocation.isBlank()) {
            throw new FatalConfigurationException("No Remote Settings server location for " + environment);
        }
        if (authToken == null || authToken.isBlank()) {
            throw new FatalConfigurationException("Remote Settings authentication token (--auth) is required");
        }
        if (!bugzillaApiKeyPresent) {
            throw new FatalConfigurationException("Bugzilla API key is required (set BZ_API_KEY)");
        }
    }

    @Override
    public String toString() {
        return "RunOptions[environment=%s, serverLocation=%s, dryRun=%s, force=%s]"
                .formatted(environment, serverLocation, dryRun, force);
    }
}
