package org.mozilla.automation.etp.remotesettings;

import org.mozilla.automation.etp.config.ServerEnvironment;

/**
 * Remote Settings server and credentials used for a call.
 *
 * @param environment dev, stage or prod
 * @param serverLocation server URL, e.g. https://remote-settings-dev.allizom.org/v1
 * @param authToken credentials (see {@link KintoAuthFilter})
 */
public record RemoteSettingsTarget(
        ServerEnvironment environment,
        String serverLocation,
        String authToken) {

    @Override
    public String toString() {
        return "%s (%s)".formatted(environment, serverLocation);
    }
}
