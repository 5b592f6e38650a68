package org.mozilla.automation.etp.cli;

import org.mozilla.automation.etp.FatalConfigurationException;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.RunOptions;
import org.mozilla.automation.etp.config.ServerEnvironment;
import org.mozilla.automation.etp.remotesettings.RemoteSettingsTarget;

import picocli.CommandLine.Option;

/**
 * Remote Settings server selection, shared by commands that touch the collection.
 */
public class ServerOptions {

    @Option(names = "--server", required = true, converter = ServerEnvironment.Converter.class, description = "Remote Settings server: dev, stage or prod")
    ServerEnvironment server;

    @Option(names = "--server-location", description = "Remote Settings server URL; defaults to the location configured for --server")
    String serverLocation;

    @Option(names = "--auth", required = true, description = "Remote Settings credentials: a bearer token, user:password, or a full Authorization header value")
    String auth;

    String location(ExceptionsManagerConfig config) {
        return serverLocation == null || serverLocation.isBlank()
                ? server.location(config.remoteSettings())
                : serverLocation;
    }

    RunOptions runOptions(ExceptionsManagerConfig config, boolean dryRun, boolean force) {
        return new RunOptions(server, location(config), auth, dryRun, force);
    }

    RemoteSettingsTarget target(ExceptionsManagerConfig config) {
        if (auth == null || auth.isBlank()) {
            throw new FatalConfigurationException("Remote Settings authentication token (--auth) is required");
        }
        return new RemoteSettingsTarget(server, location(config), auth);
    }
}
