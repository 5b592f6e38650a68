package org.mozilla.automation.etp.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

// Specified in application.yaml
@ConfigMapping(prefix = "automation.exceptionsManager")
public interface ExceptionsManagerConfig {

    BugzillaConfig bugzilla();

    RemoteSettingsConfig remoteSettings();

    SyncConfig sync();

    RetryConfig retry();

    interface BugzillaConfig {
        @WithDefault("https://bugzilla.mozilla.org/rest")
        String url();

        /** Required to comment on, close or needinfo bugs (BZ_API_KEY) */
        Optional<String> apiKey();

        /** Product searched for candidate bugs */
        @WithDefault("Web Compatibility")
        String product();

        /** Component searched for candidate bugs */
        @WithDefault("Privacy: Site Reports")
        String component();
    }

    interface RemoteSettingsConfig {
        @WithDefault("https://remote-settings-dev.allizom.org/v1")
        String devLocation();

        @WithDefault("https://remote-settings.allizom.org/v1")
        String stageLocation();

        @WithDefault("https://remote-settings.mozilla.org/v1")
        String prodLocation();

        /** Bucket records are written to (signer workspace) */
        @WithDefault("main-workspace")
        String bucket();

        /** Bucket holding signed, published records */
        @WithDefault("main")
        String publishedBucket();

        @WithDefault("url-classifier-exceptions")
        String collection();
    }

    interface SyncConfig {
        /** Client version splitting every exception into two version windows */
        @WithDefault("142.0a1")
        String versionCutoff();

        /** Number of bugs processed concurrently */
        @WithDefault("4")
        int workers();

        /** Resolution used when closing a bug */
        @WithDefault("FIXED")
        String resolution();
    }

    interface RetryConfig {
        @WithDefault("3")
        int maxAttempts();

        @WithDefault("500ms")
        Duration initialBackoff();

        @WithDefault("10s")
        Duration maxBackoff();
    }
}
