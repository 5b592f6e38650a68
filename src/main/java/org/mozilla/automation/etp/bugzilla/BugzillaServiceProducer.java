package org.mozilla.automation.etp.bugzilla;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig.BugzillaConfig;

import io.quarkus.logging.Log;

/**
 * CDI Producer for BugzillaService.
 */
@ApplicationScoped
public class BugzillaServiceProducer {

    @Inject
    ExceptionsManagerConfig config;

    /**
     * Produce BugzillaService bean.
     *
     * @return BugzillaService implementation (application-scoped singleton)
     */
    @Produces
    @ApplicationScoped
    public BugzillaService bugzillaService() {
        BugzillaConfig bzConfig = config.bugzilla();
        boolean hasApiKey = bzConfig.apiKey().filter(k -> !k.isBlank()).isPresent();
        if (!hasApiKey) {
            Log.info("Bugzilla API key not configured - bug updates are unavailable");
        }

        BugzillaClient client = RestClientBuilder.newBuilder()
                .baseUri(URI.create(bzConfig.url()))
                .followRedirects(true)
                .register(new BugzillaClientFilter(bzConfig.apiKey().filter(k -> !k.isBlank())))
                .build(BugzillaClient.class);

        Log.debugf("Bugzilla service configured for: %s", bzConfig.url());
        return new BugzillaServiceImpl(client, hasApiKey);
    }
}
