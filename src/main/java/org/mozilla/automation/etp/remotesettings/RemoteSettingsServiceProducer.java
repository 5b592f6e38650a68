package org.mozilla.automation.etp.remotesettings;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig;

import io.quarkus.logging.Log;

/**
 * CDI Producer for RemoteSettingsService.
 * <p>
 * The server is chosen per run, so REST clients are built on demand
 * for each server location and token.
 */
@ApplicationScoped
public class RemoteSettingsServiceProducer {

    @Inject
    ExceptionsManagerConfig config;

    @Produces
    @ApplicationScoped
    public RemoteSettingsService remoteSettingsService() {
        Log.debugf("Remote Settings collection: %s/%s (published: %s)",
                config.remoteSettings().bucket(),
                config.remoteSettings().collection(),
                config.remoteSettings().publishedBucket());
        return new RemoteSettingsServiceImpl(config.remoteSettings(), this::buildClient);
    }

    KintoClient buildClient(RemoteSettingsTarget target) {
        Log.infof("Remote Settings client configured for: %s", target);
        return RestClientBuilder.newBuilder()
                .baseUri(URI.create(target.serverLocation()))
                .followRedirects(true)
                .register(new KintoAuthFilter(target.authToken()))
                .build(KintoClient.class);
    }
}
