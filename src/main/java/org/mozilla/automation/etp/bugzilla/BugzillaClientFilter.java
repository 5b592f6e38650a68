package org.mozilla.automation.etp.bugzilla;

import java.util.Optional;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;

/**
 * Client request filter that adds the Bugzilla API key to every request.
 * Reads work anonymously; comments, status changes and flags need the key.
 *
 * See: https://bugzilla.readthedocs.io/en/latest/api/core/v1/general.html#authentication
 */
public class BugzillaClientFilter implements ClientRequestFilter {
    static final String API_KEY_HEADER = "X-BUGZILLA-API-KEY";

    private final Optional<String> apiKey;

    public BugzillaClientFilter(Optional<String> apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    public void filter(ClientRequestContext requestContext) {
        apiKey.ifPresent(key -> requestContext.getHeaders().putSingle(API_KEY_HEADER, key));
    }
}
