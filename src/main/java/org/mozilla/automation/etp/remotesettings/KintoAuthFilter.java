package org.mozilla.automation.etp.remotesettings;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;

/**
 * Client request filter that adds Remote Settings credentials to every request.
 * <p>
 * The token given on the command line may be:
 * <ul>
 * <li>a complete header value (<code>Bearer abc</code>), used as-is</li>
 * <li><code>user:password</code>, sent as Basic authentication</li>
 * <li>a bare token, sent as a Bearer token</li>
 * </ul>
 */
public class KintoAuthFilter implements ClientRequestFilter {
    private final String authorization;

    public KintoAuthFilter(String authToken) {
        this.authorization = toHeaderValue(authToken);
    }

    @Override
    public void filter(ClientRequestContext requestContext) {
        if (authorization != null) {
            requestContext.getHeaders().putSingle(HttpHeaders.AUTHORIZATION, authorization);
        }
    }

    static String toHeaderValue(String authToken) {
        if (authToken == null || authToken.isBlank()) {
            return null;
        }
        String token = authToken.trim();
        if (token.contains(" ")) {
            return token;
        }
        if (token.contains(":")) {
            return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
        }
        return "Bearer " + token;
    }
}
