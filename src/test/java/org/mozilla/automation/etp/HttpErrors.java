package org.mozilla.automation.etp;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

public final class HttpErrors {

    private HttpErrors() {
    }

    /**
     * Error response as thrown by the REST client for a non-2xx status.
     */
    public static WebApplicationException httpError(int status) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status);
        when(response.getStatusInfo()).thenReturn(Response.Status.fromStatusCode(status));
        return new WebApplicationException(response);
    }
}
