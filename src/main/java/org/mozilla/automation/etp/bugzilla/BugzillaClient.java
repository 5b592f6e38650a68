package org.mozilla.automation.etp.bugzilla;

import jakarta.ws.rs.BeanParam;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Bugzilla REST API client.
 * The API key header is added by {@link BugzillaClientFilter}.
 */
@Path("/bug")
public interface BugzillaClient {

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    BugList searchBugs(@BeanParam BugSearchRequest request);

    @GET
    @Path("/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    BugList getBug(@PathParam("id") long id, @QueryParam("include_fields") String includeFields);

    @PUT
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    JsonNode updateBug(@PathParam("id") long id, BugUpdate update);
}
