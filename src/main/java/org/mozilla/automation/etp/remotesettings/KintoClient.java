package org.mozilla.automation.etp.remotesettings;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import org.mozilla.automation.etp.remotesettings.KintoPayloads.CollectionEnvelope;
import org.mozilla.automation.etp.remotesettings.KintoPayloads.RecordEnvelope;
import org.mozilla.automation.etp.remotesettings.KintoPayloads.RecordList;

/**
 * Kinto HTTP API client for a Remote Settings server.
 * Credentials are added by {@link KintoAuthFilter}.
 * <p>
 * Record filters use Kinto query syntax: <code>in_urlPattern=a,b</code>
 * and <code>contains_bugIds=["123"]</code>. Null filters are not sent.
 */
@Path("/buckets/{bucket}/collections/{collection}")
public interface KintoClient {

    @GET
    @Path("/records")
    @Produces(MediaType.APPLICATION_JSON)
    RecordList getRecords(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection,
            @QueryParam("in_urlPattern") String urlPatterns,
            @QueryParam("contains_bugIds") String bugIds);

    /**
     * Create or replace a record.
     *
     * @param ifNoneMatch <code>*</code> to have the server reject the write if the id already exists
     */
    @PUT
    @Path("/records/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    RecordEnvelope putRecord(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection,
            @PathParam("id") String id,
            @HeaderParam("If-None-Match") String ifNoneMatch,
            RecordEnvelope record);

    @DELETE
    @Path("/records/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    void deleteRecord(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection,
            @PathParam("id") String id);

    @DELETE
    @Path("/records")
    @Produces(MediaType.APPLICATION_JSON)
    void deleteRecords(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection);

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    CollectionEnvelope getCollection(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection);

    @PATCH
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    CollectionEnvelope patchCollection(
            @PathParam("bucket") String bucket,
            @PathParam("collection") String collection,
            CollectionEnvelope patch);
}
