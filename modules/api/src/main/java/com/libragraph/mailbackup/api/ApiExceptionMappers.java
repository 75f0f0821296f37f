package com.libragraph.mailbackup.api;

import com.libragraph.mailbackup.core.index.EntryNotFoundException;
import com.libragraph.mailbackup.core.snapshot.SnapshotNotFoundException;
import com.libragraph.mailbackup.core.store.BlobNotFoundException;
import com.libragraph.mailbackup.core.tenant.TenantNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.util.Map;

/**
 * Maps store lookups that found nothing to 404 and malformed identifiers to 400.
 */
public class ApiExceptionMappers {

    @ServerExceptionMapper({
            BlobNotFoundException.class,
            EntryNotFoundException.class,
            SnapshotNotFoundException.class,
            TenantNotFoundException.class
    })
    public Response notFound(RuntimeException e) {
        return error(Response.Status.NOT_FOUND, e.getMessage());
    }

    @ServerExceptionMapper(IllegalArgumentException.class)
    public Response badRequest(IllegalArgumentException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message != null ? message : status.getReasonPhrase()))
                .build();
    }
}
