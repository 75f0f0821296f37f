package com.libragraph.mailbackup.api;

import com.libragraph.mailbackup.core.dao.ObjectEntryRecord;
import com.libragraph.mailbackup.core.dao.SnapshotItemRecord;
import com.libragraph.mailbackup.core.dao.SnapshotRecord;
import com.libragraph.mailbackup.core.dao.SnapshotSkipRecord;
import com.libragraph.mailbackup.core.dao.TenantRecord;
import com.libragraph.mailbackup.core.query.BackupQueryService;
import com.libragraph.mailbackup.core.tenant.TenantRegistry;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.ItemKind;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * Read-only HTTP view over snapshots, index entries and blobs.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class BackupResource {

    private static final int MAX_LIMIT = 1000;

    @Inject
    BackupQueryService queryService;

    @Inject
    TenantRegistry tenantRegistry;

    @GET
    @Path("/tenants")
    public List<TenantRecord> tenants() {
        return tenantRegistry.listAll();
    }

    /**
     * Without {@code scope}, the most recent snapshots in any state. With it,
     * the complete snapshots usable to restore that scope.
     */
    @GET
    @Path("/snapshots")
    public List<SnapshotRecord> snapshots(@QueryParam("scope") String scope,
                                          @QueryParam("limit") @DefaultValue("50") int limit) {
        if (scope == null || scope.isBlank()) {
            return queryService.recentSnapshots(clamp(limit));
        }
        return queryService.listRestoreCandidates(TenantScope.parse(scope));
    }

    @GET
    @Path("/snapshots/{id}")
    public SnapshotRecord snapshot(@PathParam("id") long id) {
        return queryService.snapshot(id);
    }

    @GET
    @Path("/snapshots/{id}/items")
    public List<SnapshotItemRecord> snapshotItems(@PathParam("id") long id,
                                                  @QueryParam("tenant") String tenantId) {
        return queryService.snapshotItems(id, tenantId);
    }

    @GET
    @Path("/snapshots/{id}/skips")
    public List<SnapshotSkipRecord> snapshotSkips(@PathParam("id") long id) {
        return queryService.snapshotSkips(id);
    }

    @GET
    @Path("/snapshots/{id}/items/{tenant}/{mailbox}/{kind}/{itemId}/content")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public byte[] snapshotItemContent(@PathParam("id") long id,
                                      @PathParam("tenant") String tenant,
                                      @PathParam("mailbox") String mailbox,
                                      @PathParam("kind") String kind,
                                      @PathParam("itemId") String itemId) {
        return queryService.downloadAsOf(id, identity(tenant, mailbox, kind, itemId));
    }

    @GET
    @Path("/items/{tenant}")
    public List<ObjectEntryRecord> liveItems(@PathParam("tenant") String tenant,
                                             @QueryParam("limit") @DefaultValue("100") int limit) {
        return queryService.liveItems(TenantScope.tenant(tenant), clamp(limit));
    }

    @GET
    @Path("/items/{tenant}/{mailbox}/{kind}/{itemId}")
    public ObjectEntryRecord item(@PathParam("tenant") String tenant,
                                  @PathParam("mailbox") String mailbox,
                                  @PathParam("kind") String kind,
                                  @PathParam("itemId") String itemId) {
        return queryService.lookup(identity(tenant, mailbox, kind, itemId));
    }

    @GET
    @Path("/blobs/{digest}")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public byte[] blob(@PathParam("digest") String digest) {
        return queryService.download(ContentHash.fromHex(digest));
    }

    private static ItemIdentity identity(String tenant, String mailbox, String kind, String itemId) {
        return new ItemIdentity(tenant, mailbox, itemId, ItemKind.fromLabel(kind));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
