package com.libragraph.mailbackup.core.snapshot;

import com.libragraph.mailbackup.core.dao.SnapshotItemRecord;
import com.libragraph.mailbackup.core.dao.SnapshotRecord;
import com.libragraph.mailbackup.core.dao.SnapshotSkipRecord;
import com.libragraph.mailbackup.core.index.EntryNotFoundException;
import com.libragraph.mailbackup.core.index.IndexFixtures;
import com.libragraph.mailbackup.core.index.ObjectIndex;
import com.libragraph.mailbackup.core.testing.EmbeddedDatabase;
import com.libragraph.mailbackup.core.testing.MutableClock;
import com.libragraph.mailbackup.types.ItemIdentity;
import com.libragraph.mailbackup.types.SnapshotStatus;
import com.libragraph.mailbackup.types.TenantScope;
import com.libragraph.mailbackup.util.ContentHash;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SnapshotManagerTest {

    private static final TenantScope CONTOSO = TenantScope.tenant("contoso");
    private static final TenantScope FABRIKAM = TenantScope.tenant("fabrikam");
    private static final Instant MODIFIED = Instant.parse("2024-05-01T08:00:00Z");

    Jdbi jdbi;
    MutableClock clock;
    ObjectIndex index;
    SnapshotManager snapshots;

    @BeforeEach
    void setUp() {
        jdbi = EmbeddedDatabase.create();
        clock = MutableClock.startingAt("2024-05-10T12:00:00Z");
        index = IndexFixtures.objectIndex(jdbi, clock);
        snapshots = SnapshotFixtures.snapshotManager(jdbi, clock);
    }

    private static ContentHash digest(String content) {
        return ContentHash.of(content.getBytes(StandardCharsets.UTF_8));
    }

    private ItemIdentity indexed(String tenant, String item, String content) {
        ItemIdentity identity = ItemIdentity.message(tenant, "inbox", item);
        index.upsert(identity, digest(content), content.length(), MODIFIED);
        return identity;
    }

    @Test
    void beginCreatesRunningSnapshot() {
        long id = snapshots.begin(CONTOSO, "nightly");

        SnapshotRecord snapshot = snapshots.get(id);
        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.RUNNING);
        assertThat(snapshot.tenantScope()).isEqualTo(CONTOSO);
        assertThat(snapshot.label()).isEqualTo("nightly");
        assertThat(snapshot.endedAt()).isNull();
    }

    @Test
    void secondBeginForSameScopeIsRejected() {
        long running = snapshots.begin(CONTOSO);

        assertThatThrownBy(() -> snapshots.begin(CONTOSO))
                .isInstanceOfSatisfying(SnapshotAlreadyRunningException.class, e -> {
                    assertThat(e.scope()).isEqualTo(CONTOSO);
                    assertThat(e.runningSnapshotId()).isEqualTo(running);
                });
        assertThat(snapshots.recent(10)).hasSize(1);
    }

    @Test
    void differentScopesRunConcurrently() {
        long a = snapshots.begin(CONTOSO);
        long b = snapshots.begin(FABRIKAM);
        long all = snapshots.begin(TenantScope.all());

        assertThat(List.of(a, b, all)).doesNotHaveDuplicates();
    }

    @Test
    void scopeIsReleasedWhenSnapshotFinishes() {
        long first = snapshots.begin(CONTOSO);
        snapshots.complete(first);
        long second = snapshots.begin(CONTOSO);
        snapshots.fail(second, "boom");

        long third = snapshots.begin(CONTOSO);

        assertThat(snapshots.get(third).status()).isEqualTo(SnapshotStatus.RUNNING);
    }

    @Test
    void recordItemIsIdempotentForSameDigest() {
        ItemIdentity item = indexed("contoso", "m1", "hello");
        long id = snapshots.begin(CONTOSO);

        snapshots.recordItem(id, item, digest("hello"));
        snapshots.recordItem(id, item, digest("hello"));

        List<SnapshotItemRecord> items = snapshots.items(id);
        assertThat(items).hasSize(1);
        assertThat(items.get(0).identity()).isEqualTo(item);
        assertThat(items.get(0).providerModifiedAt()).isEqualTo(MODIFIED);
    }

    @Test
    void recordItemWithConflictingDigestIsRejected() {
        ItemIdentity item = indexed("contoso", "m1", "hello");
        long id = snapshots.begin(CONTOSO);
        snapshots.recordItem(id, item, digest("hello"));

        assertThatThrownBy(() -> snapshots.recordItem(id, item, digest("other")))
                .isInstanceOf(InvalidSnapshotStateException.class)
                .hasMessageContaining("already recorded");
    }

    @Test
    void recordItemOutsideScopeIsRejected() {
        ItemIdentity item = indexed("fabrikam", "m1", "hello");
        long id = snapshots.begin(CONTOSO);

        assertThatThrownBy(() -> snapshots.recordItem(id, item, digest("hello")))
                .isInstanceOf(InvalidSnapshotStateException.class)
                .hasMessageContaining("outside scope");
    }

    @Test
    void recordItemRequiresIndexEntry() {
        long id = snapshots.begin(CONTOSO);

        assertThatThrownBy(() -> snapshots.recordItem(id,
                ItemIdentity.message("contoso", "inbox", "ghost"), digest("x")))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void terminalSnapshotIsImmutable() {
        ItemIdentity item = indexed("contoso", "m1", "hello");
        long id = snapshots.begin(CONTOSO);
        snapshots.recordItem(id, item, digest("hello"));
        snapshots.complete(id);

        assertThatThrownBy(() -> snapshots.recordItem(id, indexed("contoso", "m2", "late"), digest("late")))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThatThrownBy(() -> snapshots.recordSkip(id, item, "late"))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThatThrownBy(() -> snapshots.complete(id))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThatThrownBy(() -> snapshots.fail(id, "too late"))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThat(snapshots.get(id).status()).isEqualTo(SnapshotStatus.COMPLETE);
        assertThat(snapshots.items(id)).hasSize(1);
    }

    @Test
    void completeStampsEndTime() {
        long id = snapshots.begin(CONTOSO);
        clock.advance(Duration.ofMinutes(3));

        SnapshotRecord done = snapshots.complete(id);

        assertThat(done.status()).isEqualTo(SnapshotStatus.COMPLETE);
        assertThat(done.endedAt()).isEqualTo(done.startedAt().plus(Duration.ofMinutes(3)));
        assertThat(done.failure()).isNull();
    }

    @Test
    void failKeepsRecordedItemsAndStoresCause() {
        ItemIdentity item = indexed("contoso", "m1", "hello");
        long id = snapshots.begin(CONTOSO);
        snapshots.recordItem(id, item, digest("hello"));

        SnapshotRecord failed = snapshots.fail(id, new IOException("graph unreachable"));

        assertThat(failed.status()).isEqualTo(SnapshotStatus.FAILED);
        assertThat(snapshots.items(id)).hasSize(1);
        SnapshotError error = snapshots.failureOf(failed).orElseThrow();
        assertThat(error.message()).isEqualTo("graph unreachable");
        assertThat(error.exceptionType()).isEqualTo(IOException.class.getName());
        assertThat(error.retryable()).isTrue();
    }

    @Test
    void recordSkipKeepsFirstReason() {
        ItemIdentity item = ItemIdentity.message("contoso", "inbox", "broken");
        long id = snapshots.begin(CONTOSO);

        snapshots.recordSkip(id, item, "timeout");
        snapshots.recordSkip(id, item, "second reason");

        List<SnapshotSkipRecord> skips = snapshots.skips(id);
        assertThat(skips).hasSize(1);
        assertThat(skips.get(0).identity()).isEqualTo(item);
        assertThat(skips.get(0).reason()).isEqualTo("timeout");
    }

    @Test
    void incrementalPlanWithoutBaselineIsFull() {
        IncrementalPlan plan = snapshots.computeIncrementalPlan(CONTOSO, null);

        assertThat(plan.isFull()).isTrue();
        assertThat(plan.requiresFetch(ItemIdentity.message("contoso", "inbox", "any"), MODIFIED)).isTrue();
    }

    @Test
    void incrementalPlanCarriesBaselineTimesAndSkipsSinceBaseline() {
        ItemIdentity kept = indexed("contoso", "m1", "hello");
        ItemIdentity broken = ItemIdentity.message("contoso", "inbox", "broken");
        ItemIdentity recovered = ItemIdentity.message("contoso", "inbox", "recovered");

        long baseline = snapshots.begin(CONTOSO);
        snapshots.recordItem(baseline, kept, digest("hello"));
        snapshots.recordSkip(baseline, broken, "timeout");
        snapshots.recordSkip(baseline, recovered, "timeout");
        snapshots.complete(baseline);

        long next = snapshots.begin(CONTOSO);
        index.upsert(recovered, digest("recovered"), 9, MODIFIED);
        snapshots.recordItem(next, recovered, digest("recovered"));
        snapshots.complete(next);

        IncrementalPlan plan = snapshots.computeIncrementalPlan(CONTOSO, baseline);

        assertThat(plan.baselineSnapshotId()).isEqualTo(baseline);
        assertThat(plan.baseline()).containsEntry(kept, MODIFIED);
        assertThat(plan.identitiesRequiringRefetch()).containsExactly(broken);
        assertThat(plan.requiresFetch(kept, MODIFIED)).isFalse();
        assertThat(plan.requiresFetch(broken, MODIFIED)).isTrue();
    }

    @Test
    void incrementalPlanRejectsIncompleteBaseline() {
        long running = snapshots.begin(CONTOSO);
        long failed = snapshots.begin(FABRIKAM);
        snapshots.fail(failed, "boom");

        assertThatThrownBy(() -> snapshots.computeIncrementalPlan(CONTOSO, running))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThatThrownBy(() -> snapshots.computeIncrementalPlan(FABRIKAM, failed))
                .isInstanceOf(InvalidSnapshotStateException.class);
        assertThatThrownBy(() -> snapshots.computeIncrementalPlan(CONTOSO, 999L))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void restoreCandidatesIncludeWholeEstateSnapshots() {
        long contoso = snapshots.begin(CONTOSO);
        snapshots.complete(contoso);
        long fabrikam = snapshots.begin(FABRIKAM);
        snapshots.complete(fabrikam);
        long all = snapshots.begin(TenantScope.all());
        snapshots.complete(all);
        long failed = snapshots.begin(CONTOSO);
        snapshots.fail(failed, "boom");

        assertThat(snapshots.listRestoreCandidates(CONTOSO))
                .extracting(SnapshotRecord::id)
                .containsExactly(all, contoso);
        assertThat(snapshots.listRestoreCandidates(TenantScope.all()))
                .extracting(SnapshotRecord::id)
                .containsExactly(all, fabrikam, contoso);
        assertThat(snapshots.latestComplete(CONTOSO)).map(SnapshotRecord::id).hasValue(contoso);
    }

    @Test
    void resolveReturnsDigestRecordedAtThatTime() {
        ItemIdentity item = indexed("contoso", "m1", "v1");
        long first = snapshots.begin(CONTOSO);
        snapshots.recordItem(first, item, digest("v1"));
        snapshots.complete(first);
        index.upsert(item, digest("v2"), 2, MODIFIED.plusSeconds(60));
        long second = snapshots.begin(CONTOSO);
        snapshots.recordItem(second, item, digest("v2"));
        snapshots.complete(second);

        assertThat(snapshots.resolve(first, item)).isEqualTo(digest("v1"));
        assertThat(snapshots.resolve(second, item)).isEqualTo(digest("v2"));
        assertThatThrownBy(() -> snapshots.resolve(first, ItemIdentity.message("contoso", "inbox", "ghost")))
                .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> snapshots.resolve(404, item))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void pruneKeepsMostRecentCompleteSnapshots() {
        ItemIdentity item = indexed("contoso", "m1", "hello");
        long[] ids = new long[3];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = snapshots.begin(CONTOSO);
            snapshots.recordItem(ids[i], item, digest("hello"));
            snapshots.complete(ids[i]);
        }
        long running = snapshots.begin(CONTOSO);

        int pruned = snapshots.prune(CONTOSO, 2);

        assertThat(pruned).isEqualTo(1);
        assertThatThrownBy(() -> snapshots.get(ids[0])).isInstanceOf(SnapshotNotFoundException.class);
        assertThat(snapshots.get(ids[1]).status()).isEqualTo(SnapshotStatus.COMPLETE);
        assertThat(snapshots.get(running).status()).isEqualTo(SnapshotStatus.RUNNING);
        assertThatThrownBy(() -> snapshots.prune(CONTOSO, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failStaleRunsFailsEveryRunningSnapshot() {
        long a = snapshots.begin(CONTOSO);
        long b = snapshots.begin(FABRIKAM);
        long done = snapshots.begin(TenantScope.all());
        snapshots.complete(done);

        int failed = snapshots.failStaleRuns("interrupted");

        assertThat(failed).isEqualTo(2);
        assertThat(snapshots.get(a).status()).isEqualTo(SnapshotStatus.FAILED);
        assertThat(snapshots.failureOf(snapshots.get(b)).orElseThrow().message()).isEqualTo("interrupted");
        assertThat(snapshots.get(done).status()).isEqualTo(SnapshotStatus.COMPLETE);
        snapshots.begin(CONTOSO);
    }

    @Test
    void unknownSnapshotThrowsNotFound() {
        assertThatThrownBy(() -> snapshots.get(42)).isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshots.items(42)).isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshots.complete(42)).isInstanceOf(SnapshotNotFoundException.class);
    }
}
