package com.libragraph.mailbackup.core.snapshot;

import com.libragraph.mailbackup.core.testing.EmbeddedDatabase;
import com.libragraph.mailbackup.types.SnapshotStatus;
import com.libragraph.mailbackup.types.TenantScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StaleRunRecoveryTest {

    SnapshotManager snapshots;
    StaleRunRecovery recovery;

    @BeforeEach
    void setUp() {
        snapshots = SnapshotFixtures.snapshotManager(EmbeddedDatabase.create());
        recovery = new StaleRunRecovery();
        recovery.snapshotManager = snapshots;
    }

    @Test
    void recoverFailsLeftoverRunsAndFreesScope() {
        long leftover = snapshots.begin(TenantScope.tenant("contoso"));

        int recovered = recovery.recover();

        assertThat(recovered).isEqualTo(1);
        assertThat(snapshots.get(leftover).status()).isEqualTo(SnapshotStatus.FAILED);
        assertThat(snapshots.failureOf(snapshots.get(leftover)).orElseThrow().message())
                .isEqualTo(StaleRunRecovery.REASON);
        long next = snapshots.begin(TenantScope.tenant("contoso"));
        assertThat(next).isGreaterThan(leftover);
    }

    @Test
    void recoverWithNothingRunningIsNoOp() {
        long done = snapshots.begin(TenantScope.all());
        snapshots.complete(done);

        assertThat(recovery.recover()).isZero();
        assertThat(snapshots.get(done).status()).isEqualTo(SnapshotStatus.COMPLETE);
    }
}
