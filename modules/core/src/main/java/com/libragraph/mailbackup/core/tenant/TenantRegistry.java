package com.libragraph.mailbackup.core.tenant;

import com.libragraph.mailbackup.core.dao.SqlStates;
import com.libragraph.mailbackup.core.dao.TenantDao;
import com.libragraph.mailbackup.core.dao.TenantRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Tenants whose mailboxes are backed up. Deactivation is soft: a
 * deactivated tenant's entries and snapshots stay restorable, it is just
 * no longer included in runs.
 */
@ApplicationScoped
public class TenantRegistry {

    private static final Logger log = Logger.getLogger(TenantRegistry.class);

    @Inject
    Jdbi jdbi;

    Clock clock = Clock.systemUTC();

    /**
     * Registers the tenant, or reactivates and renames it if it exists.
     */
    public TenantRecord register(String tenantId, String name) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        String displayName = name != null && !name.isBlank() ? name : tenantId;
        Instant now = now();
        jdbi.useExtension(TenantDao.class, dao -> {
            if (dao.reactivate(tenantId, displayName, now) == 1) {
                return;
            }
            try {
                dao.insert(tenantId, displayName, now);
                log.infof("Tenant registered: %s (%s)", tenantId, displayName);
            } catch (UnableToExecuteStatementException e) {
                if (!SqlStates.isUniqueViolation(e)) {
                    throw e;
                }
                dao.reactivate(tenantId, displayName, now);
            }
        });
        return find(tenantId).orElseThrow();
    }

    /**
     * @throws TenantNotFoundException if the tenant was never registered
     */
    public TenantRecord rename(String tenantId, String name) {
        int updated = jdbi.withExtension(TenantDao.class, dao -> dao.rename(tenantId, name, now()));
        if (updated == 0) {
            throw new TenantNotFoundException(tenantId);
        }
        return find(tenantId).orElseThrow();
    }

    /**
     * Excludes the tenant from future runs. Idempotent.
     *
     * @throws TenantNotFoundException if the tenant was never registered
     */
    public void deactivate(String tenantId) {
        if (find(tenantId).isEmpty()) {
            throw new TenantNotFoundException(tenantId);
        }
        if (jdbi.withExtension(TenantDao.class, dao -> dao.deactivate(tenantId, now())) == 1) {
            log.infof("Tenant deactivated: %s", tenantId);
        }
    }

    public Optional<TenantRecord> find(String tenantId) {
        return jdbi.withExtension(TenantDao.class, dao -> dao.findById(tenantId));
    }

    public List<TenantRecord> listActive() {
        return jdbi.withExtension(TenantDao.class, TenantDao::findActive);
    }

    public List<TenantRecord> listAll() {
        return jdbi.withExtension(TenantDao.class, TenantDao::findAll);
    }

    /**
     * @throws TenantNotFoundException if the tenant is unknown or inactive
     */
    public TenantRecord requireActive(String tenantId) {
        return find(tenantId)
                .filter(TenantRecord::active)
                .orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
