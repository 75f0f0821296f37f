package com.libragraph.mailbackup.core.health;

import com.libragraph.mailbackup.core.store.ObjectStorage;
import com.libragraph.mailbackup.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;

/**
 * Probes the configured object store with an existence check on the
 * empty-content digest. A missing object is fine; an error is not.
 */
@Readiness
@ApplicationScoped
public class ObjectStoreHealthCheck implements HealthCheck {

    private static final ContentHash PROBE = ContentHash.of(new byte[0]);

    @Inject
    ObjectStorage storage;

    @ConfigProperty(name = "backup.object-store.type", defaultValue = "filesystem")
    String driver;

    @Override
    public HealthCheckResponse call() {
        try {
            storage.exists(PROBE).await().atMost(Duration.ofSeconds(5));
            return HealthCheckResponse.named("object-store")
                    .up()
                    .withData("driver", driver)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
