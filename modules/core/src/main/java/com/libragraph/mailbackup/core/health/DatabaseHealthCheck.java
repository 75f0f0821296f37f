package com.libragraph.mailbackup.core.health;

import com.libragraph.mailbackup.core.dao.DatabaseDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jdbi.v3.core.Jdbi;

@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    Jdbi jdbi;

    @Override
    public HealthCheckResponse call() {
        try {
            String product = jdbi.withHandle(handle -> {
                handle.attach(DatabaseDao.class).ping();
                var meta = handle.getConnection().getMetaData();
                return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
            });
            return HealthCheckResponse.named("database")
                    .up()
                    .withData("version", product)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("database")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
