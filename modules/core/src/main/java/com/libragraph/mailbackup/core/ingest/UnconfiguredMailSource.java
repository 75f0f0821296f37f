package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.core.snapshot.IncrementalPlan;
import com.libragraph.mailbackup.types.TenantScope;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.stream.Stream;

/**
 * Placeholder used until the deployment provides a real {@link MailSource}.
 * Every run against it fails.
 */
@DefaultBean
@ApplicationScoped
public class UnconfiguredMailSource implements MailSource {

    @Override
    public Stream<FetchResult> fetch(TenantScope scope, IncrementalPlan plan) {
        throw new FetchFailureException("No MailSource is configured for scope " + scope);
    }
}
