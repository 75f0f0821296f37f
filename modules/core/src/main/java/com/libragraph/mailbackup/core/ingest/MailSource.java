package com.libragraph.mailbackup.core.ingest;

import com.libragraph.mailbackup.core.snapshot.IncrementalPlan;
import com.libragraph.mailbackup.types.TenantScope;

import java.util.stream.Stream;

/**
 * Mail-fetch collaborator, typically a Microsoft Graph client.
 *
 * <p>The returned stream must report every item live upstream, either as
 * {@link FetchResult.Fetched} or, when {@link IncrementalPlan#requiresFetch}
 * allows skipping the download, as {@link FetchResult.Unchanged}. An item
 * reported as neither is left out of the snapshot.
 *
 * <p>The stream is consumed lazily and closed when the run ends. Throwing
 * from it fails the run; per-item problems should be
 * {@link FetchResult.Failed} instead.
 */
public interface MailSource {

    Stream<FetchResult> fetch(TenantScope scope, IncrementalPlan plan);
}
