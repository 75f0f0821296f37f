package com.libragraph.mailbackup.core.snapshot;

import com.libragraph.mailbackup.types.ItemIdentity;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Hint telling a fetcher which items it may skip downloading.
 *
 * <p>Only an optimisation: digests stay authoritative, so an item fetched
 * needlessly is deduplicated anyway. An item is skipped only when the
 * baseline recorded it with a provider-modified time that is not older than
 * the one the provider reports now, and no later run skipped it.
 *
 * @param baselineSnapshotId complete snapshot the plan is relative to, or null for a full plan
 * @param baseline           provider-modified time per identity recorded by the baseline
 * @param refetch            identities skipped since the baseline and not recorded since
 */
public record IncrementalPlan(Long baselineSnapshotId,
                              Map<ItemIdentity, Instant> baseline,
                              Set<ItemIdentity> refetch) {

    private static final IncrementalPlan FULL = new IncrementalPlan(null, Map.of(), Set.of());

    public IncrementalPlan {
        baseline = Map.copyOf(baseline);
        refetch = Set.copyOf(refetch);
    }

    public static IncrementalPlan full() {
        return FULL;
    }

    public boolean isFull() {
        return baselineSnapshotId == null;
    }

    public boolean requiresFetch(ItemIdentity identity, Instant providerModifiedAt) {
        if (isFull() || refetch.contains(identity)) {
            return true;
        }
        Instant known = baseline.get(identity);
        if (known == null || providerModifiedAt == null) {
            return true;
        }
        return providerModifiedAt.isAfter(known);
    }

    public Set<ItemIdentity> identitiesRequiringRefetch() {
        return refetch;
    }
}
