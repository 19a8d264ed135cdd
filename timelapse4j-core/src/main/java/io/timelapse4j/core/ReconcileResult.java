package io.timelapse4j.core;

import java.util.List;

/**
 * Camera names touched by one reconciliation.
 *
 * removed : names only present in the previous snapshot
 * added   : names only present in the new snapshot
 * updated : names present in both whose definition changed
 * failed  : names whose change could not be applied; their previous jobs stay in effect
 */
public record ReconcileResult(
        List<String> removed,
        List<String> added,
        List<String> updated,
        List<String> failed
) {
    public ReconcileResult {
        removed = List.copyOf(removed);
        added = List.copyOf(added);
        updated = List.copyOf(updated);
        failed = List.copyOf(failed);
    }

    public boolean hasEffect() {
        return !removed.isEmpty() || !added.isEmpty() || !updated.isEmpty();
    }
}
