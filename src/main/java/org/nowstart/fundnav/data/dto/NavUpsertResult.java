package org.nowstart.fundnav.data.dto;

import java.util.Set;

/**
 * Outcome of one store write. {@code changedSchemeCodes} holds every scheme that had at least
 * one point inserted or rewritten.
 */
public record NavUpsertResult(
        int inserted,
        int updated,
        Set<String> changedSchemeCodes
) {
    public static NavUpsertResult empty() {
        return new NavUpsertResult(0, 0, Set.of());
    }

    public int changed() {
        return inserted + updated;
    }
}
