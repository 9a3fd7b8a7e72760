package com.gpsr.registry.responsibility;

import com.gpsr.registry.entity.RoleType;

import java.time.Instant;

/**
 * The winning responsibility for one role.
 *
 * @param dataFreshnessDays whole days between the winner's validFrom and the target date
 * @param candidateCount    number of rows that competed for the role
 */
public record ResolvedRole(
        RoleType role,
        String responsibilityId,
        String entityId,
        String entityName,
        String sourceId,
        int confidence,
        Instant validFrom,
        long dataFreshnessDays,
        boolean hasConflicts,
        int candidateCount
) {
}
