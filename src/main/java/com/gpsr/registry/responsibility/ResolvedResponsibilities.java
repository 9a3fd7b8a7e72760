package com.gpsr.registry.responsibility;

import com.gpsr.registry.entity.RoleType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Best known answer to "who is responsible for this product in this country".
 *
 * @param responsibilities winner per role, in role order
 * @param conflictCount    number of roles with more than one candidate
 */
public record ResolvedResponsibilities(
        String productId,
        String countryCode,
        ResolutionMode resolutionMode,
        Instant resolvedAt,
        Instant targetDate,
        Map<RoleType, ResolvedRole> responsibilities,
        int conflictCount
) {
    public ResolvedResponsibilities {
        Map<RoleType, ResolvedRole> byRole = new EnumMap<>(RoleType.class);
        byRole.putAll(responsibilities);
        responsibilities = Collections.unmodifiableMap(byRole);
    }

    public Optional<ResolvedRole> forRole(RoleType role) {
        return Optional.ofNullable(responsibilities.get(role));
    }
}
