package com.gpsr.registry.product;

import com.gpsr.registry.version.AggregateVersion;

/**
 * Read view of one safety information version.
 *
 * @param current        true for the version the thread currently points at
 * @param supersededById id of the next version in the chain, null for the latest
 */
public record SafetyInfoVersion(
        AggregateVersion version,
        SafetyContent content,
        boolean current,
        String supersededById
) {
    public int versionNumber() {
        return version.versionNumber();
    }
}
