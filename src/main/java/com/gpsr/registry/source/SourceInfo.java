package com.gpsr.registry.source;

import java.util.Objects;

/**
 * Provenance details supplied with a write. Resolved to a {@link Source} through
 * {@link SourceRegistry#findOrCreate(SourceInfo)}.
 *
 * @param sourceType       kind of source
 * @param sourceIdentifier dedup key within the type, e.g. a registry extract number; may be null
 */
public record SourceInfo(
        SourceType sourceType,
        String sourceIdentifier,
        String sourceName,
        String description,
        String sourceUrl,
        String trustNote
) {
    public SourceInfo {
        Objects.requireNonNull(sourceType, "sourceType is required");
    }

    public static SourceInfo of(SourceType sourceType) {
        return new SourceInfo(sourceType, null, null, null, null, null);
    }

    public static SourceInfo of(SourceType sourceType, String sourceIdentifier) {
        return new SourceInfo(sourceType, sourceIdentifier, null, null, null, null);
    }

    public boolean hasIdentifier() {
        return sourceIdentifier != null && !sourceIdentifier.isBlank();
    }
}
