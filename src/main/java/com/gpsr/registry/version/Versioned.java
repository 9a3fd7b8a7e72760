package com.gpsr.registry.version;

import java.time.Instant;
import java.util.Map;

/**
 * A top-level aggregate whose history is kept as an append-only chain of
 * {@link AggregateVersion}s, with an owning pointer to the latest one.
 *
 * @param <A> the concrete aggregate type
 */
public interface Versioned<A extends Versioned<A>> {

    String getId();

    /**
     * Id of the version with the highest version number, or null before the
     * initial version is written.
     */
    String getCurrentVersionId();

    boolean isActive();

    A withCurrentVersion(String versionId, Instant updatedAt);

    A withActive(boolean active, Instant updatedAt);

    /**
     * The derived, normalized state captured with each version.
     */
    Map<String, Object> normalizedData();
}
