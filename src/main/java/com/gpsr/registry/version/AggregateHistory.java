package com.gpsr.registry.version;

import java.util.List;

/**
 * An aggregate together with its full version chain, newest version first.
 */
public record AggregateHistory<A>(A aggregate, List<AggregateVersion> versions) {

    public AggregateHistory {
        versions = List.copyOf(versions);
    }
}
