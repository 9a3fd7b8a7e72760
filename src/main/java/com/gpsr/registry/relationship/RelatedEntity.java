package com.gpsr.registry.relationship;

/**
 * One neighbour in an entity's corporate graph.
 *
 * @param direction {@code OUTGOING} when the entity under query is the {@code from} side
 * @param level     distance from the starting entity, used by parent chains
 */
public record RelatedEntity(String entityId, String entityName, Direction direction, int confidence, int level) {

    public enum Direction {
        OUTGOING,
        INCOMING
    }
}
