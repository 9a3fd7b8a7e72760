package com.gpsr.registry.brand;

import com.gpsr.registry.entity.Entity;

/**
 * A brand link together with the entity it points at.
 */
public record LinkedEntity(BrandLink link, Entity entity) {
}
