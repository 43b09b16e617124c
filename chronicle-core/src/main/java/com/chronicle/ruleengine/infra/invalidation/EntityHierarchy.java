/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.invalidation;

import com.chronicle.ruleengine.api.model.EntitySnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parent links between entity types, read from foreign-key fields of an entity snapshot.
 * Used to cascade invalidation from a child to its owner.
 */
public final class EntityHierarchy {

    public record ParentRef(String type, String id) {
    }

    private record Link(String parentType, String foreignKey) {
    }

    private final Map<String, Link> links;

    private EntityHierarchy(Map<String, Link> links) {
        this.links = Map.copyOf(links);
    }

    /**
     * structure to settlement ({@code settlementId}), settlement to kingdom ({@code kingdomId}),
     * character to party ({@code partyId}).
     */
    public static EntityHierarchy defaults() {
        Map<String, Link> links = new LinkedHashMap<>();
        links.put("structure", new Link("settlement", "settlementId"));
        links.put("settlement", new Link("kingdom", "kingdomId"));
        links.put("character", new Link("party", "partyId"));
        return new EntityHierarchy(links);
    }

    public static EntityHierarchy none() {
        return new EntityHierarchy(Map.of());
    }

    public EntityHierarchy withLink(String childType, String parentType, String foreignKey) {
        Map<String, Link> copy = new LinkedHashMap<>(links);
        copy.put(childType, new Link(parentType, foreignKey));
        return new EntityHierarchy(copy);
    }

    public Optional<String> parentType(String childType) {
        return Optional.ofNullable(links.get(childType)).map(Link::parentType);
    }

    /**
     * Parent of the entity, when its type has a parent link and the foreign key is set.
     */
    public Optional<ParentRef> parentOf(EntitySnapshot snapshot) {
        Link link = links.get(snapshot.entityType());
        if (link == null) {
            return Optional.empty();
        }
        String parentId = snapshot.text(link.foreignKey());
        return parentId == null ? Optional.empty() : Optional.of(new ParentRef(link.parentType(), parentId));
    }
}
