package com.jonathantong.SensorRelay.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The fixed set of entity ids relayed to subscribers
 */
@Component
public class WatchedEntities {

    private final Set<String> entityIds;

    @Autowired
    public WatchedEntities(@Value("${sensorrelay.watched-entities}") String[] entityIds) {
        Set<String> ids = new LinkedHashSet<>();
        Arrays.stream(entityIds)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(ids::add);
        this.entityIds = Collections.unmodifiableSet(ids);
    }

    public boolean contains(String entityId) {
        return entityId != null && entityIds.contains(entityId);
    }

    public Set<String> getEntityIds() {
        return entityIds;
    }

    @Override
    public String toString() {
        return entityIds.toString();
    }
}
