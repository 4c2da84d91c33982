package com.jonathantong.SensorRelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.jonathantong.SensorRelay.util.ValueDecoding;

import java.time.Instant;
import java.util.Objects;

/**
 * A state change of one watched entity, as pushed to subscribers
 */
@JsonPropertyOrder({"entity_id", "state", "date_heure"})
public class ChangeEvent {

    private final String entityId;
    private final String state;
    private final Instant observedAt;

    public ChangeEvent(String entityId, String state, Instant observedAt) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.state = state;
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt");
    }

    @JsonProperty("entity_id")
    public String getEntityId() { return entityId; }

    @JsonProperty("state")
    public String getState() { return state; }

    @JsonProperty("date_heure")
    public String getDateHeure() {
        return ValueDecoding.toIsoTimestamp(observedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeEvent)) return false;
        ChangeEvent that = (ChangeEvent) o;
        return entityId.equals(that.entityId)
                && Objects.equals(state, that.state)
                && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, state, observedAt);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "entityId='" + entityId + '\'' +
                ", state='" + state + '\'' +
                ", observedAt=" + observedAt +
                '}';
    }
}
