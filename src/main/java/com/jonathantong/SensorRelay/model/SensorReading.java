package com.jonathantong.SensorRelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One historical value of an entity, as returned by the history endpoint
 */
@JsonPropertyOrder({"state", "date_heure"})
public class SensorReading {

    private final String state;
    private final String dateHeure;

    public SensorReading(String state, String dateHeure) {
        this.state = state;
        this.dateHeure = dateHeure;
    }

    @JsonProperty("state")
    public String getState() { return state; }

    @JsonProperty("date_heure")
    public String getDateHeure() { return dateHeure; }

    @Override
    public String toString() {
        return "SensorReading{" +
                "state='" + state + '\'' +
                ", dateHeure='" + dateHeure + '\'' +
                '}';
    }
}
