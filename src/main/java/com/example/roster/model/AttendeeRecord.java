package com.example.roster.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * One participant row of the roster.
 */
@Value
@JsonPropertyOrder({"Delegation", "Honorific", "Person_Name", "Affiliation"})
public class AttendeeRecord {

    public static final List<String> COLUMNS = List.of("Delegation", "Honorific", "Person_Name", "Affiliation");

    @JsonProperty("Delegation")
    String delegation;

    @JsonProperty("Honorific")
    String honorific;

    @JsonProperty("Person_Name")
    String personName;

    @JsonProperty("Affiliation")
    String affiliation;

    /**
     * Values in {@link #COLUMNS} order.
     */
    public List<String> toRow() {
        return List.of(delegation, honorific, personName, affiliation);
    }
}
