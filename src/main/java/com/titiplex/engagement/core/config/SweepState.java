package com.titiplex.engagement.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Dernier balayage des alertes contrats.
 */
public record SweepState(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("alerted") int alerted,
        @JsonProperty("todosAdded") int todosAdded
) {
}
