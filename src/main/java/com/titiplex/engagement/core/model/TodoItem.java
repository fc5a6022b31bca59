package com.titiplex.engagement.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record TodoItem(
        @JsonProperty("id") Long id,
        @JsonProperty("motif") String motif,
        @JsonProperty("description") String description,
        @JsonProperty("contratId") Long contratId,        // référence, pas de propriété
        @JsonProperty("dateEcheance") LocalDate dateEcheance,
        @JsonProperty("priorite") String priorite,
        @JsonProperty("complete") boolean complete,
        @JsonProperty("dateCompletion") LocalDateTime dateCompletion
) {

    public static TodoItem open(String motif, String description, Long contratId, LocalDate dateEcheance, String priorite) {
        return new TodoItem(null, motif, description, contratId, dateEcheance, priorite, false, null);
    }

    public TodoItem withId(long newId) {
        return new TodoItem(newId, motif, description, contratId, dateEcheance, priorite, complete, dateCompletion);
    }
}
