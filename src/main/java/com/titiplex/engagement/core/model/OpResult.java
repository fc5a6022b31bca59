package com.titiplex.engagement.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Résultat renvoyé à l'appelant : succès, message lisible et, à la création, l'id de la ligne.
 */
public record OpResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("id") Long id
) {
    public static OpResult ok(String message) {
        return new OpResult(true, message, null);
    }

    public static OpResult ok(String message, long id) {
        return new OpResult(true, message, id);
    }

    public static OpResult fail(String message) {
        return new OpResult(false, message, null);
    }
}
