package com.titiplex.engagement.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Priorité d'une tâche, de la plus faible à la plus forte.
 */
public enum Priorite {
    BASSE("Basse"),
    NORMALE("Normale"),
    HAUTE("Haute"),
    URGENTE("Urgente");

    private final String label;

    Priorite(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Priorite> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.label.equals(label)).findFirst();
    }

    public static String labels() {
        return Arrays.stream(values()).map(Priorite::label).collect(Collectors.joining(", "));
    }
}
