package com.titiplex.engagement.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public enum StatutContrat {
    ACTIF("Actif"),
    EXPIRE("Expiré"),
    RESILIE("Résilié");

    private final String label;

    StatutContrat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<StatutContrat> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values()).filter(s -> s.label.equals(label)).findFirst();
    }

    public static String labels() {
        return Arrays.stream(values()).map(StatutContrat::label).collect(Collectors.joining(", "));
    }
}
