package com.titiplex.engagement.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Nature budgétaire : dépense de fonctionnement ou d'investissement.
 */
public enum Nature {
    FONCTIONNEMENT("Fonctionnement"),
    INVESTISSEMENT("Investissement");

    private final String label;

    Nature(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Nature> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values()).filter(n -> n.label.equals(label)).findFirst();
    }

    public static String labels() {
        return Arrays.stream(values()).map(Nature::label).collect(Collectors.joining(", "));
    }
}
