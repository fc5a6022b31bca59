package com.titiplex.engagement.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public enum TypeBc {
    ASSISTANCE("Assistance"),
    FORMATION("Formation"),
    PRESTATION("Prestation"),
    MATERIEL("Matériel"),
    LICENCES("Licences");

    private final String label;

    TypeBc(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<TypeBc> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.label.equals(label)).findFirst();
    }

    public static String labels() {
        return Arrays.stream(values()).map(TypeBc::label).collect(Collectors.joining(", "));
    }
}
