package com.titiplex.engagement.core.model;

/**
 * Cycle de vie d'un bon de commande : BROUILLON puis VALIDÉ, sans retour.
 * Persisté dans la colonne {@code valide} (0/1).
 */
public enum BcState {
    DRAFT,
    VALIDATED;

    public boolean isTerminal() {
        return this == VALIDATED;
    }

    public boolean canTransitionTo(BcState target) {
        return this == DRAFT && target == VALIDATED;
    }

    public int valide() {
        return this == VALIDATED ? 1 : 0;
    }

    public static BcState fromValide(int valide) {
        return valide == 1 ? VALIDATED : DRAFT;
    }
}
