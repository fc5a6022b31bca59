package com.titiplex.engagement.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Enveloppe budgétaire d'un client pour une année et une nature.
 * {@code montantDisponible} vaut toujours {@code montantInitial - montantConsomme}.
 */
public record Budget(
        @JsonProperty("id") Long id,
        @JsonProperty("clientId") Long clientId,
        @JsonProperty("annee") int annee,
        @JsonProperty("nature") String nature, // Fonctionnement | Investissement
        @JsonProperty("montantInitial") BigDecimal montantInitial,
        @JsonProperty("montantConsomme") BigDecimal montantConsomme,
        @JsonProperty("montantDisponible") BigDecimal montantDisponible,
        @JsonProperty("serviceDemandeur") String serviceDemandeur
) {

    /**
     * Nouveau budget, rien de consommé.
     */
    public static Budget open(long clientId, int annee, String nature, BigDecimal montantInitial, String serviceDemandeur) {
        return new Budget(null, clientId, annee, nature, montantInitial, BigDecimal.ZERO, montantInitial,
                serviceDemandeur == null ? "" : serviceDemandeur);
    }

    /**
     * Recalcule le disponible à partir de l'initial et du consommé donnés.
     */
    public Budget withMontants(BigDecimal initial, BigDecimal consomme) {
        return new Budget(id, clientId, annee, nature, initial, consomme, initial.subtract(consomme), serviceDemandeur);
    }

    public Budget impute(BigDecimal montant) {
        return withMontants(montantInitial, montantConsomme.add(montant));
    }
}
