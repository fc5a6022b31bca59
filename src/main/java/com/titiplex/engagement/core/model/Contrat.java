package com.titiplex.engagement.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Contrat(
        @JsonProperty("id") Long id,
        @JsonProperty("numeroContrat") String numeroContrat,
        @JsonProperty("clientId") Long clientId,
        @JsonProperty("contactId") Long contactId,
        @JsonProperty("dateDebut") LocalDate dateDebut,
        @JsonProperty("dateFin") LocalDate dateFin,
        @JsonProperty("montant") BigDecimal montant,
        @JsonProperty("description") String description,
        @JsonProperty("statut") String statut,           // Actif | Expiré | Résilié
        @JsonProperty("alerte6Mois") boolean alerte6Mois  // projection, recalculée par le scanner
) {

    public Contrat withId(long newId) {
        return new Contrat(newId, numeroContrat, clientId, contactId, dateDebut, dateFin, montant, description,
                statut, alerte6Mois);
    }

    public Contrat withAlerte(boolean alerte) {
        return new Contrat(id, numeroContrat, clientId, contactId, dateDebut, dateFin, montant, description,
                statut, alerte);
    }
}
