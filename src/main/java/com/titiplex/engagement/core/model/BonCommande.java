package com.titiplex.engagement.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BonCommande(
        @JsonProperty("id") Long id,
        @JsonProperty("numeroBc") String numeroBc,     // BC-AAAA-NNNN
        @JsonProperty("clientId") Long clientId,
        @JsonProperty("contratId") Long contratId,     // optionnel
        @JsonProperty("nature") String nature,
        @JsonProperty("type") String type,
        @JsonProperty("serviceDemandeur") String serviceDemandeur,
        @JsonProperty("montant") BigDecimal montant,
        @JsonProperty("etat") BcState etat,
        @JsonProperty("dateValidation") LocalDateTime dateValidation,
        @JsonProperty("description") String description
) {

    public static BonCommande draft(Long clientId, Long contratId, String nature, String type,
                                    BigDecimal montant, String serviceDemandeur, String description) {
        return new BonCommande(null, null, clientId, contratId, nature, type, serviceDemandeur, montant,
                BcState.DRAFT, null, description);
    }

    public BonCommande withId(long newId) {
        return new BonCommande(newId, numeroBc, clientId, contratId, nature, type, serviceDemandeur, montant,
                etat, dateValidation, description);
    }

    public BonCommande withNumero(String numero) {
        return new BonCommande(id, numero, clientId, contratId, nature, type, serviceDemandeur, montant,
                etat, dateValidation, description);
    }

    public BonCommande validated(LocalDateTime at) {
        return new BonCommande(id, numeroBc, clientId, contratId, nature, type, serviceDemandeur, montant,
                BcState.VALIDATED, at, description);
    }

    public boolean isValidated() {
        return etat == BcState.VALIDATED;
    }
}
