package com.titiplex.engagement.core.bc;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

public record BcStatistics(
        @JsonProperty("annee") int annee,
        @JsonProperty("totalBcs") int totalBcs,
        @JsonProperty("bcsValides") int bcsValides,
        @JsonProperty("bcsEnAttente") int bcsEnAttente,
        @JsonProperty("montantTotal") BigDecimal montantTotal,
        @JsonProperty("byNature") Map<String, NatureStats> byNature
) {
    public record NatureStats(
            @JsonProperty("valides") int valides,
            @JsonProperty("enAttente") int enAttente,
            @JsonProperty("montant") BigDecimal montant
    ) {
    }
}
