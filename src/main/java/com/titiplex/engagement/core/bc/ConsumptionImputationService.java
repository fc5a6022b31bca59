package com.titiplex.engagement.core.bc;

import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Impute le montant d'un BC qui vient d'être validé sur le budget du client,
 * pour la nature du BC et l'année civile courante.
 */
@Service
public class ConsumptionImputationService {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionImputationService.class);

    private final Clock clock;

    public ConsumptionImputationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param store dépôt lié à la transaction de validation
     * @return false si aucun budget ne correspond : le BC reste validé sans imputation
     */
    public boolean impute(Repository store, BonCommande bc) {
        int annee = LocalDate.now(clock).getYear();
        Budget budget = store.findBudget(bc.clientId(), annee, bc.nature());
        if (budget == null) {
            log.warn("BC {} validé sans imputation: aucun budget {} {} pour le client {}",
                    bc.numeroBc(), bc.nature(), annee, bc.clientId());
            return false;
        }
        Budget debited = budget.impute(bc.montant());
        store.updateBudget(debited);
        log.info("BC {} imputé sur le budget {}: consommé={}, disponible={}",
                bc.numeroBc(), budget.id(), debited.montantConsomme(), debited.montantDisponible());
        return true;
    }
}
