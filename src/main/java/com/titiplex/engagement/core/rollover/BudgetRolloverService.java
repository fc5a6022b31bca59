package com.titiplex.engagement.core.rollover;

import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Report du reliquat d'un budget sur l'exercice suivant. Le budget source n'est pas modifié.
 */
@Service
public class BudgetRolloverService {

    private static final Logger log = LoggerFactory.getLogger(BudgetRolloverService.class);

    private final Repository repo;

    public BudgetRolloverService(Repository repo) {
        this.repo = repo;
    }

    public OpResult rollover(long budgetId) {
        try {
            return repo.inTransaction(store -> {
                Budget source = store.findBudget(budgetId);
                if (source == null) return OpResult.fail("Budget introuvable");
                if (source.montantDisponible().signum() <= 0) {
                    return OpResult.fail("Aucun montant disponible à reporter");
                }
                int target = source.annee() + 1;
                if (store.findBudget(source.clientId(), target, source.nature()) != null) {
                    return OpResult.fail("Un budget existe déjà pour " + target + " (" + source.nature() + ")");
                }
                long id = store.insertBudget(Budget.open(source.clientId(), target, source.nature(),
                        source.montantDisponible(), source.serviceDemandeur()));
                log.info("Budget {} reporté sur {}: nouveau budget {} de {}", budgetId, target, id, source.montantDisponible());
                return OpResult.ok("Budget reporté sur " + target + " (" + source.montantDisponible().toPlainString() + ")", id);
            });
        } catch (StoreException e) {
            log.error("Report du budget {} impossible", budgetId, e);
            return OpResult.fail("Erreur lors du report: " + e.getMessage());
        }
    }

    /**
     * Reporte tous les budgets de {@code fromYear} sur {@code toYear}, sauf ceux déjà présents sur l'année cible
     * et ceux en dépassement. Le montant initial reporté est le disponible de la source, même nul.
     */
    public OpResult rolloverYear(int fromYear, int toYear) {
        try {
            return repo.inTransaction(store -> {
                List<Budget> budgets = store.listBudgets(fromYear, null);
                if (budgets.isEmpty()) return OpResult.fail("Aucun budget trouvé pour l'année " + fromYear);
                int reported = 0;
                for (Budget b : budgets) {
                    if (b.montantDisponible().signum() < 0) continue;
                    if (store.findBudget(b.clientId(), toYear, b.nature()) != null) continue;
                    store.insertBudget(Budget.open(b.clientId(), toYear, b.nature(), b.montantDisponible(), b.serviceDemandeur()));
                    reported++;
                }
                log.info("{} budget(s) reporté(s) de {} vers {}", reported, fromYear, toYear);
                return OpResult.ok(reported + " budget(s) reporté(s) de " + fromYear + " vers " + toYear);
            });
        } catch (StoreException e) {
            log.error("Report des budgets {} -> {} impossible", fromYear, toYear, e);
            return OpResult.fail("Erreur lors du report: " + e.getMessage());
        }
    }
}
