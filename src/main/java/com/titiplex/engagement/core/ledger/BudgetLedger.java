package com.titiplex.engagement.core.ledger;

import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.Nature;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Budgets par client, année et nature. Garantit {@code disponible = initial - consommé}
 * à chaque écriture.
 */
@Service
public class BudgetLedger {

    private static final Logger log = LoggerFactory.getLogger(BudgetLedger.class);

    static final BigDecimal LOW_BALANCE_RATIO = new BigDecimal("0.10");

    private final Repository repo;
    private final Clock clock;

    public BudgetLedger(Repository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    public OpResult create(Long clientId, int annee, String nature, BigDecimal montantInitial, String serviceDemandeur) {
        String invalid = validate(clientId, annee, nature, montantInitial);
        if (invalid != null) return OpResult.fail(invalid);
        try {
            if (repo.findBudget(clientId, annee, nature) != null) {
                return OpResult.fail("Un budget existe déjà pour ce client, cette année et cette nature");
            }
            long id = repo.insertBudget(Budget.open(clientId, annee, nature, montantInitial, serviceDemandeur));
            log.info("Budget {} créé: client={}, annee={}, nature={}, initial={}", id, clientId, annee, nature, montantInitial);
            return OpResult.ok("Budget créé avec succès", id);
        } catch (StoreException e) {
            log.error("Création du budget impossible", e);
            return OpResult.fail("Erreur lors de la création: " + e.getMessage());
        }
    }

    /**
     * Met à jour clé, montant initial et service. Le consommé stocké est conservé et le disponible
     * recalculé ; aucune vérification n'est faite contre les BC déjà validés.
     */
    public OpResult update(Budget budget) {
        if (budget == null || budget.id() == null) return OpResult.fail("ID budget requis");
        String invalid = validate(budget.clientId(), budget.annee(), budget.nature(), budget.montantInitial());
        if (invalid != null) return OpResult.fail(invalid);
        try {
            return repo.inTransaction(store -> {
                Budget current = store.findBudget(budget.id());
                if (current == null) return OpResult.fail("Budget introuvable");
                Budget clash = store.findBudget(budget.clientId(), budget.annee(), budget.nature());
                if (clash != null && !clash.id().equals(budget.id())) {
                    return OpResult.fail("Un budget existe déjà pour ce client, cette année et cette nature");
                }
                // consommé relu sous le verrou d'écriture : une validation concurrente n'est jamais écrasée
                Budget updated = new Budget(current.id(), budget.clientId(), budget.annee(), budget.nature(),
                        budget.montantInitial(), current.montantConsomme(), null,
                        budget.serviceDemandeur() == null ? "" : budget.serviceDemandeur())
                        .withMontants(budget.montantInitial(), current.montantConsomme());
                store.updateBudget(updated);
                if (updated.montantDisponible().signum() < 0) {
                    log.warn("Budget {} en dépassement après modification: disponible={}", updated.id(), updated.montantDisponible());
                }
                return OpResult.ok("Budget modifié avec succès");
            });
        } catch (StoreException e) {
            log.error("Modification du budget {} impossible", budget.id(), e);
            return OpResult.fail("Erreur lors de la modification: " + e.getMessage());
        }
    }

    /**
     * Refusée si un BC validé existe pour le même client et la même nature, quelle que soit l'année.
     */
    public OpResult delete(long id) {
        try {
            return repo.inTransaction(store -> {
                Budget budget = store.findBudget(id);
                if (budget == null) return OpResult.fail("Budget introuvable");
                int validated = store.countValidatedBc(budget.clientId(), budget.nature());
                if (validated > 0) {
                    return OpResult.fail("Impossible de supprimer: " + validated
                            + " bon(s) de commande validé(s) imputé(s) sur ce client et cette nature");
                }
                store.deleteBudget(id);
                log.info("Budget {} supprimé", id);
                return OpResult.ok("Budget supprimé avec succès");
            });
        } catch (StoreException e) {
            log.error("Suppression du budget {} impossible", id, e);
            return OpResult.fail("Erreur lors de la suppression: " + e.getMessage());
        }
    }

    public OpResult checkAvailability(long clientId, String nature, BigDecimal montant) {
        try {
            return checkAvailability(repo, clientId, nature, montant);
        } catch (StoreException e) {
            log.error("Lecture du budget impossible", e);
            return OpResult.fail("Erreur lors de la vérification: " + e.getMessage());
        }
    }

    /**
     * Variante utilisée dans une transaction : {@code store} est le dépôt lié à cette transaction.
     */
    public OpResult checkAvailability(Repository store, long clientId, String nature, BigDecimal montant) {
        int annee = LocalDate.now(clock).getYear();
        Budget budget = store.findBudget(clientId, annee, nature);
        if (budget == null) {
            return OpResult.fail("Aucun budget trouvé pour ce client (" + nature + ", " + annee + ")");
        }
        if (budget.montantDisponible().compareTo(montant) < 0) {
            return OpResult.fail("Budget insuffisant (disponible=" + money(budget.montantDisponible())
                    + ", demandé=" + money(montant) + ")");
        }
        return OpResult.ok("Budget disponible: " + money(budget.montantDisponible()));
    }

    public Budget findById(long id) {
        return repo.findBudget(id);
    }

    public Budget findByKey(long clientId, int annee, String nature) {
        return repo.findBudget(clientId, annee, nature);
    }

    public List<Budget> list(Integer annee, String nature) {
        return repo.listBudgets(annee, nature);
    }

    /**
     * Budgets de l'année courante dont le disponible est sous 10 % de l'initial.
     */
    public List<Budget> lowBalanceBudgets() {
        int annee = LocalDate.now(clock).getYear();
        return repo.listBudgets(annee, null).stream()
                .filter(b -> b.montantDisponible().compareTo(b.montantInitial().multiply(LOW_BALANCE_RATIO)) < 0)
                .sorted((a, b) -> a.montantDisponible().compareTo(b.montantDisponible()))
                .toList();
    }

    private String validate(Long clientId, int annee, String nature, BigDecimal montantInitial) {
        if (clientId == null || clientId <= 0) return "Client requis";
        int current = LocalDate.now(clock).getYear();
        if (annee < 2000 || annee > current + 10) return "Année invalide";
        if (nature == null || nature.isBlank()) return "Le champ 'Nature' est obligatoire";
        if (Nature.fromLabel(nature).isEmpty()) {
            return "Nature invalide. Valeurs acceptées: " + Nature.labels();
        }
        if (montantInitial == null || montantInitial.signum() < 0) return "Montant initial invalide";
        return null;
    }

    static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
