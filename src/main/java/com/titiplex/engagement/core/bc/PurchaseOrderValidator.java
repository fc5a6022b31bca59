package com.titiplex.engagement.core.bc;

import com.titiplex.engagement.core.ledger.BudgetLedger;
import com.titiplex.engagement.core.model.BcState;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Nature;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.model.TypeBc;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cycle de vie des bons de commande : création en brouillon, modification tant qu'ils ne sont pas validés,
 * puis validation irréversible contre le budget disponible.
 */
@Service
public class PurchaseOrderValidator {

    private static final Logger log = LoggerFactory.getLogger(PurchaseOrderValidator.class);

    static final Pattern NUMERO_BC = Pattern.compile("^BC-\\d{4}-\\d{4}$");
    private static final int MAX_SEQUENCE = 9999;

    private final Repository repo;
    private final BudgetLedger ledger;
    private final ConsumptionImputationService imputation;
    private final Clock clock;

    public PurchaseOrderValidator(Repository repo, BudgetLedger ledger, ConsumptionImputationService imputation, Clock clock) {
        this.repo = repo;
        this.ledger = ledger;
        this.imputation = imputation;
        this.clock = clock;
    }

    public static String formatNumero(int annee, int sequence) {
        return String.format("BC-%d-%04d", annee, sequence);
    }

    /**
     * Prochain numéro pour {@code annee}, sans le réserver.
     */
    public String generateNextNumero(int annee) {
        return formatNumero(annee, nextSequence(repo, annee));
    }

    // le compteur est réensemencé par le plus grand numéro existant : une saisie manuelle n'est jamais réémise
    private int nextSequence(Repository store, int annee) {
        int fromCounter = store.lastSequence(annee);
        int fromRows = 0;
        String max = store.maxNumeroBc(annee);
        if (max != null) {
            fromRows = Integer.parseInt(max.substring(max.lastIndexOf('-') + 1));
        }
        return Math.max(fromCounter, fromRows) + 1;
    }

    public OpResult create(BonCommande bc) {
        String invalid = validateFields(bc);
        if (invalid != null) return OpResult.fail(invalid);
        boolean manual = bc.numeroBc() != null && !bc.numeroBc().isBlank();
        if (manual && !NUMERO_BC.matcher(bc.numeroBc()).matches()) {
            return OpResult.fail("Numéro de BC invalide (format attendu BC-AAAA-NNNN)");
        }
        try {
            return repo.inTransaction(store -> {
                String numero = bc.numeroBc();
                if (!manual) {
                    int annee = LocalDate.now(clock).getYear();
                    int seq = nextSequence(store, annee);
                    if (seq > MAX_SEQUENCE) return OpResult.fail("Numérotation BC épuisée pour " + annee);
                    store.saveSequence(annee, seq);
                    numero = formatNumero(annee, seq);
                }
                if (store.existsNumeroBc(numero)) {
                    return OpResult.fail("Un BC avec le numéro '" + numero + "' existe déjà");
                }
                long id = store.insertBc(bc.withNumero(numero));
                log.info("BC {} créé (id={}, client={}, {} {})", numero, id, bc.clientId(), bc.nature(), bc.montant());
                return OpResult.ok("BC " + numero + " créé avec succès", id);
            });
        } catch (StoreException e) {
            log.error("Création du BC impossible", e);
            return OpResult.fail("Erreur lors de la création: " + e.getMessage());
        }
    }

    public OpResult update(BonCommande bc) {
        if (bc == null || bc.id() == null) return OpResult.fail("ID BC requis");
        try {
            return repo.inTransaction(store -> {
                BonCommande existing = store.findBc(bc.id());
                if (existing == null) return OpResult.fail("BC introuvable");
                if (existing.etat().isTerminal()) return OpResult.fail("Impossible de modifier un BC validé");
                String invalid = validateFields(bc);
                if (invalid != null) return OpResult.fail(invalid);
                if (store.updateBc(bc) == 0) return OpResult.fail("Impossible de modifier un BC validé");
                return OpResult.ok("BC mis à jour avec succès");
            });
        } catch (StoreException e) {
            log.error("Modification du BC {} impossible", bc.id(), e);
            return OpResult.fail("Erreur lors de la mise à jour: " + e.getMessage());
        }
    }

    public OpResult delete(long id) {
        try {
            return repo.inTransaction(store -> {
                BonCommande existing = store.findBc(id);
                if (existing == null) return OpResult.fail("BC introuvable");
                if (existing.etat().isTerminal()) return OpResult.fail("Impossible de supprimer un BC validé");
                if (store.deleteBc(id) == 0) return OpResult.fail("Impossible de supprimer un BC validé");
                log.info("BC {} supprimé", existing.numeroBc());
                return OpResult.ok("BC supprimé avec succès");
            });
        } catch (StoreException e) {
            log.error("Suppression du BC {} impossible", id, e);
            return OpResult.fail("Erreur lors de la suppression: " + e.getMessage());
        }
    }

    /**
     * Vérifie le disponible, passe le BC à l'état validé et impute le budget, le tout dans une seule
     * transaction : deux validations concurrentes ne peuvent pas dépasser le budget.
     */
    public OpResult validate(long id) {
        try {
            return repo.inTransaction(store -> {
                BonCommande bc = store.findBc(id);
                if (bc == null) return OpResult.fail("BC introuvable");
                if (!bc.etat().canTransitionTo(BcState.VALIDATED)) return OpResult.fail("BC déjà validé");

                OpResult check = ledger.checkAvailability(store, bc.clientId(), bc.nature(), bc.montant());
                if (!check.success()) return OpResult.fail("Validation impossible: " + check.message());

                LocalDateTime now = LocalDateTime.now(clock);
                store.markValidated(id, now);
                boolean imputed = imputation.impute(store, bc.validated(now));
                log.info("BC {} validé (imputé={})", bc.numeroBc(), imputed);
                return imputed
                        ? OpResult.ok("BC " + bc.numeroBc() + " validé avec succès. Budget imputé automatiquement.")
                        : OpResult.ok("BC " + bc.numeroBc() + " validé, aucun budget à imputer.");
            });
        } catch (StoreException e) {
            log.error("Validation du BC {} impossible", id, e);
            return OpResult.fail("Erreur lors de la validation: " + e.getMessage());
        }
    }

    public BonCommande findById(long id) {
        return repo.findBc(id);
    }

    public List<BonCommande> list(BcState etat, String nature) {
        return repo.listBcs(etat, nature);
    }

    /**
     * Nombre et montant des BC numérotés sur {@code annee}, par nature et par état.
     */
    public BcStatistics statistics(int annee) {
        int total = 0;
        int valides = 0;
        BigDecimal montantTotal = BigDecimal.ZERO;
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> montants = new LinkedHashMap<>();
        for (BonCommande bc : repo.listBcsForYear(annee)) {
            total++;
            montantTotal = montantTotal.add(bc.montant());
            int[] c = counts.computeIfAbsent(bc.nature(), k -> new int[2]);
            if (bc.isValidated()) {
                valides++;
                c[0]++;
            } else {
                c[1]++;
            }
            montants.merge(bc.nature(), bc.montant(), BigDecimal::add);
        }
        Map<String, BcStatistics.NatureStats> byNature = new LinkedHashMap<>();
        counts.forEach((nature, c) -> byNature.put(nature, new BcStatistics.NatureStats(c[0], c[1], montants.get(nature))));
        return new BcStatistics(annee, total, valides, total - valides, montantTotal, byNature);
    }

    private String validateFields(BonCommande bc) {
        if (bc == null) return "BC requis";
        if (bc.clientId() == null || bc.clientId() <= 0) return "Client requis";
        if (bc.nature() == null || bc.nature().isBlank()) return "Le champ 'Nature' est obligatoire";
        if (Nature.fromLabel(bc.nature()).isEmpty()) return "Nature invalide. Valeurs acceptées: " + Nature.labels();
        if (bc.type() == null || bc.type().isBlank()) return "Le champ 'Type' est obligatoire";
        if (TypeBc.fromLabel(bc.type()).isEmpty()) return "Type invalide. Valeurs acceptées: " + TypeBc.labels();
        if (bc.montant() == null) return "Montant invalide";
        if (bc.montant().signum() <= 0) return "Le montant doit être supérieur à zéro";
        return null;
    }
}
