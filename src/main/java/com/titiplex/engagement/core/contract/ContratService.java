package com.titiplex.engagement.core.contract;

import com.titiplex.engagement.core.alert.ContractAlertScanner;
import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.model.StatutContrat;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ContratService {

    private static final Logger log = LoggerFactory.getLogger(ContratService.class);

    private final Repository repo;
    private final ContractAlertScanner scanner;

    public ContratService(Repository repo, ContractAlertScanner scanner) {
        this.repo = repo;
        this.scanner = scanner;
    }

    public OpResult create(Contrat contrat) {
        String invalid = validate(contrat);
        if (invalid != null) return OpResult.fail(invalid);
        try {
            if (repo.existsNumeroContrat(contrat.numeroContrat(), null)) {
                return OpResult.fail("Un contrat avec le numéro '" + contrat.numeroContrat() + "' existe déjà");
            }
            long id = repo.insertContrat(contrat.withAlerte(scanner.alert(contrat)));
            log.info("Contrat {} créé (id={})", contrat.numeroContrat(), id);
            return OpResult.ok("Contrat créé avec succès", id);
        } catch (StoreException e) {
            log.error("Création du contrat {} impossible", contrat.numeroContrat(), e);
            return OpResult.fail("Erreur lors de la création: " + e.getMessage());
        }
    }

    public OpResult update(Contrat contrat) {
        if (contrat == null || contrat.id() == null) return OpResult.fail("ID contrat requis");
        String invalid = validate(contrat);
        if (invalid != null) return OpResult.fail(invalid);
        try {
            if (repo.findContrat(contrat.id()) == null) return OpResult.fail("Contrat introuvable");
            if (repo.existsNumeroContrat(contrat.numeroContrat(), contrat.id())) {
                return OpResult.fail("Un autre contrat avec le numéro '" + contrat.numeroContrat() + "' existe déjà");
            }
            repo.updateContrat(contrat.withAlerte(scanner.alert(contrat)));
            return OpResult.ok("Contrat mis à jour avec succès");
        } catch (StoreException e) {
            log.error("Modification du contrat {} impossible", contrat.id(), e);
            return OpResult.fail("Erreur lors de la mise à jour: " + e.getMessage());
        }
    }

    public OpResult delete(long id) {
        try {
            if (repo.findContrat(id) == null) return OpResult.fail("Contrat introuvable");
            if (repo.countBcForContrat(id) > 0) {
                return OpResult.fail("Impossible de supprimer: des bons de commande sont associés à ce contrat");
            }
            repo.deleteContrat(id);
            return OpResult.ok("Contrat supprimé avec succès");
        } catch (StoreException e) {
            log.error("Suppression du contrat {} impossible", id, e);
            return OpResult.fail("Erreur lors de la suppression: " + e.getMessage());
        }
    }

    public Contrat findById(long id) {
        return repo.findContrat(id);
    }

    public List<Contrat> list(String statut, boolean alerteOnly) {
        return repo.listContrats(statut, alerteOnly);
    }

    private String validate(Contrat c) {
        if (c == null) return "Contrat requis";
        if (c.numeroContrat() == null || c.numeroContrat().isBlank()) {
            return "Le champ 'Numéro de contrat' est obligatoire";
        }
        if (c.clientId() == null || c.clientId() <= 0) return "Client requis";
        if (c.montant() == null || c.montant().signum() < 0) return "Montant invalide";
        if (c.dateDebut() != null && c.dateFin() != null && c.dateFin().isBefore(c.dateDebut())) {
            return "La date de fin doit être postérieure à la date de début";
        }
        if (StatutContrat.fromLabel(c.statut()).isEmpty()) {
            return "Statut invalide. Valeurs acceptées: " + StatutContrat.labels();
        }
        return null;
    }
}
