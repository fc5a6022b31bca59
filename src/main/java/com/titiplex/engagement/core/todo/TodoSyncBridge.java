package com.titiplex.engagement.core.todo;

import com.titiplex.engagement.core.alert.ContractAlertScanner;
import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.model.Priorite;
import com.titiplex.engagement.core.model.TodoItem;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reporte les contrats en alerte dans la liste de tâches. Une seule tâche ouverte par contrat :
 * une fois la tâche terminée, une nouvelle synchronisation en recrée une.
 */
@Service
public class TodoSyncBridge {

    private static final Logger log = LoggerFactory.getLogger(TodoSyncBridge.class);

    private final Repository repo;
    private final ContractAlertScanner scanner;

    public TodoSyncBridge(Repository repo, ContractAlertScanner scanner) {
        this.repo = repo;
        this.scanner = scanner;
    }

    public SyncResult sync(List<Contrat> alertedContracts) {
        int added = 0;
        try {
            for (Contrat contrat : alertedContracts) {
                if (contrat.id() == null || repo.existsOpenTodoForContrat(contrat.id())) continue;
                repo.insertTodo(reminderFor(contrat));
                added++;
            }
        } catch (StoreException e) {
            log.error("Synchronisation des tâches interrompue après {} ajout(s)", added, e);
            return new SyncResult(false, "Erreur lors de la synchronisation: " + e.getMessage(), added);
        }
        if (added > 0) {
            log.info("{} tâche(s) de renouvellement ajoutée(s)", added);
            return new SyncResult(true, added + " tâche(s) ajoutée(s) depuis les contrats", added);
        }
        return new SyncResult(true, "Aucune nouvelle tâche à ajouter", 0);
    }

    public SyncResult syncFromScanner() {
        try {
            return sync(scanner.alertedContracts());
        } catch (StoreException e) {
            log.error("Lecture des contrats en alerte impossible", e);
            return new SyncResult(false, "Erreur lors de la synchronisation: " + e.getMessage(), 0);
        }
    }

    static TodoItem reminderFor(Contrat contrat) {
        return TodoItem.open(
                "Renouvellement contrat " + contrat.numeroContrat(),
                "Le contrat " + contrat.numeroContrat() + " expire le " + contrat.dateFin() + ". Action requise.",
                contrat.id(),
                contrat.dateFin(),
                Priorite.HAUTE.label());
    }
}
