package com.titiplex.engagement.core.store;

import com.titiplex.engagement.core.model.BcState;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.model.TodoItem;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

public interface Repository {
    void init();

    /**
     * Exécute {@code work} dans une seule transaction ; le dépôt passé en argument est lié à cette transaction.
     * Validée si {@code work} se termine, annulée s'il lève une exception.
     */
    <T> T inTransaction(Function<Repository, T> work);

    // Budgets
    long insertBudget(Budget b);

    void updateBudget(Budget b);

    void deleteBudget(long id);

    Budget findBudget(long id);

    Budget findBudget(long clientId, int annee, String nature);

    List<Budget> listBudgets(Integer annee, String nature);

    // Bons de commande
    long insertBc(BonCommande bc);

    /**
     * @return lignes modifiées, 0 si le BC est validé ou absent
     */
    int updateBc(BonCommande bc);

    void markValidated(long id, LocalDateTime at);

    int deleteBc(long id);

    BonCommande findBc(long id);

    boolean existsNumeroBc(String numeroBc);

    String maxNumeroBc(int annee);

    int countValidatedBc(long clientId, String nature);

    int countBcForContrat(long contratId);

    List<BonCommande> listBcs(BcState etat, String nature);

    List<BonCommande> listBcsForYear(int annee);

    // Compteurs de numérotation BC
    int lastSequence(int annee);

    void saveSequence(int annee, int dernier);

    // Contrats
    long insertContrat(Contrat c);

    void updateContrat(Contrat c);

    void deleteContrat(long id);

    Contrat findContrat(long id);

    boolean existsNumeroContrat(String numeroContrat, Long excludeId);

    List<Contrat> listContrats(String statut, boolean alerteOnly);

    List<Contrat> listActiveContratsWithEndDate();

    void updateAlerte(long contratId, boolean alerte);

    // Todo
    long insertTodo(TodoItem t);

    void updateTodo(TodoItem t);

    void setTodoComplete(long id, boolean complete, LocalDateTime at);

    void deleteTodo(long id);

    TodoItem findTodo(long id);

    boolean existsOpenTodoForContrat(long contratId);

    List<TodoItem> listTodos(Boolean complete);
}
