package com.titiplex.engagement.core.todo;

import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.model.Priorite;
import com.titiplex.engagement.core.model.TodoItem;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class TodoService {

    private static final Logger log = LoggerFactory.getLogger(TodoService.class);

    private final Repository repo;
    private final Clock clock;

    public TodoService(Repository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    public OpResult create(TodoItem todo) {
        String invalid = validate(todo);
        if (invalid != null) return OpResult.fail(invalid);
        try {
            long id = repo.insertTodo(todo);
            return OpResult.ok("Tâche créée avec succès", id);
        } catch (StoreException e) {
            log.error("Création de la tâche impossible", e);
            return OpResult.fail("Erreur lors de la création: " + e.getMessage());
        }
    }

    public OpResult update(TodoItem todo) {
        if (todo == null || todo.id() == null) return OpResult.fail("ID todo requis");
        String invalid = validate(todo);
        if (invalid != null) return OpResult.fail(invalid);
        try {
            if (repo.findTodo(todo.id()) == null) return OpResult.fail("Tâche introuvable");
            repo.updateTodo(todo);
            return OpResult.ok("Tâche mise à jour avec succès");
        } catch (StoreException e) {
            log.error("Modification de la tâche {} impossible", todo.id(), e);
            return OpResult.fail("Erreur lors de la mise à jour: " + e.getMessage());
        }
    }

    public OpResult toggleComplete(long id) {
        try {
            TodoItem todo = repo.findTodo(id);
            if (todo == null) return OpResult.fail("Tâche introuvable");
            boolean complete = !todo.complete();
            repo.setTodoComplete(id, complete, complete ? LocalDateTime.now(clock) : null);
            return OpResult.ok("Tâche " + (complete ? "complétée" : "réactivée") + " avec succès");
        } catch (StoreException e) {
            log.error("Changement d'état de la tâche {} impossible", id, e);
            return OpResult.fail("Erreur lors de la mise à jour: " + e.getMessage());
        }
    }

    public OpResult delete(long id) {
        try {
            repo.deleteTodo(id);
            return OpResult.ok("Tâche supprimée avec succès");
        } catch (StoreException e) {
            log.error("Suppression de la tâche {} impossible", id, e);
            return OpResult.fail("Erreur lors de la suppression: " + e.getMessage());
        }
    }

    public TodoItem findById(long id) {
        return repo.findTodo(id);
    }

    /**
     * Urgente d'abord, puis par échéance.
     */
    public List<TodoItem> list(Boolean complete) {
        return repo.listTodos(complete);
    }

    private String validate(TodoItem todo) {
        if (todo == null) return "Tâche requise";
        if (todo.motif() == null || todo.motif().isBlank()) return "Le champ 'Motif' est obligatoire";
        if (Priorite.fromLabel(todo.priorite()).isEmpty()) {
            return "Priorité invalide. Valeurs acceptées: " + Priorite.labels();
        }
        return null;
    }
}
