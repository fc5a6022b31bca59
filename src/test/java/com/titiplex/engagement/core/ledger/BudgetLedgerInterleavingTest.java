package com.titiplex.engagement.core.ledger;

import com.titiplex.engagement.core.bc.ConsumptionImputationService;
import com.titiplex.engagement.core.bc.PurchaseOrderValidator;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.Repository;
import com.titiplex.engagement.core.store.SqliteRepository;
import com.titiplex.engagement.core.store.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static com.titiplex.engagement.core.store.TestStores.YEAR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Une validation de BC lancée pendant la modification ou la suppression d'un budget.
 */
class BudgetLedgerInterleavingTest {

    @TempDir
    Path dir;

    private HookedRepository repo;
    private BudgetLedger ledger;
    private PurchaseOrderValidator validator;
    private ExecutorService pool;

    /**
     * Exécute {@code hook} une fois, au début de la prochaine transaction.
     */
    private static final class HookedRepository extends SqliteRepository {

        private volatile Runnable hook;

        HookedRepository(Path dir) {
            super(dir.toString(), "test.db", 5000);
        }

        @Override
        public <T> T inTransaction(Function<Repository, T> work) {
            Runnable once = hook;
            hook = null;
            return super.inTransaction(store -> {
                if (once != null) once.run();
                return work.apply(store);
            });
        }
    }

    @BeforeEach
    void setUp() {
        repo = new HookedRepository(dir);
        ledger = new BudgetLedger(repo, TestStores.CLOCK);
        validator = new PurchaseOrderValidator(repo, ledger, new ConsumptionImputationService(TestStores.CLOCK), TestStores.CLOCK);
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private long draft(String montant) {
        return validator.create(BonCommande.draft(1L, null, "Fonctionnement", "Matériel", new BigDecimal(montant), "", "")).id();
    }

    // la validation démarre sur une autre connexion pendant la transaction en cours
    private AtomicReference<Future<OpResult>> validateDuringNextTransaction(long bcId) {
        AtomicReference<Future<OpResult>> validation = new AtomicReference<>();
        repo.hook = () -> {
            validation.set(pool.submit(() -> validator.validate(bcId)));
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        return validation;
    }

    @Test
    void testUpdateKeepsImputationOfConcurrentValidation() throws Exception {
        long budgetId = ledger.create(1L, YEAR, "Fonctionnement", new BigDecimal("1000"), "DSI").id();
        long bcId = draft("600");
        AtomicReference<Future<OpResult>> validation = validateDuringNextTransaction(bcId);

        OpResult updated = ledger.update(new Budget(budgetId, 1L, YEAR, "Fonctionnement",
                new BigDecimal("1200"), BigDecimal.ZERO, new BigDecimal("1200"), "DSI"));

        assertTrue(updated.success(), updated.message());
        assertTrue(validation.get().get(10, TimeUnit.SECONDS).success());
        assertTrue(repo.findBc(bcId).isValidated());
        Budget b = repo.findBudget(budgetId);
        assertEquals(0, b.montantInitial().compareTo(new BigDecimal("1200")));
        assertEquals(0, b.montantConsomme().compareTo(new BigDecimal("600")));
        assertEquals(0, b.montantDisponible().compareTo(new BigDecimal("600")));
    }

    @Test
    void testDeleteNeverRemovesBudgetOfConcurrentValidation() throws Exception {
        long budgetId = ledger.create(1L, YEAR, "Fonctionnement", new BigDecimal("1000"), "DSI").id();
        long bcId = draft("600");
        AtomicReference<Future<OpResult>> validation = validateDuringNextTransaction(bcId);

        OpResult deleted = ledger.delete(budgetId);
        OpResult validated = validation.get().get(10, TimeUnit.SECONDS);

        // une seule des deux opérations aboutit
        assertNotEquals(deleted.success(), validated.success());
        if (deleted.success()) {
            assertNull(repo.findBudget(budgetId));
            assertFalse(repo.findBc(bcId).isValidated());
        } else {
            assertTrue(repo.findBc(bcId).isValidated());
            assertEquals(0, repo.findBudget(budgetId).montantConsomme().compareTo(new BigDecimal("600")));
        }
    }
}
