package com.titiplex.engagement.core.bc;

import com.titiplex.engagement.core.ledger.BudgetLedger;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.SqliteRepository;
import com.titiplex.engagement.core.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static com.titiplex.engagement.core.store.TestStores.YEAR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Validations et créations lancées en parallèle sur la même base.
 */
class ValidationConcurrencyTest {

    private static final int THREADS = 8;

    @TempDir
    Path dir;

    private SqliteRepository repo;
    private BudgetLedger ledger;
    private PurchaseOrderValidator validator;

    @BeforeEach
    void setUp() {
        repo = TestStores.open(dir);
        ledger = new BudgetLedger(repo, TestStores.CLOCK);
        validator = new PurchaseOrderValidator(repo, ledger, new ConsumptionImputationService(TestStores.CLOCK), TestStores.CLOCK);
    }

    private <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> out = new ArrayList<>();
            for (Future<T> f : futures) out.add(f.get(30, TimeUnit.SECONDS));
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testConcurrentValidationsNeverOverspend() throws Exception {
        long budgetId = ledger.create(1L, YEAR, "Fonctionnement", new BigDecimal("1000"), null).id();
        List<Long> orders = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            orders.add(validator.create(BonCommande.draft(1L, null, "Fonctionnement", "Assistance",
                    new BigDecimal("200"), "", "")).id());
        }

        List<Callable<OpResult>> tasks = new ArrayList<>();
        for (long id : orders) tasks.add(() -> validator.validate(id));
        List<OpResult> results = runConcurrently(tasks);

        long succeeded = results.stream().filter(OpResult::success).count();
        assertEquals(5, succeeded);
        Budget b = ledger.findById(budgetId);
        assertEquals(0, b.montantConsomme().compareTo(new BigDecimal("1000")));
        assertEquals(0, b.montantDisponible().signum());
    }

    @Test
    void testConcurrentCreatesGetDistinctNumbers() throws Exception {
        List<Callable<OpResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> validator.create(BonCommande.draft(1L, null, "Fonctionnement", "Assistance",
                    BigDecimal.TEN, "", "")));
        }

        List<OpResult> results = runConcurrently(tasks);

        Set<String> numeros = new HashSet<>();
        for (OpResult r : results) {
            assertTrue(r.success(), r.message());
            numeros.add(validator.findById(r.id()).numeroBc());
        }
        assertEquals(THREADS, numeros.size());
        assertEquals("BC-" + YEAR + "-000" + (THREADS + 1), validator.generateNextNumero(YEAR));
    }
}
