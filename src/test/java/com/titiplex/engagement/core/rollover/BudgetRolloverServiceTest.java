package com.titiplex.engagement.core.rollover;

import com.titiplex.engagement.core.ledger.BudgetLedger;
import com.titiplex.engagement.core.model.Budget;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.SqliteRepository;
import com.titiplex.engagement.core.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;

import static com.titiplex.engagement.core.store.TestStores.YEAR;
import static org.junit.jupiter.api.Assertions.*;

class BudgetRolloverServiceTest {

    @TempDir
    Path dir;

    private SqliteRepository repo;
    private BudgetLedger ledger;
    private BudgetRolloverService rollover;

    @BeforeEach
    void setUp() {
        repo = TestStores.open(dir);
        ledger = new BudgetLedger(repo, TestStores.CLOCK);
        rollover = new BudgetRolloverService(repo);
    }

    private long budgetWithAvailable(long clientId, String initial, String consomme) {
        long id = ledger.create(clientId, YEAR, "Fonctionnement", new BigDecimal(initial), "DSI").id();
        repo.updateBudget(repo.findBudget(id).impute(new BigDecimal(consomme)));
        return id;
    }

    @Test
    void testRolloverCopiesAvailableIntoNextYear() {
        long source = budgetWithAvailable(1L, "1000", "600");

        OpResult r = rollover.rollover(source);

        assertTrue(r.success(), r.message());
        Budget next = repo.findBudget(r.id());
        assertEquals(YEAR + 1, next.annee());
        assertEquals(0, next.montantInitial().compareTo(new BigDecimal("400")));
        assertEquals(0, next.montantConsomme().signum());
        assertEquals(0, next.montantDisponible().compareTo(new BigDecimal("400")));
        assertEquals("DSI", next.serviceDemandeur());

        Budget unchanged = repo.findBudget(source);
        assertEquals(0, unchanged.montantDisponible().compareTo(new BigDecimal("400")));
    }

    @Test
    void testSecondRolloverFails() {
        long source = budgetWithAvailable(1L, "1000", "600");
        assertTrue(rollover.rollover(source).success());

        OpResult again = rollover.rollover(source);

        assertFalse(again.success());
        assertTrue(again.message().contains("existe déjà"));
    }

    @Test
    void testRolloverNeedsPositiveBalance() {
        long spent = budgetWithAvailable(1L, "1000", "1000");

        assertFalse(rollover.rollover(spent).success());
        assertNull(repo.findBudget(1L, YEAR + 1, "Fonctionnement"));
        assertFalse(rollover.rollover(12345L).success());
    }

    @Test
    void testRolloverYearSkipsExistingTargets() {
        budgetWithAvailable(1L, "1000", "250");
        budgetWithAvailable(2L, "500", "0");
        ledger.create(2L, YEAR + 1, "Fonctionnement", new BigDecimal("42"), null);

        OpResult r = rollover.rolloverYear(YEAR, YEAR + 1);

        assertTrue(r.success(), r.message());
        assertTrue(r.message().startsWith("1 budget(s)"));
        assertEquals(0, repo.findBudget(1L, YEAR + 1, "Fonctionnement").montantInitial().compareTo(new BigDecimal("750")));
        assertEquals(0, repo.findBudget(2L, YEAR + 1, "Fonctionnement").montantInitial().compareTo(new BigDecimal("42")));
    }

    @Test
    void testRolloverYearWithoutSourceBudgets() {
        assertFalse(rollover.rolloverYear(2010, 2011).success());
    }
}
