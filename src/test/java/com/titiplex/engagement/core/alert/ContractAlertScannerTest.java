package com.titiplex.engagement.core.alert;

import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.store.SqliteRepository;
import com.titiplex.engagement.core.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static com.titiplex.engagement.core.store.TestStores.TODAY;
import static org.junit.jupiter.api.Assertions.*;

class ContractAlertScannerTest {

    @TempDir
    Path dir;

    private SqliteRepository repo;
    private ContractAlertScanner scanner;

    @BeforeEach
    void setUp() {
        repo = TestStores.open(dir);
        scanner = new ContractAlertScanner(repo, TestStores.CLOCK, 180);
    }

    private static Contrat contrat(String numero, String statut, LocalDate fin, boolean alerte) {
        return new Contrat(null, numero, 1L, null, TODAY.minusYears(1), fin, BigDecimal.ZERO, "", statut, alerte);
    }

    @Test
    void testActiveContractWithinSixMonthsIsAlerted() {
        assertTrue(scanner.alert(contrat("A", "Actif", TODAY.plusDays(170), false)));
        assertFalse(scanner.alert(contrat("A", "Actif", TODAY.plusDays(200), false)));
        assertFalse(scanner.alert(contrat("A", "Résilié", TODAY.plusDays(170), false)));
        assertFalse(scanner.alert(contrat("A", "Expiré", TODAY.plusDays(10), false)));
    }

    @Test
    void testWindowBoundsAreInclusive() {
        assertTrue(ContractAlertScanner.isAlert(contrat("A", "Actif", TODAY, false), TODAY));
        assertTrue(ContractAlertScanner.isAlert(contrat("A", "Actif", TODAY.plusDays(180), false), TODAY));
        assertFalse(ContractAlertScanner.isAlert(contrat("A", "Actif", TODAY.plusDays(181), false), TODAY));
        assertFalse(ContractAlertScanner.isAlert(contrat("A", "Actif", TODAY.minusDays(1), false), TODAY));
        assertFalse(ContractAlertScanner.isAlert(contrat("A", "Actif", null, false), TODAY));
    }

    @Test
    void testUpdateAllPersistsFlagsAndCounts() {
        long near = repo.insertContrat(contrat("NEAR", "Actif", TODAY.plusDays(30), false));
        long far = repo.insertContrat(contrat("FAR", "Actif", TODAY.plusDays(365), true));
        long past = repo.insertContrat(contrat("PAST", "Actif", TODAY.minusDays(3), true));
        long closed = repo.insertContrat(contrat("CLOSED", "Résilié", TODAY.plusDays(30), false));

        int count = scanner.updateAll();

        assertEquals(1, count);
        assertTrue(repo.findContrat(near).alerte6Mois());
        assertFalse(repo.findContrat(far).alerte6Mois());
        assertFalse(repo.findContrat(past).alerte6Mois());
        assertFalse(repo.findContrat(closed).alerte6Mois());

        List<Contrat> alerted = scanner.alertedContracts();
        assertEquals(List.of("NEAR"), alerted.stream().map(Contrat::numeroContrat).toList());
    }

    @Test
    void testUpdateAllIsIdempotent() {
        repo.insertContrat(contrat("NEAR", "Actif", TODAY.plusDays(30), false));

        assertEquals(1, scanner.updateAll());
        assertEquals(1, scanner.updateAll());
    }
}
