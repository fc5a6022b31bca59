package com.titiplex.engagement;

import com.titiplex.engagement.core.bc.PurchaseOrderValidator;
import com.titiplex.engagement.core.ledger.BudgetLedger;
import com.titiplex.engagement.core.model.BonCommande;
import com.titiplex.engagement.core.model.OpResult;
import com.titiplex.engagement.core.store.Repository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = SpringConfig.class)
class SpringConfigTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataDir(DynamicPropertyRegistry registry) {
        registry.add("app.data.dir", dataDir::toString);
    }

    @Autowired
    private Repository repo;

    @Autowired
    private BudgetLedger ledger;

    @Autowired
    private PurchaseOrderValidator validator;

    @Test
    void testContextWiresServicesOnOneDatabase() {
        int annee = LocalDate.now().getYear();
        OpResult budget = ledger.create(1L, annee, "Fonctionnement", new BigDecimal("500"), "DSI");
        assertTrue(budget.success(), budget.message());

        OpResult bc = validator.create(BonCommande.draft(1L, null, "Fonctionnement", "Prestation",
                new BigDecimal("120"), "DSI", "Audit"));
        assertTrue(bc.success(), bc.message());
        assertTrue(validator.validate(bc.id()).success());

        assertEquals(0, repo.findBudget(budget.id()).montantDisponible().compareTo(new BigDecimal("380")));
    }
}
