package com.titiplex.engagement.core.alert;

import com.titiplex.engagement.core.model.Contrat;
import com.titiplex.engagement.core.model.StatutContrat;
import com.titiplex.engagement.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Alerte « 6 mois » : contrat actif dont la date de fin tombe entre aujourd'hui et aujourd'hui + 180 jours.
 */
@Service
public class ContractAlertScanner {

    private static final Logger log = LoggerFactory.getLogger(ContractAlertScanner.class);

    public static final int DEFAULT_WINDOW_DAYS = 180;

    private final Repository repo;
    private final Clock clock;
    private final int windowDays;

    public ContractAlertScanner(Repository repo, Clock clock,
                                @Value("${app.alerts.window-days:180}") int windowDays) {
        this.repo = repo;
        this.clock = clock;
        this.windowDays = windowDays;
    }

    public static boolean isAlert(Contrat contrat, LocalDate today, int windowDays) {
        if (contrat == null || contrat.dateFin() == null) return false;
        if (!StatutContrat.ACTIF.label().equals(contrat.statut())) return false;
        LocalDate fin = contrat.dateFin();
        return !fin.isBefore(today) && !fin.isAfter(today.plusDays(windowDays));
    }

    public static boolean isAlert(Contrat contrat, LocalDate today) {
        return isAlert(contrat, today, DEFAULT_WINDOW_DAYS);
    }

    public boolean alert(Contrat contrat) {
        return isAlert(contrat, LocalDate.now(clock), windowDays);
    }

    /**
     * Recalcule et enregistre le drapeau de tous les contrats actifs ayant une date de fin.
     *
     * @return nombre de contrats en alerte
     */
    public int updateAll() {
        LocalDate today = LocalDate.now(clock);
        int alerted = 0;
        for (Contrat c : repo.listActiveContratsWithEndDate()) {
            boolean alerte = isAlert(c, today, windowDays);
            if (alerte != c.alerte6Mois()) repo.updateAlerte(c.id(), alerte);
            if (alerte) alerted++;
        }
        log.info("Alertes contrats recalculées: {} contrat(s) en alerte", alerted);
        return alerted;
    }

    public List<Contrat> alertedContracts() {
        return repo.listContrats(StatutContrat.ACTIF.label(), true);
    }
}
