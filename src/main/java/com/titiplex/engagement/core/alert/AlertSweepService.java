package com.titiplex.engagement.core.alert;

import com.titiplex.engagement.core.config.ConfigService;
import com.titiplex.engagement.core.config.SweepState;
import com.titiplex.engagement.core.store.StoreException;
import com.titiplex.engagement.core.todo.SyncResult;
import com.titiplex.engagement.core.todo.TodoSyncBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Balayage périodique : recalcul des alertes contrats puis synchronisation de la liste de tâches.
 */
@Service
public class AlertSweepService {

    private static final Logger log = LoggerFactory.getLogger(AlertSweepService.class);

    private final ContractAlertScanner scanner;
    private final TodoSyncBridge todoSync;
    private final ConfigService config;
    private final Clock clock;
    private final int sweepHours;
    private ScheduledExecutorService ses;

    public AlertSweepService(ContractAlertScanner scanner, TodoSyncBridge todoSync, ConfigService config, Clock clock,
                             @Value("${app.alerts.sweep-hours:24}") int sweepHours) {
        this.scanner = scanner;
        this.todoSync = todoSync;
        this.config = config;
        this.clock = clock;
        this.sweepHours = sweepHours;
    }

    public synchronized void start() {
        if (ses != null) return;
        ses = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "alert-sweep");
            t.setDaemon(true);
            return t;
        });
        // premier passage immédiat, puis toutes les sweepHours
        ses.scheduleAtFixedRate(this::sweepIfDue, 0, Math.max(1, sweepHours), TimeUnit.HOURS);
    }

    public synchronized void stop() {
        if (ses == null) return;
        ses.shutdownNow();
        ses = null;
    }

    public SweepState runOnce() {
        int alerted = scanner.updateAll();
        SyncResult sync = todoSync.syncFromScanner();
        if (!sync.success()) log.warn("Synchronisation des tâches: {}", sync.message());
        SweepState state = new SweepState(LocalDate.now(clock), alerted, sync.added());
        config.saveLastSweep(state);
        return state;
    }

    /**
     * Ne relance pas un balayage déjà fait aujourd'hui.
     */
    boolean sweepIfDue() {
        try {
            SweepState last = config.lastSweep();
            if (last != null && LocalDate.now(clock).equals(last.date())) return false;
            runOnce();
            return true;
        } catch (StoreException | UncheckedIOException e) {
            // une exception sortante annulerait les exécutions planifiées suivantes
            log.error("Balayage des alertes échoué", e);
            return false;
        }
    }
}
