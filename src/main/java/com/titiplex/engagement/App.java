package com.titiplex.engagement;

import com.titiplex.engagement.core.alert.AlertSweepService;
import com.titiplex.engagement.core.config.SweepState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Démarre le contexte, initialise la base et lance un balayage des alertes contrats.
 * Avec {@code app.alerts.watch=true}, reste actif et relance le balayage périodiquement.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .run(args);
        AlertSweepService sweep = context.getBean(AlertSweepService.class);

        boolean watch = context.getEnvironment().getProperty("app.alerts.watch", Boolean.class, false);
        if (watch) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                sweep.stop();
                context.close();
            }, "shutdown"));
            sweep.start();
            Thread.currentThread().join();
            return;
        }

        SweepState state = sweep.runOnce();
        log.info("Balayage du {}: {} contrat(s) en alerte, {} tâche(s) ajoutée(s)",
                state.date(), state.alerted(), state.todosAdded());
        context.close();
    }
}
