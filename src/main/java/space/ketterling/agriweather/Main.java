/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for the agricultural weather engine.
*
* Loads configuration, opens the database pool, builds the engine components,
* rebuilds the location index from the store, starts the evaluation scheduler
* and the API server, and handles a graceful shutdown.
*/

package space.ketterling.agriweather;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.agriweather.api.ApiServer;
import space.ketterling.agriweather.config.AppConfig;
import space.ketterling.agriweather.db.Database;
import space.ketterling.agriweather.db.JdbcWeatherStore;
import space.ketterling.agriweather.engine.EngineWiring;
import space.ketterling.agriweather.error.WeatherEngineException;
import space.ketterling.agriweather.jobs.EvaluationScheduler;

import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = ApiServer.defaultObjectMapper();

        HikariDataSource ds = Database.createDataSource(cfg);
        JdbcWeatherStore store = new JdbcWeatherStore(ds);
        Clock clock = Clock.system(cfg.clockZoneId());
        EngineWiring wiring = EngineWiring.build(cfg, store, clock);

        // index must exist before the API answers nearby queries
        MDC.put("job", "startup-index");
        try {
            int n = wiring.engine().rebuildIndex();
            log.info("Indexed {} locations", n);
        } catch (WeatherEngineException e) {
            log.error("Initial location index build failed; will retry on schedule", e);
        } finally {
            MDC.remove("job");
        }

        EvaluationScheduler scheduler = new EvaluationScheduler(cfg, wiring.engine());
        scheduler.start();

        ApiServer api = new ApiServer(cfg.apiPort(), om, wiring.engine());
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                wiring.close();
                ds.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
