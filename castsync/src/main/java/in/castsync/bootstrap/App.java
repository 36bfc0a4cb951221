package in.castsync.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.castsync.application.port.output.StreamService;
import in.castsync.application.service.ObsStreamDetector;
import in.castsync.application.service.StreamDetectorCallbacks;
import in.castsync.domain.stream.Stream;
import in.castsync.infrastructure.metrics.PrometheusDaemonMetrics;
import in.castsync.infrastructure.metrics.PrometheusMetricsHandler;
import in.castsync.infrastructure.obs.JdkObsWebSocketClient;
import in.castsync.infrastructure.obs.ObsWebSocketClient;
import in.castsync.infrastructure.obs.supervisor.ObsConnectionSupervisor;
import in.castsync.infrastructure.obs.transport.JdkWebSocketTransport;
import in.castsync.infrastructure.persistence.InMemoryStreamService;
import in.castsync.infrastructure.persistence.PostgresStreamService;
import in.castsync.infrastructure.persistence.StreamSchemaMigration;
import in.castsync.transport.http.HealthHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

/**
 * Daemon entry point.
 *
 * Wires the control client, session detector, store, reconnect supervisor and the
 * /health + /metrics HTTP endpoints, then runs until the JVM is asked to stop.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        DaemonConfig config = DaemonConfig.fromEnv();
        String version = version();
        log.info("castsync {} starting: {}", version, config);

        // ═══════════════════════════════════════════════════════════════
        // Metrics + store
        // ═══════════════════════════════════════════════════════════════
        PrometheusDaemonMetrics metrics = new PrometheusDaemonMetrics();

        HikariDataSource dataSource = null;
        StreamService streamService;
        if (config.store() == DaemonConfig.StoreType.POSTGRES) {
            dataSource = createDataSource(config);
            new StreamSchemaMigration(dataSource).migrate();
            streamService = new PostgresStreamService(dataSource, config.dbPoolSize());
            log.info("✓ Postgres stream store ready");
        } else {
            streamService = new InMemoryStreamService();
            log.info("✓ In-memory stream store ready (sessions are lost on restart)");
        }

        // ═══════════════════════════════════════════════════════════════
        // Control client, detector, supervisor
        // ═══════════════════════════════════════════════════════════════
        ObsWebSocketClient client = new JdkObsWebSocketClient(config.obs(),
            new JdkWebSocketTransport(config.obs().handshakeTimeout()), metrics);

        ObsStreamDetector detector = new ObsStreamDetector(client, streamService, new StreamDetectorCallbacks() {
            @Override
            public void onStreamStart(Stream stream) {
                log.info("Session {} live since {}", stream.commonId(), stream.obsStartTime());
            }

            @Override
            public void onStreamStop(Stream stream, Instant endTime) {
                log.info("Session {} finished at {}", stream.commonId(), endTime);
            }
        }, metrics, Clock.systemUTC(), () -> UUID.randomUUID().toString());

        ObsConnectionSupervisor supervisor = new ObsConnectionSupervisor(client, config.reconnectionPolicy(), metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        Undertow server = null;
        if (config.httpEnabled()) {
            RoutingHandler routes = Handlers.routing()
                .get("/health", new HealthHandler(client, detector, supervisor, version, Clock.systemUTC()))
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
            server = Undertow.builder()
                .addHttpListener(config.httpPort(), "0.0.0.0")
                .setHandler(routes)
                .build();
            server.start();
            log.info("✓ HTTP listening on port {} (GET /health, /metrics)", config.httpPort());
        }

        supervisor.start();

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        CountDownLatch done = new CountDownLatch(1);
        Undertow httpServer = server;
        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            supervisor.stop();
            client.close();
            if (httpServer != null) {
                httpServer.stop();
            }
            if (streamService instanceof PostgresStreamService) {
                ((PostgresStreamService) streamService).close();
            }
            if (pool != null) {
                pool.close();
            }
            log.info("Shutdown complete");
            done.countDown();
        }, "castsync-shutdown"));

        done.await();
    }

    private static HikariDataSource createDataSource(DaemonConfig daemonConfig) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(daemonConfig.dbUrl());
        config.setUsername(daemonConfig.dbUser());
        config.setPassword(daemonConfig.dbPass());
        config.setMaximumPoolSize(daemonConfig.dbPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("castsync-hikari");

        log.info("DB: url={}, user={}, pool={}", daemonConfig.dbUrl(), daemonConfig.dbUser(), daemonConfig.dbPoolSize());
        return new HikariDataSource(config);
    }

    private static String version() {
        String version = App.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    private App() {}
}
