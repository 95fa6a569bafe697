package fr.lapetina.aigateway;

import fr.lapetina.aigateway.api.HttpServer;
import fr.lapetina.aigateway.infrastructure.config.ConfigLoader;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AI provider gateway.
 */
public class GatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    private final RouterFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public GatewayApplication(String configPath) throws Exception {
        log.info("Starting AI gateway...");

        this.factory = RouterFactory.create(configPath).start();

        GatewayConfig.ServerConfig serverConfig = factory.getConfig().getServer();
        this.httpServer = serverConfig.isEnabled()
                ? new HttpServer(serverConfig, factory.getRouter(), factory.getMetricsRegistry(), factory.getObjectMapper())
                : null;

        log.info("AI gateway initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("AI gateway started on port {}", httpServer.getPort());
        } else {
            log.info("AI gateway started without HTTP server");
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RouterFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down AI gateway...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("AI gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : ConfigLoader.DEFAULT_CONFIG;

        try {
            GatewayApplication app = new GatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start AI gateway", e);
            System.exit(1);
        }
    }
}
