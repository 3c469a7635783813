package gamefleet.hub;

import gamefleet.hub.config.Dependencies;
import gamefleet.hub.config.HubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Hub entry point.
 *
 * Usage: {@code java gamefleet.hub.HubMain [gamefleet.ini]}
 */
public final class HubMain {

    private static final Logger log = LoggerFactory.getLogger(HubMain.class);

    private HubMain() {
    }

    public static void main(String[] args) {
        Path iniFile = Path.of(args.length > 0 ? args[0] : "gamefleet.ini");
        Dependencies deps;
        try {
            HubConfig config = HubConfig.load(iniFile).validate();
            deps = Dependencies.create(config);
        } catch (Exception e) {
            log.error("Hub failed to initialize: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
        }, "gamefleet-shutdown"));

        try {
            int port = deps.start();
            log.info("Hub ready on port {}", port);
            deps.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Hub failed to start", e);
            deps.close();
            System.exit(1);
        }
    }
}
