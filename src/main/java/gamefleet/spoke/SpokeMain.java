package gamefleet.spoke;

import gamefleet.spoke.config.AgentConfig;
import gamefleet.spoke.config.AgentDependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Spoke agent entry point.
 *
 * Usage: {@code java gamefleet.spoke.SpokeMain [agent.ini]}
 */
public final class SpokeMain {

    private static final Logger log = LoggerFactory.getLogger(SpokeMain.class);

    private SpokeMain() {
    }

    public static void main(String[] args) {
        Path iniFile = Path.of(args.length > 0 ? args[0] : "agent.ini");
        AgentDependencies deps;
        try {
            deps = AgentDependencies.create(AgentConfig.load(iniFile).validate());
        } catch (Exception e) {
            log.error("Agent failed to initialize: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "gamefleet-shutdown"));

        try {
            int port = deps.start();
            deps.announce(port);
            deps.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Agent failed to start", e);
            deps.close();
            System.exit(1);
        }
    }
}
