package gamefleet.spoke.config;

import gamefleet.core.Threads;
import gamefleet.http.HttpServer;
import gamefleet.http.RouterHandler;
import gamefleet.security.AuthFailureThrottle;
import gamefleet.security.AuthGate;
import gamefleet.security.RequestSigner;
import gamefleet.security.SecurityAudit;
import gamefleet.spoke.HubAnnouncer;
import gamefleet.spoke.api.CommandController;
import gamefleet.spoke.api.StatusController;
import gamefleet.spoke.api.TelemetryController;
import gamefleet.spoke.exec.CommandExecutor;
import gamefleet.spoke.exec.ScriptRunner;
import gamefleet.spoke.host.HostProbe;
import gamefleet.spoke.host.LocalHostProbe;
import gamefleet.spoke.logs.LogTailWebSocketHandler;
import gamefleet.spoke.server.AgentIdentity;
import gamefleet.spoke.server.AgentRequestGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Manual dependency injection container for the spoke agent.
 */
public final class AgentDependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentDependencies.class);

    private final AgentConfig config;
    private final AuthGate authGate;
    private final CommandExecutor executor;
    private final ScheduledExecutorService tailScheduler =
            Executors.newSingleThreadScheduledExecutor(Threads.daemon("gamefleet-log-tail"));
    private final HubAnnouncer announcer;
    private final RouterHandler routerHandler;
    private HttpServer server;

    private AgentDependencies(AgentConfig config, Clock clock, HostProbe host) {
        this.config = config;
        log.info("Initializing agent with config: {}", config);
        if (config.hubIp() == null || config.hubIp().isBlank()) {
            log.warn("HUB_IP not set; signed calls will be accepted from any address");
        }

        this.authGate = new AuthGate(null,
                new AgentIdentity(config.spokeId(), config.apiKeyHash(), config.hubIp()),
                new AuthFailureThrottle(config.authMaxFailures(), config.authFailureWindow(), 1024, clock),
                new SecurityAudit(), clock, config.maxClockSkew(), null);

        this.executor = new CommandExecutor(
                new ScriptRunner(config.lgsmHome(), config.executionTimeout()),
                config.allowedActions(), config.finishedCommandRetention());
        this.announcer = new HubAnnouncer(HttpClient.newHttpClient(), new RequestSigner(clock),
                RouterHandler.mapper(), Duration.ofSeconds(5), Duration.ofSeconds(10));

        this.routerHandler = new RouterHandler(new AgentRequestGuard(authGate))
                .registerController(new StatusController(host))
                .registerController(new TelemetryController(host))
                .registerController(new CommandController(executor));
    }

    public static AgentDependencies create(AgentConfig config) {
        return new AgentDependencies(config, Clock.systemUTC(), new LocalHostProbe(config.lgsmHome().toFile()));
    }

    public static AgentDependencies create(AgentConfig config, Clock clock, HostProbe host) {
        return new AgentDependencies(config, clock, host);
    }

    /**
     * Bind the server.
     *
     * @return the bound port
     */
    public synchronized int start() throws InterruptedException {
        server = new HttpServer("Spoke agent", config.host(), config.port(), routerHandler,
                () -> new LogTailWebSocketHandler(authGate, config.lgsmHome(), config.logTailInitialLines(),
                        config.logPollInterval(), tailScheduler));
        return server.start();
    }

    public CompletableFuture<Boolean> announce(int port) {
        return announcer.announce(config.hubUrl(), config.spokeId(), config.apiKeyHash(), port);
    }

    public void awaitTermination() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    public AgentConfig config() {
        return config;
    }

    public CommandExecutor executor() {
        return executor;
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop();
            server = null;
        }
        tailScheduler.shutdownNow();
        executor.close();
        log.info("Agent stopped");
    }
}
