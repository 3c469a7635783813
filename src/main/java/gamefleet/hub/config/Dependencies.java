package gamefleet.hub.config;

import gamefleet.core.Threads;
import gamefleet.http.HttpServer;
import gamefleet.http.RouterHandler;
import gamefleet.hub.api.internal.v1.AnnounceController;
import gamefleet.hub.api.internal.v1.ProvisioningController;
import gamefleet.hub.api.v1.AuthController;
import gamefleet.hub.api.v1.CommandController;
import gamefleet.hub.api.v1.HealthController;
import gamefleet.hub.api.v1.SettingsController;
import gamefleet.hub.api.v1.SpokeController;
import gamefleet.hub.api.v1.UserController;
import gamefleet.hub.client.HttpSpokeClient;
import gamefleet.hub.client.SpokeClient;
import gamefleet.hub.dispatch.CommandDispatcher;
import gamefleet.hub.events.TransitionEventBus;
import gamefleet.hub.events.TransitionRecorder;
import gamefleet.hub.events.WebhookAlertNotifier;
import gamefleet.hub.heartbeat.HeartbeatMonitor;
import gamefleet.hub.heartbeat.HeartbeatStateMachine;
import gamefleet.hub.heartbeat.SpokeProbe;
import gamefleet.hub.logs.LogRelay;
import gamefleet.hub.logs.LogUpstreamConnector;
import gamefleet.hub.logs.WebSocketLogUpstreamConnector;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.repository.CommandRepository;
import gamefleet.hub.repository.SettingsRepository;
import gamefleet.hub.repository.SpokeRepository;
import gamefleet.hub.repository.TransitionRepository;
import gamefleet.hub.repository.UserRepository;
import gamefleet.hub.server.HubRequestGuard;
import gamefleet.hub.server.LogStreamWebSocketHandler;
import gamefleet.hub.service.AccountService;
import gamefleet.hub.service.SettingsService;
import gamefleet.hub.store.Database;
import gamefleet.hub.store.JdbcCommandRepository;
import gamefleet.hub.store.JdbcSettingsRepository;
import gamefleet.hub.store.JdbcSpokeRepository;
import gamefleet.hub.store.JdbcTransitionRepository;
import gamefleet.hub.store.JdbcUserRepository;
import gamefleet.security.ApiKeys;
import gamefleet.security.AuthFailureThrottle;
import gamefleet.security.AuthGate;
import gamefleet.security.DashboardTokenService;
import gamefleet.security.PasswordHasher;
import gamefleet.security.RequestSigner;
import gamefleet.security.SecurityAudit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Manual dependency injection container for the hub.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(HubConfig.load(path));
 * int port = deps.start();
 * // ... serve ...
 * deps.close();
 * </pre>
 *
 * Tests may pass their own {@link SpokeClient} and {@link LogUpstreamConnector}.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final HubConfig config;
    private final Clock clock;
    private final Database database;

    // Repositories
    private final SpokeRepository spokeRepository;
    private final CommandRepository commandRepository;
    private final UserRepository userRepository;
    private final SettingsRepository settingsRepository;
    private final TransitionRepository transitionRepository;

    // Security
    private final SecurityAudit audit;
    private final AuthGate authGate;

    // Services
    private final FleetRegistry registry;
    private final ExecutorService outbound;
    private final ExecutorService httpIo;
    private final HttpClient httpClient;
    private final TransitionEventBus eventBus;
    private final HeartbeatMonitor heartbeatMonitor;
    private final CommandDispatcher dispatcher;
    private final LogRelay logRelay;
    private final SettingsService settingsService;
    private final AccountService accountService;

    private final RouterHandler routerHandler;
    private HttpServer server;

    private Dependencies(HubConfig config, Clock clock, SpokeClient spokeClient, LogUpstreamConnector connector) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.outbound = Executors.newFixedThreadPool(config.outboundPoolSize(), Threads.daemon("gamefleet-outbound"));
        // outbound threads block in HttpClient.send, so the client completes exchanges on its own threads
        this.httpIo = Executors.newCachedThreadPool(Threads.daemon("gamefleet-http"));
        this.httpClient = spokeHttpClient(config, httpIo);

        // Repositories
        this.spokeRepository = new JdbcSpokeRepository(database);
        this.commandRepository = new JdbcCommandRepository(database);
        this.userRepository = new JdbcUserRepository(database);
        this.settingsRepository = new JdbcSettingsRepository(database);
        this.transitionRepository = new JdbcTransitionRepository(database);

        // Registry, then the gate that looks spokes up in it
        this.registry = new FleetRegistry(spokeRepository,
                new HeartbeatStateMachine(config.degradedThreshold(), config.offlineThreshold()),
                clock, config.heartbeatHistorySize());
        this.audit = new SecurityAudit();
        this.authGate = new AuthGate(
                new DashboardTokenService(tokenSecret(config), config.tokenTtl(), clock),
                registry,
                new AuthFailureThrottle(config.authMaxFailures(), config.authFailureWindow(),
                        config.authTrackerCapacity(), clock),
                audit, clock, config.maxClockSkew(), config.provisioningToken());

        // Services
        RequestSigner signer = new RequestSigner(clock);
        SpokeClient client = spokeClient != null ? spokeClient
                : new HttpSpokeClient(httpClient, signer, RouterHandler.mapper());
        LogUpstreamConnector upstreams = connector != null ? connector
                : new WebSocketLogUpstreamConnector(httpClient, signer, config.heartbeatTimeout());

        this.settingsService = new SettingsService(settingsRepository);
        this.eventBus = new TransitionEventBus(config.eventQueueCapacity());
        eventBus.subscribe(new TransitionRecorder(transitionRepository));
        eventBus.subscribe(new WebhookAlertNotifier(settingsService, httpClient, RouterHandler.mapper(),
                config.webhookTimeout()));

        this.heartbeatMonitor = new HeartbeatMonitor(registry,
                new SpokeProbe(client, config.heartbeatTimeout(), clock),
                eventBus, outbound, config, clock);
        this.dispatcher = new CommandDispatcher(registry, commandRepository, client, outbound, config, clock);
        this.logRelay = new LogRelay(registry, upstreams, config);
        this.accountService = new AccountService(userRepository,
                new PasswordHasher(config.passwordIterations()), authGate, clock);

        registry.addListener(heartbeatMonitor);
        registry.addListener(dispatcher);
        registry.addListener(logRelay);

        // Controllers
        this.routerHandler = new RouterHandler(new HubRequestGuard(authGate))
                .registerController(new HealthController(database, registry))
                .registerController(new AuthController(accountService))
                .registerController(new UserController(accountService))
                .registerController(new SpokeController(registry, transitionRepository, audit))
                .registerController(new CommandController(dispatcher))
                .registerController(new SettingsController(settingsService, audit))
                .registerController(new ProvisioningController(registry, audit))
                .registerController(new AnnounceController(heartbeatMonitor));

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(HubConfig config) {
        return new Dependencies(config, Clock.systemUTC(), null, null);
    }

    /**
     * Create with substitute outbound clients, for tests.
     */
    public static Dependencies create(HubConfig config, Clock clock,
            SpokeClient spokeClient, LogUpstreamConnector connector) {
        return new Dependencies(config, clock, spokeClient, connector);
    }

    /**
     * Client for spoke calls, webhooks and log upstreams. {@code io} must not be the
     * pool whose threads call {@link HttpClient#send}.
     */
    static HttpClient spokeHttpClient(HubConfig config, Executor io) {
        return HttpClient.newBuilder()
                .connectTimeout(config.heartbeatTimeout())
                .executor(io)
                .build();
    }

    private static String tokenSecret(HubConfig config) {
        if (config.tokenSecret() != null && !config.tokenSecret().isBlank()) {
            return config.tokenSecret();
        }
        log.warn("No token secret configured; dashboard sessions will not survive a restart");
        return ApiKeys.generate();
    }

    /**
     * Restore state, start background work and bind the HTTP server.
     *
     * @return the bound port
     */
    public synchronized int start() throws InterruptedException {
        int restored = registry.loadPersisted();
        log.info("Restored {} spokes from storage", restored);

        accountService.bootstrapAdmin(config.adminUsername(), config.adminPassword())
                .ifPresent(password -> log.warn(
                        "Generated initial password for '{}': {} (change it after first login)",
                        config.adminUsername(), password));

        eventBus.start();
        dispatcher.recover();
        heartbeatMonitor.start();

        server = new HttpServer("Hub", config.serverHost(), config.serverPort(), routerHandler,
                () -> new LogStreamWebSocketHandler(authGate, logRelay));
        return server.start();
    }

    public void awaitTermination() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    // Getters
    public HubConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public FleetRegistry registry() {
        return registry;
    }

    public AuthGate authGate() {
        return authGate;
    }

    public HeartbeatMonitor heartbeatMonitor() {
        return heartbeatMonitor;
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    public LogRelay logRelay() {
        return logRelay;
    }

    public AccountService accountService() {
        return accountService;
    }

    public SettingsService settingsService() {
        return settingsService;
    }

    public TransitionRepository transitionRepository() {
        return transitionRepository;
    }

    public CommandRepository commandRepository() {
        return commandRepository;
    }

    public RouterHandler routerHandler() {
        return routerHandler;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");
        if (server != null) {
            server.stop();
            server = null;
        }
        heartbeatMonitor.close();
        dispatcher.close();
        logRelay.close();
        eventBus.close();
        shutdown(outbound);
        shutdown(httpIo);
        database.close();
        log.info("Dependencies closed");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
