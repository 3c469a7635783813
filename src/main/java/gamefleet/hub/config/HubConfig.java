package gamefleet.hub.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration holder for hub settings.
 * All settings have sensible defaults; an optional INI file and then
 * {@code GAMEFLEET_*} environment variables override them.
 */
public final class HubConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/gamefleet;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Security settings
    private String tokenSecret = null; // generated per process when unset
    private Duration tokenTtl = Duration.ofHours(24);
    private String adminUsername = "admin";
    private String adminPassword = null; // generated and logged once when unset
    private String provisioningToken = null; // installer registration disabled when unset
    private int passwordIterations = 120_000;
    private int authMaxFailures = 5;
    private Duration authFailureWindow = Duration.ofMinutes(15);
    private int authTrackerCapacity = 10_000;
    private Duration maxClockSkew = Duration.ofMinutes(5);

    // Heartbeat settings
    private Duration heartbeatInterval = Duration.ofSeconds(60);
    private Duration heartbeatJitter = Duration.ofSeconds(5);
    private Duration heartbeatTimeout = Duration.ofSeconds(5);
    private int degradedThreshold = 2;
    private int offlineThreshold = 3;
    private Duration graceWindow = Duration.ofMinutes(3);
    private Duration graceSweepInterval = Duration.ofSeconds(30);
    private int heartbeatHistorySize = 30;

    // Outbound / command settings
    private int outboundPoolSize = 16;
    private Duration commandAckTimeout = Duration.ofSeconds(10);
    private Duration commandPollInterval = Duration.ofSeconds(2);
    private Duration commandExecutionTimeout = Duration.ofMinutes(15);
    private boolean allowDispatchToDegraded = true;

    // Log relay settings
    private int logReplayLines = 100;
    private int logSubscriberBuffer = 1000;
    private int logDeliveryThreads = 4;

    // Alert settings
    private Duration webhookTimeout = Duration.ofSeconds(5);
    private int eventQueueCapacity = 1024;

    private HubConfig() {
    }

    public static HubConfig defaults() {
        return new HubConfig();
    }

    /**
     * Defaults, then the INI file when it exists, then environment variables.
     */
    public static HubConfig load(Path iniFile) throws IOException {
        HubConfig config = new HubConfig();
        if (iniFile != null && Files.isRegularFile(iniFile)) {
            config.applyIni(new Ini(iniFile.toFile()));
        }
        config.applyEnv(System.getenv());
        return config;
    }

    public static HubConfig fromEnv() {
        HubConfig config = new HubConfig();
        config.applyEnv(System.getenv());
        return config;
    }

    void applyIni(Ini ini) {
        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = str(server, "host", serverHost);
            serverPort = integer(server, "port", serverPort);
        }
        Profile.Section database = ini.get("database");
        if (database != null) {
            databaseUrl = str(database, "url", databaseUrl);
            databasePoolSize = integer(database, "pool_size", databasePoolSize);
        }
        Profile.Section security = ini.get("security");
        if (security != null) {
            tokenSecret = str(security, "token_secret", tokenSecret);
            tokenTtl = duration(security, "token_ttl", tokenTtl);
            adminUsername = str(security, "admin_username", adminUsername);
            adminPassword = str(security, "admin_password", adminPassword);
            provisioningToken = str(security, "provisioning_token", provisioningToken);
            passwordIterations = integer(security, "password_iterations", passwordIterations);
            authMaxFailures = integer(security, "max_failures", authMaxFailures);
            authFailureWindow = duration(security, "failure_window", authFailureWindow);
            maxClockSkew = duration(security, "max_clock_skew", maxClockSkew);
        }
        Profile.Section heartbeat = ini.get("heartbeat");
        if (heartbeat != null) {
            heartbeatInterval = duration(heartbeat, "interval", heartbeatInterval);
            heartbeatJitter = duration(heartbeat, "jitter", heartbeatJitter);
            heartbeatTimeout = duration(heartbeat, "timeout", heartbeatTimeout);
            degradedThreshold = integer(heartbeat, "degraded_after", degradedThreshold);
            offlineThreshold = integer(heartbeat, "offline_after", offlineThreshold);
            graceWindow = duration(heartbeat, "grace_window", graceWindow);
            heartbeatHistorySize = integer(heartbeat, "history_size", heartbeatHistorySize);
        }
        Profile.Section commands = ini.get("commands");
        if (commands != null) {
            outboundPoolSize = integer(commands, "outbound_pool_size", outboundPoolSize);
            commandAckTimeout = duration(commands, "ack_timeout", commandAckTimeout);
            commandPollInterval = duration(commands, "poll_interval", commandPollInterval);
            commandExecutionTimeout = duration(commands, "execution_timeout", commandExecutionTimeout);
            allowDispatchToDegraded = bool(commands, "allow_degraded", allowDispatchToDegraded);
        }
        Profile.Section logs = ini.get("logs");
        if (logs != null) {
            logReplayLines = integer(logs, "replay_lines", logReplayLines);
            logSubscriberBuffer = integer(logs, "subscriber_buffer", logSubscriberBuffer);
        }
        Profile.Section alerts = ini.get("alerts");
        if (alerts != null) {
            webhookTimeout = duration(alerts, "webhook_timeout", webhookTimeout);
            eventQueueCapacity = integer(alerts, "queue_capacity", eventQueueCapacity);
        }
    }

    void applyEnv(Map<String, String> env) {
        databaseUrl = env(env, "GAMEFLEET_DB_URL", databaseUrl, Function.identity());
        serverPort = env(env, "GAMEFLEET_PORT", serverPort, Integer::parseInt);
        serverHost = env(env, "GAMEFLEET_HOST", serverHost, Function.identity());
        tokenSecret = env(env, "GAMEFLEET_SECRET_KEY", tokenSecret, Function.identity());
        adminPassword = env(env, "GAMEFLEET_ADMIN_PASSWORD", adminPassword, Function.identity());
        provisioningToken = env(env, "GAMEFLEET_PROVISIONING_TOKEN", provisioningToken, Function.identity());
        heartbeatInterval = env(env, "GAMEFLEET_HEARTBEAT_SECONDS", heartbeatInterval,
                v -> Duration.ofSeconds(Long.parseLong(v)));
        degradedThreshold = env(env, "GAMEFLEET_DEGRADED_AFTER", degradedThreshold, Integer::parseInt);
        offlineThreshold = env(env, "GAMEFLEET_OFFLINE_AFTER", offlineThreshold, Integer::parseInt);
        allowDispatchToDegraded = env(env, "GAMEFLEET_ALLOW_DEGRADED_DISPATCH", allowDispatchToDegraded,
                Boolean::parseBoolean);
    }

    /**
     * @throws IllegalStateException when thresholds or timeouts contradict each other
     */
    public HubConfig validate() {
        if (degradedThreshold < 1) {
            throw new IllegalStateException("degraded threshold must be at least 1");
        }
        if (offlineThreshold <= degradedThreshold) {
            throw new IllegalStateException("offline threshold (" + offlineThreshold
                    + ") must exceed degraded threshold (" + degradedThreshold + ")");
        }
        if (heartbeatTimeout.compareTo(heartbeatInterval) >= 0) {
            throw new IllegalStateException("heartbeat timeout must be shorter than the interval");
        }
        if (outboundPoolSize < 1) {
            throw new IllegalStateException("outbound pool size must be positive");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String tokenSecret() {
        return tokenSecret;
    }

    public Duration tokenTtl() {
        return tokenTtl;
    }

    public String adminUsername() {
        return adminUsername;
    }

    public String adminPassword() {
        return adminPassword;
    }

    public String provisioningToken() {
        return provisioningToken;
    }

    public int passwordIterations() {
        return passwordIterations;
    }

    public int authMaxFailures() {
        return authMaxFailures;
    }

    public Duration authFailureWindow() {
        return authFailureWindow;
    }

    public int authTrackerCapacity() {
        return authTrackerCapacity;
    }

    public Duration maxClockSkew() {
        return maxClockSkew;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration heartbeatJitter() {
        return heartbeatJitter;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public int degradedThreshold() {
        return degradedThreshold;
    }

    public int offlineThreshold() {
        return offlineThreshold;
    }

    public Duration graceWindow() {
        return graceWindow;
    }

    public Duration graceSweepInterval() {
        return graceSweepInterval;
    }

    public int heartbeatHistorySize() {
        return heartbeatHistorySize;
    }

    public int outboundPoolSize() {
        return outboundPoolSize;
    }

    public Duration commandAckTimeout() {
        return commandAckTimeout;
    }

    public Duration commandPollInterval() {
        return commandPollInterval;
    }

    public Duration commandExecutionTimeout() {
        return commandExecutionTimeout;
    }

    public boolean allowDispatchToDegraded() {
        return allowDispatchToDegraded;
    }

    public int logReplayLines() {
        return logReplayLines;
    }

    public int logSubscriberBuffer() {
        return logSubscriberBuffer;
    }

    public int logDeliveryThreads() {
        return logDeliveryThreads;
    }

    public Duration webhookTimeout() {
        return webhookTimeout;
    }

    public int eventQueueCapacity() {
        return eventQueueCapacity;
    }

    // Fluent setters for testing/customization
    public HubConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public HubConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public HubConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public HubConfig withTokenSecret(String secret) {
        this.tokenSecret = secret;
        return this;
    }

    public HubConfig withTokenTtl(Duration ttl) {
        this.tokenTtl = ttl;
        return this;
    }

    public HubConfig withAdminPassword(String password) {
        this.adminPassword = password;
        return this;
    }

    public HubConfig withProvisioningToken(String token) {
        this.provisioningToken = token;
        return this;
    }

    public HubConfig withPasswordIterations(int iterations) {
        this.passwordIterations = iterations;
        return this;
    }

    public HubConfig withAuthMaxFailures(int maxFailures) {
        this.authMaxFailures = maxFailures;
        return this;
    }

    public HubConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public HubConfig withHeartbeatJitter(Duration jitter) {
        this.heartbeatJitter = jitter;
        return this;
    }

    public HubConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public HubConfig withThresholds(int degradedAfter, int offlineAfter) {
        this.degradedThreshold = degradedAfter;
        this.offlineThreshold = offlineAfter;
        return this;
    }

    public HubConfig withGraceWindow(Duration window) {
        this.graceWindow = window;
        return this;
    }

    public HubConfig withGraceSweepInterval(Duration interval) {
        this.graceSweepInterval = interval;
        return this;
    }

    public HubConfig withCommandAckTimeout(Duration timeout) {
        this.commandAckTimeout = timeout;
        return this;
    }

    public HubConfig withCommandPollInterval(Duration interval) {
        this.commandPollInterval = interval;
        return this;
    }

    public HubConfig withCommandExecutionTimeout(Duration timeout) {
        this.commandExecutionTimeout = timeout;
        return this;
    }

    public HubConfig withAllowDispatchToDegraded(boolean allow) {
        this.allowDispatchToDegraded = allow;
        return this;
    }

    public HubConfig withLogReplayLines(int lines) {
        this.logReplayLines = lines;
        return this;
    }

    public HubConfig withLogSubscriberBuffer(int lines) {
        this.logSubscriberBuffer = lines;
        return this;
    }

    private static String str(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int integer(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private static boolean bool(Profile.Section section, String key, boolean fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    /** Durations in INI files use ISO-8601 ({@code PT30S}) or plain seconds. */
    private static Duration duration(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        return trimmed.startsWith("P") || trimmed.startsWith("p")
                ? Duration.parse(trimmed)
                : Duration.ofSeconds(Long.parseLong(trimmed));
    }

    private static <T> T env(Map<String, String> env, String name, T fallback, Function<String, T> parser) {
        String value = env.get(name);
        return value == null || value.isBlank() ? fallback : parser.apply(value.trim());
    }

    @Override
    public String toString() {
        return "HubConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatInterval=" + heartbeatInterval +
                ", thresholds=" + degradedThreshold + "/" + offlineThreshold +
                ", allowDegradedDispatch=" + allowDispatchToDegraded +
                ", provisioningEnabled=" + (provisioningToken != null) +
                '}';
    }
}
