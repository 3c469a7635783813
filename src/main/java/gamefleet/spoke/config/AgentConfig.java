package gamefleet.spoke.config;

import gamefleet.security.ApiKeys;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration holder for the spoke agent.
 * Defaults, then an optional INI file ({@code [agent]} section), then the
 * environment written by the installer ({@code API_KEY}, {@code SPOKE_ID}, ...).
 *
 * The API key itself is never kept; only its SHA-256 hash.
 */
public final class AgentConfig {

    public static final Set<String> DEFAULT_ACTIONS =
            Set.of("start", "stop", "restart", "update", "backup", "monitor", "details");

    private String apiKeyHash = null;
    private String spokeId = null;
    private String host = "0.0.0.0";
    private int port = 49950;
    private String hubIp = null;
    private String hubUrl = null;
    private Path lgsmHome = Path.of(System.getProperty("user.home", "."));

    private Set<String> allowedActions = DEFAULT_ACTIONS;
    private Duration executionTimeout = Duration.ofMinutes(30);
    private int finishedCommandRetention = 256;

    private int logTailInitialLines = 50;
    private Duration logPollInterval = Duration.ofMillis(250);

    private Duration maxClockSkew = Duration.ofMinutes(5);
    private int authMaxFailures = 10;
    private Duration authFailureWindow = Duration.ofMinutes(5);

    private AgentConfig() {
    }

    public static AgentConfig defaults() {
        return new AgentConfig();
    }

    public static AgentConfig load(Path iniFile) throws IOException {
        AgentConfig config = new AgentConfig();
        if (iniFile != null && Files.isRegularFile(iniFile)) {
            config.applyIni(new Ini(iniFile.toFile()));
        }
        config.applyEnv(System.getenv());
        return config;
    }

    void applyIni(Ini ini) {
        Profile.Section agent = ini.get("agent");
        if (agent == null) {
            return;
        }
        String key = agent.get("api_key");
        if (key != null && !key.isBlank()) {
            apiKeyHash = ApiKeys.hash(key.trim());
        }
        spokeId = str(agent, "spoke_id", spokeId);
        host = str(agent, "host", host);
        port = integer(agent, "port", port);
        hubIp = str(agent, "hub_ip", hubIp);
        hubUrl = str(agent, "hub_url", hubUrl);
        String home = str(agent, "lgsm_home", null);
        if (home != null) {
            lgsmHome = Path.of(home);
        }
        String actions = str(agent, "allowed_actions", null);
        if (actions != null) {
            allowedActions = parseActions(actions);
        }
        executionTimeout = duration(agent, "execution_timeout", executionTimeout);
        logTailInitialLines = integer(agent, "log_tail_lines", logTailInitialLines);
        logPollInterval = duration(agent, "log_poll_interval", logPollInterval);
        maxClockSkew = duration(agent, "max_clock_skew", maxClockSkew);
    }

    void applyEnv(Map<String, String> env) {
        String key = env.get("API_KEY");
        if (key != null && !key.isBlank()) {
            apiKeyHash = ApiKeys.hash(key.trim());
        }
        spokeId = env(env, "SPOKE_ID", spokeId, Function.identity());
        port = env(env, "PORT", port, Integer::parseInt);
        hubIp = env(env, "HUB_IP", hubIp, Function.identity());
        hubUrl = env(env, "HUB_URL", hubUrl, Function.identity());
        lgsmHome = env(env, "LGSM_HOME", lgsmHome, Path::of);
    }

    /**
     * @throws IllegalStateException when no API key is configured
     */
    public AgentConfig validate() {
        if (apiKeyHash == null) {
            throw new IllegalStateException("API_KEY is required");
        }
        if (allowedActions.isEmpty()) {
            throw new IllegalStateException("allowed actions must not be empty");
        }
        return this;
    }

    static Set<String> parseActions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // Getters
    public String apiKeyHash() {
        return apiKeyHash;
    }

    /** Id assigned by the hub at registration, or null when the installer did not record it. */
    public String spokeId() {
        return spokeId;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String hubIp() {
        return hubIp;
    }

    public String hubUrl() {
        return hubUrl;
    }

    public Path lgsmHome() {
        return lgsmHome;
    }

    public Set<String> allowedActions() {
        return allowedActions;
    }

    public Duration executionTimeout() {
        return executionTimeout;
    }

    public int finishedCommandRetention() {
        return finishedCommandRetention;
    }

    public int logTailInitialLines() {
        return logTailInitialLines;
    }

    public Duration logPollInterval() {
        return logPollInterval;
    }

    public Duration maxClockSkew() {
        return maxClockSkew;
    }

    public int authMaxFailures() {
        return authMaxFailures;
    }

    public Duration authFailureWindow() {
        return authFailureWindow;
    }

    // Setters for testing
    public AgentConfig withApiKey(String apiKey) {
        this.apiKeyHash = ApiKeys.hash(apiKey);
        return this;
    }

    public AgentConfig withSpokeId(String spokeId) {
        this.spokeId = spokeId;
        return this;
    }

    public AgentConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public AgentConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public AgentConfig withHubIp(String hubIp) {
        this.hubIp = hubIp;
        return this;
    }

    public AgentConfig withHubUrl(String hubUrl) {
        this.hubUrl = hubUrl;
        return this;
    }

    public AgentConfig withLgsmHome(Path lgsmHome) {
        this.lgsmHome = lgsmHome;
        return this;
    }

    public AgentConfig withAllowedActions(Set<String> actions) {
        this.allowedActions = Set.copyOf(actions);
        return this;
    }

    public AgentConfig withExecutionTimeout(Duration timeout) {
        this.executionTimeout = timeout;
        return this;
    }

    public AgentConfig withFinishedCommandRetention(int retention) {
        this.finishedCommandRetention = retention;
        return this;
    }

    public AgentConfig withLogTailInitialLines(int lines) {
        this.logTailInitialLines = lines;
        return this;
    }

    public AgentConfig withLogPollInterval(Duration interval) {
        this.logPollInterval = interval;
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
        return "AgentConfig{" +
                "spokeId='" + spokeId + '\'' +
                ", port=" + port +
                ", hubIp='" + hubIp + '\'' +
                ", lgsmHome=" + lgsmHome +
                ", allowedActions=" + allowedActions +
                '}';
    }
}
