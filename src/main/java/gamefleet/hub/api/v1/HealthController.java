package gamefleet.hub.api.v1;

import gamefleet.http.Controller;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.HealthResponse;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.store.Database;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final Database database;
    private final FleetRegistry registry;

    public HealthController(Database database, FleetRegistry registry) {
        this.database = database;
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }
        Map<String, Integer> spokes = new LinkedHashMap<>();
        spokes.put("total", registry.size());
        for (Map.Entry<SpokeStatus, Integer> e : registry.countByStatus().entrySet()) {
            spokes.put(e.getKey().name().toLowerCase(), e.getValue());
        }
        return ControllerResponse.json(HealthResponse.healthy(formatUptime(), VERSION, spokes));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
