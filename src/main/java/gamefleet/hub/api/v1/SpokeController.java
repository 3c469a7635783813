package gamefleet.hub.api.v1;

import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.HeartbeatResponse;
import gamefleet.hub.api.v1.dto.RegisterSpokeRequest;
import gamefleet.hub.api.v1.dto.RegisterSpokeResponse;
import gamefleet.hub.api.v1.dto.SpokeResponse;
import gamefleet.hub.api.v1.dto.TransitionResponse;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.registry.RegistrationResult;
import gamefleet.hub.repository.TransitionRepository;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import gamefleet.security.SecurityAudit;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * Fleet membership and liveness history.
 * GET    /api/v1/spokes                    - list spokes in registration order
 * POST   /api/v1/spokes                    - register (ADMIN)
 * GET    /api/v1/spokes/{id}               - one spoke
 * DELETE /api/v1/spokes/{id}               - remove (ADMIN)
 * GET    /api/v1/spokes/{id}/heartbeats    - recent heartbeat samples
 * GET    /api/v1/spokes/{id}/transitions   - status history of one spoke
 * GET    /api/v1/transitions               - fleet status history
 */
public class SpokeController implements Controller {

    static final PathPattern SPOKES = PathPattern.of("/api/v1/spokes");
    static final PathPattern SPOKE = PathPattern.of("/api/v1/spokes/{id}");
    static final PathPattern HEARTBEATS = PathPattern.of("/api/v1/spokes/{id}/heartbeats");
    static final PathPattern SPOKE_TRANSITIONS = PathPattern.of("/api/v1/spokes/{id}/transitions");
    static final PathPattern TRANSITIONS = PathPattern.of("/api/v1/transitions");

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final FleetRegistry registry;
    private final TransitionRepository transitions;
    private final SecurityAudit audit;

    public SpokeController(FleetRegistry registry, TransitionRepository transitions, SecurityAudit audit) {
        this.registry = registry;
        this.transitions = transitions;
        this.audit = audit;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return SPOKES.matches(path) || SPOKE.matches(path) || HEARTBEATS.matches(path)
                    || SPOKE_TRANSITIONS.matches(path) || TRANSITIONS.matches(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return SPOKES.matches(path);
        }
        return method.equals(HttpMethod.DELETE) && SPOKE.matches(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        String path = request.path();
        HttpMethod method = request.method();

        if (SPOKES.matches(path)) {
            return method.equals(HttpMethod.POST) ? register(request) : list(request);
        }
        if (TRANSITIONS.matches(path)) {
            request.requireRole(Role.VIEWER);
            int limit = request.intQuery("limit", DEFAULT_LIMIT, MAX_LIMIT);
            return ControllerResponse.json(Map.of("transitions",
                    transitions.findRecent(limit).stream().map(TransitionResponse::from).toList()));
        }
        if (HEARTBEATS.matches(path)) {
            request.requireRole(Role.VIEWER);
            String id = HEARTBEATS.variable(path, "id");
            return ControllerResponse.json(Map.of("heartbeats",
                    registry.recentHeartbeats(id).stream().map(HeartbeatResponse::from).toList()));
        }
        if (SPOKE_TRANSITIONS.matches(path)) {
            request.requireRole(Role.VIEWER);
            String id = SPOKE_TRANSITIONS.variable(path, "id");
            registry.get(id);
            int limit = request.intQuery("limit", DEFAULT_LIMIT, MAX_LIMIT);
            return ControllerResponse.json(Map.of("transitions",
                    transitions.findBySpoke(id, limit).stream().map(TransitionResponse::from).toList()));
        }

        String id = SPOKE.variable(path, "id");
        if (method.equals(HttpMethod.DELETE)) {
            Principal admin = request.requireRole(Role.ADMIN);
            registry.remove(id);
            audit.adminAction(admin.name(), "remove-spoke", id);
            return ControllerResponse.ok();
        }
        request.requireRole(Role.VIEWER);
        return ControllerResponse.json(SpokeResponse.from(registry.get(id)));
    }

    private ControllerResponse list(RequestContext request) {
        request.requireRole(Role.VIEWER);
        return ControllerResponse.json(Map.of("spokes",
                registry.list().stream().map(SpokeResponse::from).toList()));
    }

    private ControllerResponse register(RequestContext request) {
        Principal admin = request.requireRole(Role.ADMIN);
        RegisterSpokeRequest body = request.body(RegisterSpokeRequest.class);
        RegistrationResult result = registry.register(body.toRegistration());
        audit.adminAction(admin.name(), result.created() ? "register-spoke" : "re-register-spoke", result.spokeId());
        RegisterSpokeResponse response = RegisterSpokeResponse.from(result);
        return result.created() ? ControllerResponse.created(response) : ControllerResponse.json(response);
    }
}
