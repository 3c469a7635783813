package gamefleet.hub.api.internal.v1;

import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.hub.heartbeat.HeartbeatMonitor;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.Principal;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Spoke boot announcement: triggers an immediate heartbeat instead of waiting for the next tick.
 * POST /internal/v1/spokes/{id}/announce (signed spoke call)
 */
public class AnnounceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AnnounceController.class);

    static final PathPattern ANNOUNCE = PathPattern.of("/internal/v1/spokes/{id}/announce");

    private final HeartbeatMonitor monitor;

    public AnnounceController(HeartbeatMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && ANNOUNCE.matches(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        String spokeId = ANNOUNCE.variable(request.path(), "id");
        Principal caller = request.principal();
        if (caller == null || !caller.equals(Principal.spoke(spokeId))) {
            throw new AuthException(AuthFailure.UNAUTHORIZED, "spoke may only announce itself");
        }
        boolean polled = monitor.pollNow(spokeId);
        log.info("Spoke {} announced from {}", spokeId, request.sourceIp());
        return ControllerResponse.accepted(Map.of("accepted", true, "polling", polled));
    }
}
