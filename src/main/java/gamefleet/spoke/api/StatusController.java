package gamefleet.spoke.api;

import gamefleet.http.Controller;
import gamefleet.http.RequestContext;
import gamefleet.protocol.StatusReport;
import gamefleet.spoke.host.HostProbe;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Liveness probe answered to the hub's heartbeat.
 * GET /v1/status
 */
public class StatusController implements Controller {

    private final HostProbe host;

    public StatusController(HostProbe host) {
        this.host = host;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/v1/status".equals(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        return ControllerResponse.json(new StatusReport("online", host.sessions(), host.telemetry()));
    }
}
