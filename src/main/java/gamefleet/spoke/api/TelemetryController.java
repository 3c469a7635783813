package gamefleet.spoke.api;

import gamefleet.http.Controller;
import gamefleet.http.RequestContext;
import gamefleet.spoke.host.HostProbe;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /v1/telemetry
 */
public class TelemetryController implements Controller {

    private final HostProbe host;

    public TelemetryController(HostProbe host) {
        this.host = host;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/v1/telemetry".equals(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        return ControllerResponse.json(host.telemetry());
    }
}
