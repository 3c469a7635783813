package gamefleet.hub.api.internal.v1;

import gamefleet.http.Controller;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.RegisterSpokeRequest;
import gamefleet.hub.api.v1.dto.RegisterSpokeResponse;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.registry.RegistrationResult;
import gamefleet.security.SecurityAudit;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Installer registration, authenticated by the hub's provisioning token.
 * POST /internal/v1/provision/spokes
 *
 * Without an explicit allowedSourceIp the installer's own address is allowlisted,
 * since the installer runs on the spoke host.
 */
public class ProvisioningController implements Controller {

    static final String PATH = "/internal/v1/provision/spokes";

    private final FleetRegistry registry;
    private final SecurityAudit audit;

    public ProvisioningController(FleetRegistry registry, SecurityAudit audit) {
        this.registry = registry;
        this.audit = audit;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        RegisterSpokeRequest body = request.body(RegisterSpokeRequest.class);
        String allowed = body.allowedSourceIp() == null || body.allowedSourceIp().isBlank()
                ? request.sourceIp()
                : body.allowedSourceIp();
        RegisterSpokeRequest effective = new RegisterSpokeRequest(body.name(), body.address(), body.apiKey(), allowed);

        RegistrationResult result = registry.register(effective.toRegistration());
        audit.adminAction(request.principal().name(), "provision-spoke", result.spokeId() + " from " + request.sourceIp());
        RegisterSpokeResponse response = RegisterSpokeResponse.from(result);
        return result.created() ? ControllerResponse.created(response) : ControllerResponse.json(response);
    }
}
