package gamefleet.spoke.server;

import gamefleet.http.RequestGuard;
import gamefleet.http.SignedCallHeaders;
import gamefleet.security.AuthGate;
import gamefleet.security.Principal;
import gamefleet.security.SpokeIdentity;
import io.netty.handler.codec.http.HttpRequest;

/**
 * Every agent endpoint requires a signed call from the hub.
 */
public final class AgentRequestGuard implements RequestGuard {

    private final AuthGate gate;

    public AgentRequestGuard(AuthGate gate) {
        this.gate = gate;
    }

    @Override
    public Principal authorize(HttpRequest request, String path, String sourceIp) {
        SpokeIdentity identity = gate.authenticateSpokeCall(SignedCallHeaders.from(request, path), sourceIp);
        return Principal.spoke(identity.spokeId());
    }
}
