package gamefleet.hub.server;

import gamefleet.http.RequestGuard;
import gamefleet.http.SignedCallHeaders;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.AuthGate;
import gamefleet.security.Principal;
import gamefleet.security.SpokeIdentity;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpRequest;

import java.util.Set;

/**
 * Picks the credential scheme by path:
 * <ul>
 *   <li>{@code /api/v1/auth/login}, {@code /api/v1/health}: public</li>
 *   <li>{@code /internal/v1/provision/*}: provisioning token header</li>
 *   <li>{@code /internal/v1/*}: signed spoke call</li>
 *   <li>everything else: dashboard bearer token</li>
 * </ul>
 */
public final class HubRequestGuard implements RequestGuard {

    public static final String PROVISIONING_HEADER = "X-Provisioning-Token";

    private static final Set<String> PUBLIC_PATHS = Set.of("/api/v1/auth/login", "/api/v1/health");

    private final AuthGate gate;

    public HubRequestGuard(AuthGate gate) {
        this.gate = gate;
    }

    @Override
    public Principal authorize(HttpRequest request, String path, String sourceIp) {
        if (PUBLIC_PATHS.contains(path)) {
            return null;
        }
        if (path.startsWith("/internal/v1/provision/")) {
            return gate.authenticateProvisioning(request.headers().get(PROVISIONING_HEADER), sourceIp);
        }
        if (path.startsWith("/internal/v1/")) {
            SpokeIdentity identity = gate.authenticateSpokeCall(SignedCallHeaders.from(request, path), sourceIp);
            return Principal.spoke(identity.spokeId());
        }
        return gate.authenticateDashboard(bearerToken(request), sourceIp);
    }

    /**
     * @throws AuthException UNAUTHENTICATED when the header is missing or not a bearer token
     */
    static String bearerToken(HttpRequest request) {
        String header = request.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "missing bearer token");
        }
        return header.substring(7).trim();
    }
}
