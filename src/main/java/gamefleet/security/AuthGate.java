package gamefleet.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry point for request authentication on both hub and spoke.
 *
 * Dashboard calls present a session token; spoke calls present a signed
 * request and must come from the spoke's allowlisted address when one is set.
 * Every failure counts against the origin in the shared throttle.
 */
public final class AuthGate {

    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);

    private final DashboardTokenService tokens;
    private final IdentityStore identities;
    private final AuthFailureThrottle throttle;
    private final SecurityAudit audit;
    private final Clock clock;
    private final Duration maxClockSkew;
    private final String provisioningToken;

    private final Set<String> allowlistWarned = ConcurrentHashMap.newKeySet();

    public AuthGate(DashboardTokenService tokens,
                    IdentityStore identities,
                    AuthFailureThrottle throttle,
                    SecurityAudit audit,
                    Clock clock,
                    Duration maxClockSkew,
                    String provisioningToken) {
        this.tokens = tokens;
        this.identities = identities;
        this.throttle = throttle;
        this.audit = audit;
        this.clock = clock;
        this.maxClockSkew = maxClockSkew;
        this.provisioningToken = provisioningToken;
    }

    /**
     * Validate a dashboard session token.
     *
     * @throws AuthException UNAUTHENTICATED, or THROTTLED for a blocked origin
     */
    public Principal authenticateDashboard(String token, String origin) {
        ensureNotThrottled(origin, "token");
        if (tokens == null) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "dashboard sessions not enabled");
        }
        try {
            return tokens.verify(token);
        } catch (AuthException e) {
            throttle.recordFailure(origin);
            audit.tokenRejected(origin, e.getMessage());
            throw e;
        }
    }

    /**
     * Validate a signed spoke call.
     *
     * @throws AuthException UNAUTHORIZED for unknown spoke, stale timestamp or bad
     *                       signature; FORBIDDEN_SOURCE_IP for a valid call from a
     *                       non-allowlisted address; THROTTLED for a blocked origin
     */
    public SpokeIdentity authenticateSpokeCall(SignedCall call, String sourceIp) {
        ensureNotThrottled(sourceIp, "spoke-call");
        String claimed = call == null ? null : call.spokeId();

        if (call == null || claimed == null || claimed.isBlank() || call.signature() == null) {
            throw reject(claimed, sourceIp, AuthFailure.UNAUTHORIZED, "missing credentials");
        }

        Optional<SpokeIdentity> found = identities.findIdentity(claimed);
        if (found.isEmpty()) {
            throw reject(claimed, sourceIp, AuthFailure.UNAUTHORIZED, "unknown spoke");
        }
        SpokeIdentity identity = found.get();

        long skew = Math.abs(clock.instant().getEpochSecond() - call.timestamp());
        if (skew > maxClockSkew.toSeconds()) {
            throw reject(claimed, sourceIp, AuthFailure.UNAUTHORIZED, "timestamp outside allowed skew");
        }

        String expected = RequestSigner.signature(identity.apiKeyHash(), call.method(), call.path(),
                claimed, call.timestamp());
        if (!ApiKeys.constantTimeEquals(expected, call.signature().toLowerCase())) {
            throw reject(claimed, sourceIp, AuthFailure.UNAUTHORIZED, "bad signature");
        }

        if (identity.hasAllowlist()) {
            if (!identity.allowedSourceIp().trim().equals(sourceIp)) {
                throw reject(claimed, sourceIp, AuthFailure.FORBIDDEN_SOURCE_IP, "source not allowlisted");
            }
        } else if (allowlistWarned.add(claimed)) {
            log.warn("Spoke {} has no source IP allowlist entry; accepting calls from any address", claimed);
        }

        audit.spokeCallAccepted(claimed, sourceIp);
        return identity;
    }

    /**
     * Validate the installer's provisioning token.
     */
    public Principal authenticateProvisioning(String presented, String origin) {
        ensureNotThrottled(origin, "provision");
        if (provisioningToken == null || provisioningToken.isBlank()) {
            throw new AuthException(AuthFailure.UNAUTHORIZED, "provisioning disabled");
        }
        if (!ApiKeys.constantTimeEquals(provisioningToken, presented)) {
            throttle.recordFailure(origin);
            audit.tokenRejected(origin, "bad provisioning token");
            throw new AuthException(AuthFailure.UNAUTHORIZED, "bad provisioning token");
        }
        return Principal.provisioner();
    }

    /**
     * Throttle check for password logins, which verify credentials elsewhere.
     */
    public void ensureNotThrottled(String origin, String action) {
        if (throttle.isBlocked(origin)) {
            audit.throttled(origin, action);
            throw new AuthException(AuthFailure.THROTTLED, "too many failed attempts");
        }
    }

    public void loginFailed(String username, String origin) {
        throttle.recordFailure(origin);
        audit.loginFailed(username, origin, "bad credentials");
    }

    public void loginSucceeded(String username, String origin) {
        throttle.reset(origin);
        audit.loginSucceeded(username, origin);
    }

    public DashboardTokenService tokens() {
        return tokens;
    }

    public SecurityAudit audit() {
        return audit;
    }

    private AuthException reject(String spokeId, String origin, AuthFailure failure, String reason) {
        throttle.recordFailure(origin);
        audit.spokeCallRejected(spokeId, origin, failure, reason);
        return new AuthException(failure, reason);
    }
}
