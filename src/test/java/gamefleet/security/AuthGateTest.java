package gamefleet.security;

import gamefleet.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AuthGateTest {

    private static final String KEY_HASH = ApiKeys.hash("s1-secret-key");

    private MutableClock clock;
    private Map<String, SpokeIdentity> identities;
    private AuthFailureThrottle throttle;
    private DashboardTokenService tokens;
    private AuthGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        identities = new HashMap<>();
        identities.put("s1", new SpokeIdentity("s1", KEY_HASH, "10.0.0.5"));
        identities.put("s2", new SpokeIdentity("s2", KEY_HASH, null));
        throttle = new AuthFailureThrottle(3, Duration.ofMinutes(5), 100, clock);
        tokens = new DashboardTokenService("0123456789abcdef0123", Duration.ofHours(1), clock);
        gate = new AuthGate(tokens, id -> Optional.ofNullable(identities.get(id)), throttle,
                new SecurityAudit(), clock, Duration.ofMinutes(5), "install-token");
    }

    private SignedCall signed(String spokeId, String keyHash, long timestamp) {
        String signature = RequestSigner.signature(keyHash, "GET", "/v1/status", spokeId, timestamp);
        return new SignedCall(spokeId, timestamp, signature, "GET", "/v1/status");
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    @Test
    void acceptsValidCallFromAllowlistedAddress() {
        SpokeIdentity identity = gate.authenticateSpokeCall(signed("s1", KEY_HASH, now()), "10.0.0.5");
        assertEquals("s1", identity.spokeId());
    }

    @Test
    void validCallFromOtherAddressIsForbidden() {
        AuthException e = assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(signed("s1", KEY_HASH, now()), "10.0.0.99"));
        assertEquals(AuthFailure.FORBIDDEN_SOURCE_IP, e.failure());
        assertEquals(403, e.failure().httpStatus());
    }

    @Test
    void spokeWithoutAllowlistAcceptsAnyAddress() {
        assertEquals("s2", gate.authenticateSpokeCall(signed("s2", KEY_HASH, now()), "192.168.1.7").spokeId());
    }

    @Test
    void rejectsWrongKey() {
        AuthException e = assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(signed("s1", ApiKeys.hash("other"), now()), "10.0.0.5"));
        assertEquals(AuthFailure.UNAUTHORIZED, e.failure());
    }

    @Test
    void rejectsUnknownSpokeAndMissingCredentials() {
        assertEquals(AuthFailure.UNAUTHORIZED, assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(signed("ghost", KEY_HASH, now()), "10.0.0.5")).failure());
        assertEquals(AuthFailure.UNAUTHORIZED, assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(null, "10.0.0.5")).failure());
    }

    @Test
    void rejectsTimestampOutsideSkew() {
        long stale = now() - Duration.ofMinutes(6).toSeconds();
        AuthException e = assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(signed("s1", KEY_HASH, stale), "10.0.0.5"));
        assertEquals("timestamp outside allowed skew", e.getMessage());

        long slightlyAhead = now() + 60;
        assertEquals("s1", gate.authenticateSpokeCall(signed("s1", KEY_HASH, slightlyAhead), "10.0.0.5").spokeId());
    }

    @Test
    void signatureCoversThePath() {
        long ts = now();
        String signature = RequestSigner.signature(KEY_HASH, "GET", "/v1/status", "s1", ts);
        SignedCall replayed = new SignedCall("s1", ts, signature, "POST", "/v1/commands");
        assertThrows(AuthException.class, () -> gate.authenticateSpokeCall(replayed, "10.0.0.5"));
    }

    @Test
    void repeatedFailuresThrottleTheOrigin() {
        for (int i = 0; i < 3; i++) {
            assertThrows(AuthException.class,
                    () -> gate.authenticateSpokeCall(signed("s1", "bad", now()), "10.0.0.5"));
        }
        AuthException e = assertThrows(AuthException.class,
                () -> gate.authenticateSpokeCall(signed("s1", KEY_HASH, now()), "10.0.0.5"));
        assertEquals(AuthFailure.THROTTLED, e.failure());

        clock.advance(Duration.ofMinutes(6));
        assertEquals("s1", gate.authenticateSpokeCall(signed("s1", KEY_HASH, now()), "10.0.0.5").spokeId());
    }

    @Test
    void dashboardTokenRoundTripAndExpiry() {
        String token = tokens.issue("ada", Role.ADMIN).token();
        Principal principal = gate.authenticateDashboard(token, "127.0.0.1");
        assertEquals("ada", principal.name());
        assertEquals(Role.ADMIN, principal.role());

        clock.advance(Duration.ofHours(2));
        AuthException e = assertThrows(AuthException.class, () -> gate.authenticateDashboard(token, "127.0.0.1"));
        assertEquals(AuthFailure.UNAUTHENTICATED, e.failure());
    }

    @Test
    void provisioningTokenMustMatch() {
        assertEquals(Role.ADMIN, gate.authenticateProvisioning("install-token", "10.0.0.8").role());
        AuthException e = assertThrows(AuthException.class,
                () -> gate.authenticateProvisioning("guess", "10.0.0.8"));
        assertEquals(AuthFailure.UNAUTHORIZED, e.failure());
    }

    @Test
    void provisioningDisabledWithoutToken() {
        AuthGate noProvisioning = new AuthGate(tokens, id -> Optional.empty(), throttle,
                new SecurityAudit(), clock, Duration.ofMinutes(5), null);
        assertThrows(AuthException.class, () -> noProvisioning.authenticateProvisioning("", "10.0.0.8"));
    }
}
