package gamefleet.security;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and verifies short-lived signed dashboard session tokens.
 *
 * Format: {@code base64url(payload) "." base64url(HMAC-SHA256(secret, payload))}.
 * Revoked token ids are remembered until their own expiry. Each token also carries the
 * user's revocation generation at issue time; {@link #revokeAllFor} bumps it.
 */
public final class DashboardTokenService {

    private static final String ALGORITHM = "HmacSHA256";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Map<String, Long> generations = new ConcurrentHashMap<>();

    public DashboardTokenService(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.length() < 16) {
            throw new IllegalArgumentException("token secret must be at least 16 characters");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = ttl;
        this.clock = clock;
    }

    record TokenPayload(
            @JsonProperty("sub") String subject,
            @JsonProperty("role") Role role,
            @JsonProperty("iat") long issuedAt,
            @JsonProperty("exp") long expiresAt,
            @JsonProperty("jti") String tokenId,
            @JsonProperty("gen") long generation) {
    }

    public record IssuedToken(String token, String tokenId, Instant expiresAt) {
    }

    public IssuedToken issue(String username, Role role) {
        Instant now = clock.instant();
        Instant expires = now.plus(ttl);
        TokenPayload payload = new TokenPayload(username, role, now.getEpochSecond(),
                expires.getEpochSecond(), UUID.randomUUID().toString(), generations.getOrDefault(username, 0L));
        try {
            byte[] body = MAPPER.writeValueAsBytes(payload);
            Base64.Encoder b64 = Base64.getUrlEncoder().withoutPadding();
            String token = b64.encodeToString(body) + "." + b64.encodeToString(sign(body));
            return new IssuedToken(token, payload.tokenId(), expires);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode token", e);
        }
    }

    /**
     * Verify signature, expiry, revocation and per-user generation.
     *
     * @throws AuthException UNAUTHENTICATED on any failure
     */
    public Principal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "missing token");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1 || token.indexOf('.', dot + 1) >= 0) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "malformed token");
        }

        byte[] body;
        byte[] presented;
        try {
            body = Base64.getUrlDecoder().decode(token.substring(0, dot));
            presented = Base64.getUrlDecoder().decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "malformed token");
        }

        if (!MessageDigest.isEqual(sign(body), presented)) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "bad token signature");
        }

        TokenPayload payload;
        try {
            payload = MAPPER.readValue(body, TokenPayload.class);
        } catch (IOException e) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "malformed token");
        }

        long now = clock.instant().getEpochSecond();
        if (now >= payload.expiresAt()) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "token expired");
        }
        if (payload.tokenId() == null || revoked.containsKey(payload.tokenId())) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "token revoked");
        }
        if (payload.generation() < generations.getOrDefault(payload.subject(), 0L)) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "token superseded");
        }
        return new Principal(payload.subject(), payload.role(), payload.tokenId());
    }

    public void revoke(String tokenId) {
        if (tokenId == null) {
            return;
        }
        revoked.put(tokenId, clock.instant().plus(ttl));
        purgeRevoked();
    }

    /** Invalidate every token issued to the user so far, whatever the clock says. */
    public void revokeAllFor(String username) {
        generations.merge(username, 1L, Long::sum);
    }

    int revokedCount() {
        return revoked.size();
    }

    private void purgeRevoked() {
        Instant now = clock.instant();
        revoked.entrySet().removeIf(e -> e.getValue().isBefore(now));
    }

    private byte[] sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }
}
