package gamefleet.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HMAC-SHA256 request signing between hub and spoke.
 * The key is the API key hash, so the raw key is never sent.
 */
public final class RequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final Clock clock;

    public RequestSigner(Clock clock) {
        this.clock = clock;
    }

    public static String signature(String apiKeyHash, String method, String path, String spokeId, long timestamp) {
        String canonical = method.toUpperCase() + "\n" + path + "\n" + spokeId + "\n" + timestamp;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(apiKeyHash.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute request signature", e);
        }
    }

    /**
     * Headers to attach to an outgoing request.
     */
    public Map<String, String> headers(String apiKeyHash, String spokeId, String method, String path) {
        long now = clock.instant().getEpochSecond();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(SignedCall.HEADER_SPOKE, spokeId);
        headers.put(SignedCall.HEADER_TIMESTAMP, Long.toString(now));
        headers.put(SignedCall.HEADER_SIGNATURE, signature(apiKeyHash, method, path, spokeId, now));
        return headers;
    }
}
