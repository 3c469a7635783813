package gamefleet.http;

import gamefleet.security.SignedCall;
import io.netty.handler.codec.http.HttpRequest;

/**
 * Extracts {@link SignedCall} credentials from request headers.
 */
public final class SignedCallHeaders {

    private SignedCallHeaders() {
    }

    public static SignedCall from(HttpRequest request, String path) {
        String spokeId = request.headers().get(SignedCall.HEADER_SPOKE);
        String signature = request.headers().get(SignedCall.HEADER_SIGNATURE);
        long timestamp;
        try {
            String raw = request.headers().get(SignedCall.HEADER_TIMESTAMP);
            timestamp = raw == null ? 0L : Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            timestamp = 0L;
        }
        return new SignedCall(spokeId, timestamp, signature, request.method().name(), path);
    }
}
