package gamefleet.security;

/**
 * Credentials carried by a hub-to-spoke or spoke-to-hub request.
 *
 * @param spokeId   claimed spoke identity ({@code X-Fleet-Spoke})
 * @param timestamp epoch seconds ({@code X-Fleet-Timestamp})
 * @param signature hex HMAC ({@code X-Fleet-Signature})
 * @param method    HTTP method of the request
 * @param path      request path without query string
 */
public record SignedCall(String spokeId, long timestamp, String signature, String method, String path) {

    public static final String HEADER_SPOKE = "X-Fleet-Spoke";
    public static final String HEADER_TIMESTAMP = "X-Fleet-Timestamp";
    public static final String HEADER_SIGNATURE = "X-Fleet-Signature";
}
