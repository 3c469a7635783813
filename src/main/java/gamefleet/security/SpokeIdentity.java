package gamefleet.security;

/**
 * What the auth gate needs to verify a spoke call.
 *
 * @param spokeId         spoke id
 * @param apiKeyHash      SHA-256 hex of the spoke API key
 * @param allowedSourceIp permitted peer address, null when not restricted
 */
public record SpokeIdentity(String spokeId, String apiKeyHash, String allowedSourceIp) {

    public boolean hasAllowlist() {
        return allowedSourceIp != null && !allowedSourceIp.isBlank();
    }
}
