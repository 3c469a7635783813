package gamefleet.hub.registry;

/**
 * Input of spoke registration. The raw API key is hashed by the registry and dropped.
 *
 * @param allowedSourceIp optional, null leaves the spoke unrestricted
 */
public record RegistrationRequest(String name, String address, String apiKey, String allowedSourceIp) {

    @Override
    public String toString() {
        return "RegistrationRequest{name='" + name + "', address='" + address
                + "', allowedSourceIp='" + allowedSourceIp + "'}";
    }
}
