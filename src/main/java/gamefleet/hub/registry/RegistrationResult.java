package gamefleet.hub.registry;

/**
 * @param created false when an existing spoke at the same address was updated
 */
public record RegistrationResult(String spokeId, boolean created) {
}
