package gamefleet.security;

import java.util.Optional;

/**
 * Lookup of spoke credentials by claimed id.
 */
@FunctionalInterface
public interface IdentityStore {

    Optional<SpokeIdentity> findIdentity(String spokeId);
}
