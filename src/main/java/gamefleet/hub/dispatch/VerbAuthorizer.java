package gamefleet.hub.dispatch;

import gamefleet.hub.model.CommandVerb;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.Principal;
import gamefleet.security.Role;

/**
 * Which role may issue which verb. OPERATOR covers start/stop/restart,
 * UPDATE and CUSTOM need ADMIN, VIEWER issues nothing.
 */
public final class VerbAuthorizer {

    public Role requiredRole(CommandVerb verb) {
        return switch (verb) {
            case START, STOP, RESTART -> Role.OPERATOR;
            case UPDATE, CUSTOM -> Role.ADMIN;
        };
    }

    /**
     * @throws AuthException UNAUTHORIZED when the principal's role is too low
     */
    public void authorize(Principal principal, CommandVerb verb) {
        if (principal == null) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "authentication required");
        }
        Role required = requiredRole(verb);
        if (!principal.hasRole(required)) {
            throw new AuthException(AuthFailure.UNAUTHORIZED,
                    verb + " requires " + required + ", caller has " + principal.role());
        }
    }
}
