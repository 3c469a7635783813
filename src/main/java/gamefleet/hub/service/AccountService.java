package gamefleet.hub.service;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.hub.model.DashboardUser;
import gamefleet.hub.repository.UserRepository;
import gamefleet.security.ApiKeys;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.AuthGate;
import gamefleet.security.DashboardTokenService;
import gamefleet.security.PasswordHasher;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dashboard accounts: login, logout, password changes and user administration.
 */
public final class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_.-]{1,64}");
    private static final int MIN_PASSWORD = 8;

    private final UserRepository users;
    private final PasswordHasher hasher;
    private final AuthGate gate;
    private final Clock clock;
    // verified against when the user does not exist, so both paths cost the same
    private final String decoyHash;

    public AccountService(UserRepository users, PasswordHasher hasher, AuthGate gate, Clock clock) {
        this.users = users;
        this.hasher = hasher;
        this.gate = gate;
        this.clock = clock;
        this.decoyHash = hasher.hash(ApiKeys.generate());
    }

    /**
     * Create the initial admin account when no user exists.
     *
     * @param configuredPassword password from configuration, or null to generate one
     * @return the generated password, or empty when nothing was created or the password was configured
     */
    public Optional<String> bootstrapAdmin(String username, String configuredPassword) {
        if (users.count() > 0) {
            return Optional.empty();
        }
        boolean generated = configuredPassword == null || configuredPassword.isBlank();
        String password = generated ? ApiKeys.generate().substring(0, 20) : configuredPassword;
        Instant now = clock.instant();
        users.save(new DashboardUser(username, hasher.hash(password), Role.ADMIN, now, now));
        log.info("Created initial admin account '{}'", username);
        return generated ? Optional.of(password) : Optional.empty();
    }

    public record LoginResult(String accessToken, Instant expiresAt, Role role) {
    }

    /**
     * @throws AuthException UNAUTHENTICATED for bad credentials, THROTTLED for a blocked origin
     */
    public LoginResult login(String username, String password, String origin) {
        gate.ensureNotThrottled(origin, "login");
        if (username == null || password == null) {
            gate.loginFailed(String.valueOf(username), origin);
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "invalid credentials");
        }
        Optional<DashboardUser> user = users.findByUsername(username);
        boolean valid = hasher.verify(password, user.map(DashboardUser::passwordHash).orElse(decoyHash));
        if (user.isEmpty() || !valid) {
            gate.loginFailed(username, origin);
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "invalid credentials");
        }
        gate.loginSucceeded(username, origin);
        DashboardTokenService.IssuedToken token = gate.tokens().issue(username, user.get().role());
        return new LoginResult(token.token(), token.expiresAt(), user.get().role());
    }

    public void logout(Principal principal) {
        gate.tokens().revoke(principal.tokenId());
        log.debug("User {} logged out", principal.name());
    }

    public List<DashboardUser> listUsers() {
        return users.findAll();
    }

    /**
     * @throws FleetException INVALID_REQUEST for a malformed name or short password, CONFLICT when it exists
     */
    public DashboardUser createUser(String username, String password, Role role, Principal actor) {
        if (username == null || !USERNAME.matcher(username).matches()) {
            throw FleetException.invalid("username must match [A-Za-z0-9_.-]{1,64}");
        }
        if (role == null) {
            throw FleetException.invalid("role is required");
        }
        requireStrongEnough(password);
        if (users.findByUsername(username).isPresent()) {
            throw new FleetException(ErrorKind.CONFLICT, "user already exists: " + username);
        }
        Instant now = clock.instant();
        DashboardUser user = new DashboardUser(username, hasher.hash(password), role, now, now);
        users.save(user);
        gate.audit().adminAction(actor.name(), "create-user", username + " as " + role);
        return user;
    }

    /**
     * @throws FleetException NOT_FOUND, or CONFLICT when deleting yourself or the last admin
     */
    public void deleteUser(String username, Principal actor) {
        DashboardUser user = users.findByUsername(username)
                .orElseThrow(() -> FleetException.notFound("user", username));
        if (user.username().equals(actor.name())) {
            throw new FleetException(ErrorKind.CONFLICT, "cannot delete your own account");
        }
        if (user.role() == Role.ADMIN
                && users.findAll().stream().filter(u -> u.role() == Role.ADMIN).count() <= 1) {
            throw new FleetException(ErrorKind.CONFLICT, "cannot delete the last admin");
        }
        users.delete(username);
        gate.tokens().revokeAllFor(username);
        gate.audit().adminAction(actor.name(), "delete-user", username);
    }

    /**
     * Change the caller's own password. Tokens issued before the change stop working;
     * a fresh token is returned so the caller stays signed in.
     *
     * @throws AuthException UNAUTHENTICATED when the current password is wrong
     */
    public LoginResult changePassword(Principal principal, String currentPassword, String newPassword, String origin) {
        gate.ensureNotThrottled(origin, "password-change");
        DashboardUser user = users.findByUsername(principal.name())
                .orElseThrow(() -> FleetException.notFound("user", principal.name()));
        if (currentPassword == null || !hasher.verify(currentPassword, user.passwordHash())) {
            gate.loginFailed(principal.name(), origin);
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "current password is incorrect");
        }
        requireStrongEnough(newPassword);
        Instant now = clock.instant();
        users.save(new DashboardUser(user.username(), hasher.hash(newPassword), user.role(), user.createdAt(), now));
        gate.tokens().revokeAllFor(user.username());
        gate.tokens().revoke(principal.tokenId());
        gate.audit().adminAction(principal.name(), "change-password", principal.name());

        DashboardTokenService.IssuedToken token = gate.tokens().issue(user.username(), user.role());
        return new LoginResult(token.token(), token.expiresAt(), user.role());
    }

    private static void requireStrongEnough(String password) {
        if (password == null || password.length() < MIN_PASSWORD) {
            throw FleetException.invalid("password must be at least " + MIN_PASSWORD + " characters");
        }
    }
}
