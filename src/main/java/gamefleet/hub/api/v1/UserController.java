package gamefleet.hub.api.v1;

import gamefleet.core.FleetException;
import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.ChangePasswordRequest;
import gamefleet.hub.api.v1.dto.CreateUserRequest;
import gamefleet.hub.api.v1.dto.LoginResponse;
import gamefleet.hub.api.v1.dto.UserResponse;
import gamefleet.hub.service.AccountService;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Locale;
import java.util.Map;

/**
 * Dashboard credentials.
 * GET    /api/v1/users             - ADMIN
 * POST   /api/v1/users             - ADMIN
 * DELETE /api/v1/users/{name}      - ADMIN
 * PUT    /api/v1/users/me/password - any role, own password
 */
public class UserController implements Controller {

    static final PathPattern USERS = PathPattern.of("/api/v1/users");
    static final PathPattern USER = PathPattern.of("/api/v1/users/{name}");
    static final PathPattern OWN_PASSWORD = PathPattern.of("/api/v1/users/me/password");

    private final AccountService accounts;

    public UserController(AccountService accounts) {
        this.accounts = accounts;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.PUT)) {
            return OWN_PASSWORD.matches(path);
        }
        if (method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST)) {
            return USERS.matches(path);
        }
        return method.equals(HttpMethod.DELETE) && USER.matches(path);
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        String path = request.path();
        if (OWN_PASSWORD.matches(path)) {
            Principal self = request.requireRole(Role.VIEWER);
            ChangePasswordRequest body = request.body(ChangePasswordRequest.class);
            AccountService.LoginResult fresh = accounts.changePassword(self,
                    body.currentPassword(), body.newPassword(), request.sourceIp());
            return ControllerResponse.json(LoginResponse.from(fresh));
        }

        Principal admin = request.requireRole(Role.ADMIN);
        if (request.method().equals(HttpMethod.DELETE)) {
            accounts.deleteUser(USER.variable(path, "name"), admin);
            return ControllerResponse.ok();
        }
        if (request.method().equals(HttpMethod.POST)) {
            CreateUserRequest body = request.body(CreateUserRequest.class);
            Role role = parseRole(body.role());
            return ControllerResponse.created(
                    UserResponse.from(accounts.createUser(body.username(), body.password(), role, admin)));
        }
        return ControllerResponse.json(Map.of("users",
                accounts.listUsers().stream().map(UserResponse::from).toList()));
    }

    private static Role parseRole(String raw) {
        if (raw == null || raw.isBlank()) {
            return Role.VIEWER;
        }
        try {
            return Role.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw FleetException.invalid("role must be VIEWER, OPERATOR or ADMIN");
        }
    }
}
