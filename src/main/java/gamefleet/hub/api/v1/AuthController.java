package gamefleet.hub.api.v1;

import gamefleet.http.Controller;
import gamefleet.http.PathPattern;
import gamefleet.http.RequestContext;
import gamefleet.hub.api.v1.dto.LoginRequest;
import gamefleet.hub.api.v1.dto.LoginResponse;
import gamefleet.hub.service.AccountService;
import gamefleet.security.Role;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Dashboard sessions.
 * POST /api/v1/auth/login  - exchange credentials for a token (public, throttled)
 * POST /api/v1/auth/logout - revoke the presented token
 */
public class AuthController implements Controller {

    static final PathPattern LOGIN = PathPattern.of("/api/v1/auth/login");
    static final PathPattern LOGOUT = PathPattern.of("/api/v1/auth/logout");

    private final AccountService accounts;

    public AuthController(AccountService accounts) {
        this.accounts = accounts;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (LOGIN.matches(path) || LOGOUT.matches(path));
    }

    @Override
    public ControllerResponse handle(RequestContext request) {
        if (LOGOUT.matches(request.path())) {
            accounts.logout(request.requireRole(Role.VIEWER));
            return ControllerResponse.ok();
        }
        LoginRequest body = request.body(LoginRequest.class);
        AccountService.LoginResult result = accounts.login(body.username(), body.password(), request.sourceIp());
        return ControllerResponse.json(LoginResponse.from(result));
    }
}
