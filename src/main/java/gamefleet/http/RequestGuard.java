package gamefleet.http;

import gamefleet.security.Principal;
import io.netty.handler.codec.http.HttpRequest;

/**
 * Authenticates a request before it reaches a controller.
 */
@FunctionalInterface
public interface RequestGuard {

    /**
     * @return the caller, or null for public endpoints
     * @throws gamefleet.security.AuthException when the request is rejected
     */
    Principal authorize(HttpRequest request, String path, String sourceIp);
}
