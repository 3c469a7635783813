package gamefleet.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import gamefleet.core.FleetException;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One inbound request as seen by a controller.
 *
 * @param channel   Netty channel context
 * @param request   aggregated request
 * @param path      path without query string
 * @param sourceIp  peer address of the connection
 * @param principal authenticated caller, null on public endpoints
 */
public record RequestContext(
        ChannelHandlerContext channel,
        FullHttpRequest request,
        String path,
        String sourceIp,
        Principal principal) {

    public HttpMethod method() {
        return request.method();
    }

    public String header(String name) {
        return request.headers().get(name);
    }

    /**
     * Parse the JSON body.
     *
     * @throws FleetException INVALID_REQUEST when the body is empty or malformed
     */
    public <T> T body(Class<T> type) {
        String body = request.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw FleetException.invalid("request body is required");
        }
        try {
            return RouterHandler.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw FleetException.invalid("malformed JSON body");
        }
    }

    public String query(String name) {
        List<String> values = new QueryStringDecoder(request.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public int intQuery(String name, int defaultValue, int max) {
        String raw = query(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw FleetException.invalid(name + " must be positive");
            }
            return Math.min(value, max);
        } catch (NumberFormatException e) {
            throw FleetException.invalid(name + " must be an integer");
        }
    }

    /**
     * @throws AuthException UNAUTHORIZED when the caller lacks the role
     */
    public Principal requireRole(Role role) {
        if (principal == null) {
            throw new AuthException(AuthFailure.UNAUTHENTICATED, "authentication required");
        }
        if (!principal.hasRole(role)) {
            throw new AuthException(AuthFailure.UNAUTHORIZED, role + " role required");
        }
        return principal;
    }

    public static String sourceIp(ChannelHandlerContext ctx) {
        SocketAddress remote = ctx.channel().remoteAddress();
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
