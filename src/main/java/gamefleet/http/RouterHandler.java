package gamefleet.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gamefleet.core.FleetException;
import gamefleet.http.Controller.ControllerResponse;
import gamefleet.security.AuthException;
import gamefleet.security.Principal;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that authenticates requests through a {@link RequestGuard}
 * and dispatches them to registered controllers.
 *
 * Error mapping:
 * - AuthException: 401/403/429 by failure
 * - FleetException: status of its kind
 * - IllegalArgumentException: 400
 * - anything else: 500 with a generic message, details logged only
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final RequestGuard guard;

    public RouterHandler(RequestGuard guard) {
        this.guard = guard;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;
        String sourceIp = RequestContext.sourceIp(ctx);

        ControllerResponse response;
        try {
            response = route(ctx, req, path, sourceIp);
        } catch (AuthException e) {
            log.debug("Rejected {} {} from {}: {}", method, path, sourceIp, e.getMessage());
            response = ControllerResponse.error(HttpResponseStatus.valueOf(e.failure().httpStatus()),
                    e.failure().code(), e.getMessage());
        } catch (FleetException e) {
            response = mapFleetException(method, path, e);
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, "invalid_request", e.getMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {}", method, path, t);
            response = ControllerResponse.error(INTERNAL_SERVER_ERROR, "internal_fault", "internal error");
        }
        writeSafe(ctx, req, response);
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, String path, String sourceIp)
            throws Exception {
        for (Controller controller : controllers) {
            if (controller.matches(req.method(), path)) {
                Principal principal = guard.authorize(req, path, sourceIp);
                return controller.handle(new RequestContext(ctx, req, path, sourceIp, principal));
            }
        }
        log.debug("No handler for: {} {}", req.method(), path);
        return ControllerResponse.error(NOT_FOUND, "not_found", "no such endpoint");
    }

    private static ControllerResponse mapFleetException(HttpMethod method, String path, FleetException e) {
        HttpResponseStatus status = HttpResponseStatus.valueOf(e.kind().httpStatus());
        return switch (e.kind()) {
            case INTERNAL_FAULT -> {
                log.error("Internal fault on {} {}", method, path, e);
                yield ControllerResponse.error(status, e.kind().code(), "internal error");
            }
            case SPOKE_UNREACHABLE -> {
                log.info("{} {}: {}", method, path, e.getMessage());
                yield ControllerResponse.error(status, e.kind().code(), e.getMessage());
            }
            default -> ControllerResponse.error(status, e.kind().code(), e.getMessage());
        };
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        try {
            String body = response.body() == null ? "" : response.body();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

            boolean keepAlive = HttpUtil.isKeepAlive(req);
            HttpUtil.setKeepAlive(httpResponse, keepAlive);
            if (keepAlive) {
                ctx.writeAndFlush(httpResponse);
            } else {
                ctx.writeAndFlush(httpResponse).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.debug("Closing idle connection {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Unhandled exception in channel {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
