package gamefleet.hub.server;

import gamefleet.core.FleetException;
import gamefleet.http.PathPattern;
import gamefleet.http.RouterHandler;
import gamefleet.http.WebSocketEndpoint;
import gamefleet.hub.logs.LogRelay;
import gamefleet.hub.logs.StreamHandle;
import gamefleet.security.AuthGate;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Live console stream for the dashboard.
 * GET /api/v1/spokes/{id}/logs/{instance} (WebSocket upgrade)
 *
 * Browsers cannot set headers on a WebSocket handshake, so the dashboard token
 * may also be passed as {@code ?token=}.
 */
public final class LogStreamWebSocketHandler extends WebSocketEndpoint {

    private static final Logger log = LoggerFactory.getLogger(LogStreamWebSocketHandler.class);

    static final PathPattern LOGS = PathPattern.of("/api/v1/spokes/{id}/logs/{instance}");

    private final AuthGate gate;
    private final LogRelay relay;

    private volatile StreamHandle handle;

    public LogStreamWebSocketHandler(AuthGate gate, LogRelay relay) {
        this.gate = gate;
        this.relay = relay;
    }

    @Override
    protected boolean accepts(String path) {
        return LOGS.matches(path);
    }

    @Override
    protected void authenticate(FullHttpRequest request, String path, String sourceIp) {
        String token = queryToken(request);
        if (token == null) {
            token = HubRequestGuard.bearerToken(request);
        }
        gate.authenticateDashboard(token, sourceIp);
    }

    @Override
    protected void opened(ChannelHandlerContext ctx, String path) {
        Map<String, String> vars = LOGS.match(path).orElseThrow();
        NettyLogSubscriber subscriber = new NettyLogSubscriber(ctx.channel(), RouterHandler.mapper());
        try {
            handle = relay.subscribe(vars.get("id"), vars.get("instance"), subscriber);
            if (!ctx.channel().isActive()) {
                handle.close();
                return;
            }
            log.debug("Log stream opened: {}/{} for {}", vars.get("id"), vars.get("instance"),
                    ctx.channel().remoteAddress());
        } catch (FleetException e) {
            closeWith(ctx, WebSocketCloseStatus.POLICY_VIOLATION, e.getMessage());
        }
    }

    @Override
    protected void writabilityChanged(ChannelHandlerContext ctx, boolean writable) {
        StreamHandle current = handle;
        if (writable && current != null) {
            relay.resume(current);
        }
    }

    @Override
    protected void closed() {
        StreamHandle current = handle;
        if (current != null) {
            current.close();
        }
    }

    private static String queryToken(FullHttpRequest request) {
        List<String> values = new QueryStringDecoder(request.uri()).parameters().get("token");
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
