package gamefleet.http;

import gamefleet.core.FleetException;
import gamefleet.security.AuthException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Per-connection handler that upgrades matching requests to a server-push WebSocket.
 * Other requests pass through to the router unchanged.
 */
public abstract class WebSocketEndpoint extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEndpoint.class);

    private WebSocketServerHandshaker handshaker;

    /** Whether this endpoint serves the given path. */
    protected abstract boolean accepts(String path);

    /**
     * Authenticate the upgrade request before the handshake.
     *
     * @throws AuthException    to refuse with the failure's status
     * @throws FleetException   to refuse with the kind's status
     */
    protected abstract void authenticate(FullHttpRequest request, String path, String sourceIp);

    /** Handshake completed; start pushing frames. */
    protected abstract void opened(ChannelHandlerContext ctx, String path);

    /** Connection gone, for any reason. Called at most once after {@link #opened}. */
    protected abstract void closed();

    /** Channel writability flipped. */
    protected void writabilityChanged(ChannelHandlerContext ctx, boolean writable) {
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof FullHttpRequest request && handshaker == null) {
            String path = new QueryStringDecoder(request.uri()).path();
            if (!isUpgrade(request) || !accepts(path)) {
                ctx.fireChannelRead(msg);
                return;
            }
            try {
                upgrade(ctx, request, path);
            } finally {
                ReferenceCountUtil.release(request);
            }
            return;
        }
        if (msg instanceof WebSocketFrame frame) {
            try {
                onFrame(ctx, frame);
            } finally {
                ReferenceCountUtil.release(frame);
            }
            return;
        }
        ctx.fireChannelRead(msg);
    }

    private void upgrade(ChannelHandlerContext ctx, FullHttpRequest request, String path) {
        String sourceIp = RequestContext.sourceIp(ctx);
        try {
            authenticate(request, path, sourceIp);
        } catch (AuthException e) {
            log.debug("WebSocket upgrade refused for {} from {}: {}", path, sourceIp, e.getMessage());
            refuse(ctx, HttpResponseStatus.valueOf(e.failure().httpStatus()), e.failure().code(), e.getMessage());
            return;
        } catch (FleetException e) {
            refuse(ctx, HttpResponseStatus.valueOf(e.kind().httpStatus()), e.kind().code(), e.getMessage());
            return;
        }

        String host = request.headers().get(HttpHeaderNames.HOST, "localhost");
        WebSocketServerHandshakerFactory factory =
                new WebSocketServerHandshakerFactory("ws://" + host + path, null, true);
        handshaker = factory.newHandshaker(request);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }
        if (ctx.pipeline().get(HttpServer.IDLE_HANDLER) != null) {
            ctx.pipeline().remove(HttpServer.IDLE_HANDLER);
        }
        handshaker.handshake(ctx.channel(), request).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                ctx.channel().closeFuture().addListener(f -> closed());
                opened(ctx, path);
            } else {
                log.debug("WebSocket handshake failed: {}", future.cause().getMessage());
                ctx.close();
            }
        });
    }

    private void onFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof CloseWebSocketFrame close) {
            handshaker.close(ctx.channel(), close.retain());
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        }
        // text and binary frames from the client are ignored; the stream is push-only
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (handshaker != null) {
            writabilityChanged(ctx, ctx.channel().isWritable());
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (handshaker == null) {
            ctx.fireExceptionCaught(cause);
            return;
        }
        log.debug("WebSocket error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    /** Push one text frame. */
    protected static void send(ChannelHandlerContext ctx, String text) {
        ctx.writeAndFlush(new TextWebSocketFrame(text));
    }

    /** Close the socket with a status and reason. */
    protected static void closeWith(ChannelHandlerContext ctx, WebSocketCloseStatus status, String reason) {
        String trimmed = reason.length() > 120 ? reason.substring(0, 120) : reason;
        ctx.writeAndFlush(new CloseWebSocketFrame(status.code(), trimmed))
                .addListener(ChannelFutureListener.CLOSE);
    }

    private static boolean isUpgrade(FullHttpRequest request) {
        return request.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
    }

    private static void refuse(ChannelHandlerContext ctx, HttpResponseStatus status, String code, String message) {
        String body = "{\"error\":\"" + code + "\",\"message\":\"" + message.replace("\"", "'") + "\"}";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
