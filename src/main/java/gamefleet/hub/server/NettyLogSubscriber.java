package gamefleet.hub.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gamefleet.hub.logs.LogLine;
import gamefleet.hub.logs.LogSubscriber;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes relay output to a dashboard WebSocket as JSON text frames:
 * {@code {"type":"line","text":...}}, {@code {"type":"gap","dropped":n}} and
 * {@code {"type":"closed","reason":...}}. Not ready while the channel is unwritable.
 */
final class NettyLogSubscriber implements LogSubscriber {

    private final Channel channel;
    private final ObjectMapper mapper;

    NettyLogSubscriber(Channel channel, ObjectMapper mapper) {
        this.channel = channel;
        this.mapper = mapper;
    }

    @Override
    public boolean ready() {
        return channel.isActive() && channel.isWritable();
    }

    @Override
    public void deliver(LogLine line) {
        Map<String, Object> frame = new LinkedHashMap<>();
        if (line.isGap()) {
            frame.put("type", "gap");
            frame.put("dropped", line.dropped());
        } else {
            frame.put("type", "line");
            frame.put("text", line.text());
        }
        channel.writeAndFlush(new TextWebSocketFrame(json(frame)));
    }

    @Override
    public void closed(String reason) {
        if (!channel.isActive()) {
            return;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "closed");
        frame.put("reason", reason);
        channel.write(new TextWebSocketFrame(json(frame)));
        String trimmed = reason.length() > 120 ? reason.substring(0, 120) : reason;
        channel.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE.code(), trimmed))
                .addListener(ChannelFutureListener.CLOSE);
    }

    private String json(Map<String, Object> frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode log frame", e);
        }
    }
}
