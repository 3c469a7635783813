package gamefleet.spoke.logs;

import gamefleet.http.PathPattern;
import gamefleet.http.SignedCallHeaders;
import gamefleet.http.WebSocketEndpoint;
import gamefleet.security.AuthGate;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Streams {@code log/console/<instance>-console.log} to the hub, one line per text frame.
 * WS /v1/logs/{instance} (signed spoke call)
 *
 * Sends the most recent lines first, then polls the file for new ones. While the
 * channel is not writable a poll is skipped and the file itself holds the backlog.
 */
public final class LogTailWebSocketHandler extends WebSocketEndpoint {

    private static final Logger log = LoggerFactory.getLogger(LogTailWebSocketHandler.class);

    static final PathPattern LOGS = PathPattern.of("/v1/logs/{instance}");
    private static final Pattern INSTANCE = Pattern.compile("[A-Za-z0-9_.-]+");

    private final AuthGate gate;
    private final Path lgsmHome;
    private final int initialLines;
    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;

    private volatile ScheduledFuture<?> polling;

    public LogTailWebSocketHandler(AuthGate gate, Path lgsmHome, int initialLines, Duration pollInterval,
            ScheduledExecutorService scheduler) {
        this.gate = gate;
        this.lgsmHome = lgsmHome;
        this.initialLines = initialLines;
        this.pollInterval = pollInterval;
        this.scheduler = scheduler;
    }

    static Path consoleLog(Path lgsmHome, String instance) {
        return lgsmHome.resolve("log").resolve("console").resolve(instance + "-console.log");
    }

    @Override
    protected boolean accepts(String path) {
        return LOGS.matches(path);
    }

    @Override
    protected void authenticate(FullHttpRequest request, String path, String sourceIp) {
        gate.authenticateSpokeCall(SignedCallHeaders.from(request, path), sourceIp);
    }

    @Override
    protected void opened(ChannelHandlerContext ctx, String path) {
        String instance = LOGS.variable(path, "instance");
        if (instance == null || !INSTANCE.matcher(instance).matches() || instance.startsWith(".")) {
            closeWith(ctx, WebSocketCloseStatus.POLICY_VIOLATION, "invalid instance");
            return;
        }
        Path file = consoleLog(lgsmHome, instance);
        if (!Files.isRegularFile(file)) {
            closeWith(ctx, WebSocketCloseStatus.ENDPOINT_UNAVAILABLE,
                    "log file not found: log/console/" + instance + "-console.log");
            return;
        }

        FileTailer tailer = new FileTailer(file);
        try {
            for (String line : tailer.lastLines(initialLines)) {
                ctx.write(new TextWebSocketFrame(line));
            }
            ctx.flush();
        } catch (IOException e) {
            closeWith(ctx, WebSocketCloseStatus.INTERNAL_SERVER_ERROR, "cannot read log: " + e.getMessage());
            return;
        }
        log.debug("Tailing {} for {}", file, ctx.channel().remoteAddress());

        long periodMs = pollInterval.toMillis();
        polling = scheduler.scheduleWithFixedDelay(() -> pollOnce(ctx, tailer), periodMs, periodMs,
                TimeUnit.MILLISECONDS);
        if (!ctx.channel().isActive()) {
            closed();
        }
    }

    private void pollOnce(ChannelHandlerContext ctx, FileTailer tailer) {
        if (!ctx.channel().isWritable()) {
            return;
        }
        try {
            List<String> lines = tailer.poll();
            for (String line : lines) {
                ctx.write(new TextWebSocketFrame(line));
            }
            if (!lines.isEmpty()) {
                ctx.flush();
            }
        } catch (IOException e) {
            log.warn("Log tail failed: {}", e.getMessage());
            stopPolling();
            closeWith(ctx, WebSocketCloseStatus.INTERNAL_SERVER_ERROR, "cannot read log: " + e.getMessage());
        }
    }

    @Override
    protected void closed() {
        stopPolling();
    }

    private void stopPolling() {
        ScheduledFuture<?> current = polling;
        if (current != null) {
            current.cancel(false);
        }
    }
}
