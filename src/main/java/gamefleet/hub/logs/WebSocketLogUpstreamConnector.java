package gamefleet.hub.logs;

import gamefleet.hub.model.Spoke;
import gamefleet.security.RequestSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects to {@code /v1/logs/<instance>} on the spoke agent with a signed WebSocket handshake.
 */
public final class WebSocketLogUpstreamConnector implements LogUpstreamConnector {

    private static final Logger log = LoggerFactory.getLogger(WebSocketLogUpstreamConnector.class);

    private final HttpClient httpClient;
    private final RequestSigner signer;
    private final Duration connectTimeout;

    public WebSocketLogUpstreamConnector(HttpClient httpClient, RequestSigner signer, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.signer = signer;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public LogUpstream open(Spoke spoke, String instance, LogUpstreamListener listener) {
        String path = "/v1/logs/" + URLEncoder.encode(instance, StandardCharsets.UTF_8);
        String base = spoke.baseUrl();
        URI uri = URI.create((base.startsWith("https://") ? "wss://" + base.substring(8) : "ws://" + base.substring(7))
                + path);

        Connection connection = new Connection(listener);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
        signer.headers(spoke.apiKeyHash(), spoke.id(), "GET", path).forEach(builder::header);

        CompletableFuture<WebSocket> future = builder.buildAsync(uri, connection);
        future.whenComplete((ws, error) -> {
            if (error != null) {
                connection.finish("upstream connect failed: " + rootMessage(error));
            } else {
                log.debug("Log upstream connected: {}", uri);
                connection.attach(ws);
            }
        });
        return connection;
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Splits text frames into lines and forwards them in order.
     */
    private static final class Connection implements WebSocket.Listener, LogUpstream {

        private final LogUpstreamListener listener;
        private final StringBuilder partial = new StringBuilder();
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile WebSocket webSocket;
        private volatile boolean closeRequested;

        Connection(LogUpstreamListener listener) {
            this.listener = listener;
        }

        void attach(WebSocket ws) {
            this.webSocket = ws;
            if (closeRequested) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "unsubscribed");
            }
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                for (String line : frame.split("\\r?\\n", -1)) {
                    if (!line.isEmpty()) {
                        listener.onLine(line);
                    }
                }
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            finish("upstream closed (" + statusCode + (reason == null || reason.isEmpty() ? "" : ": " + reason) + ")");
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            finish("upstream error: " + rootMessage(error));
        }

        void finish(String reason) {
            if (finished.compareAndSet(false, true) && !closeRequested) {
                listener.onClosed(reason);
            }
        }

        @Override
        public void close() {
            closeRequested = true;
            WebSocket ws = webSocket;
            if (ws != null && !ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "unsubscribed");
            }
        }
    }
}
