package gamefleet.http;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Netty HTTP server shared by the hub and the spoke agent.
 *
 * Pipeline: idle timeout, HTTP codec, aggregator, optional per-channel WebSocket
 * endpoint, then the shared {@link RouterHandler}.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    public static final String IDLE_HANDLER = "idle";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final String name;
    private final String host;
    private final int port;
    private final RouterHandler router;
    private final Supplier<ChannelHandler> webSocketEndpoint;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    /**
     * @param port              0 binds an ephemeral port
     * @param webSocketEndpoint creates one endpoint per connection, or null when there is none
     */
    public HttpServer(String name, String host, int port, RouterHandler router,
            Supplier<ChannelHandler> webSocketEndpoint) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.router = router;
        this.webSocketEndpoint = webSocketEndpoint;
    }

    /**
     * Bind and start serving.
     *
     * @return the bound port
     */
    public synchronized int start() throws InterruptedException {
        if (running) {
            return port();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(IDLE_HANDLER, new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            if (webSocketEndpoint != null) {
                                p.addLast(webSocketEndpoint.get());
                            }
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).sync().channel();
            running = true;
            log.info("{} listening on {}:{} ({} controllers)", name, host, port(), router.controllerCount());
            return port();
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
    }

    public int port() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Block until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("{} stopped", name);
            }
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
