package reportflow.engine.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
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
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the {@link RouterHandler}.
 *
 * Controllers run on a separate executor group, not on the I/O event loop,
 * because a manual run blocks until the report is written.
 */
public final class ReportFlowServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReportFlowServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int REQUEST_THREADS = 16;

    private final String host;
    private final int port;
    private final RouterHandler router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup requestGroup;
    private Channel serverChannel;

    public ReportFlowServer(String host, int port, RouterHandler router) {
        this.host = host;
        this.port = port;
        this.router = router;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("reportflow-http-boss", true));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("reportflow-http-io", true));
        requestGroup = new DefaultEventExecutorGroup(REQUEST_THREADS,
                new DefaultThreadFactory("reportflow-http-request", true));

        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new IdleStateHandler(120, 0, 0, TimeUnit.SECONDS));
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast(requestGroup, "router", router);
                    }
                });

        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
        log.info("HTTP server listening on {}:{}", host, boundPort());
    }

    /** Actual port, useful when started with port 0 */
    public int boundPort() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (requestGroup != null) {
            requestGroup.shutdownGracefully();
            requestGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        log.info("HTTP server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
