package minikv.network;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import minikv.Config;
import minikv.ServerContext;
import minikv.protocol.netty.NettyRespDecoder;
import minikv.protocol.netty.NettyRespEncoder;
import minikv.server.Janitor;
import minikv.utils.Log;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TCP front end: one boss thread accepts, a fixed worker pool serves the channels.
 */
public class MiniKvServer implements Closeable {
    private final ServerContext context;
    private final Janitor janitor;
    private final ChannelGroup clients = new DefaultChannelGroup("minikv-clients", GlobalEventExecutor.INSTANCE);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(ServerContext context) {
        this.context = context;
        this.janitor = new Janitor(context.getDatabase(), context.getConfig().expirySweepIntervalMs);
    }

    /**
     * Binds the listening socket and starts the janitor. Blocks until bound.
     */
    public void start() throws InterruptedException {
        Config config = context.getConfig();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        final NettyRespEncoder encoder = new NettyRespEncoder(context.getCodec());
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .option(ChannelOption.SO_BACKLOG, 511)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childOption(ChannelOption.SO_KEEPALIVE, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     clients.add(ch);
                     ch.pipeline().addLast(new NettyRespDecoder(context.getCodec()));
                     ch.pipeline().addLast(encoder);
                     ch.pipeline().addLast(new ClientHandler(context));
                 }
             });

            serverChannel = b.bind(config.bind, config.port).sync().channel();
        } catch (Exception e) {
            // bind failures such as java.net.BindException surface here
            shutdownGroups();
            throw e;
        }
        janitor.start();
    }

    /**
     * Port actually bound; differs from the configured one when that was 0.
     */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ServerContext getContext() {
        return context;
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitClose() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        Log.info("Shutting down...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        // Each close is queued behind the request its event loop is processing
        clients.close().awaitUninterruptibly();
        janitor.stop();
        shutdownGroups();
        Log.info("Shutdown complete.");
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
