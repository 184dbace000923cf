package miniredis;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import miniredis.codec.TrailingLineFrameDecoder;
import miniredis.codec.Utf8LineDecoder;
import miniredis.command.CommandDispatcher;
import miniredis.datastore.InMemoryKeyValueStore;
import miniredis.datastore.KeyValueStore;
import miniredis.error.AddressNotBoundException;
import miniredis.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;

/**
 * Accepts client connections and gives each one its own pipeline. All pipelines share the
 * single store instance owned by this server.
 * <p>
 * Socket I/O runs on the worker event loops; commands run on a separate executor group so a
 * wait on the store lock never stalls I/O. Netty binds each channel to one executor, which
 * keeps the commands of a connection in arrival order.
 */
public class MiniRedisServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MiniRedisServer.class);

    private final ServerConfig config;
    private final KeyValueStore store;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup dispatchGroup;
    private Channel serverChannel;

    public MiniRedisServer(ServerConfig config) {
        this(config, new InMemoryKeyValueStore());
    }

    public MiniRedisServer(ServerConfig config, KeyValueStore store) {
        this.config = config;
        this.store = store;
        this.dispatcher = new CommandDispatcher(store);
    }

    /**
     * Binds the configured address and starts accepting. Returns once the socket is bound.
     *
     * @return the bound address, useful when the configured port is 0
     * @throws AddressNotBoundException if the address cannot be bound; nothing is left running
     */
    public synchronized InetSocketAddress start() throws AddressNotBoundException {
        Preconditions.checkState(serverChannel == null, "server already started");

        bossGroup = new NioEventLoopGroup(1, threadFactory("miniredis-accept-%d"));
        workerGroup = new NioEventLoopGroup(config.ioThreads, threadFactory("miniredis-io-%d"));
        dispatchGroup = new DefaultEventExecutorGroup(config.dispatchThreads, threadFactory("miniredis-dispatch-%d"));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new AcceptFailureLogger())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        addLineCodec(pipeline, config.maxLineLength);
                        pipeline.addLast(dispatchGroup, "commandHandler", new MiniRedisServerHandler(dispatcher));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                // end of input is handled by the command handler once queued lines are answered
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        ChannelFuture future = bootstrap.bind(config.host, config.port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            logger.error("Failed to bind to {}: {}", config.address(), future.cause().getMessage());
            shutdownGroups();
            throw new AddressNotBoundException(config.address(), future.cause());
        }

        serverChannel = future.channel();
        logger.info("MiniRedis is running on {}", localAddress());
        return localAddress();
    }

    public InetSocketAddress localAddress() {
        Preconditions.checkState(serverChannel != null, "server not started");
        return (InetSocketAddress) serverChannel.localAddress();
    }

    public KeyValueStore store() {
        return store;
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            Preconditions.checkState(serverChannel != null, "server not started");
            channel = serverChannel;
        }
        channel.closeFuture().sync();
    }

    @Override
    public synchronized void close() {
        if (serverChannel == null) {
            return;
        }
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
        logger.info("MiniRedis stopped");
    }

    static void addLineCodec(ChannelPipeline pipeline, int maxLineLength) {
        pipeline.addLast("frameDecoder", new TrailingLineFrameDecoder(maxLineLength));
        pipeline.addLast("lineDecoder", new Utf8LineDecoder());
        pipeline.addLast("stringEncoder", new StringEncoder(StandardCharsets.UTF_8));
    }

    private void shutdownGroups() {
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (dispatchGroup != null) dispatchGroup.shutdownGracefully();
        workerGroup = null;
        bossGroup = null;
        dispatchGroup = null;
    }

    private static ThreadFactory threadFactory(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).build();
    }

    /**
     * Sits on the listening channel. A failed accept is logged and the listener keeps going;
     * the event is passed on so Netty's acceptor can back off briefly.
     */
    private static final class AcceptFailureLogger extends ChannelInboundHandlerAdapter {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.warn("{}: failed to accept a connection on {}", ErrorKind.STREAM_NOT_CONNECTED, ctx.channel().localAddress(), cause);
            ctx.fireExceptionCaught(cause);
        }
    }
}
