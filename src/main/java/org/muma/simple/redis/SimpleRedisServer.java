package org.muma.simple.redis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.simple.redis.command.CommandDispatcher;
import org.muma.simple.redis.config.SimpleRedisConfig;
import org.muma.simple.redis.protocol.RespCodec;
import org.muma.simple.redis.protocol.RespDecoder;
import org.muma.simple.redis.protocol.RespEncoder;
import org.muma.simple.redis.server.RedisCommandHandler;
import org.muma.simple.redis.store.StorageEngine;
import org.muma.simple.redis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class SimpleRedisServer {

    private static final Logger log = LoggerFactory.getLogger(SimpleRedisServer.class);

    private final SimpleRedisConfig config;
    private final StorageEngine storage;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SimpleRedisServer(SimpleRedisConfig config) {
        this(config, new MemoryStorageEngine());
    }

    public SimpleRedisServer(SimpleRedisConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
    }

    /**
     * 绑定端口并开始接受连接，返回监听 Channel。端口配置为 0 时由系统分配。
     */
    public Channel bind() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        RespCodec codec = RespCodec.fromConfig(config);
        CommandDispatcher dispatcher = new CommandDispatcher(storage);
        RedisCommandHandler commandHandler = new RedisCommandHandler(dispatcher);

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // 每个连接独占一个 Decoder (有累积缓冲)，Handler 共享
                        ch.pipeline()
                                .addLast(new RespDecoder(codec))
                                .addLast(new RespEncoder())
                                .addLast(commandHandler);
                    }
                });

        log.info("Starting Simple-Redis server on port {}", config.getPort());
        try {
            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdown();
            throw e;
        }
        log.info("Simple-Redis started successfully, listening on {}", serverChannel.localAddress());
        return serverChannel;
    }

    public int getBoundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public void shutdown() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("Simple-Redis stopped, {} keys in memory discarded.", storage.size());
    }

    public static void main(String[] args) throws InterruptedException {
        SimpleRedisConfig config = SimpleRedisConfig.load(args);
        SimpleRedisServer server = new SimpleRedisServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "Redis-Shutdown"));
        try {
            server.bind();
            server.awaitTermination();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            server.shutdown();
        }
    }
}
