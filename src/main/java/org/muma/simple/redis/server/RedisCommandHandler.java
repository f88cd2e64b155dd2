package org.muma.simple.redis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.simple.redis.command.CommandDispatcher;
import org.muma.simple.redis.protocol.ErrorMessage;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.protocol.RespProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 连接级处理器：每个解出的请求交给 {@link CommandDispatcher}，结果按请求顺序写回。
 * 本身无状态，所有连接共用一个实例。
 */
@ChannelHandler.Sharable
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        ctx.writeAndFlush(dispatcher.dispatch(msg));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof RespProtocolException) {
            // 字节流已经错位，无法再找到下一帧的边界，回一个错误后关闭连接
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.writeAndFlush(new ErrorMessage("ERR Protocol error: " + cause.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            log.error("Unexpected error on channel {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    public int getConnectedClients() {
        return connectedClients.get();
    }
}
