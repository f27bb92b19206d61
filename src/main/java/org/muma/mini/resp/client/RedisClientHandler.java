package org.muma.mini.resp.client;

import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import org.muma.mini.resp.exception.RespException;
import org.muma.mini.resp.exception.RespProtocolException;
import org.muma.mini.resp.exception.RespTransportException;
import org.muma.mini.resp.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * 客户端的 Netty Handler
 * 负责把请求和回复一一配对。
 * <p>
 * pending 队列只在 EventLoop 线程上读写：出站时先登记 future 再交给编码器，
 * 所以队列顺序就是字节在线路上的顺序，RESP 回复按 FIFO 返回，队头就是当前回复的主人。
 * 多个线程同时 send 也不会交错帧。
 */
public class RedisClientHandler extends ChannelDuplexHandler {

    private static final Logger log = LoggerFactory.getLogger(RedisClientHandler.class);

    private final Deque<CompletableFuture<RedisMessage>> pending = new ArrayDeque<>();

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
        if (msg instanceof PendingCommand pc) {
            if (log.isDebugEnabled()) {
                log.debug("Sending {} to {}", pc.command(), ctx.channel().remoteAddress());
            }
            pending.addLast(pc.reply());
            ctx.write(pc.command(), promise);
        } else {
            ctx.write(msg, promise);
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof RedisMessage reply)) {
            ReferenceCountUtil.release(msg);
            return;
        }

        CompletableFuture<RedisMessage> future = pending.pollFirst();
        if (future == null) {
            // 没有人在等这个回复，说明帧已经错位
            log.warn("Unsolicited reply from {}: {}", ctx.channel().remoteAddress(), reply);
            failAll(new RespProtocolException("Received a reply with no pending command: " + reply));
            ctx.close();
            return;
        }
        if (reply.isError()) {
            log.debug("Server replied error: {}", reply);
        }
        future.complete(reply);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // 解码器抛出的异常会被 Netty 包一层 DecoderException
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;

        RespException error;
        if (root instanceof RespProtocolException protocolError) {
            log.warn("Protocol error on {}, closing connection: {}", ctx.channel().remoteAddress(), root.getMessage());
            error = protocolError;
        } else {
            log.warn("I/O error on {}, closing connection", ctx.channel().remoteAddress(), root);
            error = new RespTransportException("I/O error: " + root.getMessage(), root);
        }
        failAll(error);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!pending.isEmpty()) {
            log.info("Connection to {} closed with {} pending commands", ctx.channel().remoteAddress(), pending.size());
        }
        failAll(new RespTransportException("Connection closed"));
        super.channelInactive(ctx);
    }

    // 仅用于测试和日志
    int pendingCount() {
        return pending.size();
    }

    private void failAll(RespException error) {
        CompletableFuture<RedisMessage> future;
        while ((future = pending.pollFirst()) != null) {
            future.completeExceptionally(error);
        }
    }
}
