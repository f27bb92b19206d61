package org.muma.mini.resp.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import lombok.Getter;
import org.muma.mini.resp.config.RedisClientConfig;
import org.muma.mini.resp.exception.RespTransportException;
import org.muma.mini.resp.protocol.Command;
import org.muma.mini.resp.protocol.CommandEncoder;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.RespDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 一条到服务端的 TCP 连接
 * 持有唯一的 Channel，负责建立连接、发送命令、关闭。
 * 请求与回复的配对交给 pipeline 末端的 {@link RedisClientHandler}。
 */
public class RedisConnection {

    private static final Logger log = LoggerFactory.getLogger(RedisConnection.class);

    private final RedisClientConfig config;
    private final EventLoopGroup group;

    @Getter
    private volatile ConnectionState state = ConnectionState.UNCONNECTED;

    private volatile Channel channel;
    // 一个连接对象只允许 connect 一次
    private boolean connectStarted;

    public RedisConnection(RedisClientConfig config, EventLoopGroup group) {
        this.config = config;
        this.group = group;
    }

    /**
     * 建立连接。没有握手，TCP 连上即可用。
     * 失败时连接进入 CLOSED，future 以 {@link RespTransportException} 结束。
     */
    public synchronized CompletableFuture<Void> connect(String host, int port) {
        if (connectStarted || state != ConnectionState.UNCONNECTED) {
            throw new IllegalStateException("Connection already used, state: " + state);
        }
        connectStarted = true;

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, config.isTcpNoDelay())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (config.isWireLogging()) {
                            p.addLast(new LoggingHandler(LogLevel.DEBUG));
                        }
                        p.addLast(new RespDecoder(config.getMaxBulkLength(), config.getMaxLineLength()))
                                .addLast(new CommandEncoder())
                                .addLast(new RedisClientHandler());
                    }
                });

        CompletableFuture<Void> result = new CompletableFuture<>();
        b.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                if (onConnected(future.channel(), host, port)) {
                    result.complete(null);
                } else {
                    result.completeExceptionally(new RespTransportException("Connection closed while connecting"));
                }
            } else {
                state = ConnectionState.CLOSED;
                log.warn("Failed to connect to {}:{}: {}", host, port, future.cause().toString());
                result.completeExceptionally(
                        new RespTransportException("Failed to connect to " + host + ":" + port, future.cause()));
            }
        });
        return result;
    }

    // 包可见：测试里直接挂上 EmbeddedChannel
    boolean onConnected(Channel ch, String host, int port) {
        synchronized (this) {
            // connect 过程中已被 close
            if (state == ConnectionState.CLOSED) {
                ch.close();
                return false;
            }
            this.channel = ch;
            this.state = ConnectionState.CONNECTED;
        }
        log.info("Connected to {}:{}", host, port);
        ch.closeFuture().addListener((ChannelFutureListener) f -> {
            state = ConnectionState.CLOSED;
            log.info("Connection to {}:{} closed", host, port);
        });
        return true;
    }

    /**
     * 发送一条命令，返回它的回复。
     * 未连接或已关闭时立即失败；调用方取消 future 会关闭连接，因为回复可能读了一半。
     */
    public CompletableFuture<RedisMessage> execute(Command command) {
        Channel ch = this.channel;
        if (state != ConnectionState.CONNECTED || ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new RespTransportException("Connection is not open, state: " + state));
        }

        CompletableFuture<RedisMessage> reply = new CompletableFuture<>();
        reply.whenComplete((r, e) -> {
            if (reply.isCancelled()) {
                close("command cancelled");
            }
        });

        ch.writeAndFlush(new PendingCommand(command, reply)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(new RespTransportException("Failed to write " + command, future.cause()));
                future.channel().close();
            }
        });
        return reply;
    }

    public void close() {
        close("closed by caller");
    }

    void close(String reason) {
        Channel ch;
        synchronized (this) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            state = ConnectionState.CLOSED;
            ch = this.channel;
        }
        log.info("Closing connection: {}", reason);
        if (ch != null) {
            ChannelFuture closed = ch.close();
            // 在 EventLoop 线程上 (例如异步回调里) 不能阻塞等待
            if (!ch.eventLoop().inEventLoop()) {
                closed.syncUninterruptibly();
            }
        }
    }
}
