package org.muma.mini.resp.client;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.mini.resp.config.RedisClientConfig;
import org.muma.mini.resp.exception.RespException;
import org.muma.mini.resp.exception.RespTimeoutException;
import org.muma.mini.resp.exception.RespTransportException;
import org.muma.mini.resp.protocol.Command;
import org.muma.mini.resp.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * RESP 客户端入口
 * <p>
 * 所有命令最终都走 {@link #send(Command)}：编码 -> 写出 -> flush -> 解码一条回复。
 * get / set / incr 只是拼参数的便捷方法。
 * <p>
 * 线程安全：多个线程可以共用一个客户端，每个调用拿到的都是自己那条命令的回复。
 * 服务端的 "-ERR" 回复以 {@link org.muma.mini.resp.protocol.ErrorMessage} 返回，不抛异常；
 * 传输错误、协议错误和超时抛出 {@link RespException} 的子类，并且连接随之关闭。
 */
public class RedisClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisClient.class);

    private final RedisClientConfig config;
    private final RedisConnection connection;
    // 客户端自己创建的 EventLoopGroup，close 时关闭
    private final EventLoopGroup ownedGroup;

    public RedisClient() {
        this(new RedisClientConfig());
    }

    public RedisClient(RedisClientConfig config) {
        this.config = config;
        this.ownedGroup = new NioEventLoopGroup(config.getIoThreads(),
                new DefaultThreadFactory("resp-client-io", true));
        this.connection = new RedisConnection(config, ownedGroup);
    }

    RedisClient(RedisClientConfig config, RedisConnection connection) {
        this.config = config;
        this.connection = connection;
        this.ownedGroup = null;
    }

    public void connect() {
        connect(config.getHost(), config.getPort());
    }

    public void connect(String host, int port) {
        await(connection.connect(host, port), "CONNECT " + host + ":" + port);
    }

    // --- Generic ---

    public RedisMessage send(String... args) {
        return send(Command.of(args));
    }

    public RedisMessage send(byte[]... args) {
        return send(Command.of(args));
    }

    public RedisMessage send(Command command) {
        return await(sendAsync(command), command.name());
    }

    /**
     * 异步发送。future 被取消时连接会被关闭。
     */
    public CompletableFuture<RedisMessage> sendAsync(Command command) {
        return connection.execute(command);
    }

    // --- Convenience ---

    public RedisMessage get(String key) {
        return send("GET", key);
    }

    public RedisMessage set(String key, String value) {
        return send("SET", key, value);
    }

    public RedisMessage incr(String key) {
        return send("INCR", key);
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    @Override
    public void close() {
        connection.close();
        if (ownedGroup != null) {
            ownedGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    // 把 future 的受检异常翻译成 RespException
    private <T> T await(CompletableFuture<T> future, String what) {
        long timeout = config.getCommandTimeoutMillis();
        try {
            return timeout > 0 ? future.get(timeout, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            // 回复可能已读了一半，连接不能再用
            log.warn("{} timed out after {} ms, closing connection", what, timeout);
            connection.close("command timed out");
            future.cancel(false);
            throw new RespTimeoutException(what + " timed out after " + timeout + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.close("caller interrupted");
            future.cancel(false);
            throw new RespTransportException(what + " interrupted", e);
        } catch (CancellationException e) {
            throw new RespTransportException(what + " cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RespException respException) {
                throw respException;
            }
            throw new RespTransportException(what + " failed: " + cause, cause);
        }
    }
}
