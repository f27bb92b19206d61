package org.muma.mini.resp.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.Test;
import org.muma.mini.resp.config.RedisClientConfig;
import org.muma.mini.resp.exception.RespTransportException;
import org.muma.mini.resp.protocol.Command;
import org.muma.mini.resp.protocol.RedisMessage;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 不走真实 TCP，把 EmbeddedChannel 直接挂到 RedisConnection 上
 */
class RedisConnectionTest {

    // 所有写出都以 I/O 错误失败，模拟对端已经断开
    private static class BrokenPipe extends ChannelOutboundHandlerAdapter {
        @Override
        public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
            ReferenceCountUtil.release(msg);
            promise.setFailure(new IOException("Broken pipe"));
        }
    }

    private RedisConnection attach(EmbeddedChannel channel) {
        RedisConnection connection = new RedisConnection(new RedisClientConfig(), null);
        assertTrue(connection.onConnected(channel, "embedded", 0));
        return connection;
    }

    @Test
    void testWriteFailureFailsCommandAndClosesConnection() {
        EmbeddedChannel channel = new EmbeddedChannel(new BrokenPipe());
        RedisConnection connection = attach(channel);
        assertEquals(ConnectionState.CONNECTED, connection.getState());

        CompletableFuture<RedisMessage> reply = connection.execute(Command.of("PING"));

        ExecutionException e = assertThrows(ExecutionException.class, reply::get);
        RespTransportException error = assertInstanceOf(RespTransportException.class, e.getCause());
        assertInstanceOf(IOException.class, error.getCause());
        assertFalse(channel.isOpen());
        assertEquals(ConnectionState.CLOSED, connection.getState());
    }

    @Test
    void testCancelClosesConnection() {
        EmbeddedChannel channel = new EmbeddedChannel(new RedisClientHandler());
        RedisConnection connection = attach(channel);

        CompletableFuture<RedisMessage> reply = connection.execute(Command.of("GET", "k"));
        assertFalse(reply.isDone());

        reply.cancel(true);

        assertFalse(channel.isOpen());
        assertEquals(ConnectionState.CLOSED, connection.getState());
    }

    @Test
    void testCloseBeforeConnectedRejectsLateChannel() {
        RedisConnection connection = new RedisConnection(new RedisClientConfig(), null);
        connection.close();

        EmbeddedChannel channel = new EmbeddedChannel();
        assertFalse(connection.onConnected(channel, "embedded", 0));
        assertFalse(channel.isOpen());
        assertEquals(ConnectionState.CLOSED, connection.getState());
    }
}
