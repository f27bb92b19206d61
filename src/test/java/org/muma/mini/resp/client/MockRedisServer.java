package org.muma.mini.resp.client;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.ErrorMessage;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisInteger;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.RespDecoder;
import org.muma.mini.resp.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 测试用的最小 RESP 服务端
 * 支持 PING / ECHO / SET / GET / INCR / DEL，数据放在内存 Map 里。
 * silent 模式下只收不回，用来模拟卡死的对端；fragment 模式下回复逐字节 flush。
 */
class MockRedisServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MockRedisServer.class);

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final Map<String, byte[]> data = new ConcurrentHashMap<>();
    private final boolean silent;
    private final boolean fragment;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    MockRedisServer() {
        this(false, false);
    }

    MockRedisServer(boolean silent, boolean fragment) {
        this.silent = silent;
        this.fragment = fragment;
    }

    MockRedisServer start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new CommandHandler());
                    }
                });

        // 端口 0：由系统分配空闲端口
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
        log.info("Mock server listening on {}", serverChannel.localAddress());
        return this;
    }

    int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private class CommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
            if (silent) {
                return;
            }
            if (!(msg instanceof RedisArray array) || array.size() == 0) {
                send(ctx, new ErrorMessage("ERR protocol error: expected array"));
                return;
            }
            send(ctx, execute(array));
        }

        private RedisMessage execute(RedisArray array) {
            String name = ((BulkString) array.get(0)).asString().toUpperCase(Locale.ROOT);
            int argc = array.size();
            switch (name) {
                case "PING":
                    return new SimpleString("PONG");
                case "ECHO":
                    return argc == 2 ? array.get(1) : wrongArgs(name);
                case "SET":
                    if (argc != 3) return wrongArgs(name);
                    data.put(arg(array, 1), ((BulkString) array.get(2)).content());
                    return new SimpleString("OK");
                case "GET":
                    if (argc != 2) return wrongArgs(name);
                    return new BulkString(data.get(arg(array, 1)));
                case "DEL":
                    if (argc != 2) return wrongArgs(name);
                    return new RedisInteger(data.remove(arg(array, 1)) == null ? 0 : 1);
                case "INCR":
                    if (argc != 2) return wrongArgs(name);
                    return incr(arg(array, 1));
                default:
                    return new ErrorMessage("ERR unknown command '" + name + "'");
            }
        }

        private RedisMessage incr(String key) {
            synchronized (data) {
                byte[] old = data.get(key);
                long value;
                try {
                    value = old == null ? 0 : Long.parseLong(new String(old, StandardCharsets.UTF_8));
                } catch (NumberFormatException e) {
                    return new ErrorMessage("ERR value is not an integer or out of range");
                }
                value++;
                data.put(key, Long.toString(value).getBytes(StandardCharsets.UTF_8));
                return new RedisInteger(value);
            }
        }

        private String arg(RedisArray array, int index) {
            return ((BulkString) array.get(index)).asString();
        }

        private RedisMessage wrongArgs(String name) {
            return new ErrorMessage("ERR wrong number of arguments for '" + name.toLowerCase(Locale.ROOT) + "' command");
        }

        private void send(ChannelHandlerContext ctx, RedisMessage reply) {
            ByteBuf buf = ctx.alloc().buffer();
            writeReply(buf, reply);
            if (!fragment) {
                ctx.writeAndFlush(buf);
                return;
            }
            try {
                while (buf.isReadable()) {
                    ctx.writeAndFlush(buf.readRetainedSlice(1));
                }
            } finally {
                buf.release();
            }
        }
    }

    // 服务端方向的回复编码，客户端不需要
    private static void writeReply(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            out.writeBytes(String.valueOf(i.value()).getBytes(StandardCharsets.US_ASCII));
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNull()) {
                out.writeBytes("-1".getBytes(StandardCharsets.US_ASCII));
                out.writeBytes(CRLF);
            } else {
                out.writeBytes(String.valueOf(b.content().length).getBytes(StandardCharsets.US_ASCII));
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            out.writeBytes(String.valueOf(a.isNull() ? -1 : a.size()).getBytes(StandardCharsets.US_ASCII));
            out.writeBytes(CRLF);
            for (int i = 0; i < a.size(); i++) {
                writeReply(out, a.get(i));
            }
        }
    }
}
