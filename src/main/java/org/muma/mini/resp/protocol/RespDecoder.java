package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.muma.mini.resp.exception.RespProtocolException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 回复解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时回滚到本条回复的起点，等下一批字节到达后重新解析。
 * 因此任意位置的 TCP 分片都不会影响解析结果。
 * <p>
 * 代价：replay 的粒度是一条完整的顶层回复 (每解出一条，ReplayingDecoder 自动记下新的起点)。
 * 一条很大的数组回复如果分成很多片到达，每来一片都要从数组开头重新解析一遍，
 * 总开销大约是回复大小的平方。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    // 与 Redis 的 proto-max-bulk-len 默认值一致
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;

    // 单行 (+ - : 以及长度行) 的默认上限，与 Redis 的 inline 上限一致
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    // 数组嵌套层数上限，超过即视为协议错误，避免递归解析把栈打爆
    static final int MAX_NESTING_DEPTH = 1024;

    private static final int SNIPPET_LENGTH = 64;

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final int maxBulkLength;
    private final int maxLineLength;

    // 出现过协议错误后，流的位置已不可信，之后的字节全部丢弃
    private boolean failed;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH);
    }

    public RespDecoder(int maxBulkLength) {
        this(maxBulkLength, DEFAULT_MAX_LINE_LENGTH);
    }

    public RespDecoder(int maxBulkLength, int maxLineLength) {
        if (maxBulkLength <= 0) {
            throw new IllegalArgumentException("maxBulkLength must be positive: " + maxBulkLength);
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.maxBulkLength = maxBulkLength;
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(actualReadableBytes());
            return;
        }
        try {
            out.add(readMessage(in, 0));
        } catch (RespProtocolException e) {
            failed = true;
            in.skipBytes(actualReadableBytes());
            throw e;
        }
    }

    // 读取下一个完整的 RedisMessage，数组元素递归调用；depth 是外层数组的层数
    private RedisMessage readMessage(ByteBuf in, int depth) {
        // 1. 读取类型标识字节
        byte typeByte = in.readByte();

        // 2. 根据类型分发处理
        return switch (typeByte) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in, depth);
            default -> throw unknownType(typeByte, in);
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL; // Null Bulk String
        }
        if (length < -1 || length > maxBulkLength) {
            throw new RespProtocolException("Invalid bulk string length: " + length);
        }

        // 先切片再拷贝，数据不足时 replay 不会白白分配大数组
        ByteBuf payload = in.readSlice((int) length);
        byte[] content = ByteBufUtil.getBytes(payload);

        // 读取末尾的 CRLF
        readCRLF(in);

        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in, int depth) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespProtocolException("Array nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
        long count = readLong(in);
        if (count == -1) {
            return new RedisArray(null); // Null Array
        }
        if (count < -1 || count > Integer.MAX_VALUE - 8) {
            throw new RespProtocolException("Invalid array length: " + count);
        }

        // count 来自对端，不按它预分配
        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, 16));
        for (int i = 0; i < count; i++) {
            elements.add(readMessage(in, depth + 1));
        }
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    // 读取一行 (到 \n 为止)，去掉结尾的 \r\n 或单独的 \n
    private String readLine(ByteBuf in) {
        ByteBuf buffer = internalBuffer();
        int available = buffer.writerIndex() - in.readerIndex();
        if (available > maxLineLength && buffer.bytesBefore(in.readerIndex(), maxLineLength, LF) < 0) {
            throw new RespProtocolException("Line exceeds " + maxLineLength + " bytes without terminator");
        }

        // 找不到 \n 时这里会触发 replay
        int length = in.bytesBefore(LF);
        byte[] bytes = new byte[length];
        in.readBytes(bytes);
        in.skipBytes(1);

        int end = length > 0 && bytes[length - 1] == CR ? length - 1 : length;
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    // 读取并解析长整型
    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Invalid integer: '" + s + "'", e);
        }
    }

    // 跳过 CRLF，必须严格是 \r\n
    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException("Expected CRLF after bulk string payload");
        }
    }

    private RespProtocolException unknownType(byte typeByte, ByteBuf in) {
        int n = Math.min(actualReadableBytes(), SNIPPET_LENGTH);
        String snippet = in.toString(in.readerIndex(), n, StandardCharsets.UTF_8);
        return new RespProtocolException(String.format("Unknown RESP type byte: '%c' (0x%02x), following: '%s'",
                (char) (typeByte & 0xFF), typeByte & 0xFF, snippet));
    }
}
