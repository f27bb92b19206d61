package org.muma.mini.resp.utils;

import io.netty.buffer.ByteBuf;
import org.muma.mini.resp.protocol.Command;

import java.nio.charset.StandardCharsets;

/**
 * RESP 请求编码工具类
 * 所有命令统一使用 multi-bulk 形式: *<argc>\r\n 后跟 argc 个 $<len>\r\n<bytes>\r\n
 */
public final class RespCodecUtil {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespCodecUtil() {
    }

    public static void writeCommand(ByteBuf out, Command command) {
        // *<count>\r\n
        out.writeByte('*');
        writeDecimal(out, command.size());
        out.writeBytes(CRLF);

        for (byte[] arg : command.args()) {
            // $<length>\r\n<data>\r\n，长度是字节数而不是字符数
            out.writeByte('$');
            writeDecimal(out, arg.length);
            out.writeBytes(CRLF);
            out.writeBytes(arg);
            out.writeBytes(CRLF);
        }
    }

    // 预估编码后的字节数，用于分配 ByteBuf
    public static int estimateSize(Command command) {
        int size = 16;
        for (byte[] arg : command.args()) {
            size += arg.length + 16;
        }
        return size;
    }

    private static void writeDecimal(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
    }
}
