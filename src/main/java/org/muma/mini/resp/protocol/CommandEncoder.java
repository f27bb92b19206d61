package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.muma.mini.resp.utils.RespCodecUtil;

/**
 * 请求编码器：Command -> multi-bulk 字节流
 */
public class CommandEncoder extends MessageToByteEncoder<Command> {

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, Command msg, boolean preferDirect) {
        int size = RespCodecUtil.estimateSize(msg);
        return preferDirect ? ctx.alloc().ioBuffer(size) : ctx.alloc().heapBuffer(size);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Command msg, ByteBuf out) {
        RespCodecUtil.writeCommand(out, msg);
    }
}
