package miniredis.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LineBasedFrameDecoder;

import java.util.List;

/**
 * Splits the stream on {@code \n} or {@code \r\n}. When input ends, bytes left after the last
 * terminator are emitted as one final line instead of being dropped.
 */
public class TrailingLineFrameDecoder extends LineBasedFrameDecoder {

    public TrailingLineFrameDecoder(int maxLength) {
        super(maxLength);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            out.add(in.readRetainedSlice(in.readableBytes()));
        }
    }
}
