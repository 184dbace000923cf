package miniredis.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes a framed line as UTF-8. Malformed input is a read failure, never replaced
 * with substitute characters.
 */
public class Utf8LineDecoder extends MessageToMessageDecoder<ByteBuf> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) {
        if (!ByteBufUtil.isText(msg, StandardCharsets.UTF_8)) {
            throw new CorruptedFrameException("line is not valid UTF-8");
        }
        out.add(msg.toString(StandardCharsets.UTF_8));
    }
}
