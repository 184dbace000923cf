package miniredis;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import miniredis.command.CommandDispatcher;
import miniredis.error.ErrorKind;
import miniredis.error.MiniRedisException;
import miniredis.lexer.Lexer;
import miniredis.parser.Parser;
import miniredis.parser.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Per-connection handler. Receives one decoded line at a time, runs it through the lexer,
 * parser and dispatcher, and writes back exactly one response line. Blank lines get no answer.
 * Transport failures close this channel only; end of input closes it after the pending answers.
 */
public class MiniRedisServerHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(MiniRedisServerHandler.class);

    static final String LINE_TERMINATOR = "\n";

    private final CommandDispatcher dispatcher;
    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser();

    public MiniRedisServerHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("Connection opened: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        List<String> tokens = lexer.tokenize(line);
        Optional<Request> request = parser.parse(tokens);
        if (request.isEmpty()) {
            return;
        }

        String response;
        try {
            response = dispatcher.dispatch(request.get());
        } catch (MiniRedisException e) {
            logger.debug("{} from {}: {}", e.kind(), ctx.channel().remoteAddress(), e.getMessage());
            response = e.getMessage();
        }

        ctx.writeAndFlush(response + LINE_TERMINATOR).addListener(new CloseOnWriteFailure());
    }

    /**
     * The client shut down its write side. Lines read before that are answered first, since
     * this event is queued behind them; the channel closes once the last response is flushed.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            logger.debug("Input shut down by {}", ctx.channel().remoteAddress());
            ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("{}: {}", ErrorKind.STREAM_CLOSED, ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException || cause instanceof CorruptedFrameException) {
            logger.warn("{} from {}: {}", ErrorKind.STREAM_NOT_READABLE, ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            logger.warn("{} from {}", ErrorKind.STREAM_NOT_READABLE, ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private static final class CloseOnWriteFailure implements ChannelFutureListener {
        @Override
        public void operationComplete(ChannelFuture future) {
            if (!future.isSuccess()) {
                logger.warn("{} to {}", ErrorKind.STREAM_NOT_WRITABLE, future.channel().remoteAddress(), future.cause());
                future.channel().close();
            }
        }
    }
}
