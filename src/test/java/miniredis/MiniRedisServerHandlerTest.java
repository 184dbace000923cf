package miniredis;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.ReferenceCountUtil;
import miniredis.command.CommandDispatcher;
import miniredis.datastore.InMemoryKeyValueStore;
import miniredis.error.StoreLockedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MiniRedisServerHandlerTest {

    private static final int MAX_LINE = 64;

    private CommandDispatcher dispatcher;
    private EmbeddedChannel channel;

    @BeforeEach
    void setup() {
        dispatcher = new CommandDispatcher(new InMemoryKeyValueStore());
        channel = newChannel();
    }

    @AfterEach
    void teardown() {
        channel.finishAndReleaseAll();
    }

    private EmbeddedChannel newChannel() {
        EmbeddedChannel embedded = new EmbeddedChannel();
        MiniRedisServer.addLineCodec(embedded.pipeline(), MAX_LINE);
        embedded.pipeline().addLast(new MiniRedisServerHandler(dispatcher));
        return embedded;
    }

    private void send(String text) {
        channel.writeInbound(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    private String readResponse() {
        ByteBuf out = channel.readOutbound();
        if (out == null) {
            return null;
        }
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    void test_setThenGet() {
        send("SET k v\n");
        assertEquals("OK\n", readResponse());

        send("GET k\n");
        assertEquals("v\n", readResponse());
    }

    @Test
    void test_missingKeyIsNil() {
        send("GET nothing\n");
        assertEquals("nil\n", readResponse());
    }

    @Test
    void test_crlfTerminatedLines() {
        send("SET k v\r\nGET k\r\n");
        assertEquals("OK\n", readResponse());
        assertEquals("v\n", readResponse());
    }

    @Test
    void test_pipelinedCommandsAnsweredInOrder() {
        send("SET a 1\nSET a 2\nGET a\nDEL a\nGET a\n");
        assertEquals("OK\n", readResponse());
        assertEquals("OK\n", readResponse());
        assertEquals("2\n", readResponse());
        assertEquals("OK\n", readResponse());
        assertEquals("nil\n", readResponse());
        assertNull(readResponse());
    }

    @Test
    void test_lineSplitAcrossReads() {
        send("SET spl");
        assertNull(readResponse());
        send("it value\n");
        assertEquals("OK\n", readResponse());
    }

    @Test
    void test_blankLinesGetNoResponse() {
        send("\n   \n\t\n");
        assertNull(readResponse());
        assertTrue(channel.isOpen());

        send("GET k\n");
        assertEquals("nil\n", readResponse());
    }

    @Test
    void test_errorsAreRenderedAsResponseLines() {
        send("FOO bar\n");
        assertEquals("Invalid command: FOO\n", readResponse());

        send("SET only_key\n");
        assertEquals("Invalid arguments: [only_key]\n", readResponse());

        send("GET\n");
        assertEquals("Invalid arguments: []\n", readResponse());
        assertTrue(channel.isOpen());
    }

    @Test
    void test_overlongLineClosesConnection() {
        send("SET k " + "x".repeat(MAX_LINE * 2));
        channel.runPendingTasks();
        assertFalse(channel.isOpen());
    }

    @Test
    void test_writeFailureClosesConnection() {
        channel.finishAndReleaseAll();
        channel = newChannel();
        channel.pipeline().addFirst(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("broken pipe"));
            }
        });

        send("SET k v\n");
        channel.runPendingTasks();
        assertFalse(channel.isOpen());
    }

    @Test
    void test_storeFailureIsAnsweredAndConnectionStaysOpen() {
        channel.finishAndReleaseAll();
        dispatcher = new CommandDispatcher(new InMemoryKeyValueStore() {
            @Override
            public Optional<String> get(String key) throws StoreLockedException {
                if (key.equals("locked")) {
                    throw new StoreLockedException(new InterruptedException());
                }
                return super.get(key);
            }
        });
        channel = newChannel();

        send("GET locked\n");
        assertEquals("Store is locked\n", readResponse());
        assertTrue(channel.isOpen());

        send("SET k v\nGET k\n");
        assertEquals("OK\n", readResponse());
        assertEquals("v\n", readResponse());
    }

    @Test
    void test_inputShutdownAnswersQueuedLinesThenCloses() {
        send("SET a 1\nGET a\n");
        channel.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
        channel.runPendingTasks();

        assertEquals("OK\n", readResponse());
        assertEquals("1\n", readResponse());
        assertFalse(channel.isOpen());
    }

    @Test
    void test_unterminatedLastLineIsAnsweredAtEndOfInput() {
        send("SET a 1\nGET a");
        assertEquals("OK\n", readResponse());
        assertNull(readResponse());

        channel.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
        channel.runPendingTasks();

        assertEquals("1\n", readResponse());
        assertFalse(channel.isOpen());
    }

    @Test
    void test_invalidUtf8ClosesConnection() {
        channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{'G', 'E', 'T', ' ', (byte) 0xff, (byte) 0xfe, '\n'}));
        channel.runPendingTasks();

        assertNull(readResponse());
        assertFalse(channel.isOpen());
    }
}
