package miniredis.client;

import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import miniredis.error.ErrorKind;
import miniredis.error.MiniRedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Blocking line client. Each {@link #send(String)} writes one command line and waits for
 * the single response line the server sends back.
 */
public class MiniRedisClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(MiniRedisClient.class);

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;

    private MiniRedisClient(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public static MiniRedisClient connect(String address) throws MiniRedisException {
        HostAndPort hostAndPort = HostAndPort.fromString(address);
        Preconditions.checkArgument(hostAndPort.hasPort(), "address needs a port: %s", address);
        return connect(hostAndPort.getHost(), hostAndPort.getPort());
    }

    public static MiniRedisClient connect(String host, int port) throws MiniRedisException {
        Socket socket = null;
        try {
            socket = new Socket(host, port);
            logger.debug("Connected to {}:{}", host, port);
            return new MiniRedisClient(socket);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new MiniRedisException(ErrorKind.STREAM_NOT_CONNECTED, "Could not connect to " + host + ":" + port, e);
        }
    }

    /**
     * Sends one command and returns the response line without its terminator.
     *
     * @throws IllegalArgumentException if the line is blank, since the server never answers one
     * @throws MiniRedisException       if the connection fails or the server closes it
     */
    public String send(String line) throws MiniRedisException {
        Preconditions.checkArgument(line != null && !line.isBlank(), "blank lines get no response");
        Preconditions.checkArgument(line.indexOf('\n') < 0, "one command per line");

        try {
            writer.write(line);
            writer.write('\n');
        } catch (IOException e) {
            throw new MiniRedisException(ErrorKind.STREAM_NOT_WRITABLE, "Could not write command", e);
        }
        try {
            writer.flush();
        } catch (IOException e) {
            throw new MiniRedisException(ErrorKind.STREAM_NOT_FLUSHED, "Could not flush command", e);
        }

        String response;
        try {
            response = reader.readLine();
        } catch (IOException e) {
            throw new MiniRedisException(ErrorKind.STREAM_NOT_READABLE, "Could not read response", e);
        }
        if (response == null) {
            throw new MiniRedisException(ErrorKind.STREAM_CLOSED, "Server closed the connection");
        }
        return response;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private static void closeQuietly(Socket socket) {
        if (socket == null) return;
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Failed to close socket", e);
        }
    }
}
