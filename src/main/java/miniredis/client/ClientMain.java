package miniredis.client;

import miniredis.ServerConfig;
import miniredis.error.MiniRedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Interactive terminal client. {@code quit} ends the session locally and is never sent.
 */
public class ClientMain {

    private static final Logger logger = LoggerFactory.getLogger(ClientMain.class);

    static final String QUIT = "quit";
    static final String PROMPT = "> ";

    public static void main(String[] args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.contains("--help") || arguments.contains("-h")) {
            printHelp();
            return;
        }

        String address = arguments.isEmpty()
                ? ServerConfig.DEFAULT_HOST + ":" + ServerConfig.DEFAULT_PORT
                : arguments.get(0);

        try (MiniRedisClient client = MiniRedisClient.connect(address)) {
            run(client, new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
        } catch (MiniRedisException | IOException | IllegalArgumentException e) {
            logger.error("Client failed: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Reads lines until end of input or {@code quit}, printing one response per command.
     */
    static void run(MiniRedisClient client, Reader input, PrintStream out) throws IOException, MiniRedisException {
        BufferedReader lines = new BufferedReader(input);
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = lines.readLine();
            if (line == null || line.trim().equals(QUIT)) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            out.println(client.send(line.trim()));
        }
    }

    static void printHelp() {
        System.out.println("MiniRedis Client");
        System.out.println();
        System.out.println("Connects to a MiniRedis server and sends commands typed at the prompt.");
        System.out.println();
        System.out.println("USAGE:");
        System.out.println("    miniredis-client [ADDRESS]");
        System.out.println();
        System.out.println("ARGS:");
        System.out.println("    <ADDRESS>    The server address [default: "
                + ServerConfig.DEFAULT_HOST + ":" + ServerConfig.DEFAULT_PORT + "]");
        System.out.println();
        System.out.println("COMMANDS:");
        System.out.println("    GET <key>            Prints the value, or nil");
        System.out.println("    SET <key> <value>    Stores the value");
        System.out.println("    DEL <key>            Removes the key");
        System.out.println("    quit                 Exits the client");
    }
}
