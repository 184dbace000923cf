package miniredis;

import miniredis.error.AddressNotBoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.contains("--help") || arguments.contains("-h")) {
            printHelp();
            return;
        }

        ServerConfig config = ServerConfig.load();
        if (!arguments.isEmpty()) {
            try {
                config.withAddress(arguments.get(0));
            } catch (IllegalArgumentException e) {
                logger.error("Invalid address {}: {}", arguments.get(0), e.getMessage());
                System.exit(1);
            }
        }

        MiniRedisServer server = new MiniRedisServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "miniredis-shutdown"));
        try {
            server.start();
            server.awaitTermination();
        } catch (AddressNotBoundException e) {
            logger.error("Server failed: {}", e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Interrupted, shutting down");
        } finally {
            server.close();
        }
    }

    static void printHelp() {
        System.out.println("MiniRedis Server");
        System.out.println();
        System.out.println("Starts the MiniRedis server and listens for client connections.");
        System.out.println();
        System.out.println("USAGE:");
        System.out.println("    miniredis-server [ADDRESS]");
        System.out.println();
        System.out.println("ARGS:");
        System.out.println("    <ADDRESS>    The address to listen on [default: "
                + ServerConfig.DEFAULT_HOST + ":" + ServerConfig.DEFAULT_PORT + "]");
        System.out.println();
        System.out.println("EXAMPLES:");
        System.out.println("    miniredis-server 127.0.0.1:6379");
        System.out.println("    miniredis-server --help");
    }
}
