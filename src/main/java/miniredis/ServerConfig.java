package miniredis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.net.HostAndPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_RESOURCE = "miniredis.yaml";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;

    public String host = DEFAULT_HOST;
    public int port = DEFAULT_PORT;
    // longest accepted command line in bytes, terminator excluded
    public int maxLineLength = 64 * 1024;
    // 0 lets Netty pick (2 * cores)
    public int ioThreads = 0;
    public int dispatchThreads = 16;

    public ServerConfig() {
    }

    public static ServerConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Reads defaults from a YAML resource on the classpath. A missing or broken resource
     * is not fatal: the built-in defaults apply.
     */
    public static ServerConfig load(String resource) {
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Config resource {} not found. Using defaults.", resource);
                return new ServerConfig();
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            ServerConfig config = mapper.readValue(in, ServerConfig.class);
            return config == null ? new ServerConfig() : config;
        } catch (IOException e) {
            logger.warn("Failed to read config resource {} ({}). Using defaults.", resource, e.getMessage());
            return new ServerConfig();
        }
    }

    /**
     * Overrides host and port from a {@code host:port} address. A bare host keeps the current port.
     *
     * @throws IllegalArgumentException if the address cannot be parsed
     */
    public ServerConfig withAddress(String address) {
        HostAndPort hostAndPort = HostAndPort.fromString(address).withDefaultPort(port);
        this.host = hostAndPort.getHost();
        this.port = hostAndPort.getPort();
        return this;
    }

    public String address() {
        return HostAndPort.fromParts(host, port).toString();
    }
}
