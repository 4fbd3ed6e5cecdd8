package minikv;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import minikv.protocol.RespCodec;
import minikv.utils.Log;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

/**
 * Server settings, read once at startup from a YAML file. Unknown keys are rejected.
 */
public class Config {
    public static final String DEFAULT_FILE = "minikv.yaml";
    public static final String PORT_ENV = "MINIKV_PORT";

    public String version = "0.1.0";
    public String bind = "0.0.0.0";
    public int port = 6379;
    public int maxClients = 10000;       // 0 = unlimited
    public int workerThreads = 0;        // 0 = Netty default
    public long defaultTtlSeconds = 0;   // 0 = keys never expire by default
    public int pubsubBacklogLimit = 10000;
    public long maxBulkLength = RespCodec.DEFAULT_MAX_BULK_LENGTH;
    public int maxArrayLength = RespCodec.DEFAULT_MAX_ARRAY_LENGTH;
    public long expirySweepIntervalMs = 100;
    public String logLevel = "INFO";

    public static class ConfigException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static Config load(String filename) {
        Config config = new Config();
        File f = new File(filename);

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                JsonNode root = mapper.readTree(f);
                // An empty document has no root node
                if (root != null && !root.isMissingNode() && !root.isNull()) {
                    config = mapper.treeToValue(root, Config.class);
                }
            } catch (IOException e) {
                throw new ConfigException("Failed to parse " + filename + ": " + e.getMessage(), e);
            }
        }

        String envPort = System.getenv(PORT_ENV);
        if (envPort != null && !envPort.isEmpty()) {
            try {
                config.port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(PORT_ENV + " is not a number: " + envPort, e);
            }
        }

        config.validate();
        return config;
    }

    public void validate() {
        if (port < 0 || port > 65535) throw new ConfigException("port out of range: " + port);
        if (bind == null || bind.isEmpty()) throw new ConfigException("bind must not be empty");
        if (maxClients < 0) throw new ConfigException("maxClients must not be negative");
        if (workerThreads < 0) throw new ConfigException("workerThreads must not be negative");
        if (defaultTtlSeconds < 0) throw new ConfigException("defaultTtlSeconds must not be negative");
        if (pubsubBacklogLimit <= 0) throw new ConfigException("pubsubBacklogLimit must be positive");
        if (maxBulkLength <= 0 || maxBulkLength > RespCodec.MAX_BULK_LENGTH_LIMIT) {
            throw new ConfigException("maxBulkLength must be between 1 and " + RespCodec.MAX_BULK_LENGTH_LIMIT);
        }
        if (maxArrayLength <= 0) throw new ConfigException("maxArrayLength must be positive");
        if (expirySweepIntervalMs <= 0) throw new ConfigException("expirySweepIntervalMs must be positive");
        if (logLevel == null || !Arrays.asList("DEBUG", "INFO", "WARN", "ERROR").contains(logLevel.toUpperCase())) {
            throw new ConfigException("Unknown logLevel: " + logLevel);
        }
    }
}
