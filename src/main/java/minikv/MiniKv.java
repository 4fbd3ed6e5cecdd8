package minikv;

import minikv.network.MiniKvServer;
import minikv.utils.Log;

/**
 * Entry point: {@code java -jar minikv.jar [config.yaml]}.
 */
public class MiniKv {

    public static void printBanner(Config config) {
        Log.info("\n" +
                "           _       _ _           \n" +
                "  _ __ ___ (_)_ __ (_) | ____   __\n" +
                " | '_ ` _ \\| | '_ \\| | |/ /\\ \\ / /\n" +
                " | | | | | | | | | | |   <  \\ V / \n" +
                " |_| |_| |_|_|_| |_|_|_|\\_\\  \\_/  \n" +
                "                                  \n" +
                " :: MiniKV ::       (v" + config.version + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " \n");
    }

    public static void main(String[] args) {
        String path = args.length > 0 ? args[0] : Config.DEFAULT_FILE;

        Config config;
        try {
            config = Config.load(path);
        } catch (Config.ConfigException e) {
            Log.error("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        Log.setLevel(config.logLevel);
        printBanner(config);

        MiniKvServer server = new MiniKvServer(new ServerContext(config));
        try {
            server.start();
        } catch (Exception e) {
            Log.error("Failed to bind " + config.bind + ":" + config.port + ": " + e.getMessage());
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));

        Log.info("Ready on " + config.bind + ":" + server.getPort());
        Log.info("Max clients: " + (config.maxClients == 0 ? "Unlimited" : String.valueOf(config.maxClients))
                + ", default TTL: " + (config.defaultTtlSeconds == 0 ? "none" : config.defaultTtlSeconds + "s"));
        try {
            server.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.close();
        }
    }
}
