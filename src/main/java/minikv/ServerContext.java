package minikv;

import minikv.commands.CommandDispatcher;
import minikv.commands.CommandRegistry;
import minikv.db.Database;
import minikv.protocol.RespCodec;
import minikv.utils.Time;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by every session of one server instance.
 */
public class ServerContext {
    private final Config config;
    private final Time.Clock clock;
    private final Database database;
    private final PubSub pubSub;
    private final RespCodec codec;
    private final CommandDispatcher dispatcher;
    private final long startTime;

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong rejectedConnections = new AtomicLong();
    private final AtomicLong totalCommands = new AtomicLong();
    private final AtomicLong nextClientId = new AtomicLong();

    public ServerContext(Config config) {
        this(config, Time.SYSTEM_CLOCK);
    }

    public ServerContext(Config config, Time.Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(clock, config.defaultTtlSeconds);
        this.pubSub = new PubSub();
        this.codec = new RespCodec(config.maxBulkLength, config.maxArrayLength);
        this.dispatcher = new CommandDispatcher(CommandRegistry.standard());
        this.startTime = clock.currentTimeMillis();
    }

    public Config getConfig() {
        return config;
    }

    public Time.Clock getClock() {
        return clock;
    }

    public Database getDatabase() {
        return database;
    }

    public PubSub getPubSub() {
        return pubSub;
    }

    public RespCodec getCodec() {
        return codec;
    }

    public CommandDispatcher getDispatcher() {
        return dispatcher;
    }

    public String getVersion() {
        return config.version;
    }

    public long getUptime() {
        return clock.currentTimeMillis() - startTime;
    }

    public String getOsName() {
        return System.getProperty("os.name");
    }

    public String getOsArch() {
        return System.getProperty("os.arch");
    }

    public String getJavaVersion() {
        return System.getProperty("java.version");
    }

    public AtomicInteger getActiveConnections() {
        return activeConnections;
    }

    public AtomicLong getTotalConnections() {
        return totalConnections;
    }

    public AtomicLong getRejectedConnections() {
        return rejectedConnections;
    }

    public AtomicLong getTotalCommands() {
        return totalCommands;
    }

    public long nextClientId() {
        return nextClientId.incrementAndGet();
    }

    public long getUsedMemory() {
        return Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();
    }
}
