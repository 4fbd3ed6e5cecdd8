package minikv.commands;

import minikv.commands.connection.EchoCommand;
import minikv.commands.connection.PingCommand;
import minikv.commands.connection.QuitCommand;
import minikv.commands.generic.DelCommand;
import minikv.commands.generic.ExistsCommand;
import minikv.commands.generic.ExpireCommand;
import minikv.commands.generic.KeysCommand;
import minikv.commands.generic.PersistCommand;
import minikv.commands.generic.TtlCommand;
import minikv.commands.generic.TypeCommand;
import minikv.commands.hash.HDelCommand;
import minikv.commands.hash.HExistsCommand;
import minikv.commands.hash.HGetAllCommand;
import minikv.commands.hash.HGetCommand;
import minikv.commands.hash.HKeysCommand;
import minikv.commands.hash.HLenCommand;
import minikv.commands.hash.HMGetCommand;
import minikv.commands.hash.HSetCommand;
import minikv.commands.hash.HValsCommand;
import minikv.commands.list.LIndexCommand;
import minikv.commands.list.LLenCommand;
import minikv.commands.list.LPopCommand;
import minikv.commands.list.LPushCommand;
import minikv.commands.list.LRangeCommand;
import minikv.commands.list.RPopCommand;
import minikv.commands.list.RPushCommand;
import minikv.commands.pubsub.PSubscribeCommand;
import minikv.commands.pubsub.PUnsubscribeCommand;
import minikv.commands.pubsub.PubSubCommand;
import minikv.commands.pubsub.PublishCommand;
import minikv.commands.pubsub.SubscribeCommand;
import minikv.commands.pubsub.UnsubscribeCommand;
import minikv.commands.server.DbSizeCommand;
import minikv.commands.server.FlushDbCommand;
import minikv.commands.server.InfoCommand;
import minikv.commands.set.SAddCommand;
import minikv.commands.set.SCardCommand;
import minikv.commands.set.SIsMemberCommand;
import minikv.commands.set.SMembersCommand;
import minikv.commands.set.SRemCommand;
import minikv.commands.string.AppendCommand;
import minikv.commands.string.DecrByCommand;
import minikv.commands.string.DecrCommand;
import minikv.commands.string.GetCommand;
import minikv.commands.string.GetSetCommand;
import minikv.commands.string.IncrByCommand;
import minikv.commands.string.IncrCommand;
import minikv.commands.string.MGetCommand;
import minikv.commands.string.MSetCommand;
import minikv.commands.string.SetCommand;
import minikv.commands.string.SetNxCommand;
import minikv.commands.string.StrLenCommand;
import minikv.commands.zset.ZAddCommand;
import minikv.commands.zset.ZCardCommand;
import minikv.commands.zset.ZRangeCommand;
import minikv.commands.zset.ZRankCommand;
import minikv.commands.zset.ZRemCommand;
import minikv.commands.zset.ZScoreCommand;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static minikv.commands.CommandMetadata.FLAG_PUBSUB_CONTEXT;
import static minikv.commands.CommandMetadata.FLAG_READONLY;
import static minikv.commands.CommandMetadata.FLAG_WRITE;

/**
 * Verb table. Lookups are case-insensitive.
 */
public class CommandRegistry {
    private final Map<String, CommandContainer> commands = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public void register(String name, Command command, CommandMetadata metadata) {
        commands.put(name, new CommandContainer(name.toUpperCase(), command, metadata));
    }

    public CommandContainer get(String name) {
        return commands.get(name);
    }

    public Collection<CommandContainer> all() {
        return Collections.unmodifiableCollection(commands.values());
    }

    public int size() {
        return commands.size();
    }

    /**
     * Registry holding every verb the server supports.
     */
    public static CommandRegistry standard() {
        CommandRegistry r = new CommandRegistry();

        // String
        r.register("GET", new GetCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("SET", new SetCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("SETNX", new SetNxCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("GETSET", new GetSetCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("INCR", new IncrCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_WRITE));
        r.register("DECR", new DecrCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_WRITE));
        r.register("INCRBY", new IncrByCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("DECRBY", new DecrByCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("APPEND", new AppendCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("STRLEN", new StrLenCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("MGET", new MGetCommand(), CommandMetadata.of(-2, 1, -1, 1, FLAG_READONLY));
        r.register("MSET", new MSetCommand(), CommandMetadata.of(-3, 1, -1, 2, FLAG_WRITE));

        // List
        r.register("LPUSH", new LPushCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("RPUSH", new RPushCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("LPOP", new LPopCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_WRITE));
        r.register("RPOP", new RPopCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_WRITE));
        r.register("LRANGE", new LRangeCommand(), CommandMetadata.of(4, 1, 1, 1, FLAG_READONLY));
        r.register("LLEN", new LLenCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("LINDEX", new LIndexCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));

        // Hash
        r.register("HSET", new HSetCommand(), CommandMetadata.of(-4, 1, 1, 1, FLAG_WRITE));
        r.register("HGET", new HGetCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));
        r.register("HDEL", new HDelCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("HGETALL", new HGetAllCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("HMGET", new HMGetCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_READONLY));
        r.register("HEXISTS", new HExistsCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));
        r.register("HLEN", new HLenCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("HKEYS", new HKeysCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("HVALS", new HValsCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));

        // Set
        r.register("SADD", new SAddCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("SREM", new SRemCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("SMEMBERS", new SMembersCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("SISMEMBER", new SIsMemberCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));
        r.register("SCARD", new SCardCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));

        // Sorted set
        r.register("ZADD", new ZAddCommand(), CommandMetadata.of(-4, 1, 1, 1, FLAG_WRITE));
        r.register("ZSCORE", new ZScoreCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));
        r.register("ZREM", new ZRemCommand(), CommandMetadata.of(-3, 1, 1, 1, FLAG_WRITE));
        r.register("ZRANGE", new ZRangeCommand(), CommandMetadata.of(-4, 1, 1, 1, FLAG_READONLY));
        r.register("ZCARD", new ZCardCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("ZRANK", new ZRankCommand(), CommandMetadata.of(3, 1, 1, 1, FLAG_READONLY));

        // Keyspace
        r.register("DEL", new DelCommand(), CommandMetadata.of(-2, 1, -1, 1, FLAG_WRITE));
        r.register("EXISTS", new ExistsCommand(), CommandMetadata.of(-2, 1, -1, 1, FLAG_READONLY));
        r.register("TYPE", new TypeCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("EXPIRE", new ExpireCommand(1000), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("PEXPIRE", new ExpireCommand(1), CommandMetadata.of(3, 1, 1, 1, FLAG_WRITE));
        r.register("TTL", new TtlCommand(false), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("PTTL", new TtlCommand(true), CommandMetadata.of(2, 1, 1, 1, FLAG_READONLY));
        r.register("PERSIST", new PersistCommand(), CommandMetadata.of(2, 1, 1, 1, FLAG_WRITE));
        r.register("KEYS", new KeysCommand(), CommandMetadata.of(2, 0, 0, 0, FLAG_READONLY));

        // Server
        r.register("DBSIZE", new DbSizeCommand(), CommandMetadata.of(1, 0, 0, 0, FLAG_READONLY));
        r.register("FLUSHDB", new FlushDbCommand(), CommandMetadata.of(1, 0, 0, 0, FLAG_WRITE));
        r.register("INFO", new InfoCommand(), CommandMetadata.of(-1, 0, 0, 0));

        // Connection
        r.register("PING", new PingCommand(), CommandMetadata.of(-1, 0, 0, 0, FLAG_PUBSUB_CONTEXT));
        r.register("ECHO", new EchoCommand(), CommandMetadata.of(2, 0, 0, 0));
        r.register("QUIT", new QuitCommand(), CommandMetadata.of(1, 0, 0, 0, FLAG_PUBSUB_CONTEXT));

        // Pub/Sub
        r.register("SUBSCRIBE", new SubscribeCommand(), CommandMetadata.of(-2, 0, 0, 0, FLAG_PUBSUB_CONTEXT));
        r.register("UNSUBSCRIBE", new UnsubscribeCommand(), CommandMetadata.of(-1, 0, 0, 0, FLAG_PUBSUB_CONTEXT));
        r.register("PSUBSCRIBE", new PSubscribeCommand(), CommandMetadata.of(-2, 0, 0, 0, FLAG_PUBSUB_CONTEXT));
        r.register("PUNSUBSCRIBE", new PUnsubscribeCommand(), CommandMetadata.of(-1, 0, 0, 0, FLAG_PUBSUB_CONTEXT));
        r.register("PUBLISH", new PublishCommand(), CommandMetadata.of(3, 0, 0, 0));
        r.register("PUBSUB", new PubSubCommand(), CommandMetadata.of(-2, 0, 0, 0));

        return r;
    }
}
