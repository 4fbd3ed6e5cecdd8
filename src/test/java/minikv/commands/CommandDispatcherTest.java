package minikv.commands;

import minikv.MockClientHandler;
import minikv.db.WrongTypeException;
import minikv.network.ClientHandler;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespInteger;
import minikv.protocol.RespSimpleString;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class CommandDispatcherTest extends CommandTestSupport {

    @Test
    public void testUnknownCommand() {
        assertEquals("ERR unknown command 'FOO'", run("FOO", "bar"));
        assertEquals(0, context.getTotalCommands().get());
    }

    @Test
    public void testVerbIsCaseInsensitive() {
        assertEquals("OK", run("set", "k", "v"));
        assertEquals("v", run("gEt", "k"));
    }

    @Test
    public void testWrongArity() {
        assertEquals("ERR wrong number of arguments for 'get' command", run("GET"));
        assertEquals("ERR wrong number of arguments for 'get' command", run("GET", "a", "b"));
        assertEquals("ERR wrong number of arguments for 'set' command", run("SET", "k"));
        assertEquals("ERR wrong number of arguments for 'mset' command", run("MSET", "a", "1", "b"));
        assertEquals("ERR wrong number of arguments for 'hset' command", run("HSET", "h", "f", "v", "g"));
    }

    @Test
    public void testNonArrayFrameIsRejected() {
        context.getDispatcher().dispatch(client, new RespSimpleString("PING"));
        assertEquals(CommandDispatcher.NOT_A_COMMAND, client.lastError);
    }

    @Test
    public void testArrayWithNonBulkElementIsRejected() {
        context.getDispatcher().dispatch(client, RespArray.of(RespBulkString.of("GET"), RespInteger.of(1)));
        assertEquals(CommandDispatcher.NOT_A_COMMAND, client.lastError);

        client.reset();
        context.getDispatcher().dispatch(client, RespArray.of(RespBulkString.of("GET"), RespBulkString.NULL));
        assertEquals(CommandDispatcher.NOT_A_COMMAND, client.lastError);

        client.reset();
        context.getDispatcher().dispatch(client, RespArray.NULL);
        assertEquals(CommandDispatcher.NOT_A_COMMAND, client.lastError);
    }

    @Test
    public void testEmptyArrayIsIgnored() {
        context.getDispatcher().dispatch(client, RespArray.EMPTY);
        assertTrue(client.frames.isEmpty());
    }

    @Test
    public void testWrongTypeReply() {
        run("LPUSH", "l", "a");
        assertEquals(WrongTypeException.MESSAGE, run("GET", "l"));
        assertEquals(WrongTypeException.MESSAGE, run("HSET", "l", "f", "v"));
        // The failed write left the list untouched
        assertEquals("[a]", run("LRANGE", "l", "0", "-1"));
    }

    @Test
    public void testSubscribedModeRestrictsCommands() {
        assertEquals("[subscribe, news, 1]", run("SUBSCRIBE", "news"));
        assertTrue(client.isSubscribed());

        assertEquals("ERR Can't execute 'get': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context",
                run("GET", "k"));
        assertEquals("[pong, ]", run("PING"));
        assertEquals("[pong, hi]", run("PING", "hi"));
        assertEquals("[psubscribe, n*, 2]", run("PSUBSCRIBE", "n*"));

        assertEquals("[unsubscribe, news, 1]", run("UNSUBSCRIBE"));
        assertEquals("[punsubscribe, n*, 0]", run("PUNSUBSCRIBE", "n*"));
        assertFalse(client.isSubscribed());

        assertEquals("PONG", run("PING"));
        assertEquals("null", run("GET", "k"));
    }

    @Test
    public void testUnexpectedFailureBecomesErrorReply() {
        CommandRegistry registry = new CommandRegistry();
        registry.register("BOOM", (c, args) -> {
            throw new IllegalStateException("kaboom");
        }, CommandMetadata.of(1, 0, 0, 0));
        registry.register("NPE", (c, args) -> {
            throw new NullPointerException();
        }, CommandMetadata.of(1, 0, 0, 0));
        CommandDispatcher dispatcher = new CommandDispatcher(registry);

        dispatcher.dispatch(client, makeArgs("BOOM"));
        assertEquals("ERR kaboom", client.lastError);
        dispatcher.dispatch(client, makeArgs("NPE"));
        assertEquals("ERR NullPointerException", client.lastError);
    }

    @Test
    public void testCommandsAreCounted() {
        run("SET", "a", "1");
        run("GET", "a");
        run("GET");
        assertEquals(2, context.getTotalCommands().get());
    }

    @Test
    public void testToArgs() {
        assertNull(CommandDispatcher.toArgs(RespInteger.of(3)));
        assertEquals(Collections.emptyList(), CommandDispatcher.toArgs(RespArray.EMPTY));
        assertArrayEquals("x".getBytes(), CommandDispatcher.toArgs(RespArray.of(RespBulkString.of("x"))).get(0));
    }

    @Test
    public void testStandardRegistryCoversEveryVerb() {
        CommandRegistry registry = CommandRegistry.standard();
        for (String verb : Arrays.asList("GET", "SET", "SETNX", "GETSET", "INCR", "DECR", "INCRBY", "DECRBY",
                "APPEND", "STRLEN", "MGET", "MSET", "LPUSH", "RPUSH", "LPOP", "RPOP", "LRANGE", "LLEN", "LINDEX",
                "HSET", "HGET", "HDEL", "HGETALL", "HMGET", "HEXISTS", "HLEN", "HKEYS", "HVALS",
                "SADD", "SREM", "SMEMBERS", "SISMEMBER", "SCARD",
                "ZADD", "ZSCORE", "ZREM", "ZRANGE", "ZCARD", "ZRANK",
                "DEL", "EXISTS", "TYPE", "EXPIRE", "PEXPIRE", "TTL", "PTTL", "PERSIST", "KEYS",
                "DBSIZE", "FLUSHDB", "INFO", "PING", "ECHO", "QUIT",
                "SUBSCRIBE", "UNSUBSCRIBE", "PSUBSCRIBE", "PUNSUBSCRIBE", "PUBLISH", "PUBSUB")) {
            assertNotNull(registry.get(verb), verb);
            assertNotNull(registry.get(verb.toLowerCase()), verb);
        }
    }

    @Test
    public void testClientHandlerWithoutChannelIsNotSubscribed() {
        ClientHandler plain = new MockClientHandler(context);
        assertFalse(plain.isSubscribed());
    }
}
