package minikv.commands.generic;

import minikv.commands.CommandException;
import minikv.commands.CommandTestSupport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class GenericCommandsTest extends CommandTestSupport {

    @Test
    public void testDelAndExists() {
        run("MSET", "a", "1", "b", "2");
        assertEquals("3", run("EXISTS", "a", "b", "a", "c"));
        assertEquals("2", run("DEL", "a", "b", "c"));
        assertEquals("0", run("EXISTS", "a", "b"));
    }

    @Test
    public void testType() {
        run("SET", "s", "v");
        run("RPUSH", "l", "v");
        run("HSET", "h", "f", "v");
        run("SADD", "st", "v");
        run("ZADD", "z", "1", "v");
        assertEquals("string", run("TYPE", "s"));
        assertEquals("list", run("TYPE", "l"));
        assertEquals("hash", run("TYPE", "h"));
        assertEquals("set", run("TYPE", "st"));
        assertEquals("zset", run("TYPE", "z"));
        assertEquals("none", run("TYPE", "missing"));
    }

    @Test
    public void testExpireTtlAndPersist() {
        run("SET", "k", "v");
        assertEquals("-1", run("TTL", "k"));
        assertEquals("-2", run("TTL", "missing"));
        assertEquals("-2", run("PTTL", "missing"));

        assertEquals("1", run("EXPIRE", "k", "100"));
        assertEquals("100", run("TTL", "k"));
        assertEquals("100000", run("PTTL", "k"));
        clock.advance(40_400);
        // 59.6 seconds rounds up
        assertEquals("60", run("TTL", "k"));

        assertEquals("1", run("PERSIST", "k"));
        assertEquals("0", run("PERSIST", "k"));
        assertEquals("-1", run("TTL", "k"));
        assertEquals("0", run("EXPIRE", "missing", "10"));
    }

    @Test
    public void testPexpireAndLazyExpiry() {
        run("SET", "k", "v");
        assertEquals("1", run("PEXPIRE", "k", "500"));
        clock.advance(500);
        assertEquals("null", run("GET", "k"));
        assertEquals("0", run("EXISTS", "k"));
        assertEquals(1, context.getDatabase().getExpiredKeys());
    }

    @Test
    public void testNonPositiveExpireDeletes() {
        run("SET", "k", "v");
        assertEquals("1", run("EXPIRE", "k", "0"));
        assertEquals("0", run("EXISTS", "k"));
        run("SET", "j", "v");
        assertEquals("1", run("EXPIRE", "j", "-10"));
        assertEquals("-2", run("TTL", "j"));
    }

    @Test
    public void testExpireArgumentErrors() {
        run("SET", "k", "v");
        assertEquals(CommandException.NOT_AN_INTEGER, run("EXPIRE", "k", "soon"));
        assertEquals("ERR invalid expire time in 'expire' command",
                run("EXPIRE", "k", String.valueOf(Long.MAX_VALUE)));
        assertEquals("-1", run("TTL", "k"));
    }

    @Test
    public void testKeys() {
        run("MSET", "user:1", "a", "user:2", "b", "order:1", "c");
        String[] keys = run("KEYS", "user:*").replace("[", "").replace("]", "").split(", ");
        Arrays.sort(keys);
        assertArrayEquals(new String[]{"user:1", "user:2"}, keys);
        assertEquals("[order:1]", run("KEYS", "order:?"));
        assertEquals("[]", run("KEYS", "nothing*"));
    }

    @Test
    public void testExpiredKeysAreHiddenFromKeys() {
        run("SET", "short", "v", "PX", "10");
        run("SET", "long", "v");
        clock.advance(10);
        assertEquals("[long]", run("KEYS", "*"));
    }
}
