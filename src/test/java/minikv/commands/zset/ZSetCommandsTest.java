package minikv.commands.zset;

import minikv.commands.CommandException;
import minikv.commands.CommandTestSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ZSetCommandsTest extends CommandTestSupport {

    @Test
    public void testAddAndRange() {
        assertEquals("3", run("ZADD", "z", "2", "b", "1", "a", "3", "c"));
        assertEquals("[a, b, c]", run("ZRANGE", "z", "0", "-1"));
        assertEquals("[a, 1, b, 2]", run("ZRANGE", "z", "0", "1", "WITHSCORES"));
        assertEquals("3", run("ZCARD", "z"));
    }

    @Test
    public void testUpdatingScoreReordersMember() {
        run("ZADD", "z", "1", "a", "2", "b");
        assertEquals("0", run("ZADD", "z", "5", "a"));
        assertEquals("[b, a]", run("ZRANGE", "z", "0", "-1"));
        assertEquals("5", run("ZSCORE", "z", "a"));
        assertEquals("1", run("ZRANK", "z", "a"));
        assertEquals("0", run("ZRANK", "z", "b"));
        assertEquals("null", run("ZRANK", "z", "x"));
    }

    @Test
    public void testEqualScoresOrderByMember() {
        run("ZADD", "z", "1", "c", "1", "a", "1", "b");
        assertEquals("[a, b, c]", run("ZRANGE", "z", "0", "-1"));
    }

    @Test
    public void testScoresFormatting() {
        run("ZADD", "z", "1.5", "a", "-inf", "low", "+inf", "high");
        assertEquals("1.5", run("ZSCORE", "z", "a"));
        assertEquals("[low, -inf, a, 1.5, high, inf]", run("ZRANGE", "z", "0", "-1", "withscores"));
        assertEquals("null", run("ZSCORE", "z", "missing"));
    }

    @Test
    public void testInvalidArguments() {
        assertEquals(CommandException.NOT_A_FLOAT, run("ZADD", "z", "abc", "a"));
        assertEquals(CommandException.NOT_A_FLOAT, run("ZADD", "z", "nan", "a"));
        assertEquals(CommandException.SYNTAX, run("ZADD", "z", "1", "a", "2"));
        assertEquals(CommandException.SYNTAX, run("ZRANGE", "z", "0", "1", "BOGUS"));
        // A bad score anywhere leaves the key untouched
        assertEquals(CommandException.NOT_A_FLOAT, run("ZADD", "z", "1", "a", "x", "b"));
        assertEquals("0", run("ZCARD", "z"));
    }

    @Test
    public void testRemove() {
        run("ZADD", "z", "1", "a", "2", "b");
        assertEquals("1", run("ZREM", "z", "a", "nope"));
        assertEquals("1", run("ZREM", "z", "b"));
        assertEquals("0", run("EXISTS", "z"));
    }
}
