package minikv.commands.list;

import minikv.commands.CommandException;
import minikv.commands.CommandTestSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ListCommandsTest extends CommandTestSupport {

    @Test
    public void testPushAndRange() {
        assertEquals("3", run("LPUSH", "l", "a", "b", "c"));
        assertEquals("[c, b, a]", run("LRANGE", "l", "0", "-1"));
        assertEquals("5", run("RPUSH", "l", "d", "e"));
        assertEquals("[c, b, a, d, e]", run("LRANGE", "l", "0", "-1"));
        assertEquals("[a, d]", run("LRANGE", "l", "2", "3"));
        assertEquals("[d, e]", run("LRANGE", "l", "-2", "100"));
        assertEquals("[]", run("LRANGE", "l", "4", "1"));
        assertEquals("[]", run("LRANGE", "missing", "0", "-1"));
    }

    @Test
    public void testPopFromBothEnds() {
        run("RPUSH", "l", "a", "b", "c");
        assertEquals("a", run("LPOP", "l"));
        assertEquals("c", run("RPOP", "l"));
        assertEquals("1", run("LLEN", "l"));
        assertEquals("b", run("LPOP", "l"));
        assertEquals("null", run("LPOP", "l"));
        // Emptied lists disappear
        assertEquals("0", run("EXISTS", "l"));
        assertEquals("none", run("TYPE", "l"));
    }

    @Test
    public void testIndex() {
        run("RPUSH", "l", "a", "b", "c");
        assertEquals("a", run("LINDEX", "l", "0"));
        assertEquals("c", run("LINDEX", "l", "-1"));
        assertEquals("null", run("LINDEX", "l", "3"));
        assertEquals("null", run("LINDEX", "l", "-4"));
        assertEquals(CommandException.NOT_AN_INTEGER, run("LINDEX", "l", "x"));
    }

    @Test
    public void testLenOfMissingList() {
        assertEquals("0", run("LLEN", "nope"));
    }
}
