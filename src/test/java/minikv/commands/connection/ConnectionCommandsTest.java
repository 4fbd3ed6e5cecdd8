package minikv.commands.connection;

import minikv.commands.CommandTestSupport;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespSimpleString;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionCommandsTest extends CommandTestSupport {

    @Test
    public void testPing() {
        run("PING");
        assertEquals(RespSimpleString.PONG, client.last());
        run("PING", "hello");
        assertEquals(RespBulkString.of("hello"), client.last());
        assertEquals("ERR wrong number of arguments for 'ping' command", run("PING", "a", "b"));
    }

    @Test
    public void testEcho() {
        assertEquals("hi there", run("ECHO", "hi there"));
        assertEquals("ERR wrong number of arguments for 'echo' command", run("ECHO"));
    }

    @Test
    public void testQuitRepliesThenCloses() {
        assertEquals("OK", run("QUIT"));
        assertEquals("client sent QUIT", client.closedWith);
        assertTrue(client.isClosing());
    }

    @Test
    public void testQuitIsAllowedWhileSubscribed() {
        run("SUBSCRIBE", "c");
        assertEquals("OK", run("QUIT"));
        assertTrue(client.isClosing());
    }
}
