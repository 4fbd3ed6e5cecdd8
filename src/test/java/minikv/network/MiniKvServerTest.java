package minikv.network;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import minikv.Config;
import minikv.MockClientHandler;
import minikv.ServerContext;
import minikv.commands.CommandMetadata;
import minikv.protocol.RespCodec;
import minikv.protocol.RespFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
public class MiniKvServerTest {
    private MiniKvServer server;

    /**
     * Blocking RESP client over a plain socket.
     */
    static class TestClient implements AutoCloseable {
        private final Socket socket;
        private final InputStream in;
        private final OutputStream out;
        private final ByteBuf buffer = Unpooled.buffer();

        TestClient(int port) throws IOException {
            socket = new Socket("127.0.0.1", port);
            socket.setSoTimeout(5000);
            in = socket.getInputStream();
            out = socket.getOutputStream();
        }

        void sendRaw(String raw) throws IOException {
            out.write(raw.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        void send(String... args) throws IOException {
            StringBuilder sb = new StringBuilder("*").append(args.length).append("\r\n");
            for (String arg : args) {
                sb.append('$').append(arg.getBytes(StandardCharsets.UTF_8).length).append("\r\n").append(arg).append("\r\n");
            }
            sendRaw(sb.toString());
        }

        /**
         * @return the next reply rendered as text, or null at end of stream
         */
        String read() throws IOException {
            byte[] chunk = new byte[4096];
            while (true) {
                RespFrame frame = RespCodec.DEFAULT.decode(buffer);
                if (frame != null) {
                    buffer.discardReadBytes();
                    return MockClientHandler.render(frame);
                }
                int n = in.read(chunk);
                if (n < 0) return null;
                buffer.writeBytes(chunk, 0, n);
            }
        }

        String call(String... args) throws IOException {
            send(args);
            return read();
        }

        /**
         * True when the server closed the connection.
         */
        boolean isClosedByServer() throws IOException {
            try {
                return in.read() < 0;
            } catch (SocketTimeoutException e) {
                return false;
            } catch (IOException e) {
                // connection reset
                return true;
            }
        }

        @Override
        public void close() throws IOException {
            buffer.release();
            socket.close();
        }
    }

    private static ServerContext localContext(Config config) {
        config.bind = "127.0.0.1";
        config.port = 0;
        return new ServerContext(config);
    }

    private void startServer(Config config) throws InterruptedException {
        startServer(localContext(config));
    }

    private void startServer(ServerContext context) throws InterruptedException {
        server = new MiniKvServer(context);
        server.start();
    }

    @BeforeEach
    public void setup() throws InterruptedException {
        startServer(new Config());
    }

    @AfterEach
    public void tearDown() {
        server.close();
    }

    @Test
    public void testBasicCommands() throws IOException {
        try (TestClient client = new TestClient(server.getPort())) {
            assertEquals("PONG", client.call("PING"));
            assertEquals("OK", client.call("SET", "a", "1"));
            assertEquals("OK", client.call("SET", "a", "2"));
            assertEquals("2", client.call("GET", "a"));
            assertEquals("3", client.call("RPUSH", "l", "x", "y", "z"));
            assertEquals("[x, y, z]", client.call("LRANGE", "l", "0", "-1"));
        }
    }

    @Test
    public void testPubSubAcrossConnections() throws Exception {
        try (TestClient c1 = new TestClient(server.getPort());
             TestClient c2 = new TestClient(server.getPort());
             TestClient c3 = new TestClient(server.getPort())) {
            assertEquals("[subscribe, news, 1]", c1.call("SUBSCRIBE", "news"));
            assertEquals("[subscribe, news, 1]", c2.call("SUBSCRIBE", "news"));

            assertEquals("2", c3.call("PUBLISH", "news", "hello"));
            assertEquals("[message, news, hello]", c1.read());
            assertEquals("[message, news, hello]", c2.read());

            assertEquals("ERR Can't execute 'get': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context",
                    c1.call("GET", "a"));
        }
    }

    @Test
    public void testMessagesArriveInPublishOrder() throws Exception {
        try (TestClient sub = new TestClient(server.getPort());
             TestClient pub = new TestClient(server.getPort())) {
            sub.call("SUBSCRIBE", "seq");
            for (int i = 0; i < 100; i++) {
                assertEquals("1", pub.call("PUBLISH", "seq", String.valueOf(i)));
            }
            for (int i = 0; i < 100; i++) {
                assertEquals("[message, seq, " + i + "]", sub.read());
            }
        }
    }

    @Test
    public void testMalformedInputClosesConnection() throws IOException {
        try (TestClient client = new TestClient(server.getPort())) {
            client.sendRaw("*1\r\n$abc\r\n");
            assertTrue(client.read().startsWith("ERR Protocol error: "));
            assertTrue(client.isClosedByServer());
        }
        // Other clients are unaffected
        try (TestClient client = new TestClient(server.getPort())) {
            assertEquals("PONG", client.call("PING"));
        }
    }

    @Test
    public void testQuitClosesConnection() throws IOException {
        try (TestClient client = new TestClient(server.getPort())) {
            assertEquals("OK", client.call("QUIT"));
            assertTrue(client.isClosedByServer());
        }
    }

    @Test
    public void testMaxClientsRefusal() throws Exception {
        server.close();
        Config config = new Config();
        config.maxClients = 1;
        startServer(config);

        try (TestClient first = new TestClient(server.getPort())) {
            assertEquals("PONG", first.call("PING"));
            try (TestClient second = new TestClient(server.getPort())) {
                assertEquals(ClientHandler.MAX_CLIENTS_REACHED, second.read());
                assertTrue(second.isClosedByServer());
            }
            assertEquals("PONG", first.call("PING"));
        }
    }

    @Test
    public void testDisconnectedSubscriberIsForgotten() throws Exception {
        try (TestClient sub = new TestClient(server.getPort())) {
            sub.call("SUBSCRIBE", "gone");
        }
        ServerContext context = server.getContext();
        long deadline = System.currentTimeMillis() + 5000;
        while (context.getPubSub().getNumSub("gone") > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, context.getPubSub().getNumSub("gone"));
    }

    @Test
    public void testPushesFollowPublishOrderAcrossEventLoops() throws Exception {
        server.close();
        Config config = new Config();
        config.workerThreads = 2;
        ServerContext context = localContext(config);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        // Parks the calling event loop until released
        context.getDispatcher().getRegistry().register("HOLD", (client, args) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            client.sendOk();
        }, CommandMetadata.of(1, 0, 0, 0));
        startServer(context);

        // Channels are spread round-robin: the subscriber and the second publisher share a loop
        try (TestClient subscriber = new TestClient(server.getPort());
             TestClient remote = new TestClient(server.getPort());
             TestClient local = new TestClient(server.getPort())) {
            assertEquals("[subscribe, ch, 1]", subscriber.call("SUBSCRIBE", "ch"));

            local.sendRaw("*1\r\n$4\r\nHOLD\r\n*3\r\n$7\r\nPUBLISH\r\n$2\r\nch\r\n$2\r\nm2\r\n");
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            try {
                assertEquals("1", remote.call("PUBLISH", "ch", "m1"));
            } finally {
                release.countDown();
            }
            assertEquals("OK", local.read());
            assertEquals("1", local.read());

            assertEquals("[message, ch, m1]", subscriber.read());
            assertEquals("[message, ch, m2]", subscriber.read());
        }
    }
}
