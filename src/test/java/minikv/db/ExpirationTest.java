package minikv.db;

import minikv.utils.GlobMatcher;
import minikv.utils.MockClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ExpirationTest {

    private MockClock clock;
    private Database db;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @BeforeEach
    public void setup() {
        clock = new MockClock();
        db = new Database(clock, 0);
    }

    @Test
    public void testPassiveExpiration() {
        db.set("exp_key", b("val"), clock.currentTimeMillis() + 100, false, false);
        assertNotNull(db.get("exp_key"));

        clock.advance(100);

        // Passive expire on access
        assertNull(db.get("exp_key"), "Key should have expired");
        assertEquals(0, db.rawSize());
        assertEquals(1, db.getExpiredKeys());
    }

    @Test
    public void testExpiredKeyIsAbsentForWrites() {
        db.push("l", true, Collections.singletonList("old"));
        db.expire("l", 50);
        clock.advance(60);

        // A write starts from scratch, without the old TTL
        assertEquals(1, db.push("l", true, Collections.singletonList("new")));
        assertEquals(Collections.singletonList("new"), db.range("l", 0, -1));
        assertEquals(-1, db.ttlMillis("l"));
    }

    @Test
    public void testExpiredKeyHiddenFromKeysAndSize() {
        db.set("a", b("1"));
        db.set("b", b("2"));
        db.expire("b", 10);
        clock.advance(10);
        assertEquals(1, db.size());
        assertEquals(Collections.singletonList("a"), db.keys(new GlobMatcher("*")));
        assertFalse(db.exists("b"));
    }

    @Test
    public void testTtlReporting() {
        assertEquals(-2, db.ttlMillis("missing"));
        db.set("k", b("v"));
        assertEquals(-1, db.ttlMillis("k"));
        assertTrue(db.expire("k", 5000));
        assertEquals(5000, db.ttlMillis("k"));
        clock.advance(1500);
        assertEquals(3500, db.ttlMillis("k"));
        assertTrue(db.persist("k"));
        assertFalse(db.persist("k"));
        assertEquals(-1, db.ttlMillis("k"));
    }

    @Test
    public void testExpireOnMissingKey() {
        assertFalse(db.expire("missing", 1000));
        assertFalse(db.exists("missing"));
    }

    @Test
    public void testNonPositiveTtlDeletes() {
        db.set("k", b("v"));
        assertTrue(db.expire("k", 0));
        assertFalse(db.exists("k"));
        assertEquals(0, db.rawSize());
    }

    @Test
    public void testIncrKeepsTtl() {
        db.set("n", b("1"));
        db.expire("n", 1000);
        db.incrBy("n", 1);
        assertEquals(1000, db.ttlMillis("n"));
    }

    @Test
    public void testSetWithoutExpiryClearsTtl() {
        db.set("k", b("v"), clock.currentTimeMillis() + 1000, false, false);
        db.set("k", b("w"));
        assertEquals(-1, db.ttlMillis("k"));
    }

    @Test
    public void testDefaultTtlAppliesToNewKeys() {
        Database withDefault = new Database(clock, 60);
        withDefault.set("s", b("v"));
        withDefault.sadd("set", Collections.singletonList("m"));
        assertEquals(60_000, withDefault.ttlMillis("s"));
        assertEquals(60_000, withDefault.ttlMillis("set"));

        // Adding to an existing key does not refresh the expiry
        clock.advance(10_000);
        withDefault.sadd("set", Collections.singletonList("n"));
        assertEquals(50_000, withDefault.ttlMillis("set"));

        // SET without EX/PX goes back to the default
        withDefault.set("s", b("again"));
        assertEquals(60_000, withDefault.ttlMillis("s"));

        clock.advance(60_000);
        assertNull(withDefault.get("s"));
        assertFalse(withDefault.exists("set"));
    }

    @Test
    public void testSweepRemovesOnlyExpired() {
        for (int i = 0; i < 30; i++) {
            db.set("tmp" + i, b("v"), clock.currentTimeMillis() + 10, false, false);
        }
        db.set("keep", b("v"));
        clock.advance(20);

        int removed = 0;
        for (int pass = 0; pass < 5; pass++) {
            removed += db.sweepExpired(20);
        }
        assertEquals(30, removed);
        assertEquals(1, db.rawSize());
        assertNotNull(db.get("keep"));
    }
}
