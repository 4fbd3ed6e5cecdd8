package minikv.server;

import minikv.db.Database;
import minikv.utils.MockClock;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class JanitorTest {

    @Test
    public void testCycleKeepsSweepingWhileManyKeysExpire() {
        MockClock clock = new MockClock();
        Database db = new Database(clock, 0);
        for (int i = 0; i < 100; i++) {
            db.set("k" + i, "v".getBytes(StandardCharsets.UTF_8), clock.currentTimeMillis() + 5, false, false);
        }
        clock.advance(10);

        Janitor janitor = new Janitor(db, 100);
        int removed = janitor.runCycle();
        // Every sample is fully expired, so the cycle does not stop after the first batch
        assertEquals(100, removed);
        assertEquals(100, db.getExpiredKeys());
        assertEquals(0, db.size());
    }

    @Test
    public void testCycleStopsEarlyWhenFewKeysExpire() {
        MockClock clock = new MockClock();
        Database db = new Database(clock, 0);
        for (int i = 0; i < 100; i++) {
            db.set("k" + i, "v".getBytes(StandardCharsets.UTF_8));
        }
        Janitor janitor = new Janitor(db, 100);
        assertEquals(0, janitor.runCycle());
        assertEquals(100, db.size());
    }

    @Test
    public void testScheduledSweepRemovesExpiredKeys() throws InterruptedException {
        Database db = new Database();
        db.set("gone", "v".getBytes(StandardCharsets.UTF_8), System.currentTimeMillis() + 20, false, false);
        Janitor janitor = new Janitor(db, 10);
        janitor.start();
        try {
            long deadline = System.currentTimeMillis() + 5000;
            while (db.getExpiredKeys() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            janitor.stop();
        }
        assertEquals(1, db.getExpiredKeys());
        assertEquals(0, db.size());
    }
}
