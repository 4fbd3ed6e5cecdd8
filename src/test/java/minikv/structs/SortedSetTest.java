package minikv.structs;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SortedSetTest {

    @Test
    public void testScoreUpdate() {
        SortedSet zset = new SortedSet();

        assertEquals(1, zset.add(10.0, "A"));
        assertEquals(1, zset.size());
        assertEquals(10.0, zset.score("A"));

        // Update A: 20
        assertEquals(0, zset.add(20.0, "A"));
        assertEquals(1, zset.size()); // Size should remain 1
        assertEquals(20.0, zset.score("A"));

        // Ensure no ghost node at 10.0
        List<ZNode> all = zset.range(0, 0);
        assertEquals(1, all.size());
        assertEquals(new ZNode(20.0, "A"), all.get(0));
    }

    @Test
    public void testOrderByScoreThenMember() {
        SortedSet zset = new SortedSet();
        zset.add(2, "b");
        zset.add(1, "z");
        zset.add(2, "a");
        zset.add(Double.NEGATIVE_INFINITY, "low");

        List<ZNode> range = zset.range(0, 3);
        assertEquals("low", range.get(0).member);
        assertEquals("z", range.get(1).member);
        assertEquals("a", range.get(2).member);
        assertEquals("b", range.get(3).member);

        assertEquals(0, zset.rank("low"));
        assertEquals(2, zset.rank("a"));
        assertEquals(3, zset.rank("b"));
        assertEquals(-1, zset.rank("missing"));
    }

    @Test
    public void testRemove() {
        SortedSet zset = new SortedSet();
        zset.add(1, "a");
        zset.add(2, "b");
        assertTrue(zset.remove("a"));
        assertFalse(zset.remove("a"));
        assertNull(zset.score("a"));
        assertEquals(0, zset.rank("b"));
        assertEquals(1, zset.range(0, 10).size());
        assertTrue(zset.remove("b"));
        assertTrue(zset.isEmpty());
    }

    @Test
    public void testSubRange() {
        SortedSet zset = new SortedSet();
        for (int i = 0; i < 10; i++) zset.add(i, "m" + i);
        List<ZNode> mid = zset.range(3, 5);
        assertEquals(3, mid.size());
        assertEquals("m3", mid.get(0).member);
        assertEquals("m5", mid.get(2).member);
    }
}
