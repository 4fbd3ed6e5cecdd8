package minikv.db;

import minikv.structs.SortedSet;
import minikv.structs.ZNode;
import minikv.utils.ByteStrings;
import minikv.utils.GlobMatcher;
import minikv.utils.Time;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * The keyspace. Every operation on a key runs inside that key's
 * {@link ConcurrentHashMap#compute} section, so operations on one key are linearized
 * and never touch another key. An expired key is treated as absent and removed when touched.
 */
public class Database {
    private final ConcurrentHashMap<String, ValueEntry> store = new ConcurrentHashMap<>();
    private final Time.Clock clock;
    private final long defaultTtlMillis;

    private final AtomicLong keyspaceHits = new AtomicLong();
    private final AtomicLong keyspaceMisses = new AtomicLong();
    private final AtomicLong expiredKeys = new AtomicLong();

    // Only the janitor thread advances this
    private Iterator<Map.Entry<String, ValueEntry>> sweepCursor;

    public Database() {
        this(Time.SYSTEM_CLOCK, 0);
    }

    /**
     * @param defaultTtlSeconds expiry applied to keys created without one; 0 for none
     */
    public Database(Time.Clock clock, long defaultTtlSeconds) {
        this.clock = clock;
        this.defaultTtlMillis = defaultTtlSeconds * 1000;
    }

    // ---------------------------------------------------------------- core helpers

    private long defaultExpireAt(long now) {
        return defaultTtlMillis > 0 ? now + defaultTtlMillis : ValueEntry.NO_EXPIRY;
    }

    /**
     * Runs {@code reader} against the live entry of {@code key} holding {@code type}.
     * Returns {@code ifAbsent} when the key is missing or expired.
     */
    @SuppressWarnings("unchecked")
    private <T> T read(String key, DataType type, Function<ValueEntry, T> reader, T ifAbsent) {
        final long now = clock.currentTimeMillis();
        final Object[] ret = {ifAbsent};
        final boolean[] found = {false};
        store.computeIfPresent(key, (k, v) -> {
            if (v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                return null;
            }
            if (type != null) v.checkType(type);
            found[0] = true;
            ret[0] = reader.apply(v);
            return v;
        });
        if (found[0]) keyspaceHits.incrementAndGet();
        else keyspaceMisses.incrementAndGet();
        return (T) ret[0];
    }

    /**
     * Runs {@code mutation} against the entry of {@code key}, creating an empty one of
     * {@code type} first when {@code create} is set. Collections left empty are removed.
     * An exception thrown by the mutation leaves the mapping unchanged.
     */
    @SuppressWarnings("unchecked")
    private <T> T update(String key, DataType type, boolean create, Function<ValueEntry, T> mutation, T ifAbsent) {
        final long now = clock.currentTimeMillis();
        final Object[] ret = {ifAbsent};
        store.compute(key, (k, v) -> {
            if (v != null && v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                v = null;
            }
            if (v == null) {
                if (!create) return null;
                v = ValueEntry.empty(type, defaultExpireAt(now));
            } else {
                v.checkType(type);
            }
            ret[0] = mutation.apply(v);
            return v.isEmptyCollection() ? null : v;
        });
        return (T) ret[0];
    }

    private static String str(byte[] b) {
        return ByteStrings.decode(b);
    }

    /**
     * Resolves a Redis-style inclusive index range against {@code size}.
     *
     * @return {@code {start, stop}} within bounds, or null when the range is empty
     */
    static int[] normalizeRange(long start, long stop, int size) {
        if (start < 0) start += size;
        if (stop < 0) stop += size;
        if (start < 0) start = 0;
        if (stop >= size) stop = size - 1;
        if (start > stop || start >= size) return null;
        return new int[]{(int) start, (int) stop};
    }

    // ---------------------------------------------------------------- strings

    public byte[] get(String key) {
        return read(key, DataType.STRING, ValueEntry::asString, null);
    }

    /**
     * SET semantics: replaces a value of any type.
     *
     * @param expireAt absolute expiry in millis, or {@link ValueEntry#NO_EXPIRY} for the default
     * @return false when the NX/XX condition prevented the write
     */
    public boolean set(String key, byte[] value, long expireAt, boolean nx, boolean xx) {
        final long now = clock.currentTimeMillis();
        final boolean[] written = {false};
        store.compute(key, (k, v) -> {
            if (v != null && v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                v = null;
            }
            boolean exists = v != null;
            if ((nx && exists) || (xx && !exists)) return v;
            written[0] = true;
            return ValueEntry.string(value, expireAt != ValueEntry.NO_EXPIRY ? expireAt : defaultExpireAt(now));
        });
        return written[0];
    }

    public void set(String key, byte[] value) {
        set(key, value, ValueEntry.NO_EXPIRY, false, false);
    }

    public boolean setNx(String key, byte[] value) {
        return set(key, value, ValueEntry.NO_EXPIRY, true, false);
    }

    /**
     * @return the previous string value, or null
     */
    public byte[] getSet(String key, byte[] value) {
        final long now = clock.currentTimeMillis();
        final byte[][] old = {null};
        store.compute(key, (k, v) -> {
            if (v != null && v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                v = null;
            }
            if (v != null) old[0] = v.asString();
            return ValueEntry.string(value, defaultExpireAt(now));
        });
        return old[0];
    }

    /**
     * Adds {@code delta} to the integer held at {@code key} (0 when absent); keeps the expiry.
     */
    public long incrBy(String key, long delta) {
        return update(key, DataType.STRING, true, v -> {
            byte[] current = v.asString();
            long value = current.length == 0 ? 0 : parseLong(current);
            long result;
            try {
                result = Math.addExact(value, delta);
            } catch (ArithmeticException e) {
                throw new StoreException(StoreException.OVERFLOW);
            }
            v.setString(ByteStrings.encode(Long.toString(result)));
            return result;
        }, 0L);
    }

    private static long parseLong(byte[] bytes) {
        String s = str(bytes);
        if (s.isEmpty() || s.length() > 20 || s.charAt(0) == '+') {
            throw new StoreException(StoreException.NOT_AN_INTEGER);
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new StoreException(StoreException.NOT_AN_INTEGER);
        }
    }

    /**
     * @return length of the string after the append
     */
    public int append(String key, byte[] suffix) {
        return update(key, DataType.STRING, true, v -> {
            byte[] current = v.asString();
            byte[] joined = new byte[current.length + suffix.length];
            System.arraycopy(current, 0, joined, 0, current.length);
            System.arraycopy(suffix, 0, joined, current.length, suffix.length);
            v.setString(joined);
            return joined.length;
        }, 0);
    }

    public int strlen(String key) {
        return read(key, DataType.STRING, v -> v.asString().length, 0);
    }

    /**
     * Missing keys and keys of another type read as null.
     */
    public List<byte[]> mget(List<String> keys) {
        List<byte[]> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            ValueEntry entry = entry(key);
            values.add(entry != null && entry.getType() == DataType.STRING ? entry.asString() : null);
        }
        return values;
    }

    public void mset(Map<String, byte[]> pairs) {
        for (Map.Entry<String, byte[]> e : pairs.entrySet()) {
            set(e.getKey(), e.getValue());
        }
    }

    // ---------------------------------------------------------------- lists

    /**
     * @return length of the list after the push
     */
    public int push(String key, boolean left, List<String> values) {
        return update(key, DataType.LIST, true, v -> {
            Deque<String> list = v.asList();
            for (String value : values) {
                if (left) list.addFirst(value);
                else list.addLast(value);
            }
            return list.size();
        }, 0);
    }

    public String pop(String key, boolean left) {
        return update(key, DataType.LIST, false, v -> {
            Deque<String> list = v.asList();
            return left ? list.pollFirst() : list.pollLast();
        }, null);
    }

    public List<String> range(String key, long start, long stop) {
        return read(key, DataType.LIST, v -> {
            Deque<String> list = v.asList();
            int[] bounds = normalizeRange(start, stop, list.size());
            if (bounds == null) return Collections.<String>emptyList();
            List<String> result = new ArrayList<>(bounds[1] - bounds[0] + 1);
            int idx = 0;
            for (String item : list) {
                if (idx > bounds[1]) break;
                if (idx >= bounds[0]) result.add(item);
                idx++;
            }
            return result;
        }, Collections.<String>emptyList());
    }

    public int llen(String key) {
        return read(key, DataType.LIST, v -> v.asList().size(), 0);
    }

    public String lindex(String key, long index) {
        return read(key, DataType.LIST, v -> {
            Deque<String> list = v.asList();
            long idx = index < 0 ? list.size() + index : index;
            if (idx < 0 || idx >= list.size()) return null;
            Iterator<String> it = list.iterator();
            for (long i = 0; i < idx; i++) it.next();
            return it.next();
        }, null);
    }

    // ---------------------------------------------------------------- hashes

    /**
     * @return number of fields that were newly created
     */
    public int hset(String key, Map<String, String> fields) {
        return update(key, DataType.HASH, true, v -> {
            Map<String, String> hash = v.asHash();
            int added = 0;
            for (Map.Entry<String, String> e : fields.entrySet()) {
                if (hash.put(e.getKey(), e.getValue()) == null) added++;
            }
            return added;
        }, 0);
    }

    public String hget(String key, String field) {
        return read(key, DataType.HASH, v -> v.asHash().get(field), null);
    }

    public int hdel(String key, Collection<String> fields) {
        return update(key, DataType.HASH, false, v -> {
            Map<String, String> hash = v.asHash();
            int removed = 0;
            for (String field : fields) {
                if (hash.remove(field) != null) removed++;
            }
            return removed;
        }, 0);
    }

    public Map<String, String> hgetAll(String key) {
        return read(key, DataType.HASH, v -> (Map<String, String>) new LinkedHashMap<>(v.asHash()),
                Collections.<String, String>emptyMap());
    }

    public List<String> hmget(String key, List<String> fields) {
        List<String> missing = new ArrayList<>(Collections.<String>nCopies(fields.size(), null));
        return read(key, DataType.HASH, v -> {
            Map<String, String> hash = v.asHash();
            List<String> values = new ArrayList<>(fields.size());
            for (String field : fields) values.add(hash.get(field));
            return values;
        }, missing);
    }

    public boolean hexists(String key, String field) {
        return read(key, DataType.HASH, v -> v.asHash().containsKey(field), false);
    }

    public int hlen(String key) {
        return read(key, DataType.HASH, v -> v.asHash().size(), 0);
    }

    public List<String> hkeys(String key) {
        return read(key, DataType.HASH, v -> (List<String>) new ArrayList<>(v.asHash().keySet()),
                Collections.<String>emptyList());
    }

    public List<String> hvals(String key) {
        return read(key, DataType.HASH, v -> (List<String>) new ArrayList<>(v.asHash().values()),
                Collections.<String>emptyList());
    }

    // ---------------------------------------------------------------- sets

    public int sadd(String key, Collection<String> members) {
        return update(key, DataType.SET, true, v -> {
            Set<String> set = v.asSet();
            int added = 0;
            for (String m : members) {
                if (set.add(m)) added++;
            }
            return added;
        }, 0);
    }

    public int srem(String key, Collection<String> members) {
        return update(key, DataType.SET, false, v -> {
            Set<String> set = v.asSet();
            int removed = 0;
            for (String m : members) {
                if (set.remove(m)) removed++;
            }
            return removed;
        }, 0);
    }

    public List<String> smembers(String key) {
        return read(key, DataType.SET, v -> (List<String>) new ArrayList<>(v.asSet()),
                Collections.<String>emptyList());
    }

    public boolean sismember(String key, String member) {
        return read(key, DataType.SET, v -> v.asSet().contains(member), false);
    }

    public int scard(String key) {
        return read(key, DataType.SET, v -> v.asSet().size(), 0);
    }

    // ---------------------------------------------------------------- sorted sets

    /**
     * @return number of members that were newly added
     */
    public int zadd(String key, Map<String, Double> scores) {
        return update(key, DataType.ZSET, true, v -> {
            SortedSet zset = v.asZSet();
            int added = 0;
            for (Map.Entry<String, Double> e : scores.entrySet()) {
                added += zset.add(e.getValue(), e.getKey());
            }
            return added;
        }, 0);
    }

    public Double zscore(String key, String member) {
        return read(key, DataType.ZSET, v -> v.asZSet().score(member), null);
    }

    public int zrem(String key, Collection<String> members) {
        return update(key, DataType.ZSET, false, v -> {
            SortedSet zset = v.asZSet();
            int removed = 0;
            for (String m : members) {
                if (zset.remove(m)) removed++;
            }
            return removed;
        }, 0);
    }

    public List<ZNode> zrange(String key, long start, long stop) {
        return read(key, DataType.ZSET, v -> {
            SortedSet zset = v.asZSet();
            int[] bounds = normalizeRange(start, stop, zset.size());
            if (bounds == null) return Collections.<ZNode>emptyList();
            return zset.range(bounds[0], bounds[1]);
        }, Collections.<ZNode>emptyList());
    }

    public int zcard(String key) {
        return read(key, DataType.ZSET, v -> v.asZSet().size(), 0);
    }

    /**
     * @return zero-based rank, or null when the key or member is missing
     */
    public Long zrank(String key, String member) {
        return read(key, DataType.ZSET, v -> {
            long rank = v.asZSet().rank(member);
            return rank < 0 ? null : rank;
        }, null);
    }

    // ---------------------------------------------------------------- keyspace

    /**
     * The live entry for {@code key} regardless of type, or null.
     */
    private ValueEntry entry(String key) {
        return read(key, null, v -> v, null);
    }

    public boolean exists(String key) {
        return entry(key) != null;
    }

    public DataType type(String key) {
        ValueEntry entry = entry(key);
        return entry == null ? null : entry.getType();
    }

    public boolean delete(String key) {
        ValueEntry removed = store.remove(key);
        return removed != null && !removed.isExpired(clock.currentTimeMillis());
    }

    /**
     * Sets an absolute expiry; a time already past deletes the key.
     *
     * @return false when the key does not exist
     */
    public boolean expireAt(String key, long expireAtMillis) {
        final long now = clock.currentTimeMillis();
        final boolean[] found = {false};
        store.computeIfPresent(key, (k, v) -> {
            if (v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                return null;
            }
            found[0] = true;
            if (expireAtMillis <= now) return null;
            v.setExpireAt(expireAtMillis);
            return v;
        });
        return found[0];
    }

    public boolean expire(String key, long ttlMillis) {
        long now = clock.currentTimeMillis();
        return expireAt(key, ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis);
    }

    /**
     * @return remaining time to live in millis, -1 without expiry, -2 when the key is missing
     */
    public long ttlMillis(String key) {
        final long now = clock.currentTimeMillis();
        Long ttl = read(key, null, v -> {
            long at = v.getExpireAt();
            return at == ValueEntry.NO_EXPIRY ? -1L : at - now;
        }, -2L);
        return ttl;
    }

    /**
     * @return true when an expiry was removed
     */
    public boolean persist(String key) {
        final long now = clock.currentTimeMillis();
        final boolean[] cleared = {false};
        store.computeIfPresent(key, (k, v) -> {
            if (v.isExpired(now)) {
                expiredKeys.incrementAndGet();
                return null;
            }
            if (v.getExpireAt() != ValueEntry.NO_EXPIRY) {
                v.setExpireAt(ValueEntry.NO_EXPIRY);
                cleared[0] = true;
            }
            return v;
        });
        return cleared[0];
    }

    public List<String> keys(GlobMatcher matcher) {
        long now = clock.currentTimeMillis();
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, ValueEntry> e : store.entrySet()) {
            if (!e.getValue().isExpired(now) && matcher.matches(e.getKey())) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    /**
     * Number of live keys.
     */
    public int size() {
        long now = clock.currentTimeMillis();
        int count = 0;
        for (ValueEntry v : store.values()) {
            if (!v.isExpired(now)) count++;
        }
        return count;
    }

    public void flush() {
        store.clear();
    }

    /**
     * Samples up to {@code sampleSize} keys from where the previous call stopped and removes
     * the expired ones. Called from the janitor thread only.
     *
     * @return number of keys removed
     */
    public int sweepExpired(int sampleSize) {
        long now = clock.currentTimeMillis();
        if (sweepCursor == null || !sweepCursor.hasNext()) {
            sweepCursor = store.entrySet().iterator();
        }
        int removed = 0;
        int checked = 0;
        while (sweepCursor.hasNext() && checked < sampleSize) {
            Map.Entry<String, ValueEntry> e = sweepCursor.next();
            ValueEntry v = e.getValue();
            if (v.isExpired(now) && store.remove(e.getKey(), v)) {
                removed++;
            }
            checked++;
        }
        expiredKeys.addAndGet(removed);
        return removed;
    }

    public long getKeyspaceHits() {
        return keyspaceHits.get();
    }

    public long getKeyspaceMisses() {
        return keyspaceMisses.get();
    }

    public long getExpiredKeys() {
        return expiredKeys.get();
    }

    /**
     * Number of stored keys including expired ones not yet removed.
     */
    int rawSize() {
        return store.size();
    }
}
