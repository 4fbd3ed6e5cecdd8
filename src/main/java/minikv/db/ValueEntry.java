package minikv.db;

import minikv.structs.SortedSet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One stored value with its type tag and expiry.
 *
 * The payload is only touched inside the {@link Database}'s per-key critical section;
 * {@code expireAt} is volatile because the janitor and KEYS read it without that lock.
 */
public class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final DataType type;
    private Object value;
    private volatile long expireAt;

    public ValueEntry(DataType type, Object value, long expireAt) {
        this.type = type;
        this.value = value;
        this.expireAt = expireAt;
    }

    public static ValueEntry string(byte[] value, long expireAt) {
        return new ValueEntry(DataType.STRING, value, expireAt);
    }

    static ValueEntry empty(DataType type, long expireAt) {
        switch (type) {
            case STRING: return new ValueEntry(type, new byte[0], expireAt);
            case LIST: return new ValueEntry(type, new ArrayDeque<String>(), expireAt);
            case HASH: return new ValueEntry(type, new LinkedHashMap<String, String>(), expireAt);
            case SET: return new ValueEntry(type, new LinkedHashSet<String>(), expireAt);
            case ZSET: return new ValueEntry(type, new SortedSet(), expireAt);
            default: throw new IllegalArgumentException("Unknown type " + type);
        }
    }

    public DataType getType() {
        return type;
    }

    public void checkType(DataType expected) {
        if (type != expected) throw new WrongTypeException(expected, type);
    }

    public byte[] asString() {
        checkType(DataType.STRING);
        return (byte[]) value;
    }

    void setString(byte[] bytes) {
        checkType(DataType.STRING);
        this.value = bytes;
    }

    @SuppressWarnings("unchecked")
    public Deque<String> asList() {
        checkType(DataType.LIST);
        return (Deque<String>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> asHash() {
        checkType(DataType.HASH);
        return (Map<String, String>) value;
    }

    @SuppressWarnings("unchecked")
    public Set<String> asSet() {
        checkType(DataType.SET);
        return (Set<String>) value;
    }

    public SortedSet asZSet() {
        checkType(DataType.ZSET);
        return (SortedSet) value;
    }

    /**
     * Collections are never stored empty; strings may be.
     */
    boolean isEmptyCollection() {
        switch (type) {
            case STRING: return false;
            case LIST: return asList().isEmpty();
            case HASH: return asHash().isEmpty();
            case SET: return asSet().isEmpty();
            case ZSET: return asZSet().isEmpty();
            default: throw new IllegalStateException("Unknown type " + type);
        }
    }

    public boolean isExpired(long now) {
        long at = expireAt;
        return at != NO_EXPIRY && now >= at;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public void setExpireAt(long expireAt) {
        this.expireAt = expireAt;
    }
}
