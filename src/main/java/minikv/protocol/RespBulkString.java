package minikv.protocol;

import minikv.utils.ByteStrings;

import java.util.Arrays;

/**
 * Length-prefixed binary-safe string. A {@code null} content is the RESP null bulk string.
 */
public final class RespBulkString extends RespFrame {
    public static final RespBulkString NULL = new RespBulkString(null);

    private final byte[] content;

    public RespBulkString(byte[] content) {
        this.content = content;
    }

    public static RespBulkString of(byte[] content) {
        return content == null ? NULL : new RespBulkString(content);
    }

    /**
     * @param s a byte string as produced by {@link ByteStrings#decode}
     */
    public static RespBulkString of(String s) {
        return s == null ? NULL : new RespBulkString(ByteStrings.encode(s));
    }

    public boolean isNull() {
        return content == null;
    }

    public byte[] getContent() {
        return content;
    }

    public String asString() {
        return content == null ? null : ByteStrings.decode(content);
    }

    @Override
    public Type getType() {
        return Type.BULK_STRING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespBulkString)) return false;
        return Arrays.equals(content, ((RespBulkString) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "$nil" : "$\"" + asString() + "\"";
    }
}
