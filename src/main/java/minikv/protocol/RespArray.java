package minikv.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array of frames. A {@code null} element list is the RESP null array.
 */
public final class RespArray extends RespFrame {
    public static final RespArray NULL = new RespArray(null);
    public static final RespArray EMPTY = new RespArray(Collections.emptyList());

    private final List<RespFrame> elements;

    public RespArray(List<RespFrame> elements) {
        this.elements = elements == null ? null : Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static RespArray of(RespFrame... elements) {
        return new RespArray(Arrays.asList(elements));
    }

    public static RespArray ofBulkStrings(List<byte[]> items) {
        if (items == null) return NULL;
        List<RespFrame> frames = new ArrayList<>(items.size());
        for (byte[] item : items) {
            frames.add(RespBulkString.of(item));
        }
        return new RespArray(frames);
    }

    public static RespArray ofStrings(Iterable<String> items) {
        List<RespFrame> frames = new ArrayList<>();
        for (String item : items) {
            frames.add(RespBulkString.of(item));
        }
        return new RespArray(frames);
    }

    public boolean isNull() {
        return elements == null;
    }

    public List<RespFrame> getElements() {
        return elements;
    }

    public int size() {
        return elements == null ? 0 : elements.size();
    }

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespArray)) return false;
        return Objects.equals(elements, ((RespArray) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "*nil" : elements.toString();
    }
}
