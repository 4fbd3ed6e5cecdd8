package minikv.protocol;

import java.util.Objects;

public final class RespError extends RespFrame {
    private final String message;

    public RespError(String message) {
        this.message = checkLine(message);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public Type getType() {
        return Type.ERROR;
    }

    // Line-based frames cannot carry CR or LF, and must be valid UTF-16 to encode as UTF-8.
    static String checkLine(String s) {
        Objects.requireNonNull(s, "value");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r' || c == '\n') {
                throw new IllegalArgumentException("CR and LF are not allowed in a line frame");
            }
            if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                throw new IllegalArgumentException("unpaired surrogate at index " + i);
            }
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespError)) return false;
        return message.equals(((RespError) o).message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Type.ERROR, message);
    }

    @Override
    public String toString() {
        return "-" + message;
    }
}
