package minikv.protocol;

import java.util.Objects;

public final class RespSimpleString extends RespFrame {
    public static final RespSimpleString OK = new RespSimpleString("OK");
    public static final RespSimpleString PONG = new RespSimpleString("PONG");

    private final String value;

    public RespSimpleString(String value) {
        this.value = RespError.checkLine(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return Type.SIMPLE_STRING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespSimpleString)) return false;
        return value.equals(((RespSimpleString) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Type.SIMPLE_STRING, value);
    }

    @Override
    public String toString() {
        return "+" + value;
    }
}
