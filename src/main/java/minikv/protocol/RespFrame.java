package minikv.protocol;

/**
 * One unit of the RESP wire protocol.
 *
 * The set of variants is closed: subclasses live in this package only.
 * {@link #END} is an out-of-band marker for the end of a connection's input stream;
 * it has no bytes on the wire.
 */
public abstract class RespFrame {

    public enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY,
        END
    }

    public static final RespFrame END = new RespFrame() {
        @Override
        public Type getType() {
            return Type.END;
        }

        @Override
        public String toString() {
            return "END";
        }
    };

    RespFrame() {
    }

    public abstract Type getType();
}
