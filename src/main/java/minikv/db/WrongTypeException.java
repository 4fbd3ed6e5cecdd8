package minikv.db;

public class WrongTypeException extends StoreException {
    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final DataType expected;
    private final DataType actual;

    public WrongTypeException(DataType expected, DataType actual) {
        super(MESSAGE);
        this.expected = expected;
        this.actual = actual;
    }

    public DataType getExpected() {
        return expected;
    }

    public DataType getActual() {
        return actual;
    }
}
