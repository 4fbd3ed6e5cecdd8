package minikv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * Malformed input on the wire. The stream cannot be resynchronized, so the connection is dropped.
 */
public class ProtocolException extends DecoderException {
    private static final long serialVersionUID = 1L;

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
