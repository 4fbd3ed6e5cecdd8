package minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP2 decoder/encoder.
 *
 * <pre>
 * +OK\r\n                      simple string
 * -ERR message\r\n             error
 * :42\r\n                      integer
 * $5\r\nhello\r\n              bulk string ($-1\r\n is null)
 * *2\r\n$3\r\nGET\r\n$1\r\na\r\n   array (*-1\r\n is null)
 * </pre>
 *
 * {@link #decode(ByteBuf)} is resumable: when the buffer holds only part of a frame it returns
 * {@code null} and leaves the reader index where it was.
 */
public class RespCodec {
    public static final byte SIMPLE_STRING = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK_STRING = '$';
    public static final byte ARRAY = '*';

    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    // Payload plus CR LF must fit in one ByteBuf
    public static final long MAX_BULK_LENGTH_LIMIT = Integer.MAX_VALUE - 2;
    static final int MAX_NESTING = 64;
    static final int MAX_LINE_LENGTH = 64 * 1024;

    public static final RespCodec DEFAULT = new RespCodec(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH);

    private static final byte[] CRLF = {'\r', '\n'};

    private final long maxBulkLength;
    private final int maxArrayLength;

    public RespCodec(long maxBulkLength, int maxArrayLength) {
        if (maxBulkLength < 0 || maxBulkLength > MAX_BULK_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxBulkLength out of range: " + maxBulkLength);
        }
        if (maxArrayLength < 0) {
            throw new IllegalArgumentException("maxArrayLength out of range: " + maxArrayLength);
        }
        this.maxBulkLength = maxBulkLength;
        this.maxArrayLength = maxArrayLength;
    }

    // --- DECODING ---

    /**
     * @return the next complete frame, or {@code null} if more bytes are needed
     * @throws ProtocolException if the bytes can never form a valid frame
     */
    public RespFrame decode(ByteBuf in) {
        int start = in.readerIndex();
        RespFrame frame = decodeFrame(in, 0);
        if (frame == null) {
            in.readerIndex(start);
        }
        return frame;
    }

    private RespFrame decodeFrame(ByteBuf in, int depth) {
        if (!in.isReadable()) return null;

        byte type = in.readByte();
        switch (type) {
            case SIMPLE_STRING: {
                String line = readLine(in);
                return line == null ? null : new RespSimpleString(line);
            }
            case ERROR: {
                String line = readLine(in);
                return line == null ? null : new RespError(line);
            }
            case INTEGER: {
                String line = readLine(in);
                return line == null ? null : RespInteger.of(parseLong(line, "integer"));
            }
            case BULK_STRING:
                return decodeBulkString(in);
            case ARRAY:
                return decodeArray(in, depth);
            default:
                throw new ProtocolException("unknown type marker 0x" + Integer.toHexString(type & 0xFF));
        }
    }

    private RespFrame decodeBulkString(ByteBuf in) {
        String line = readLine(in);
        if (line == null) return null;

        long length = parseLong(line, "bulk length");
        if (length == -1) return RespBulkString.NULL;
        if (length < -1 || length > maxBulkLength) {
            throw new ProtocolException("invalid bulk length " + length);
        }

        if (in.readableBytes() < length + CRLF.length) return null;

        byte[] content = new byte[(int) length];
        in.readBytes(content);
        if (in.readByte() != '\r' || in.readByte() != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return new RespBulkString(content);
    }

    private RespFrame decodeArray(ByteBuf in, int depth) {
        String line = readLine(in);
        if (line == null) return null;

        long count = parseLong(line, "array length");
        if (count == -1) return RespArray.NULL;
        if (count < -1 || count > maxArrayLength) {
            throw new ProtocolException("invalid array length " + count);
        }
        if (depth >= MAX_NESTING) {
            throw new ProtocolException("arrays nested deeper than " + MAX_NESTING);
        }

        // Cap the pre-allocation: the declared count is untrusted until the elements arrive.
        List<RespFrame> elements = new ArrayList<>((int) Math.min(count, 1024));
        for (long i = 0; i < count; i++) {
            RespFrame element = decodeFrame(in, depth + 1);
            if (element == null) return null;
            elements.add(element);
        }
        return new RespArray(elements);
    }

    private String readLine(ByteBuf in) {
        int start = in.readerIndex();
        int end = in.writerIndex();
        int limit = Math.min(end, start + MAX_LINE_LENGTH);

        for (int i = start; i < limit; i++) {
            byte b = in.getByte(i);
            if (b == '\n') {
                throw new ProtocolException("unexpected LF without CR");
            }
            if (b == '\r') {
                if (i + 1 >= end) return null;
                if (in.getByte(i + 1) != '\n') {
                    throw new ProtocolException("expected LF after CR");
                }
                String line = in.toString(start, i - start, StandardCharsets.UTF_8);
                in.readerIndex(i + 2);
                return line;
            }
        }

        if (end - start >= MAX_LINE_LENGTH) {
            throw new ProtocolException("line longer than " + MAX_LINE_LENGTH + " bytes");
        }
        return null;
    }

    private static long parseLong(String s, String what) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid " + what + " '" + s + "'", e);
        }
    }

    // --- ENCODING ---

    public void encode(RespFrame frame, ByteBuf out) {
        switch (frame.getType()) {
            case SIMPLE_STRING:
                writeLine(out, SIMPLE_STRING, ((RespSimpleString) frame).getValue());
                break;
            case ERROR:
                writeLine(out, ERROR, ((RespError) frame).getMessage());
                break;
            case INTEGER:
                writeLine(out, INTEGER, Long.toString(((RespInteger) frame).getValue()));
                break;
            case BULK_STRING: {
                byte[] content = ((RespBulkString) frame).getContent();
                if (content == null) {
                    writeLine(out, BULK_STRING, "-1");
                } else {
                    writeLine(out, BULK_STRING, Integer.toString(content.length));
                    out.writeBytes(content);
                    out.writeBytes(CRLF);
                }
                break;
            }
            case ARRAY: {
                List<RespFrame> elements = ((RespArray) frame).getElements();
                if (elements == null) {
                    writeLine(out, ARRAY, "-1");
                } else {
                    writeLine(out, ARRAY, Integer.toString(elements.size()));
                    for (RespFrame element : elements) {
                        encode(element, out);
                    }
                }
                break;
            }
            case END:
                break;
        }
    }

    public byte[] encode(RespFrame frame) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(frame, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeLine(ByteBuf out, byte marker, String line) {
        out.writeByte(marker);
        out.writeCharSequence(line, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }
}
