package minikv.utils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Keys, fields, members and channels are arbitrary bytes. They are held as Strings with one
 * char per byte (U+0000 to U+00FF), so any input maps back to exactly the bytes it came from.
 */
public final class ByteStrings {
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private ByteStrings() {
    }

    public static String decode(byte[] bytes) {
        return new String(bytes, CHARSET);
    }

    /**
     * Chars above U+00FF have no byte form and encode as {@code '?'}.
     */
    public static byte[] encode(String s) {
        return s.getBytes(CHARSET);
    }
}
