package minikv.commands;

import minikv.utils.ByteStrings;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Argument decoding shared by the command implementations.
 */
public final class Args {
    private Args() {
    }

    /**
     * Byte-preserving form used for keys, fields, members, channels and options.
     */
    public static String str(byte[] arg) {
        return ByteStrings.decode(arg);
    }

    public static byte[] bytes(String s) {
        return ByteStrings.encode(s);
    }

    /**
     * UTF-8 text for echoing an argument back inside an error message.
     */
    public static String text(byte[] arg) {
        return new String(arg, StandardCharsets.UTF_8);
    }

    /**
     * Decodes {@code args[from..]} with {@link #str}.
     */
    public static List<String> strings(List<byte[]> args, int from) {
        List<String> result = new ArrayList<>(Math.max(0, args.size() - from));
        for (int i = from; i < args.size(); i++) {
            result.add(str(args.get(i)));
        }
        return result;
    }

    public static long parseLong(byte[] arg) {
        String s = str(arg);
        if (s.isEmpty() || s.charAt(0) == '+') throw new CommandException(CommandException.NOT_AN_INTEGER);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new CommandException(CommandException.NOT_AN_INTEGER);
        }
    }

    /**
     * Accepts decimal numbers plus {@code inf}, {@code +inf} and {@code -inf}; rejects NaN.
     */
    public static double parseDouble(byte[] arg) {
        String s = str(arg).trim().toLowerCase();
        switch (s) {
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        try {
            double d = Double.parseDouble(s);
            if (Double.isNaN(d) || s.endsWith("d") || s.endsWith("f")) {
                throw new CommandException(CommandException.NOT_A_FLOAT);
            }
            return d;
        } catch (NumberFormatException e) {
            throw new CommandException(CommandException.NOT_A_FLOAT);
        }
    }

    /**
     * Formats a score the way replies show it: integral values without a fraction.
     */
    public static String formatDouble(double d) {
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e17) return Long.toString((long) d);
        return Double.toString(d);
    }
}
