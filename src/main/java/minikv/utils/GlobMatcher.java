package minikv.utils;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Redis-style glob patterns: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}
 * and {@code \} to escape the next character.
 */
public class GlobMatcher {
    private final String glob;
    private final Pattern pattern;

    public GlobMatcher(String glob) {
        this.glob = glob;
        this.pattern = compile(glob);
    }

    private static Pattern compile(String glob) {
        try {
            return Pattern.compile(toRegex(glob), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            // e.g. a reversed range like [z-a]; match the text literally
            return Pattern.compile(Pattern.quote(glob), Pattern.DOTALL);
        }
    }

    public boolean matches(String text) {
        return pattern.matcher(text).matches();
    }

    public String getGlob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    sb.append(".*");
                    break;
                case '?':
                    sb.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        sb.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        sb.append("\\\\");
                    }
                    break;
                case '[': {
                    int close = glob.indexOf(']', i + 1);
                    String body = close < 0 ? "" : glob.substring(i + 1, close);
                    if (body.isEmpty() || body.equals("^")) {
                        sb.append("\\[");
                        break;
                    }
                    sb.append('[');
                    int j = i + 1;
                    if (glob.charAt(j) == '^') {
                        sb.append('^');
                        j++;
                    }
                    int first = j;
                    for (; j < close; j++) {
                        char cc = glob.charAt(j);
                        if (cc == '-' && j > first && j + 1 < close) {
                            sb.append('-');
                        } else if (Character.isLetterOrDigit(cc)) {
                            sb.append(cc);
                        } else {
                            sb.append('\\').append(cc);
                        }
                    }
                    sb.append(']');
                    i = close;
                    break;
                }
                default:
                    if (Character.isLetterOrDigit(c)) {
                        sb.append(c);
                    } else {
                        sb.append(Pattern.quote(String.valueOf(c)));
                    }
            }
            i++;
        }
        return sb.toString();
    }
}
