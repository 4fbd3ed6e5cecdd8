package minikv.commands;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Static facts about a verb. Arity counts the verb itself: a positive value is exact,
 * a negative value is a minimum.
 */
public class CommandMetadata {
    public static final String FLAG_WRITE = "write";
    public static final String FLAG_READONLY = "readonly";
    public static final String FLAG_PUBSUB_CONTEXT = "pubsub-context";

    private final int arity;
    private final Set<String> flags;
    private final int firstKey;
    private final int lastKey;
    private final int step;

    public CommandMetadata(int arity, Set<String> flags, int firstKey, int lastKey, int step) {
        this.arity = arity;
        this.flags = flags != null ? flags : Collections.<String>emptySet();
        this.firstKey = firstKey;
        this.lastKey = lastKey;
        this.step = step;
    }

    public static CommandMetadata of(int arity, int firstKey, int lastKey, int step, String... flags) {
        return new CommandMetadata(arity, Collections.unmodifiableSet(new HashSet<>(Arrays.asList(flags))),
                firstKey, lastKey, step);
    }

    public boolean acceptsArgCount(int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public int getArity() {
        return arity;
    }

    public Set<String> getFlags() {
        return flags;
    }

    public int getFirstKey() {
        return firstKey;
    }

    public int getLastKey() {
        return lastKey;
    }

    public int getStep() {
        return step;
    }
}
