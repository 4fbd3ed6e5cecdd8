package minikv;

import minikv.utils.GlobMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel and pattern subscriptions. Membership changes go through {@code compute} on the
 * affected entry; publish only reads and takes no lock.
 */
public class PubSub {
    // Channel -> Set of Subscribers
    private final ConcurrentHashMap<String, Set<Subscriber>> channels = new ConcurrentHashMap<>();
    // Pattern -> matcher and its Subscribers
    private final ConcurrentHashMap<String, PatternSubscribers> patterns = new ConcurrentHashMap<>();

    // Subscriber -> Set of Channels (Reverse Index)
    private final ConcurrentHashMap<Subscriber, Set<String>> subToChannels = new ConcurrentHashMap<>();
    // Subscriber -> Set of Patterns (Reverse Index)
    private final ConcurrentHashMap<Subscriber, Set<String>> subToPatterns = new ConcurrentHashMap<>();

    public interface Subscriber {
        /**
         * Delivers one published message. {@code pattern} is null for a direct channel match.
         * Called on the publisher's thread; must not block.
         *
         * @return false when the subscriber is going away and dropped the message
         */
        boolean send(String channel, byte[] message, String pattern);
    }

    private static class PatternSubscribers {
        final GlobMatcher matcher;
        final Set<Subscriber> subscribers = ConcurrentHashMap.newKeySet();

        PatternSubscribers(String pattern) {
            this.matcher = new GlobMatcher(pattern);
        }
    }

    /**
     * @return false when {@code sub} was already subscribed to {@code channel}
     */
    public boolean subscribe(String channel, Subscriber sub) {
        final boolean[] added = {false};
        channels.compute(channel, (k, subs) -> {
            if (subs == null) subs = ConcurrentHashMap.newKeySet();
            added[0] = subs.add(sub);
            return subs;
        });
        addReverse(subToChannels, sub, channel);
        return added[0];
    }

    /**
     * @return false when {@code sub} was not subscribed to {@code channel}
     */
    public boolean unsubscribe(String channel, Subscriber sub) {
        final boolean[] removed = {false};
        channels.computeIfPresent(channel, (k, subs) -> {
            removed[0] = subs.remove(sub);
            return subs.isEmpty() ? null : subs;
        });
        removeReverse(subToChannels, sub, channel);
        return removed[0];
    }

    public boolean psubscribe(String pattern, Subscriber sub) {
        final boolean[] added = {false};
        patterns.compute(pattern, (k, entry) -> {
            if (entry == null) entry = new PatternSubscribers(pattern);
            added[0] = entry.subscribers.add(sub);
            return entry;
        });
        addReverse(subToPatterns, sub, pattern);
        return added[0];
    }

    public boolean punsubscribe(String pattern, Subscriber sub) {
        final boolean[] removed = {false};
        patterns.computeIfPresent(pattern, (k, entry) -> {
            removed[0] = entry.subscribers.remove(sub);
            return entry.subscribers.isEmpty() ? null : entry;
        });
        removeReverse(subToPatterns, sub, pattern);
        return removed[0];
    }

    /**
     * Drops every channel and pattern subscription of {@code sub}.
     */
    public void unsubscribeAll(Subscriber sub) {
        // Fast Unsubscribe using Reverse Index
        Set<String> userChannels = subToChannels.remove(sub);
        if (userChannels != null) {
            for (String channel : userChannels) {
                channels.computeIfPresent(channel, (k, subs) -> {
                    subs.remove(sub);
                    return subs.isEmpty() ? null : subs;
                });
            }
        }

        Set<String> userPatterns = subToPatterns.remove(sub);
        if (userPatterns != null) {
            for (String pattern : userPatterns) {
                patterns.computeIfPresent(pattern, (k, entry) -> {
                    entry.subscribers.remove(sub);
                    return entry.subscribers.isEmpty() ? null : entry;
                });
            }
        }
    }

    /**
     * Delivers {@code message} to the current subscribers of {@code channel} and of every
     * matching pattern.
     *
     * @return number of deliveries the subscribers accepted
     */
    public int publish(String channel, byte[] message) {
        int count = 0;

        Set<Subscriber> direct = channels.get(channel);
        if (direct != null) {
            for (Subscriber sub : direct) {
                if (sub.send(channel, message, null)) count++;
            }
        }

        for (Map.Entry<String, PatternSubscribers> entry : patterns.entrySet()) {
            PatternSubscribers ps = entry.getValue();
            if (ps.matcher.matches(channel)) {
                for (Subscriber sub : ps.subscribers) {
                    if (sub.send(channel, message, entry.getKey())) count++;
                }
            }
        }
        return count;
    }

    /**
     * Channels plus patterns {@code sub} is subscribed to.
     */
    public int subscriptionCount(Subscriber sub) {
        return sizeOf(subToChannels.get(sub)) + sizeOf(subToPatterns.get(sub));
    }

    public List<String> getSubscribedChannels(Subscriber sub) {
        Set<String> set = subToChannels.get(sub);
        return set == null ? Collections.<String>emptyList() : new ArrayList<>(set);
    }

    public List<String> getSubscribedPatterns(Subscriber sub) {
        Set<String> set = subToPatterns.get(sub);
        return set == null ? Collections.<String>emptyList() : new ArrayList<>(set);
    }

    public int getChannelCount() { return channels.size(); }
    public int getPatternCount() { return patterns.size(); }

    /**
     * Active channels, optionally filtered by a glob; null matches all.
     */
    public List<String> getChannels(GlobMatcher filter) {
        List<String> result = new ArrayList<>();
        for (String channel : channels.keySet()) {
            if (filter == null || filter.matches(channel)) result.add(channel);
        }
        return result;
    }

    public int getNumSub(String channel) {
        Set<Subscriber> subs = channels.get(channel);
        return subs == null ? 0 : subs.size();
    }

    private static int sizeOf(Set<String> set) {
        return set == null ? 0 : set.size();
    }

    private static void addReverse(ConcurrentHashMap<Subscriber, Set<String>> index, Subscriber sub, String name) {
        index.compute(sub, (k, set) -> {
            if (set == null) set = ConcurrentHashMap.newKeySet();
            set.add(name);
            return set;
        });
    }

    private static void removeReverse(ConcurrentHashMap<Subscriber, Set<String>> index, Subscriber sub, String name) {
        index.computeIfPresent(sub, (k, set) -> {
            set.remove(name);
            return set.isEmpty() ? null : set;
        });
    }
}
