package minikv.structs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Members ordered by score, ties broken by member. Not thread-safe: the owning
 * store entry's lock guards every access.
 */
public class SortedSet {
    private final Map<String, Double> scores = new HashMap<>();
    private final TreeSet<ZNode> sorted = new TreeSet<>();

    /**
     * @return 1 if the member is new, 0 if it existed (its score may have changed)
     */
    public int add(double score, String member) {
        Double oldScore = scores.get(member);
        if (oldScore != null) {
            if (Double.compare(oldScore, score) == 0) return 0;
            sorted.remove(new ZNode(oldScore, member));
            scores.put(member, score);
            sorted.add(new ZNode(score, member));
            return 0;
        }
        scores.put(member, score);
        sorted.add(new ZNode(score, member));
        return 1;
    }

    public boolean remove(String member) {
        Double score = scores.remove(member);
        if (score == null) return false;
        sorted.remove(new ZNode(score, member));
        return true;
    }

    public Double score(String member) {
        return scores.get(member);
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Zero-based rank in ascending order, or -1 when absent.
     */
    public long rank(String member) {
        Double score = scores.get(member);
        if (score == null) return -1;
        return sorted.headSet(new ZNode(score, member), false).size();
    }

    /**
     * Inclusive index range; both bounds already normalized to {@code [0, size)}.
     */
    public List<ZNode> range(int start, int stop) {
        List<ZNode> result = new ArrayList<>(Math.max(0, stop - start + 1));
        Iterator<ZNode> it = sorted.iterator();
        int idx = 0;
        while (it.hasNext() && idx <= stop) {
            ZNode node = it.next();
            if (idx >= start) result.add(node);
            idx++;
        }
        return result;
    }
}
