package minikv.structs;

import java.util.Objects;

public class ZNode implements Comparable<ZNode> {
    public final double score;
    public final String member;

    public ZNode(double score, String member) {
        this.score = score;
        this.member = member;
    }

    @Override
    public int compareTo(ZNode o) {
        int c = Double.compare(this.score, o.score);
        return c != 0 ? c : this.member.compareTo(o.member);
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof ZNode) {
            ZNode z = (ZNode) o;
            return Double.compare(score, z.score) == 0 && member.equals(z.member);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, member);
    }

    @Override
    public String toString() {
        return member + "=" + score;
    }
}
