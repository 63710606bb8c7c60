package pl.marcinmilkowski.joint_bpe.bpe;

/**
 * One merge operation: two adjacent symbols become their concatenation.
 *
 * Natural order compares the left symbol, then the right one; the learner
 * breaks frequency ties in favour of the larger pair.
 */
public record MergeRule(String left, String right) implements Comparable<MergeRule> {

    public String merged() {
        return left + right;
    }

    /**
     * Codebook file line, without the newline.
     */
    public String toLine() {
        return left + " " + right;
    }

    @Override
    public int compareTo(MergeRule other) {
        int byLeft = left.compareTo(other.left);
        return byLeft != 0 ? byLeft : right.compareTo(other.right);
    }

    @Override
    public String toString() {
        return left + " " + right + " -> " + merged();
    }
}
