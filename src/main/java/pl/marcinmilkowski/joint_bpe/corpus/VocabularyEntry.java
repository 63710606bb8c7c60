package pl.marcinmilkowski.joint_bpe.corpus;

/**
 * A single vocabulary line: a word or subword symbol with its count.
 *
 * Natural order is the emission order of vocabulary files: count descending,
 * then symbol ascending.
 */
public record VocabularyEntry(
    String symbol,     // word or subword, separator included
    long count         // occurrences in the corpus
) implements Comparable<VocabularyEntry> {

    @Override
    public int compareTo(VocabularyEntry other) {
        int byCount = Long.compare(other.count, this.count);
        if (byCount != 0) {
            return byCount;
        }
        return this.symbol.compareTo(other.symbol);
    }

    /**
     * Format as a vocabulary file line, without the newline.
     */
    public String toLine() {
        return symbol + " " + count;
    }

    @Override
    public String toString() {
        return String.format("%s (%d)", symbol, count);
    }
}
