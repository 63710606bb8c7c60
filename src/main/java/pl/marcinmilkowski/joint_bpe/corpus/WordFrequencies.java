package pl.marcinmilkowski.joint_bpe.corpus;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable mapping from word (or subword) to a non-negative count.
 *
 * The backing map has no defined iteration order. Anything that leaves the
 * process goes through {@link #sortedEntries()} or {@link #toDictLines()},
 * both of which are ordered.
 */
public class WordFrequencies {

    private final Map<String, Long> counts;

    public WordFrequencies() {
        this.counts = new HashMap<>();
    }

    private WordFrequencies(Map<String, Long> counts) {
        this.counts = counts;
    }

    /**
     * Add {@code amount} to the count of {@code word}, creating the key if absent.
     */
    public void add(String word, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Negative count for '" + word + "': " + amount);
        }
        counts.merge(word, amount, Long::sum);
    }

    /**
     * Increment the count of {@code word} by one.
     */
    public void increment(String word) {
        add(word, 1L);
    }

    /**
     * Overwrite the count of {@code word}.
     */
    public void set(String word, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count for '" + word + "': " + count);
        }
        counts.put(word, count);
    }

    /**
     * Add every count of {@code other} to this mapping.
     */
    public void addAll(WordFrequencies other) {
        other.counts.forEach(this::add);
    }

    public long get(String word) {
        return counts.getOrDefault(word, 0L);
    }

    public boolean contains(String word) {
        return counts.containsKey(word);
    }

    /**
     * Number of distinct keys.
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Sum of all counts.
     */
    public long total() {
        long sum = 0;
        for (long c : counts.values()) {
            sum += c;
        }
        return sum;
    }

    /**
     * Largest count, or 0 for an empty mapping.
     */
    public long maxCount() {
        long max = 0;
        for (long c : counts.values()) {
            max = Math.max(max, c);
        }
        return max;
    }

    public Set<String> words() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    /**
     * Entries in emission order: count descending, ties by ascending symbol.
     */
    public List<VocabularyEntry> sortedEntries() {
        return counts.entrySet().stream()
            .map(e -> new VocabularyEntry(e.getKey(), e.getValue()))
            .sorted()
            .toList();
    }

    /**
     * Lazy {@code "word count"} lines in emission order, the input format of the merge learner.
     */
    public Iterator<String> toDictLines() {
        return sortedEntries().stream().map(VocabularyEntry::toLine).iterator();
    }

    /**
     * Independent read-only copy. Later changes to this mapping do not show through.
     */
    public WordFrequencies snapshot() {
        return new WordFrequencies(Collections.unmodifiableMap(new HashMap<>(counts)));
    }

    @Override
    public String toString() {
        return String.format("WordFrequencies[%d items, total=%d]", size(), total());
    }
}
