package pl.marcinmilkowski.joint_bpe.bpe;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Weighted adjacent-pair counts over a word list, plus an index from each pair
 * to the words it occurs in.
 *
 * The ranking holds exactly the pairs with a positive count, ordered by count
 * descending and then by pair descending. A pair's count may only change while
 * it is outside the ranking.
 */
final class PairStatistics {

    private final Map<MergeRule, Long> counts = new HashMap<>();
    private final Map<MergeRule, Map<Integer, Integer>> occurrences = new HashMap<>();
    private final TreeSet<MergeRule> ranking = new TreeSet<>(this::compareRanked);

    /**
     * Orders pairs best first: higher count, then larger pair.
     */
    int compareRanked(MergeRule a, MergeRule b) {
        int byCount = Long.compare(count(b), count(a));
        return byCount != 0 ? byCount : b.compareTo(a);
    }

    long count(MergeRule pair) {
        return counts.getOrDefault(pair, 0L);
    }

    /**
     * Best pair overall, or null if no pair has a positive count.
     */
    MergeRule best() {
        return ranking.isEmpty() ? null : ranking.first();
    }

    /**
     * Register (sign = +1) or unregister (sign = -1) every adjacent pair of a word.
     */
    void addWord(int wordIndex, List<String> symbols, long frequency, int sign) {
        for (int i = 0; i < symbols.size() - 1; i++) {
            adjust(new MergeRule(symbols.get(i), symbols.get(i + 1)), wordIndex, frequency, sign);
        }
    }

    /**
     * Indices of the words currently containing {@code pair}, ascending.
     */
    List<Integer> wordsContaining(MergeRule pair) {
        Map<Integer, Integer> perWord = occurrences.get(pair);
        if (perWord == null) {
            return List.of();
        }
        List<Integer> indices = new ArrayList<>(perWord.keySet());
        indices.sort(null);
        return indices;
    }

    private void adjust(MergeRule pair, int wordIndex, long frequency, int sign) {
        long old = count(pair);
        if (old > 0) {
            ranking.remove(pair);
        }
        long updated = old + sign * frequency;
        if (updated > 0) {
            counts.put(pair, updated);
            ranking.add(pair);
        } else {
            counts.remove(pair);
        }

        Map<Integer, Integer> perWord = occurrences.computeIfAbsent(pair, k -> new HashMap<>());
        int n = perWord.getOrDefault(wordIndex, 0) + sign;
        if (n > 0) {
            perWord.put(wordIndex, n);
        } else {
            perWord.remove(wordIndex);
            if (perWord.isEmpty()) {
                occurrences.remove(pair);
            }
        }
    }
}
