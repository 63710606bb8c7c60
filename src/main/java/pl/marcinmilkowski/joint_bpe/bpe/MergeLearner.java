package pl.marcinmilkowski.joint_bpe.bpe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Learns a BPE codebook from a word-frequency dictionary.
 *
 * Every word starts as its code points, with the boundary symbol marked (see
 * {@link MergeDirection}). Each step:
 * 1. Pick the adjacent pair with the highest weighted frequency (ties: larger pair)
 * 2. Emit it as the next rule
 * 3. Merge all its non-overlapping occurrences, left to right, in every word
 * 4. Update pair statistics for the changed words only
 *
 * Learning stops after {@code symbols} rules or when the best pair falls below
 * {@code minFrequency}. If it stopped on frequency and special words are
 * configured, the rest of the budget goes to completing those words in order.
 *
 * Usage:
 *   MergeLearner learner = new MergeLearner();
 *   learner.setSymbols(10000);
 *   learner.setMinFrequency(2);
 *   Codebook codebook = learner.learn(vocab.toDictLines());
 */
public class MergeLearner {

    private static final Logger logger = LoggerFactory.getLogger(MergeLearner.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Configuration
    private int symbols = 10000;
    private int minFrequency = 2;
    private MergeDirection direction = MergeDirection.PREPEND;
    private boolean totalSymbols = false;
    private List<String> specialWords = List.of();
    private boolean verbose = false;

    // Configuration setters
    public void setSymbols(int symbols) { this.symbols = symbols; }
    public void setMinFrequency(int minFrequency) { this.minFrequency = minFrequency; }
    public void setDirection(MergeDirection direction) { this.direction = direction; }
    public void setTotalSymbols(boolean totalSymbols) { this.totalSymbols = totalSymbols; }
    public void setSpecialWords(List<String> specialWords) { this.specialWords = List.copyOf(specialWords); }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }

    /**
     * Learn merge rules.
     *
     * @param dictLines {@code "word count"} lines, consumed once
     * @return the ordered codebook
     * @throws IllegalArgumentException if a line is not a word and a non-negative count
     */
    public Codebook learn(Iterator<String> dictLines) {
        List<List<String>> words = new ArrayList<>();
        List<Long> frequencies = new ArrayList<>();
        Map<String, Integer> wordIndex = new HashMap<>();
        readDictionary(dictLines, words, frequencies, wordIndex);

        PairStatistics stats = new PairStatistics();
        for (int i = 0; i < words.size(); i++) {
            stats.addWord(i, words.get(i), frequencies.get(i), +1);
        }

        int budget = symbols;
        if (totalSymbols) {
            int characters = countUniqueCharacters(words);
            budget = Math.max(0, budget - characters);
            logger.info("Subtracting {} unique characters from the symbol budget: {} merges left", characters, budget);
        }

        List<MergeRule> rules = new ArrayList<>();
        boolean stoppedOnFrequency = false;
        while (rules.size() < budget) {
            MergeRule best = stats.best();
            if (best == null) {
                stoppedOnFrequency = true;
                logger.info("No pairs left to merge. Stopping");
                break;
            }
            long frequency = stats.count(best);
            if (frequency < minFrequency) {
                stoppedOnFrequency = true;
                logger.info("no pair has frequency >= {}. Stopping", minFrequency);
                break;
            }
            emit(best, frequency, rules);
            mergeEverywhere(best, words, frequencies, stats);
        }

        if (stoppedOnFrequency && !specialWords.isEmpty()) {
            completeSpecialWords(budget, rules, words, frequencies, wordIndex, stats);
        }

        logger.info("Learned {} merge rules from {} words", rules.size(), words.size());
        return new Codebook(rules);
    }

    private void readDictionary(Iterator<String> dictLines, List<List<String>> words,
                                List<Long> frequencies, Map<String, Integer> wordIndex) {
        long lineIndex = 0;
        while (dictLines.hasNext()) {
            String line = dictLines.next();
            String[] fields = WHITESPACE.split(line.strip());
            if (fields.length != 2) {
                throw new IllegalArgumentException("Invalid vocabulary line " + lineIndex + ": " + line);
            }
            long count;
            try {
                count = Long.parseLong(fields[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid count at vocabulary line " + lineIndex + ": " + line, e);
            }
            if (count < 0) {
                throw new IllegalArgumentException("Negative count at vocabulary line " + lineIndex + ": " + line);
            }

            Integer existing = wordIndex.get(fields[0]);
            if (existing != null) {
                frequencies.set(existing, frequencies.get(existing) + count);
            } else {
                wordIndex.put(fields[0], words.size());
                words.add(direction.toSymbols(fields[0]));
                frequencies.add(count);
            }
            lineIndex++;
        }
    }

    /**
     * Unique non-boundary characters plus unique boundary-marked characters.
     */
    private int countUniqueCharacters(List<List<String>> words) {
        Set<String> internal = new HashSet<>();
        Set<String> boundary = new HashSet<>();
        for (List<String> word : words) {
            int b = direction.boundaryIndex(word);
            for (int i = 0; i < word.size(); i++) {
                (i == b ? boundary : internal).add(word.get(i));
            }
        }
        return internal.size() + boundary.size();
    }

    /**
     * Spend the remaining budget merging special words back together, one word at a time.
     */
    private void completeSpecialWords(int budget, List<MergeRule> rules, List<List<String>> words,
                                      List<Long> frequencies, Map<String, Integer> wordIndex,
                                      PairStatistics stats) {
        for (String special : new LinkedHashSet<>(specialWords)) {
            Integer index = wordIndex.get(special);
            if (index == null) {
                logger.debug("Special word '{}' is not in the learning vocabulary", special);
                continue;
            }
            while (words.get(index).size() > 1) {
                if (rules.size() >= budget) {
                    logger.info("Symbol budget reached while completing special words");
                    return;
                }
                List<String> symbolsOfWord = words.get(index);
                MergeRule best = null;
                for (int i = 0; i < symbolsOfWord.size() - 1; i++) {
                    MergeRule pair = new MergeRule(symbolsOfWord.get(i), symbolsOfWord.get(i + 1));
                    if (best == null || stats.compareRanked(pair, best) < 0) {
                        best = pair;
                    }
                }
                emit(best, stats.count(best), rules);
                mergeEverywhere(best, words, frequencies, stats);
            }
        }
    }

    private void emit(MergeRule rule, long frequency, List<MergeRule> rules) {
        if (verbose) {
            logger.info("pair {}: {} {} -> {} (frequency {})",
                rules.size(), rule.left(), rule.right(), rule.merged(), frequency);
        }
        rules.add(rule);
    }

    private static void mergeEverywhere(MergeRule pair, List<List<String>> words,
                                        List<Long> frequencies, PairStatistics stats) {
        for (int index : stats.wordsContaining(pair)) {
            List<String> oldWord = words.get(index);
            long frequency = frequencies.get(index);
            List<String> newWord = replacePair(oldWord, pair);
            stats.addWord(index, oldWord, frequency, -1);
            stats.addWord(index, newWord, frequency, +1);
            words.set(index, newWord);
        }
    }

    /**
     * Replace non-overlapping occurrences of {@code pair}, scanning left to right.
     */
    static List<String> replacePair(List<String> symbols, MergeRule pair) {
        List<String> result = new ArrayList<>(symbols.size());
        String merged = pair.merged();
        int i = 0;
        while (i < symbols.size()) {
            if (i < symbols.size() - 1
                    && symbols.get(i).equals(pair.left())
                    && symbols.get(i + 1).equals(pair.right())) {
                result.add(merged);
                i += 2;
            } else {
                result.add(symbols.get(i));
                i++;
            }
        }
        return result;
    }
}
