package pl.marcinmilkowski.joint_bpe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.bpe.MergeDirection;
import pl.marcinmilkowski.joint_bpe.corpus.WordFrequencies;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Unique characters of the combined vocabulary, split by position.
 *
 * Terminal characters are the ones that sit on the marked word boundary (the
 * last character in PREPEND mode, the first in POSTPEND mode) and are emitted
 * without a separator. All other positions give non-terminal characters, emitted
 * with the separator attached on the direction's side.
 *
 * {@link #augment} pins every such symbol above all observed counts: terminal
 * characters at max + 2, non-terminal ones at max + 1.
 */
public final class CharacterInventory {

    private static final Logger logger = LoggerFactory.getLogger(CharacterInventory.class);

    private final SortedSet<String> terminal;
    private final SortedSet<String> internal;

    private CharacterInventory(SortedSet<String> terminal, SortedSet<String> internal) {
        this.terminal = Collections.unmodifiableSortedSet(terminal);
        this.internal = Collections.unmodifiableSortedSet(internal);
    }

    /**
     * Collect characters from every word of {@code vocab}.
     */
    public static CharacterInventory of(WordFrequencies vocab, MergeDirection direction, String separator) {
        SortedSet<String> terminal = new TreeSet<>();
        SortedSet<String> internal = new TreeSet<>();
        for (String word : vocab.words()) {
            int[] cps = word.codePoints().toArray();
            if (cps.length == 0) {
                continue;
            }
            int boundary = direction == MergeDirection.PREPEND ? cps.length - 1 : 0;
            for (int i = 0; i < cps.length; i++) {
                String c = new String(Character.toChars(cps[i]));
                if (i == boundary) {
                    terminal.add(c);
                } else {
                    internal.add(direction.renderInternal(c, separator));
                }
            }
        }
        logger.info("Got {} non-terminal and {} terminal characters", internal.size(), terminal.size());
        return new CharacterInventory(terminal, internal);
    }

    /**
     * Overwrite the counts of all character symbols with pseudo-counts above the current maximum.
     * Must run after every other change to {@code vocab}.
     */
    public void augment(WordFrequencies vocab) {
        long max = vocab.maxCount();
        long pseudoCountTerminal = max + 2;
        long pseudoCountInternal = max + 1;
        for (String c : terminal) {
            vocab.set(c, pseudoCountTerminal);
        }
        for (String c : internal) {
            vocab.set(c, pseudoCountInternal);
        }
    }

    /**
     * Terminal characters, bare.
     */
    public SortedSet<String> terminal() {
        return terminal;
    }

    /**
     * Non-terminal characters, separator attached.
     */
    public SortedSet<String> internal() {
        return internal;
    }
}
