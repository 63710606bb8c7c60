package pl.marcinmilkowski.joint_bpe.corpus;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered list of privileged words that must reach every output vocabulary.
 *
 * Order and duplicates are kept as in the source file; positions are only
 * used when reporting problems with a word.
 */
public record SpecialVocabulary(
    Path source,        // file the words were read from, null for the empty list
    List<String> words  // in file order
) {

    private static final SpecialVocabulary EMPTY = new SpecialVocabulary(null, List.of());

    public SpecialVocabulary {
        words = List.copyOf(words);
    }

    /**
     * The absent special vocabulary: no folding, no warnings.
     */
    public static SpecialVocabulary empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public int size() {
        return words.size();
    }
}
