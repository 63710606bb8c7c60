package pl.marcinmilkowski.joint_bpe.bpe;

import java.util.ArrayList;
import java.util.List;

/**
 * Segments words into subwords by applying a codebook as a strict priority list.
 *
 * For a word, the pair with the lowest rank among its adjacent pairs is merged
 * everywhere it occurs (left to right, non-overlapping), and this repeats until no
 * pair has a rule. The boundary marker is then dropped and separators attached
 * according to the {@link MergeDirection}.
 *
 * Instances hold no mutable state and can be shared between threads.
 */
public class MergeApplier {

    private final Codebook codebook;
    private final String separator;
    private final MergeDirection direction;

    public MergeApplier(Codebook codebook, String separator, MergeDirection direction) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Separator must not be empty");
        }
        this.codebook = codebook;
        this.separator = separator;
        this.direction = direction;
    }

    public Codebook getCodebook() {
        return codebook;
    }

    public String getSeparator() {
        return separator;
    }

    public MergeDirection getDirection() {
        return direction;
    }

    /**
     * Segment a single word.
     *
     * @return the pieces in order, separators attached
     * @throws SegmentationException if the word is empty or contains whitespace
     */
    public List<String> segment(String word) {
        if (word == null || word.isEmpty()) {
            throw new SegmentationException(String.valueOf(word), "empty word");
        }
        if (word.codePoints().anyMatch(Character::isWhitespace)) {
            throw new SegmentationException(word, "word contains whitespace");
        }
        if (word.codePointCount(0, word.length()) == 1) {
            return List.of(word);
        }

        List<String> symbols = direction.toSymbols(word);
        while (symbols.size() > 1) {
            int bestRank = Codebook.NO_RULE;
            MergeRule best = null;
            for (int i = 0; i < symbols.size() - 1; i++) {
                int rank = codebook.rankOf(symbols.get(i), symbols.get(i + 1));
                if (rank < bestRank) {
                    bestRank = rank;
                    best = codebook.get(rank);
                }
            }
            if (best == null) {
                break;
            }
            symbols = MergeLearner.replacePair(symbols, best);
        }
        return direction.render(symbols, separator);
    }

    /**
     * Segment several tokens and concatenate their pieces. Empty tokens are skipped.
     */
    public List<String> segment(List<String> tokens) {
        List<String> pieces = new ArrayList<>();
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            pieces.addAll(segment(token));
        }
        return pieces;
    }

    /**
     * Segment every whitespace-delimited token of a line.
     *
     * The pieces of a token are joined with single spaces; whitespace runs of
     * the original line, leading and trailing ones included, are kept verbatim.
     */
    public String segmentLine(String line) {
        StringBuilder out = new StringBuilder(line.length() * 2);
        int i = 0;
        int n = line.length();
        while (i < n) {
            int cp = line.codePointAt(i);
            int start = i;
            if (Character.isWhitespace(cp)) {
                while (i < n && Character.isWhitespace(line.codePointAt(i))) {
                    i += Character.charCount(line.codePointAt(i));
                }
                out.append(line, start, i);
            } else {
                while (i < n && !Character.isWhitespace(line.codePointAt(i))) {
                    i += Character.charCount(line.codePointAt(i));
                }
                out.append(String.join(" ", segment(line.substring(start, i))));
            }
        }
        return out.toString();
    }
}
