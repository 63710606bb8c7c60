package pl.marcinmilkowski.joint_bpe.bpe;

import java.util.ArrayList;
import java.util.List;

/**
 * Which side of a word boundary the separator goes on.
 *
 * PREPEND (default): the word end is marked while learning, and every piece except
 * the last carries the separator after it ({@code new@@ er}).
 * POSTPEND: the word start is marked, and every piece except the first carries
 * the separator before it ({@code new @@er}).
 */
public enum MergeDirection {
    PREPEND,
    POSTPEND;

    /** Marker glued to the last symbol of a word in PREPEND mode. */
    public static final String END_OF_WORD = "</w>";

    /** Marker glued to the first symbol of a word in POSTPEND mode. */
    public static final String BEGIN_OF_WORD = "<w>";

    public static MergeDirection of(boolean postpend) {
        return postpend ? POSTPEND : PREPEND;
    }

    /**
     * Split a word into code-point symbols and mark its boundary symbol.
     */
    public List<String> toSymbols(String word) {
        List<String> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        if (symbols.isEmpty()) {
            return symbols;
        }
        if (this == PREPEND) {
            int last = symbols.size() - 1;
            symbols.set(last, symbols.get(last) + END_OF_WORD);
        } else {
            symbols.set(0, BEGIN_OF_WORD + symbols.get(0));
        }
        return symbols;
    }

    /**
     * Index of the symbol that carries the boundary marker.
     */
    public int boundaryIndex(List<String> symbols) {
        return this == PREPEND ? symbols.size() - 1 : 0;
    }

    /**
     * Drop the boundary marker and attach separators, producing output pieces.
     */
    public List<String> render(List<String> symbols, String separator) {
        int n = symbols.size();
        List<String> pieces = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String symbol = symbols.get(i);
            if (this == PREPEND) {
                if (i == n - 1) {
                    pieces.add(stripSuffix(symbol, END_OF_WORD));
                } else {
                    pieces.add(symbol + separator);
                }
            } else {
                if (i == 0) {
                    pieces.add(stripPrefix(symbol, BEGIN_OF_WORD));
                } else {
                    pieces.add(separator + symbol);
                }
            }
        }
        return pieces;
    }

    /**
     * Render a single non-boundary character the way it appears inside a segmented word.
     */
    public String renderInternal(String character, String separator) {
        return this == PREPEND ? character + separator : separator + character;
    }

    private static String stripSuffix(String s, String suffix) {
        return s.endsWith(suffix) ? s.substring(0, s.length() - suffix.length()) : s;
    }

    private static String stripPrefix(String s, String prefix) {
        return s.startsWith(prefix) ? s.substring(prefix.length()) : s;
    }
}
