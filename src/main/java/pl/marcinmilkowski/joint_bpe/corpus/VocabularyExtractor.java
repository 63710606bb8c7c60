package pl.marcinmilkowski.joint_bpe.corpus;

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Turns a corpus into word frequencies.
 *
 * Two input modes:
 * - Raw text: every line is split on whitespace and each token counts once.
 *   Tokenization runs through Lucene's {@link WhitespaceTokenizer} over the
 *   whole stream, so line breaks are ordinary whitespace.
 * - Dictionary: every line is a pre-counted {@code word count} pair.
 *   Any line that is not exactly a word and a non-negative integer aborts
 *   extraction with a {@link MalformedCorpusException}.
 *
 * The source is opened afresh on every call, so the same path can be
 * extracted again later in the run.
 */
public class VocabularyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyExtractor.class);

    /** Upper bound accepted by Lucene's char tokenizers; longer tokens are split. */
    static final int MAX_TOKEN_LENGTH = 1024 * 1024;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean dictInput;

    public VocabularyExtractor(boolean dictInput) {
        this.dictInput = dictInput;
    }

    public boolean isDictInput() {
        return dictInput;
    }

    /**
     * Extract word frequencies from a UTF-8 file.
     *
     * @param source corpus or dictionary file
     * @return fresh frequency mapping
     * @throws MalformedCorpusException if a dictionary line cannot be parsed
     * @throws IOException if the file cannot be read
     */
    public WordFrequencies extract(Path source) throws IOException {
        WordFrequencies vocab;
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            vocab = dictInput ? extractDict(reader, source) : extractRawText(reader);
        }
        logger.debug("Extracted {} unique words ({} tokens) from {}", vocab.size(), vocab.total(), source);
        return vocab;
    }

    /**
     * Count whitespace-separated tokens in a character stream.
     */
    public WordFrequencies extractRawText(Reader reader) throws IOException {
        WordFrequencies vocab = new WordFrequencies();
        try (Tokenizer tokenizer = new WhitespaceTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH)) {
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            tokenizer.setReader(reader);
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                vocab.increment(term.toString());
            }
            tokenizer.end();
        }
        return vocab;
    }

    private WordFrequencies extractDict(BufferedReader reader, Path source) throws IOException {
        WordFrequencies vocab = new WordFrequencies();
        String line;
        long index = 0;
        while ((line = reader.readLine()) != null) {
            DictEntry entry = parseDictLine(source, index, line);
            vocab.add(entry.word(), entry.count());
            index++;
        }
        return vocab;
    }

    /**
     * Parse one {@code word count} dictionary line.
     *
     * @param source    file the line came from, for error reporting
     * @param lineIndex 0-based line index
     * @param line      raw line content
     * @throws MalformedCorpusException if the line is not a word and a non-negative integer
     */
    public static DictEntry parseDictLine(Path source, long lineIndex, String line) throws MalformedCorpusException {
        String[] fields = Arrays.stream(WHITESPACE.split(strip(line)))
            .filter(field -> !field.isEmpty())
            .toArray(String[]::new);
        if (fields.length != 2) {
            throw new MalformedCorpusException(source, lineIndex, line,
                "expected 'word count', got " + fields.length + " field(s)");
        }
        long count;
        try {
            count = Long.parseLong(fields[1]);
        } catch (NumberFormatException e) {
            throw new MalformedCorpusException(source, lineIndex, line, "count is not an integer", e);
        }
        if (count < 0) {
            throw new MalformedCorpusException(source, lineIndex, line, "negative count");
        }
        return new DictEntry(fields[0], count);
    }

    /**
     * Strip carriage returns, newlines and spaces from both ends of a line.
     */
    public static String strip(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isStripped(line.charAt(start))) {
            start++;
        }
        while (end > start && isStripped(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    private static boolean isStripped(char c) {
        return c == '\r' || c == '\n' || c == ' ';
    }

    /**
     * One parsed dictionary line.
     */
    public record DictEntry(String word, long count) {
    }
}
