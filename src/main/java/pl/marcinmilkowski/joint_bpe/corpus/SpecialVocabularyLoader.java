package pl.marcinmilkowski.joint_bpe.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the special vocabulary: one word per line, UTF-8.
 *
 * Each line is stripped of carriage returns, newlines and spaces at both ends.
 * A line that is empty afterwards, or that still contains whitespace, cannot
 * be a single word and is rejected.
 */
public class SpecialVocabularyLoader {

    private static final Logger logger = LoggerFactory.getLogger(SpecialVocabularyLoader.class);

    /**
     * Load a special vocabulary file.
     *
     * @param path the word list, or null when no special vocabulary is configured
     * @return the ordered words, or {@link SpecialVocabulary#empty()} for a null path
     * @throws MalformedCorpusException if a line is not a single word
     * @throws IOException if the file cannot be read
     */
    public SpecialVocabulary load(Path path) throws IOException {
        if (path == null) {
            return SpecialVocabulary.empty();
        }
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Special vocabulary file not found");
        }

        List<String> words = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            long index = 0;
            while ((line = reader.readLine()) != null) {
                String word = VocabularyExtractor.strip(line);
                if (word.isEmpty()) {
                    throw new MalformedCorpusException(path, index, line, "empty special word");
                }
                if (word.codePoints().anyMatch(Character::isWhitespace)) {
                    throw new MalformedCorpusException(path, index, line, "special word contains whitespace");
                }
                words.add(word);
                index++;
            }
        }

        logger.info("Loaded {} special words from {}", words.size(), path);
        return new SpecialVocabulary(path, words);
    }
}
