package pl.marcinmilkowski.joint_bpe.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a vocabulary file: one {@code symbol count} line per entry, UTF-8,
 * no header, every line terminated by {@code \n}.
 *
 * Entries are sorted by count descending and then by symbol, so identical
 * input always produces byte-identical files.
 */
public class VocabularyWriter {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyWriter.class);

    public void write(WordFrequencies vocab, Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(vocab, writer);
        }
        logger.debug("Wrote {} vocabulary entries to {}", vocab.size(), output);
    }

    public void write(WordFrequencies vocab, Writer writer) throws IOException {
        for (VocabularyEntry entry : vocab.sortedEntries()) {
            writer.write(entry.toLine());
            writer.write('\n');
        }
    }
}
