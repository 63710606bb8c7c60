package pl.marcinmilkowski.joint_bpe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.bpe.MergeApplier;
import pl.marcinmilkowski.joint_bpe.bpe.SegmentationException;
import pl.marcinmilkowski.joint_bpe.corpus.MalformedCorpusException;
import pl.marcinmilkowski.joint_bpe.corpus.SpecialVocabulary;
import pl.marcinmilkowski.joint_bpe.corpus.VocabularyExtractor;
import pl.marcinmilkowski.joint_bpe.corpus.WordFrequencies;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-derives one corpus's vocabulary in subword units, using the shared codebook.
 *
 * Dictionary input: every {@code word count} line is segmented and each piece
 * receives the word's count.
 * Raw text: every line is segmented into a scratch file, which is then counted
 * like any raw corpus. The scratch file is removed on every exit path.
 *
 * Holds no per-corpus state; one instance serves all corpora, from several
 * threads if needed.
 */
public class CorpusVocabularyDeriver {

    private static final Logger logger = LoggerFactory.getLogger(CorpusVocabularyDeriver.class);

    private final MergeApplier applier;
    private final boolean dictInput;
    private final Path scratchDirectory;

    public CorpusVocabularyDeriver(MergeApplier applier, boolean dictInput, Path scratchDirectory) {
        this.applier = applier;
        this.dictInput = dictInput;
        this.scratchDirectory = scratchDirectory;
    }

    /**
     * Subword frequencies of one corpus.
     *
     * @throws MalformedCorpusException if a dictionary line is malformed or its word cannot be segmented
     */
    public WordFrequencies derive(Path corpus) throws IOException {
        return dictInput ? deriveFromDict(corpus) : deriveFromRawText(corpus);
    }

    private WordFrequencies deriveFromDict(Path corpus) throws IOException {
        WordFrequencies vocab = new WordFrequencies();
        try (BufferedReader reader = Files.newBufferedReader(corpus, StandardCharsets.UTF_8)) {
            String line;
            long index = 0;
            while ((line = reader.readLine()) != null) {
                VocabularyExtractor.DictEntry entry = VocabularyExtractor.parseDictLine(corpus, index, line);
                List<String> pieces;
                try {
                    pieces = applier.segment(entry.word());
                } catch (SegmentationException e) {
                    throw new MalformedCorpusException(corpus, index, line, e.getMessage(), e);
                }
                for (String piece : pieces) {
                    vocab.add(piece, entry.count());
                }
                index++;
            }
        }
        return vocab;
    }

    private WordFrequencies deriveFromRawText(Path corpus) throws IOException {
        Files.createDirectories(scratchDirectory);
        Path scratch = Files.createTempFile(scratchDirectory, "joint-bpe-", ".seg");
        try {
            try (BufferedReader reader = Files.newBufferedReader(corpus, StandardCharsets.UTF_8);
                 BufferedWriter writer = Files.newBufferedWriter(scratch, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    writer.write(applier.segmentLine(line));
                    writer.write('\n');
                }
            }
            return new VocabularyExtractor(false).extract(scratch);
        } finally {
            Files.deleteIfExists(scratch);
            logger.debug("Removed scratch file {}", scratch);
        }
    }

    /**
     * Add one count to every piece of every special word.
     *
     * @return the special words that were split into more than one piece, in file order
     * @throws MalformedCorpusException if a special word cannot be segmented
     */
    public List<SpecialWordSplit> foldSpecialVocabulary(WordFrequencies vocab, SpecialVocabulary special)
            throws MalformedCorpusException {
        List<SpecialWordSplit> splits = new ArrayList<>();
        List<String> words = special.words();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            List<String> pieces;
            try {
                pieces = applier.segment(word);
            } catch (SegmentationException e) {
                throw new MalformedCorpusException(special.source(), i, word, e.getMessage(), e);
            }
            if (pieces.size() != 1) {
                splits.add(new SpecialWordSplit(i, word, pieces));
            }
            for (String piece : pieces) {
                vocab.increment(piece);
            }
        }
        return splits;
    }
}
