package pl.marcinmilkowski.joint_bpe.pipeline;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.config.ConfigurationMismatchException;
import pl.marcinmilkowski.joint_bpe.config.PipelineConfig;
import pl.marcinmilkowski.joint_bpe.corpus.MalformedCorpusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for JointBpePipeline on small dictionary and raw-text corpora.
 */
class JointBpePipelineTest {

    private static final String EXPECTED_CODES = String.join("\n",
        "#version: 0.2",
        "e r</w>",
        "l o",
        "w er</w>",
        "n e",
        "ne wer</w>",
        "lo w</w>",
        "w i",
        "wi d",
        "wid er</w>",
        "w e") + "\n";

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    private PipelineConfig.Builder dictConfig(String outDir) throws IOException {
        Path en = write("corpus.en", "low 5\nlowest 2\n");
        Path de = write("corpus.de", "newer 6\nwider 3\n");
        Path out = tempDir.resolve(outDir);
        return PipelineConfig.builder()
            .withInputs(List.of(en, de))
            .withVocabularies(List.of(out.resolve("vocab.en"), out.resolve("vocab.de")))
            .withCodes(out.resolve("codes.bpe"))
            .withSymbols(10)
            .withMinFrequency(2)
            .withDictInput(true)
            .withScratchDirectory(tempDir.resolve("scratch"));
    }

    @Test
    @DisplayName("One codebook is learned over both corpora and each gets its own vocabulary")
    void testJointLearning() throws Exception {
        PipelineConfig config = dictConfig("out").build();

        PipelineReport report = new JointBpePipeline(config).run();

        assertEquals(EXPECTED_CODES, read(config.codes()));
        assertEquals("low 5\nlo@@ 2\ns@@ 2\nt 2\nwe@@ 2\n", read(config.vocabularies().get(0)));
        assertEquals("newer 6\nwider 3\n", read(config.vocabularies().get(1)));

        assertEquals(10, report.mergeCount());
        assertEquals(4, report.combinedVocabularySize());
        assertEquals(5, report.corpora().get(0).uniqueItems());
        assertEquals(13, report.corpora().get(0).totalCount());
        assertTrue(report.allSplits().isEmpty());
    }

    @Test
    @DisplayName("A special word not captured by merges is reported and its pieces counted")
    void testSpecialWordSplit() throws Exception {
        Path special = write("special.txt", "unbelievable\n");
        PipelineConfig config = dictConfig("out").withSpecialVocab(special).build();

        PipelineReport report = new JointBpePipeline(config).run();

        // learning is unaffected: none of the special word's pairs is frequent enough
        assertEquals(EXPECTED_CODES, read(config.codes()));

        List<SpecialWordSplit> splits = report.corpora().get(0).splits();
        assertEquals(1, splits.size());
        assertEquals("unbelievable", splits.get(0).word());
        assertEquals(0, splits.get(0).index());
        assertEquals("u@@ n@@ b@@ e@@ l@@ i@@ e@@ v@@ a@@ b@@ l@@ e", splits.get(0).joinedPieces());
        assertEquals(2, report.allSplits().size());

        String vocabDe = read(config.vocabularies().get(1));
        assertTrue(vocabDe.startsWith("newer 6\nwider 3\nb@@ 2\ne@@ 2\nl@@ 2\n"), vocabDe);
        assertTrue(vocabDe.contains("\ne 1\n"));
        assertTrue(vocabDe.contains("\nu@@ 1\n"));
    }

    @Test
    @DisplayName("A special word that survives whole gets one extra count and no warning")
    void testSpecialWordWhole() throws Exception {
        Path special = write("special.txt", "low\n");
        PipelineConfig config = dictConfig("out").withSpecialVocab(special).build();

        PipelineReport report = new JointBpePipeline(config).run();

        assertTrue(report.allSplits().isEmpty());
        assertTrue(read(config.vocabularies().get(0)).startsWith("low 6\n"));
        assertTrue(read(config.vocabularies().get(1)).contains("low 1\n"));
    }

    @Test
    @DisplayName("Character vocabulary pins every character above all other counts")
    void testCharacterVocab() throws Exception {
        PipelineConfig config = dictConfig("out").withCharacterVocab(true).build();

        PipelineReport report = new JointBpePipeline(config).run();

        assertEquals("r 8\nt 8\nw 8\n"
            + "d@@ 7\ne@@ 7\ni@@ 7\nl@@ 7\nn@@ 7\no@@ 7\ns@@ 7\nw@@ 7\n"
            + "newer 6\nwider 3\n", read(config.vocabularies().get(1)));
        assertEquals(3, report.terminalCharacters());
        assertEquals(8, report.internalCharacters());
        assertEquals(2, report.corpora().get(1).uniqueItems());
    }

    @Test
    @DisplayName("Raw text: segmented pieces account for every character of every token")
    void testRawTextConservation() throws Exception {
        String text = "low lower lowest\nnewer  wider low\n\twidest newest\n";
        Path en = write("raw.en", text);
        Path scratch = tempDir.resolve("scratch");
        PipelineConfig config = PipelineConfig.builder()
            .withInputs(List.of(en))
            .withVocabularies(List.of(tempDir.resolve("vocab.en")))
            .withCodes(tempDir.resolve("codes.bpe"))
            .withSymbols(20)
            .withScratchDirectory(scratch)
            .build();

        new JointBpePipeline(config).run();

        long expectedChars = text.codePoints().filter(cp -> !Character.isWhitespace(cp)).count();
        long pieceChars = 0;
        long wordEnds = 0;
        for (String line : Files.readAllLines(config.vocabularies().get(0), StandardCharsets.UTF_8)) {
            String[] fields = line.split(" ");
            String symbol = fields[0];
            long count = Long.parseLong(fields[1]);
            if (symbol.endsWith("@@")) {
                symbol = symbol.substring(0, symbol.length() - 2);
            } else {
                wordEnds += count;
            }
            pieceChars += symbol.codePointCount(0, symbol.length()) * count;
        }
        assertEquals(expectedChars, pieceChars);
        assertEquals(8, wordEnds);

        try (Stream<Path> leftovers = Files.list(scratch)) {
            assertEquals(0, leftovers.count());
        }
    }

    @Test
    @DisplayName("Identical inputs give byte-identical outputs, with and without threads")
    void testDeterminism() throws Exception {
        PipelineConfig first = dictConfig("run1").build();
        PipelineConfig second = dictConfig("run2").build();
        PipelineConfig threaded = dictConfig("run3").withThreads(2).build();

        new JointBpePipeline(first).run();
        new JointBpePipeline(second).run();
        new JointBpePipeline(threaded).run();

        for (PipelineConfig other : List.of(second, threaded)) {
            assertArrayEquals(Files.readAllBytes(first.codes()), Files.readAllBytes(other.codes()));
            for (int i = 0; i < 2; i++) {
                assertArrayEquals(Files.readAllBytes(first.vocabularies().get(i)),
                    Files.readAllBytes(other.vocabularies().get(i)));
            }
        }
    }

    @Test
    @DisplayName("Mismatched input and output counts fail before any file is written")
    void testMismatch() throws IOException {
        Path en = write("corpus.en", "low 5\n");
        Path de = write("corpus.de", "newer 6\n");

        assertThrows(ConfigurationMismatchException.class, () -> PipelineConfig.builder()
            .withInputs(List.of(en, de))
            .withVocabularies(List.of(tempDir.resolve("vocab.en")))
            .withCodes(tempDir.resolve("codes.bpe"))
            .build());

        assertFalse(Files.exists(tempDir.resolve("codes.bpe")));
        assertFalse(Files.exists(tempDir.resolve("vocab.en")));
    }

    @Test
    @DisplayName("Malformed dictionary line aborts the run and leaves existing outputs untouched")
    void testMalformedDictLine() throws IOException {
        Path en = write("corpus.en", "low 5\n");
        Path de = write("corpus.de", "newer 6\nbroken line here\n");
        Path codes = write("out/codes.bpe", "previous\n");
        PipelineConfig config = PipelineConfig.builder()
            .withInputs(List.of(en, de))
            .withVocabularies(List.of(tempDir.resolve("out/vocab.en"), tempDir.resolve("out/vocab.de")))
            .withCodes(codes)
            .withDictInput(true)
            .build();

        MalformedCorpusException e = assertThrows(MalformedCorpusException.class,
            () -> new JointBpePipeline(config).run());
        assertEquals(de, e.getSource());
        assertEquals(1, e.getLineIndex());

        assertEquals("previous\n", read(codes));
        try (Stream<Path> files = Files.list(tempDir.resolve("out"))) {
            assertEquals(List.of(codes), files.toList());
        }
    }

    @Test
    @DisplayName("Report file lists merges and per-corpus splits")
    void testReport() throws Exception {
        Path special = write("special.txt", "unbelievable\n");
        Path reportFile = tempDir.resolve("out/report.json");
        PipelineConfig config = dictConfig("out")
            .withSpecialVocab(special)
            .withReport(reportFile)
            .build();

        new JointBpePipeline(config).run();

        JSONObject report = JSON.parseObject(read(reportFile));
        assertEquals(10, report.getIntValue("merge_count"));
        assertEquals(2, report.getJSONArray("corpora").size());
        JSONObject firstCorpus = report.getJSONArray("corpora").getJSONObject(0);
        assertEquals("unbelievable",
            firstCorpus.getJSONArray("special_word_splits").getJSONObject(0).getString("word"));
        assertEquals(12,
            firstCorpus.getJSONArray("special_word_splits").getJSONObject(0).getJSONArray("pieces").size());
    }
    @Test
    @DisplayName("Special word split is logged as a warning naming the word and its pieces")
    void testSpecialWordSplitWarning() throws Exception {
        Path special = write("special.txt", "unbelievable\n");
        PipelineConfig config = dictConfig("out").withSpecialVocab(special).build();

        Logger pipelineLogger = (Logger) LoggerFactory.getLogger(JointBpePipeline.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        pipelineLogger.addAppender(appender);
        try {
            new JointBpePipeline(config).run();
        } finally {
            pipelineLogger.detachAppender(appender);
            appender.stop();
        }

        List<String> warnings = appender.list.stream()
            .filter(event -> event.getLevel() == Level.WARN)
            .map(ILoggingEvent::getFormattedMessage)
            .toList();
        // one warning per corpus
        assertEquals(2, warnings.size());
        for (String warning : warnings) {
            assertTrue(warning.contains("unbelievable"), warning);
            assertTrue(warning.contains("u@@ n@@ b@@ e@@ l@@ i@@ e@@ v@@ a@@ b@@ l@@ e"), warning);
        }
    }

    @Test
    @DisplayName("A dictionary word that cannot be segmented aborts the run at its line")
    void testUnsegmentableDictWord() throws IOException {
        Path en = write("corpus.en", "low 5\na\u2003b 3\n");
        Path out = tempDir.resolve("out");
        PipelineConfig config = PipelineConfig.builder()
            .withInputs(List.of(en))
            .withVocabularies(List.of(out.resolve("vocab.en")))
            .withCodes(out.resolve("codes.bpe"))
            .withDictInput(true)
            .build();

        MalformedCorpusException e = assertThrows(MalformedCorpusException.class,
            () -> new JointBpePipeline(config).run());
        assertEquals(en, e.getSource());
        assertEquals(1, e.getLineIndex());
        assertEquals("a\u2003b 3", e.getLine());

        try (Stream<Path> files = Files.list(out)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("A failing corpus on a worker thread leaves no staged or final outputs")
    void testThreadedFailure() throws IOException {
        Path en = write("corpus.en", "low 5\nlowest 2\n");
        Path de = write("corpus.de", "newer 6\nwi\u2003der 3\n");
        Path out = tempDir.resolve("out");
        PipelineConfig config = PipelineConfig.builder()
            .withInputs(List.of(en, de))
            .withVocabularies(List.of(out.resolve("vocab.en"), out.resolve("vocab.de")))
            .withCodes(out.resolve("codes.bpe"))
            .withDictInput(true)
            .withThreads(2)
            .build();

        assertThrows(MalformedCorpusException.class, () -> new JointBpePipeline(config).run());

        try (Stream<Path> files = Files.list(out)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("POSTPEND run with character vocabulary and threads")
    void testPostpendEndToEnd() throws Exception {
        Path en = write("corpus.en", "low 5\nwo 1\n");
        Path de = write("corpus.de", "low 3\n");
        Path out = tempDir.resolve("out");
        PipelineConfig config = PipelineConfig.builder()
            .withInputs(List.of(en, de))
            .withVocabularies(List.of(out.resolve("vocab.en"), out.resolve("vocab.de")))
            .withCodes(out.resolve("codes.bpe"))
            .withSymbols(10)
            .withMinFrequency(2)
            .withDictInput(true)
            .withPostpend(true)
            .withCharacterVocab(true)
            .withThreads(2)
            .build();

        PipelineReport report = new JointBpePipeline(config).run();

        assertEquals("#version: 0.2\no w\n<w>l ow\n", read(config.codes()));
        // terminal characters are word-initial; the others carry the separator in front
        assertEquals("l 7\nw 7\n@@o 6\n@@w 6\nlow 5\n", read(config.vocabularies().get(0)));
        assertEquals("l 5\nw 5\n@@o 4\n@@w 4\nlow 3\n", read(config.vocabularies().get(1)));
        // low, w and @@o before augmentation
        assertEquals(3, report.corpora().get(0).uniqueItems());
        assertEquals(2, report.terminalCharacters());
        assertEquals(2, report.internalCharacters());
    }
}
