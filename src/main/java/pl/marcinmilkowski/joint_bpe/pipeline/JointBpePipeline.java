package pl.marcinmilkowski.joint_bpe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.bpe.Codebook;
import pl.marcinmilkowski.joint_bpe.bpe.MergeApplier;
import pl.marcinmilkowski.joint_bpe.bpe.MergeLearner;
import pl.marcinmilkowski.joint_bpe.config.PipelineConfig;
import pl.marcinmilkowski.joint_bpe.corpus.SpecialVocabulary;
import pl.marcinmilkowski.joint_bpe.corpus.SpecialVocabularyLoader;
import pl.marcinmilkowski.joint_bpe.corpus.VocabularyExtractor;
import pl.marcinmilkowski.joint_bpe.corpus.VocabularyWriter;
import pl.marcinmilkowski.joint_bpe.corpus.WordFrequencies;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Learns one BPE codebook over several corpora and writes a subword vocabulary per corpus.
 *
 * Steps:
 * 1. Sum the word frequencies of all corpora; add 1 for every special word
 * 2. Learn the codebook once from a snapshot of that combined mapping
 * 3. Build one shared {@link MergeApplier}
 * 4. Per corpus: re-segment and re-count, add 1 to every piece of every special
 *    word, optionally pin single characters above all counts, write sorted
 * 5. Move the codebook, the vocabularies and the optional report into place
 *
 * Steps 1-3 are sequential. Step 4 may run on several threads; corpora share
 * nothing but the read-only applier and character inventory. Any failure aborts
 * the run and no output file is created or replaced.
 */
public class JointBpePipeline {

    private static final Logger logger = LoggerFactory.getLogger(JointBpePipeline.class);

    private final PipelineConfig config;
    private final VocabularyWriter vocabularyWriter = new VocabularyWriter();

    public JointBpePipeline(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Execute the whole run.
     *
     * @return summary of the run
     * @throws pl.marcinmilkowski.joint_bpe.corpus.MalformedCorpusException on a malformed
     *         dictionary line, special word or unsegmentable word
     * @throws IOException if any file cannot be read or written
     * @throws InterruptedException if interrupted while waiting for corpus workers
     */
    public PipelineReport run() throws IOException, InterruptedException {
        long startTime = System.currentTimeMillis();

        SpecialVocabulary special = new SpecialVocabularyLoader().load(config.specialVocab());

        // Combined mapping
        VocabularyExtractor extractor = new VocabularyExtractor(config.dictInput());
        WordFrequencies combined = new WordFrequencies();
        for (Path input : config.inputs()) {
            combined.addAll(extractor.extract(input));
        }
        for (String word : special.words()) {
            combined.increment(word);
        }
        WordFrequencies learningVocabulary = combined.snapshot();
        logger.info("Combined vocabulary: {} unique words from {} corpora",
            learningVocabulary.size(), config.inputs().size());

        // Learning
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(config.symbols());
        learner.setMinFrequency(config.minFrequency());
        learner.setDirection(config.direction());
        learner.setTotalSymbols(config.totalSymbols());
        learner.setSpecialWords(special.words());
        learner.setVerbose(config.verbose());
        Codebook codebook = learner.learn(learningVocabulary.toDictLines());

        MergeApplier applier = new MergeApplier(codebook, config.separator(), config.direction());
        CorpusVocabularyDeriver deriver = new CorpusVocabularyDeriver(
            applier, config.dictInput(), config.scratchDirectory());
        CharacterInventory characters = config.characterVocab()
            ? CharacterInventory.of(learningVocabulary, config.direction(), config.separator())
            : null;

        PipelineReport report;
        try (StagedOutputs outputs = new StagedOutputs()) {
            codebook.write(outputs.stage(config.codes()));

            List<Path> stagedVocabularies = new ArrayList<>();
            for (Path vocabulary : config.vocabularies()) {
                stagedVocabularies.add(outputs.stage(vocabulary));
            }

            List<PipelineReport.CorpusReport> corpora =
                deriveAll(deriver, special, characters, stagedVocabularies);

            report = new PipelineReport(
                config.codes(),
                codebook.size(),
                learningVocabulary.size(),
                characters != null ? characters.terminal().size() : 0,
                characters != null ? characters.internal().size() : 0,
                corpora);

            if (config.report() != null) {
                report.writeJson(outputs.stage(config.report()));
            }
            outputs.commit();
        }

        long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Run completed in {} s: {} merges, {} vocabularies",
            String.format(Locale.ROOT, "%.1f", elapsed / 1000.0), codebook.size(), config.vocabularies().size());
        return report;
    }

    private List<PipelineReport.CorpusReport> deriveAll(CorpusVocabularyDeriver deriver,
                                                        SpecialVocabulary special,
                                                        CharacterInventory characters,
                                                        List<Path> stagedVocabularies)
            throws IOException, InterruptedException {
        int n = config.inputs().size();
        List<Callable<PipelineReport.CorpusReport>> tasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Path input = config.inputs().get(i);
            Path vocabulary = config.vocabularies().get(i);
            Path staged = stagedVocabularies.get(i);
            tasks.add(() -> deriveOne(deriver, special, characters, input, vocabulary, staged));
        }

        List<PipelineReport.CorpusReport> reports = new ArrayList<>(n);
        if (config.threads() == 1 || n == 1) {
            for (Callable<PipelineReport.CorpusReport> task : tasks) {
                reports.add(callDirect(task));
            }
            return reports;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.threads(), n));
        try {
            List<Future<PipelineReport.CorpusReport>> futures = new ArrayList<>(n);
            for (Callable<PipelineReport.CorpusReport> task : tasks) {
                futures.add(executor.submit(task));
            }
            for (Future<PipelineReport.CorpusReport> future : futures) {
                try {
                    reports.add(future.get());
                } catch (ExecutionException ee) {
                    futures.forEach(f -> f.cancel(true));
                    throw unwrap(ee.getCause());
                }
            }
        } finally {
            // Workers write into staged files; none may still run once staging is cleaned up
            executor.shutdown();
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.info("Waiting for corpus workers to finish");
            }
        }
        return reports;
    }

    private PipelineReport.CorpusReport deriveOne(CorpusVocabularyDeriver deriver,
                                                  SpecialVocabulary special,
                                                  CharacterInventory characters,
                                                  Path input, Path vocabulary, Path staged) throws IOException {
        WordFrequencies vocab = deriver.derive(input);

        List<SpecialWordSplit> splits = deriver.foldSpecialVocabulary(vocab, special);
        for (SpecialWordSplit split : splits) {
            logger.warn("special vocab '{}' not captured by merges, split into '{}'",
                split.word(), split.joinedPieces());
        }

        int uniqueItems = vocab.size();
        logger.info("Vocabulary got {} unique items ({})", uniqueItems, input);

        if (characters != null) {
            characters.augment(vocab);
        }

        vocabularyWriter.write(vocab, staged);
        return new PipelineReport.CorpusReport(input, vocabulary, uniqueItems, vocab.total(), splits);
    }

    private static PipelineReport.CorpusReport callDirect(Callable<PipelineReport.CorpusReport> task)
            throws IOException {
        try {
            return task.call();
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Corpus processing failed", e);
        }
    }

    private static IOException unwrap(Throwable cause) {
        if (cause instanceof IOException io) {
            return io;
        }
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException("Corpus processing failed", cause);
    }
}
