package pl.marcinmilkowski.joint_bpe.config;

import pl.marcinmilkowski.joint_bpe.bpe.MergeDirection;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable settings for one joint BPE run.
 *
 * Build through {@link #builder()}; {@link Builder#build()} validates the
 * settings and throws before anything touches the file system.
 */
public record PipelineConfig(
    List<Path> inputs,          // corpora, one vocabulary each
    List<Path> vocabularies,    // per-corpus vocabulary outputs, same order as inputs
    Path codes,                 // codebook output
    int symbols,                // merge budget
    int minFrequency,           // stop when the best pair is rarer than this
    Path specialVocab,          // optional word list, null when unset
    String separator,           // subword boundary marker
    MergeDirection direction,
    boolean totalSymbols,       // subtract unique characters from the budget
    boolean characterVocab,     // add single characters with pseudo-counts
    boolean dictInput,          // inputs are "word count" dictionaries
    boolean verbose,            // log every learned merge
    int threads,                // workers for per-corpus re-derivation
    Path report,                // optional JSON run report, null when unset
    Path scratchDirectory       // where raw-text scratch buffers live
) {

    public static final int DEFAULT_SYMBOLS = 10000;
    public static final int DEFAULT_MIN_FREQUENCY = 2;
    public static final String DEFAULT_SEPARATOR = "@@";

    public PipelineConfig {
        inputs = List.copyOf(inputs);
        vocabularies = List.copyOf(vocabularies);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasSpecialVocab() {
        return specialVocab != null;
    }

    /**
     * Fluent builder. Later calls override earlier ones, which lets
     * command-line options override a loaded configuration file.
     */
    public static class Builder {
        private List<Path> inputs = new ArrayList<>();
        private List<Path> vocabularies = new ArrayList<>();
        private Path codes;
        private int symbols = DEFAULT_SYMBOLS;
        private int minFrequency = DEFAULT_MIN_FREQUENCY;
        private Path specialVocab;
        private String separator = DEFAULT_SEPARATOR;
        private MergeDirection direction = MergeDirection.PREPEND;
        private boolean totalSymbols;
        private boolean characterVocab;
        private boolean dictInput;
        private boolean verbose;
        private int threads = 1;
        private Path report;
        private Path scratchDirectory;

        public Builder withInputs(List<Path> inputs) { this.inputs = new ArrayList<>(inputs); return this; }
        public Builder withVocabularies(List<Path> vocabularies) { this.vocabularies = new ArrayList<>(vocabularies); return this; }
        public Builder withCodes(Path codes) { this.codes = codes; return this; }
        public Builder withSymbols(int symbols) { this.symbols = symbols; return this; }
        public Builder withMinFrequency(int minFrequency) { this.minFrequency = minFrequency; return this; }
        public Builder withSpecialVocab(Path specialVocab) { this.specialVocab = specialVocab; return this; }
        public Builder withSeparator(String separator) { this.separator = separator; return this; }
        public Builder withDirection(MergeDirection direction) { this.direction = direction; return this; }
        public Builder withPostpend(boolean postpend) { this.direction = MergeDirection.of(postpend); return this; }
        public Builder withTotalSymbols(boolean totalSymbols) { this.totalSymbols = totalSymbols; return this; }
        public Builder withCharacterVocab(boolean characterVocab) { this.characterVocab = characterVocab; return this; }
        public Builder withDictInput(boolean dictInput) { this.dictInput = dictInput; return this; }
        public Builder withVerbose(boolean verbose) { this.verbose = verbose; return this; }
        public Builder withThreads(int threads) { this.threads = threads; return this; }
        public Builder withReport(Path report) { this.report = report; return this; }
        public Builder withScratchDirectory(Path scratchDirectory) { this.scratchDirectory = scratchDirectory; return this; }

        /**
         * Validate and build.
         *
         * @throws ConfigurationMismatchException if there are no inputs or the
         *         input and vocabulary counts differ
         * @throws IllegalArgumentException for any other invalid value
         */
        public PipelineConfig build() {
            if (inputs.isEmpty() || inputs.size() != vocabularies.size()) {
                throw new ConfigurationMismatchException(inputs.size(), vocabularies.size());
            }
            if (codes == null) {
                throw new IllegalArgumentException("Codebook output path is required");
            }
            if (symbols <= 0) {
                throw new IllegalArgumentException("Symbol budget must be positive: " + symbols);
            }
            if (minFrequency <= 0) {
                throw new IllegalArgumentException("Minimum frequency must be positive: " + minFrequency);
            }
            if (separator == null || separator.isEmpty()) {
                throw new IllegalArgumentException("Separator must not be empty");
            }
            if (threads <= 0) {
                throw new IllegalArgumentException("Thread count must be positive: " + threads);
            }
            Path scratch = scratchDirectory != null
                ? scratchDirectory
                : Paths.get(System.getProperty("java.io.tmpdir"));
            return new PipelineConfig(inputs, vocabularies, codes, symbols, minFrequency, specialVocab,
                separator, direction, totalSymbols, characterVocab, dictInput, verbose, threads, report, scratch);
        }
    }
}
