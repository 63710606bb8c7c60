package pl.marcinmilkowski.joint_bpe.config;

/**
 * The number of input corpora and vocabulary outputs do not match.
 *
 * Raised while validating the configuration, before any file is opened.
 */
public class ConfigurationMismatchException extends IllegalArgumentException {

    private final int inputCount;
    private final int vocabularyCount;

    public ConfigurationMismatchException(int inputCount, int vocabularyCount) {
        super(inputCount == 0
            ? "At least one input file is required"
            : "Number of input files (" + inputCount + ") and vocabulary files ("
                + vocabularyCount + ") must match");
        this.inputCount = inputCount;
        this.vocabularyCount = vocabularyCount;
    }

    public int getInputCount() {
        return inputCount;
    }

    public int getVocabularyCount() {
        return vocabularyCount;
    }
}
