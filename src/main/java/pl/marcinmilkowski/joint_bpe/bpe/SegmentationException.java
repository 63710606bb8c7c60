package pl.marcinmilkowski.joint_bpe.bpe;

/**
 * A word the merge applier cannot segment.
 */
public class SegmentationException extends IllegalArgumentException {

    private final String word;

    public SegmentationException(String word, String reason) {
        super("Cannot segment '" + word + "': " + reason);
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
