package pl.marcinmilkowski.joint_bpe.corpus;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A corpus, dictionary or word-list line that cannot be used.
 *
 * Always fatal for a run: one bad line invalidates the joint statistics.
 */
public class MalformedCorpusException extends IOException {

    private final Path source;
    private final long lineIndex;
    private final String line;

    public MalformedCorpusException(Path source, long lineIndex, String line, String reason) {
        this(source, lineIndex, line, reason, null);
    }

    public MalformedCorpusException(Path source, long lineIndex, String line, String reason, Throwable cause) {
        super(String.format("Failed reading %s at line %d: %s (%s)", source, lineIndex, line, reason), cause);
        this.source = source;
        this.lineIndex = lineIndex;
        this.line = line;
    }

    /**
     * The file the line came from.
     */
    public Path getSource() {
        return source;
    }

    /**
     * 0-based line index.
     */
    public long getLineIndex() {
        return lineIndex;
    }

    /**
     * The raw line content.
     */
    public String getLine() {
        return line;
    }
}
