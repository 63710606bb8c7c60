package pl.marcinmilkowski.joint_bpe.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output files that only appear once the whole run succeeds.
 *
 * Each target is written to a staged sibling file first. {@link #commit()} moves
 * all of them into place; {@link #close()} deletes whatever was not committed,
 * so a failed run leaves no new or partial outputs behind.
 *
 * Existing targets are moved to backup siblings before being replaced. If a move
 * fails partway through a commit, targets already replaced are restored from their
 * backups (or removed, if they did not exist before) and the failure is rethrown.
 *
 * Staging is not thread-safe; writing to distinct staged files from several
 * threads is.
 */
public final class StagedOutputs implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(StagedOutputs.class);

    private final Map<Path, Path> stagedByTarget = new LinkedHashMap<>();
    private boolean committed;

    /**
     * Create an empty staged file next to {@code target} and return its path.
     */
    public Path stage(Path target) throws IOException {
        if (stagedByTarget.containsKey(target)) {
            throw new IllegalArgumentException("Output staged twice: " + target);
        }
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);
        Path staged = Files.createTempFile(directory, "." + absolute.getFileName(), ".staged");
        stagedByTarget.put(target, staged);
        return staged;
    }

    /**
     * Move every staged file onto its target, replacing existing files.
     */
    public void commit() throws IOException {
        // target -> backup of its previous content, null when the target was new
        Map<Path, Path> replaced = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, Path> e : stagedByTarget.entrySet()) {
                Path target = e.getKey();
                if (Files.isRegularFile(target)) {
                    Path absolute = target.toAbsolutePath();
                    Path backup = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName(), ".backup");
                    try {
                        move(target, backup);
                    } catch (IOException moveFailure) {
                        Files.deleteIfExists(backup);
                        throw moveFailure;
                    }
                    replaced.put(target, backup);
                    move(e.getValue(), target);
                } else {
                    move(e.getValue(), target);
                    replaced.put(target, null);
                }
            }
        } catch (IOException e) {
            rollBack(replaced, e);
            throw e;
        }
        committed = true;

        for (Path backup : replaced.values()) {
            if (backup != null) {
                Files.deleteIfExists(backup);
            }
        }
        log.debug("Committed {} output file(s)", stagedByTarget.size());
    }

    private static void rollBack(Map<Path, Path> replaced, IOException failure) {
        for (Map.Entry<Path, Path> e : replaced.entrySet()) {
            Path target = e.getKey();
            Path backup = e.getValue();
            try {
                if (backup != null) {
                    move(backup, target);
                } else {
                    Files.deleteIfExists(target);
                }
            } catch (IOException rollbackFailure) {
                failure.addSuppressed(rollbackFailure);
            }
        }
        log.warn("Commit failed; restored {} output file(s)", replaced.size());
    }

    public int size() {
        return stagedByTarget.size();
    }

    private static void move(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() throws IOException {
        if (committed) {
            return;
        }
        IOException failure = null;
        for (Path staged : stagedByTarget.values()) {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (!stagedByTarget.isEmpty()) {
            log.warn("Run did not complete; discarded {} staged output file(s)", stagedByTarget.size());
        }
        if (failure != null) {
            throw failure;
        }
    }
}
