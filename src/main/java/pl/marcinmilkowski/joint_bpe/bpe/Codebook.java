package pl.marcinmilkowski.joint_bpe.bpe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.joint_bpe.corpus.MalformedCorpusException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of learned merge rules.
 *
 * A rule's rank is its position: when several rules apply to a word, the one
 * with the lowest rank wins. If a rule occurs twice, its first position counts.
 *
 * File format (UTF-8):
 * <pre>
 * #version: 0.2
 * e r&lt;/w&gt;
 * l o
 * ...
 * </pre>
 */
public final class Codebook {

    private static final Logger log = LoggerFactory.getLogger(Codebook.class);

    public static final String VERSION_HEADER = "#version: 0.2";

    /** Rank returned for pairs that have no rule. */
    public static final int NO_RULE = Integer.MAX_VALUE;

    private final List<MergeRule> rules;
    private final Map<MergeRule, Integer> ranks;

    public Codebook(List<MergeRule> rules) {
        this.rules = List.copyOf(rules);
        Map<MergeRule, Integer> loadedRanks = new HashMap<>(rules.size() * 2);
        for (int i = 0; i < this.rules.size(); i++) {
            loadedRanks.putIfAbsent(this.rules.get(i), i);
        }
        this.ranks = Collections.unmodifiableMap(loadedRanks);
    }

    /**
     * Rank of the rule merging {@code left} and {@code right}, or {@link #NO_RULE}.
     */
    public int rankOf(String left, String right) {
        return ranks.getOrDefault(new MergeRule(left, right), NO_RULE);
    }

    public List<MergeRule> rules() {
        return rules;
    }

    public MergeRule get(int rank) {
        return rules.get(rank);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public void write(Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(writer);
        }
        log.debug("Wrote {} merge rules to {}", rules.size(), output);
    }

    public void write(Writer writer) throws IOException {
        writer.write(VERSION_HEADER);
        writer.write('\n');
        for (MergeRule rule : rules) {
            writer.write(rule.toLine());
            writer.write('\n');
        }
    }

    /**
     * Read a codebook file. The version header is optional.
     *
     * @throws MalformedCorpusException if a rule line is not two space-separated symbols
     */
    public static Codebook read(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString(), null, "Codebook file not found");
        }
        List<MergeRule> loaded = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            long index = 0;
            while ((line = reader.readLine()) != null) {
                if (index == 0 && line.startsWith("#version:")) {
                    index++;
                    continue;
                }
                String stripped = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
                String[] parts = stripped.split(" ", -1);
                if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                    throw new MalformedCorpusException(input, index, line, "expected 'left right' merge rule");
                }
                loaded.add(new MergeRule(parts[0], parts[1]));
                index++;
            }
        }
        log.info("Loaded {} merge rules from {}", loaded.size(), input);
        return new Codebook(loaded);
    }

    @Override
    public String toString() {
        return "Codebook[" + rules.size() + " rules]";
    }
}
