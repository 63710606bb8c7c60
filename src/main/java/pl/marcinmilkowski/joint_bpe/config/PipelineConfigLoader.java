package pl.marcinmilkowski.joint_bpe.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads run settings from a JSON file.
 *
 * Expected JSON structure (every key optional except where the run needs it):
 * {
 *   "inputs": ["corpus.en", "corpus.de"],
 *   "vocabularies": ["vocab.en", "vocab.de"],
 *   "codes": "codes.bpe",
 *   "symbols": 32000,
 *   "min_frequency": 2,
 *   "special_vocab": "special.txt",
 *   "separator": "@@",
 *   "postpend": false,
 *   "total_symbols": false,
 *   "character_vocab": true,
 *   "dict_input": false,
 *   "verbose": false,
 *   "threads": 2,
 *   "report": "run.json",
 *   "scratch_dir": "/tmp"
 * }
 *
 * Relative paths are resolved against the directory holding the JSON file.
 * The result is a builder so that command-line options can still override it.
 */
public class PipelineConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private final Path configPath;
    private final Path baseDirectory;

    public PipelineConfigLoader(Path configPath) {
        this.configPath = configPath;
        Path parent = configPath.toAbsolutePath().getParent();
        this.baseDirectory = parent != null ? parent : configPath.toAbsolutePath();
    }

    /**
     * Parse the file into a pre-filled builder.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the JSON is invalid or a value has the wrong type
     */
    public PipelineConfig.Builder load() throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Pipeline config file not found: " + configPath);
        }

        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid JSON in pipeline config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty pipeline config: " + configPath);
        }

        PipelineConfig.Builder builder = PipelineConfig.builder();
        try {
            if (root.containsKey("inputs")) {
                builder.withInputs(paths(root.getJSONArray("inputs"), "inputs"));
            }
            if (root.containsKey("vocabularies")) {
                builder.withVocabularies(paths(root.getJSONArray("vocabularies"), "vocabularies"));
            }
            if (root.containsKey("codes")) {
                builder.withCodes(path(root.getString("codes")));
            }
            if (root.containsKey("symbols")) {
                builder.withSymbols(root.getIntValue("symbols"));
            }
            if (root.containsKey("min_frequency")) {
                builder.withMinFrequency(root.getIntValue("min_frequency"));
            }
            if (root.containsKey("special_vocab")) {
                builder.withSpecialVocab(path(root.getString("special_vocab")));
            }
            if (root.containsKey("separator")) {
                builder.withSeparator(root.getString("separator"));
            }
            if (root.containsKey("postpend")) {
                builder.withPostpend(root.getBooleanValue("postpend"));
            }
            if (root.containsKey("total_symbols")) {
                builder.withTotalSymbols(root.getBooleanValue("total_symbols"));
            }
            if (root.containsKey("character_vocab")) {
                builder.withCharacterVocab(root.getBooleanValue("character_vocab"));
            }
            if (root.containsKey("dict_input")) {
                builder.withDictInput(root.getBooleanValue("dict_input"));
            }
            if (root.containsKey("verbose")) {
                builder.withVerbose(root.getBooleanValue("verbose"));
            }
            if (root.containsKey("threads")) {
                builder.withThreads(root.getIntValue("threads"));
            }
            if (root.containsKey("report")) {
                builder.withReport(path(root.getString("report")));
            }
            if (root.containsKey("scratch_dir")) {
                builder.withScratchDirectory(path(root.getString("scratch_dir")));
            }
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid value in pipeline config " + configPath + ": " + e.getMessage(), e);
        }

        logger.info("Loaded pipeline config from {}", configPath);
        return builder;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private List<Path> paths(JSONArray array, String key) {
        if (array == null) {
            throw new IllegalArgumentException("'" + key + "' must be an array of paths");
        }
        List<Path> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Empty path at " + key + "[" + i + "]");
            }
            result.add(path(value));
        }
        return result;
    }

    private Path path(String value) {
        if (value == null) {
            return null;
        }
        Path p = Path.of(value);
        return p.isAbsolute() ? p : baseDirectory.resolve(p).normalize();
    }
}
