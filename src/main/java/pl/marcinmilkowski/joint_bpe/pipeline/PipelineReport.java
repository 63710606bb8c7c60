package pl.marcinmilkowski.joint_bpe.pipeline;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a completed run.
 */
public record PipelineReport(
    Path codes,
    int mergeCount,                 // rules in the codebook
    int combinedVocabularySize,     // distinct words across all corpora, special words included
    int terminalCharacters,         // 0 unless character augmentation ran
    int internalCharacters,
    List<CorpusReport> corpora      // input order
) {

    public PipelineReport {
        corpora = List.copyOf(corpora);
    }

    /**
     * Every special-word split, across all corpora.
     */
    public List<SpecialWordSplit> allSplits() {
        return corpora.stream()
            .flatMap(c -> c.splits().stream())
            .toList();
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("codes", codes.toString());
        root.put("merge_count", mergeCount);
        root.put("combined_vocabulary_size", combinedVocabularySize);
        root.put("terminal_characters", terminalCharacters);
        root.put("internal_characters", internalCharacters);

        JSONArray corporaArray = new JSONArray();
        for (CorpusReport corpus : corpora) {
            corporaArray.add(corpus.toJson());
        }
        root.put("corpora", corporaArray);
        return root;
    }

    /**
     * Write the report as pretty-printed JSON.
     */
    public void writeJson(Path output) throws IOException {
        String pretty = JSON.toJSONString(toJson(), JSONWriter.Feature.PrettyFormat);
        Files.writeString(output, pretty + "\n", StandardCharsets.UTF_8);
    }

    /**
     * Outcome for one corpus.
     */
    public record CorpusReport(
        Path input,
        Path vocabulary,
        int uniqueItems,                // before character augmentation
        long totalCount,                // sum of counts written, after augmentation
        List<SpecialWordSplit> splits
    ) {

        public CorpusReport {
            splits = List.copyOf(splits);
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("input", input.toString());
            obj.put("vocabulary", vocabulary.toString());
            obj.put("unique_items", uniqueItems);
            obj.put("total_count", totalCount);
            JSONArray splitArray = new JSONArray();
            for (SpecialWordSplit split : splits) {
                splitArray.add(split.toJson());
            }
            obj.put("special_word_splits", splitArray);
            return obj;
        }
    }
}
