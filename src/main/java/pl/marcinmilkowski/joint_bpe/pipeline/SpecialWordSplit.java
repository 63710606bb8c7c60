package pl.marcinmilkowski.joint_bpe.pipeline;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * A special word that the learned merges did not keep whole.
 *
 * Purely informational: the pieces are still counted in the vocabulary.
 */
public record SpecialWordSplit(
    int index,              // 0-based position in the special vocabulary file
    String word,
    List<String> pieces     // segmentation, separators attached
) {

    public SpecialWordSplit {
        pieces = List.copyOf(pieces);
    }

    /**
     * Pieces joined by single spaces, as shown in warnings.
     */
    public String joinedPieces() {
        return String.join(" ", pieces);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("index", index);
        obj.put("word", word);
        obj.put("pieces", new JSONArray(pieces));
        return obj;
    }
}
