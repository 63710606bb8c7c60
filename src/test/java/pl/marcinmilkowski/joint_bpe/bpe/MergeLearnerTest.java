package pl.marcinmilkowski.joint_bpe.bpe;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MergeLearner.
 */
class MergeLearnerTest {

    private static final List<String> JOINT_DICT = List.of(
        "newer 6", "low 5", "wider 3", "lowest 2");

    private static List<String> lines(Codebook codebook) {
        return codebook.rules().stream().map(MergeRule::toLine).toList();
    }

    @Test
    @DisplayName("Most frequent pair first, ties go to the larger pair")
    void testMergeOrder() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(10);
        learner.setMinFrequency(2);

        Codebook codebook = learner.learn(JOINT_DICT.iterator());

        assertEquals(List.of(
            "e r</w>",
            "l o",
            "w er</w>",
            "n e",
            "ne wer</w>",
            "lo w</w>",
            "w i",
            "wi d",
            "wid er</w>",
            "w e"), lines(codebook));
    }

    @Test
    @DisplayName("Input order of the dictionary does not change the result")
    void testOrderIndependent() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(10);
        Codebook a = learner.learn(JOINT_DICT.iterator());
        Codebook b = learner.learn(List.of("lowest 2", "wider 3", "low 5", "newer 6").iterator());
        assertEquals(a.rules(), b.rules());
    }

    @Test
    @DisplayName("Learning stops when the best pair is below the minimum frequency")
    void testMinFrequencyStop() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(100);
        learner.setMinFrequency(3);

        Codebook codebook = learner.learn(JOINT_DICT.iterator());

        assertEquals(9, codebook.size());
        assertEquals("wid er</w>", codebook.get(8).toLine());
    }

    @Test
    @DisplayName("Learning stops when no pairs are left")
    void testExhausted() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(100);
        learner.setMinFrequency(1);

        Codebook codebook = learner.learn(List.of("ab 1", "c 4").iterator());

        assertEquals(List.of("a b</w>"), lines(codebook));
    }

    @Test
    @DisplayName("Duplicate dictionary words are summed")
    void testDuplicatesSummed() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(1);
        learner.setMinFrequency(3);

        Codebook codebook = learner.learn(List.of("xy 2", "ab 2", "xy 2").iterator());

        assertEquals(List.of("x y</w>"), lines(codebook));
    }

    @Test
    @DisplayName("Total-symbols mode subtracts unique characters from the budget")
    void testTotalSymbols() {
        MergeLearner learner = new MergeLearner();
        learner.setTotalSymbols(true);

        // l, o and w</w>: 3 characters
        learner.setSymbols(3);
        assertTrue(learner.learn(List.of("low 5").iterator()).isEmpty());

        learner.setSymbols(4);
        assertEquals(List.of("o w</w>"), lines(learner.learn(List.of("low 5").iterator())));
    }

    @Test
    @DisplayName("POSTPEND marks the word start")
    void testPostpend() {
        MergeLearner learner = new MergeLearner();
        learner.setDirection(MergeDirection.POSTPEND);
        learner.setSymbols(10);

        Codebook codebook = learner.learn(List.of("low 5").iterator());

        assertEquals(List.of("o w", "<w>l ow"), lines(codebook));
    }

    @Test
    @DisplayName("Leftover budget completes special words after a frequency stop")
    void testSpecialWordCompletion() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(10);
        learner.setMinFrequency(2);
        learner.setSpecialWords(List.of("xyz"));

        Codebook codebook = learner.learn(List.of("low 5", "xyz 1").iterator());

        assertEquals(List.of("o w</w>", "l ow</w>", "y z</w>", "x yz</w>"), lines(codebook));
    }

    @Test
    @DisplayName("Special word completion respects the budget")
    void testSpecialWordBudget() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(3);
        learner.setMinFrequency(2);
        learner.setSpecialWords(List.of("xyz"));

        Codebook codebook = learner.learn(List.of("low 5", "xyz 1").iterator());

        assertEquals(List.of("o w</w>", "l ow</w>", "y z</w>"), lines(codebook));
    }

    @Test
    @DisplayName("Without special words a frequency stop ends learning")
    void testNoSpecialWords() {
        MergeLearner learner = new MergeLearner();
        learner.setSymbols(10);
        learner.setMinFrequency(2);

        Codebook codebook = learner.learn(List.of("low 5", "xyz 1").iterator());

        assertEquals(2, codebook.size());
    }

    @Test
    @DisplayName("Malformed dictionary line is rejected")
    void testMalformedLine() {
        MergeLearner learner = new MergeLearner();
        assertThrows(IllegalArgumentException.class,
            () -> learner.learn(List.of("low 5", "oops").iterator()));
    }

    @Test
    @DisplayName("replacePair merges non-overlapping occurrences left to right")
    void testReplacePair() {
        List<String> merged = MergeLearner.replacePair(List.of("a", "a", "a"), new MergeRule("a", "a"));
        assertEquals(List.of("aa", "a"), merged);

        merged = MergeLearner.replacePair(List.of("a", "b", "a", "b</w>"), new MergeRule("a", "b"));
        assertEquals(List.of("ab", "a", "b</w>"), merged);
    }
}
