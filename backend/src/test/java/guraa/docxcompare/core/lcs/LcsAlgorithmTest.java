package guraa.docxcompare.core.lcs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LCS Algorithm Tests")
class LcsAlgorithmTest {

    private static List<String> keys(String... values) {
        return Arrays.asList(values);
    }

    private static void assertValid(List<LcsMatch> matches, List<String> original, List<String> revised) {
        for (int k = 0; k < matches.size(); k++) {
            LcsMatch match = matches.get(k);
            assertThat(original.get(match.getOriginalIndex())).isEqualTo(revised.get(match.getRevisedIndex()));
            if (k > 0) {
                assertThat(match.getOriginalIndex()).isGreaterThan(matches.get(k - 1).getOriginalIndex());
                assertThat(match.getRevisedIndex()).isGreaterThan(matches.get(k - 1).getRevisedIndex());
            }
        }
    }

    @ParameterizedTest
    @EnumSource(LcsAlgorithmType.class)
    @DisplayName("Should find the common subsequence of two small sequences")
    void shouldFindCommonSubsequence_whenSequencesOverlap(LcsAlgorithmType type) {
        List<String> original = keys("a", "b", "c", "d", "e");
        List<String> revised = keys("a", "x", "c", "d", "y", "e");

        List<LcsMatch> matches = type.create().compute(original, revised);

        assertThat(matches).containsExactly(
                new LcsMatch(0, 0), new LcsMatch(2, 2), new LcsMatch(3, 3), new LcsMatch(4, 5));
    }

    @ParameterizedTest
    @EnumSource(LcsAlgorithmType.class)
    @DisplayName("Should return no matches when one side is empty")
    void shouldReturnEmpty_whenOneSideIsEmpty(LcsAlgorithmType type) {
        assertThat(type.create().compute(keys(), keys("a"))).isEmpty();
        assertThat(type.create().compute(keys("a"), keys())).isEmpty();
    }

    @Test
    @DisplayName("Should agree with the table-based algorithm on random input")
    void shouldMatchDynamicProgrammingLength_whenInputIsRandom() {
        Random random = new Random(42);
        LcsAlgorithm hunt = new HuntSzymanskiLcs();
        LcsAlgorithm table = new DynamicProgrammingLcs();

        for (int round = 0; round < 200; round++) {
            List<String> original = randomKeys(random, random.nextInt(30));
            List<String> revised = randomKeys(random, random.nextInt(30));

            List<LcsMatch> fast = hunt.compute(original, revised);
            List<LcsMatch> reference = table.compute(original, revised);

            assertThat(fast).hasSameSizeAs(reference);
            assertValid(fast, original, revised);
            assertValid(reference, original, revised);
        }
    }

    private static List<String> randomKeys(Random random, int length) {
        List<String> keys = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            keys.add(String.valueOf((char) ('a' + random.nextInt(5))));
        }
        return keys;
    }
}
