package nl.nfi.djwordlist.generate.expand;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LeetExpansionTest {

    private static final Map<Character, List<String>> AT_FOR_A = Map.of('a', List.of("@"));

    @Test
    void singleSubstitutionPerVariant() {
        assertThat(LeetExpansion.of("banana", "banana", AT_FOR_A, 1))
                .containsExactly("banana", "b@nana", "ban@na", "banan@");
    }

    @Test
    void boundIsAppliedToSimultaneousSubstitutions() {
        // C(3,0) + C(3,1) + C(3,2) + C(3,3)
        assertThat(collect(LeetExpansion.of("banana", "banana", AT_FOR_A, 3))).hasSize(8);
        assertThat(collect(LeetExpansion.of("banana", "banana", AT_FOR_A, 2))).hasSize(7);
        // larger than the number of eligible positions
        assertThat(collect(LeetExpansion.of("banana", "banana", AT_FOR_A, 10))).hasSize(8);
    }

    @Test
    void zeroBoundYieldsIdentityOnly() {
        assertThat(LeetExpansion.of("banana", "banana", AT_FOR_A, 0)).containsExactly("banana");
    }

    @Test
    void noEligiblePositionsYieldsIdentityOnly() {
        final LeetExpansion expansion = LeetExpansion.of("xyz", "xyz", AT_FOR_A, 4);

        assertThat(expansion.eligiblePositionCount()).isZero();
        assertThat(expansion).containsExactly("xyz");
    }

    @Test
    void replacementChoicesAreCrossed() {
        final Map<Character, List<String>> leet = Map.of('a', List.of("@", "4"), 's', List.of("$"));

        assertThat(LeetExpansion.of("as", "as", leet, 2))
                .containsExactly("as", "@s", "4s", "a$", "@$", "4$");
    }

    @Test
    void identicalResultsAreEmittedOnce() {
        // replacing either 'a' by "aa" gives the same string
        final Map<Character, List<String>> leet = Map.of('a', List.of("aa"));

        assertThat(LeetExpansion.of("aa", "aa", leet, 2))
                .containsExactly("aa", "aaa", "aaaa");
    }

    @Test
    void eligibilityFollowsReferenceCharacters() {
        // the upper cased value has no 'a', but the original base string does
        assertThat(LeetExpansion.of("BANANA", "banana", AT_FOR_A, 1))
                .containsExactly("BANANA", "B@NANA", "BAN@NA", "BANAN@");
    }

    @Test
    void eligibilityIsCaseSensitive() {
        assertThat(LeetExpansion.of("BANANA", "BANANA", AT_FOR_A, 1)).containsExactly("BANANA");
    }

    @Test
    void allVariantsAreDistinct() {
        final Map<Character, List<String>> leet = Map.of(
                'a', List.of("@", "4"),
                's', List.of("$", "5"),
                'e', List.of("3"));
        final List<String> variants = collect(LeetExpansion.of("seasides", "seasides", leet, 3));

        assertThat(new HashSet<>(variants)).hasSameSizeAs(variants);
        assertThat(variants.get(0)).isEqualTo("seasides");
    }

    private static List<String> collect(final Iterable<String> values) {
        final List<String> result = new ArrayList<>();
        values.forEach(result::add);
        return result;
    }
}
