package org.testplan.cover;

import org.junit.jupiter.api.Test;
import org.testplan.enumeration.Candidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GreedyCoverSelectorTest {

    private final GreedyCoverSelector selector = new GreedyCoverSelector();

    @Test
    void select_shouldPickLargestGainFirst() {
        // Given
        List<Candidate> candidates = List.of(
                candidate("small", 1, 2),
                candidate("large", 1, 3, 4, 5),
                candidate("rest", 2, 6));

        // When
        CoverResult result = selector.select(candidates, Set.of(1, 2, 3, 4, 5, 6));

        // Then
        assertThat(result.getTestCases()).extracting(testCase -> testCase.getAssignment().get(1))
                .containsExactly("large", "rest");
        assertThat(result.getTestCases()).extracting(TestCase::getSequenceNumber).containsExactly(1, 2);
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getCoverage()).isEqualTo(1.0);
    }

    @Test
    void select_shouldPreferEarliestCandidate_onTies() {
        // Given
        List<Candidate> candidates = List.of(candidate("first", 1, 2), candidate("second", 2, 3));

        // When
        CoverResult result = selector.select(candidates, Set.of(1, 2, 3));

        // Then
        assertThat(result.getTestCases().get(0).getAssignment().get(1)).isEqualTo("first");
    }

    @Test
    void select_shouldReportShortfall_whenCandidatesCannotCoverUniverse() {
        // Given
        List<Candidate> candidates = List.of(candidate("only", 1, 2), candidate("duplicate", 1, 2));

        // When
        CoverResult result = selector.select(candidates, Set.of(1, 2, 3));

        // Then
        assertThat(result.getTestCases()).hasSize(1);
        assertThat(result.getUncovered()).containsExactly(3);
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void select_shouldStrictlyReduceUncovered_withEverySelection() {
        // Given
        List<Candidate> candidates = List.of(
                candidate("a", 1), candidate("b", 1, 2), candidate("c", 2, 3), candidate("d", 4), candidate("e", 1, 4));
        Set<Integer> universe = Set.of(1, 2, 3, 4);

        // When
        CoverResult result = selector.select(candidates, universe);

        // Then
        Set<Integer> uncovered = new TreeSet<>(universe);
        for (TestCase testCase : result.getTestCases()) {
            int before = uncovered.size();
            uncovered.removeAll(testCase.getVisibleQuestionNumbers());
            assertThat(uncovered.size()).isLessThan(before);
        }
        assertThat(uncovered).isEmpty();
    }

    @Test
    void select_shouldLeaveInputUntouched() {
        // Given
        List<Candidate> candidates = new ArrayList<>(List.of(candidate("a", 1), candidate("b", 2)));

        // When
        selector.select(candidates, Set.of(1, 2));

        // Then
        assertThat(candidates).hasSize(2);
    }

    @Test
    void select_shouldReturnNoCases_whenUniverseIsEmpty() {
        // When
        CoverResult result = selector.select(List.of(candidate("a", 1)), Set.of());

        // Then
        assertThat(result.getTestCases()).isEmpty();
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    void select_shouldRejectNullArguments() {
        assertThatThrownBy(() -> selector.select(null, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Candidate candidate(String tag, Integer... visible) {
        TreeMap<Integer, String> assignment = new TreeMap<>();
        assignment.put(1, tag);
        return new Candidate(assignment, assignment, new TreeSet<>(List.of(visible)));
    }
}
