package org.testplan.cover;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Casi di test selezionati e domande dell'universo rimaste scoperte.
 */
public final class CoverResult {

    private final List<TestCase> testCases;
    private final SortedSet<Integer> universe;
    private final SortedSet<Integer> uncovered;

    CoverResult(List<TestCase> testCases, SortedSet<Integer> universe, SortedSet<Integer> uncovered) {
        this.testCases = List.copyOf(testCases);
        this.universe = Collections.unmodifiableSortedSet(new TreeSet<>(universe));
        this.uncovered = Collections.unmodifiableSortedSet(new TreeSet<>(uncovered));
    }

    public List<TestCase> getTestCases() {
        return testCases;
    }

    public SortedSet<Integer> getUniverse() {
        return universe;
    }

    public SortedSet<Integer> getUncovered() {
        return uncovered;
    }

    public boolean isComplete() {
        return uncovered.isEmpty();
    }

    /**
     * @return frazione dell'universo coperta (1.0 per universo vuoto)
     */
    public double getCoverage() {
        return universe.isEmpty() ? 1.0 : (double) (universe.size() - uncovered.size()) / universe.size();
    }
}
