package org.testplan.enumeration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Esito della ricerca: candidati della fase 1 seguiti da quelli della fase 3, obiettivo di
 * copertura e domande rimaste scoperte.
 */
public final class EnumerationResult {

    private final List<Candidate> candidates;
    private final int phaseOneCount;
    private final List<Integer> gatekeepers;
    private final SortedSet<Integer> coverageTarget;
    private final SortedSet<Integer> uncovered;

    public EnumerationResult(List<Candidate> phaseOne, List<Candidate> phaseThree, List<Integer> gatekeepers,
                             SortedSet<Integer> coverageTarget, SortedSet<Integer> uncovered) {
        List<Candidate> all = new ArrayList<>(phaseOne);
        all.addAll(phaseThree);
        this.candidates = Collections.unmodifiableList(all);
        this.phaseOneCount = phaseOne.size();
        this.gatekeepers = List.copyOf(gatekeepers);
        this.coverageTarget = Collections.unmodifiableSortedSet(new TreeSet<>(coverageTarget));
        this.uncovered = Collections.unmodifiableSortedSet(new TreeSet<>(uncovered));
    }

    public static EnumerationResult empty(SortedSet<Integer> coverageTarget) {
        return new EnumerationResult(List.of(), List.of(), List.of(), coverageTarget, coverageTarget);
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public List<Candidate> getPhaseOneCandidates() {
        return candidates.subList(0, phaseOneCount);
    }

    public List<Candidate> getPhaseThreeCandidates() {
        return candidates.subList(phaseOneCount, candidates.size());
    }

    /**
     * @return gatekeeper scelti nella fase 1, in ordine di rango
     */
    public List<Integer> getGatekeepers() {
        return gatekeepers;
    }

    public SortedSet<Integer> getCoverageTarget() {
        return coverageTarget;
    }

    public SortedSet<Integer> getUncovered() {
        return uncovered;
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("EnumerationResult{candidates=%d (fase1=%d), target=%d, uncovered=%s}",
                candidates.size(), phaseOneCount, coverageTarget.size(), uncovered);
    }
}
