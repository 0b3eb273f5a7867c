package org.testplan.enumeration;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combinazione di risposte valida trovata dalla ricerca, con l'insieme di domande che rende
 * visibili. Immutabile.
 */
public final class Candidate {

    private final SortedMap<Integer, String> assignment;
    private final SortedMap<Integer, String> completeAssignment;
    private final SortedSet<Integer> visibleQuestionNumbers;

    public Candidate(SortedMap<Integer, String> assignment, SortedMap<Integer, String> completeAssignment,
                     SortedSet<Integer> visibleQuestionNumbers) {
        this.assignment = Collections.unmodifiableSortedMap(new TreeMap<>(assignment));
        this.completeAssignment = Collections.unmodifiableSortedMap(new TreeMap<>(completeAssignment));
        this.visibleQuestionNumbers = Collections.unmodifiableSortedSet(new TreeSet<>(visibleQuestionNumbers));
    }

    /**
     * @return valori imposti dalla ricerca
     */
    public SortedMap<Integer, String> getAssignment() {
        return assignment;
    }

    /**
     * @return valori non nulli di tutte le variabili di test non dinamiche
     */
    public SortedMap<Integer, String> getCompleteAssignment() {
        return completeAssignment;
    }

    public SortedSet<Integer> getVisibleQuestionNumbers() {
        return visibleQuestionNumbers;
    }

    @Override
    public String toString() {
        return "Candidate{assignment=" + assignment + ", visible=" + visibleQuestionNumbers.size() + '}';
    }
}
