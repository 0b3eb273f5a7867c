package org.testplan.cover;

import org.testplan.enumeration.Candidate;

import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Caso di test selezionato, numerato da 1 nell'ordine di selezione.
 */
public final class TestCase {

    private final int sequenceNumber;
    private final Candidate candidate;

    TestCase(int sequenceNumber, Candidate candidate) {
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Numero di sequenza deve essere ≥ 1: " + sequenceNumber);
        }
        this.sequenceNumber = sequenceNumber;
        this.candidate = candidate;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    public SortedMap<Integer, String> getAssignment() {
        return candidate.getAssignment();
    }

    public SortedMap<Integer, String> getCompleteAssignment() {
        return candidate.getCompleteAssignment();
    }

    public SortedSet<Integer> getVisibleQuestionNumbers() {
        return candidate.getVisibleQuestionNumbers();
    }

    public int getQuestionCount() {
        return candidate.getVisibleQuestionNumbers().size();
    }

    @Override
    public String toString() {
        return "TestCase #" + sequenceNumber + " " + candidate.getAssignment() + " (" + getQuestionCount() + " domande)";
    }
}
