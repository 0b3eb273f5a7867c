package org.testplan.output;

import org.testplan.constraint.ValueEncoding;
import org.testplan.cover.TestCase;
import org.testplan.model.Classification;
import org.testplan.model.Question;
import org.testplan.model.Questionnaire;
import org.testplan.model.VisibilityExpression;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * PIANO DI TEST - Contratto di uscita del generatore verso i renderer
 *
 * Contiene i casi selezionati, il questionario, la classificazione, le codifiche dei valori,
 * le domande irraggiungibili con la loro condizione, l'obiettivo di copertura e le domande
 * rimaste scoperte. Per i questionari degeneri (nessuna variabile di test, nessuna
 * combinazione valida) non ci sono casi e il messaggio di stato spiega il motivo.
 */
public final class TestPlan {

    private final Questionnaire questionnaire;
    private final Classification classification;
    private final SortedMap<Integer, ValueEncoding> encodings;
    private final List<TestCase> testCases;
    private final SortedSet<Integer> unreachable;
    private final SortedMap<Integer, VisibilityExpression> unreachableConditions;
    private final SortedSet<Integer> coverageTarget;
    private final SortedSet<Integer> uncovered;
    private final int candidateCount;
    private final String statusMessage;

    public TestPlan(Questionnaire questionnaire, Classification classification,
                    SortedMap<Integer, ValueEncoding> encodings, List<TestCase> testCases,
                    SortedSet<Integer> unreachable, SortedMap<Integer, VisibilityExpression> unreachableConditions,
                    SortedSet<Integer> coverageTarget, SortedSet<Integer> uncovered,
                    int candidateCount, String statusMessage) {
        this.questionnaire = questionnaire;
        this.classification = classification;
        this.encodings = Collections.unmodifiableSortedMap(new TreeMap<>(encodings));
        this.testCases = List.copyOf(testCases);
        this.unreachable = Collections.unmodifiableSortedSet(new TreeSet<>(unreachable));
        this.unreachableConditions = Collections.unmodifiableSortedMap(new TreeMap<>(unreachableConditions));
        this.coverageTarget = Collections.unmodifiableSortedSet(new TreeSet<>(coverageTarget));
        this.uncovered = Collections.unmodifiableSortedSet(new TreeSet<>(uncovered));
        this.candidateCount = candidateCount;
        this.statusMessage = statusMessage;
    }

    public String getQuestionnaireName() {
        return questionnaire.getName();
    }

    public Questionnaire getQuestionnaire() {
        return questionnaire;
    }

    public List<Question> getQuestions() {
        return questionnaire.getQuestions();
    }

    public Classification getClassification() {
        return classification;
    }

    public SortedMap<Integer, ValueEncoding> getEncodings() {
        return encodings;
    }

    public List<TestCase> getTestCases() {
        return testCases;
    }

    public SortedSet<Integer> getUnreachable() {
        return unreachable;
    }

    public SortedMap<Integer, VisibilityExpression> getUnreachableConditions() {
        return unreachableConditions;
    }

    public SortedSet<Integer> getCoverageTarget() {
        return coverageTarget;
    }

    public SortedSet<Integer> getUncovered() {
        return uncovered;
    }

    /**
     * @return domande dell'obiettivo coperte da almeno un caso
     */
    public SortedSet<Integer> getCovered() {
        SortedSet<Integer> covered = new TreeSet<>(coverageTarget);
        covered.removeAll(uncovered);
        return covered;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    /**
     * @return spiegazione per i piani senza casi, null altrimenti
     */
    public String getStatusMessage() {
        return statusMessage;
    }

    public boolean hasTestCases() {
        return !testCases.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("TestPlan{%s, cases=%d, covered=%d/%d, unreachable=%s%s}",
                getQuestionnaireName(), testCases.size(), getCovered().size(), coverageTarget.size(), unreachable,
                statusMessage != null ? ", status=" + statusMessage : "");
    }
}
