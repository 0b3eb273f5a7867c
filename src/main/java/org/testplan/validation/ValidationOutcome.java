package org.testplan.validation;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Esito di una validazione: visibilità e assegnamento completo se valido, motivo se non valido.
 * Prodotto nuovo a ogni chiamata e mai modificato.
 */
public final class ValidationOutcome {

    /** Motivo per vincoli contraddittori */
    public static final String UNSAT_REASON = "contradictory constraints (unsat)";

    private final boolean ok;
    private final SortedSet<Integer> visibleQuestionNumbers;
    private final SortedMap<Integer, String> completeAssignment;
    private final String reason;

    private ValidationOutcome(boolean ok, SortedSet<Integer> visibleQuestionNumbers,
                              SortedMap<Integer, String> completeAssignment, String reason) {
        this.ok = ok;
        this.visibleQuestionNumbers = Collections.unmodifiableSortedSet(new TreeSet<>(visibleQuestionNumbers));
        this.completeAssignment = Collections.unmodifiableSortedMap(new TreeMap<>(completeAssignment));
        this.reason = reason;
    }

    public static ValidationOutcome success(SortedSet<Integer> visibleQuestionNumbers,
                                            SortedMap<Integer, String> completeAssignment) {
        return new ValidationOutcome(true, visibleQuestionNumbers, completeAssignment, null);
    }

    public static ValidationOutcome failure(String reason) {
        return new ValidationOutcome(false, new TreeSet<>(), new TreeMap<>(), reason);
    }

    public boolean isOk() {
        return ok;
    }

    public SortedSet<Integer> getVisibleQuestionNumbers() {
        return visibleQuestionNumbers;
    }

    public SortedMap<Integer, String> getCompleteAssignment() {
        return completeAssignment;
    }

    /**
     * @return motivo del fallimento, null se la validazione è riuscita
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return ok
                ? "ValidationOutcome{ok, visible=" + visibleQuestionNumbers + ", assignment=" + completeAssignment + '}'
                : "ValidationOutcome{failed: " + reason + '}';
    }
}
