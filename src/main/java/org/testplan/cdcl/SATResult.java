package org.testplan.cdcl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RISULTATO SAT - Esito immutabile di una risoluzione booleana
 *
 * ESITI:
 * • SATISFIABLE: esiste un modello, disponibile per nome di variabile
 * • UNSATISFIABLE: nessun modello possibile
 * • UNKNOWN: budget di conflitti esaurito prima di una risposta (esito indeterminato)
 */
public class SATResult {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN
    }

    private final Status status;
    private final Map<String, Boolean> assignment;
    private final String message;
    private final SATStatistics statistics;

    private SATResult(Status status, Map<String, Boolean> assignment, String message, SATStatistics statistics) {
        this.status = status;
        this.assignment = assignment;
        this.message = message;
        this.statistics = statistics != null ? statistics : new SATStatistics();
    }

    //region FACTORY METHODS

    /**
     * @param assignment modello completo (può essere vuoto per formule senza variabili)
     * @throws IllegalArgumentException se il modello è null
     */
    public static SATResult satisfiable(Map<String, Boolean> assignment, SATStatistics statistics) {
        if (assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento");
        }
        return new SATResult(Status.SATISFIABLE,
                Collections.unmodifiableMap(new LinkedHashMap<>(assignment)), null, statistics);
    }

    public static SATResult unsatisfiable(String message, SATStatistics statistics) {
        return new SATResult(Status.UNSATISFIABLE, null, message, statistics);
    }

    public static SATResult unknown(String message, SATStatistics statistics) {
        return new SATResult(Status.UNKNOWN, null, message, statistics);
    }

    //endregion

    //region ACCESSORS

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }

    /**
     * @return modello per nome di variabile (null se non SAT)
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    /**
     * @return valore della variabile nel modello; false se assente o se il risultato non è SAT
     */
    public boolean valueOf(String variable) {
        return assignment != null && Boolean.TRUE.equals(assignment.get(variable));
    }

    public String getMessage() {
        return message;
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        return switch (status) {
            case SATISFIABLE -> "SAT (" + assignment.size() + " variabili) " + statistics.toCompactString();
            case UNSATISFIABLE -> "UNSAT " + statistics.toCompactString();
            case UNKNOWN -> "UNKNOWN: " + message + " " + statistics.toCompactString();
        };
    }
}
