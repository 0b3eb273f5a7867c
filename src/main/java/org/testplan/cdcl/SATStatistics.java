package org.testplan.cdcl;

/**
 * STATISTICHE SAT - Contatori di esecuzione di una singola risoluzione CDCL
 *
 * Il numero di conflitti è confrontato con il budget del solver a ogni conflitto.
 */
public class SATStatistics {

    private int decisions = 0;
    private int propagations = 0;
    private int conflicts = 0;
    private int learnedClauses = 0;
    private int backjumps = 0;

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public void incrementDecisions() {
        decisions++;
    }

    public void incrementPropagations() {
        propagations++;
    }

    public void incrementConflicts() {
        conflicts++;
    }

    public void incrementLearnedClauses() {
        learnedClauses++;
    }

    public void incrementBackjumps() {
        backjumps++;
    }

    /**
     * Ferma il cronometro; le chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public int getDecisions() {
        return decisions;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getLearnedClauses() {
        return learnedClauses;
    }

    public int getBackjumps() {
        return backjumps;
    }

    /**
     * @return durata in millisecondi (tempo trascorso finora se il cronometro non è fermo)
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    /**
     * @return true se i conflitti registrati superano il budget
     */
    public boolean exceedsConflictBudget(int conflictBudget) {
        return conflicts > conflictBudget;
    }

    //endregion

    public String toCompactString() {
        return String.format("D:%d P:%d C:%d L:%d B:%d T:%dms",
                decisions, propagations, conflicts, learnedClauses, backjumps, getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return "SATStatistics{" + toCompactString() + '}';
    }
}
