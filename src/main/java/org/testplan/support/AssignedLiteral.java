package org.testplan.support;

import java.util.Arrays;

/**
 * LETTERALE ASSEGNATO - Variabile assegnata durante la ricerca CDCL
 *
 * Memorizza variabile, valore, livello di decisione e clausola di ragione. Le decisioni
 * euristiche non hanno ragione; le implicazioni portano la clausola che le ha forzate,
 * usata dall'analisi dei conflitti per risalire al primo punto di implicazione unico.
 */
public final class AssignedLiteral {

    private final int variable;
    private final boolean value;
    private final int level;

    /** Clausola causante (null per le decisioni) */
    private final int[] reason;

    /**
     * @param variable ID variabile (> 0)
     * @param value valore assegnato
     * @param level livello di decisione (≥ 0)
     * @param reason clausola causante, null per le decisioni
     * @throws IllegalArgumentException se variabile o livello non validi
     */
    public AssignedLiteral(int variable, boolean value, int level, int[] reason) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        if (level < 0) {
            throw new IllegalArgumentException("Livello negativo: " + level);
        }
        this.variable = variable;
        this.value = value;
        this.level = level;
        this.reason = reason;
    }

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public int getLevel() {
        return level;
    }

    public int[] getReason() {
        return reason;
    }

    public boolean isDecision() {
        return reason == null;
    }

    /**
     * @return ID positivo se la variabile è vera, negativo se falsa
     */
    public int toDIMACSLiteral() {
        return value ? variable : -variable;
    }

    @Override
    public String toString() {
        return "AssignedLiteral{var=" + variable + ", val=" + value + ", level=" + level
                + (reason != null ? ", reason=" + Arrays.toString(reason) : ", DECISION") + '}';
    }
}
