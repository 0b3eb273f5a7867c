package org.testplan.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DECISION STACK - Stack dei livelli di decisione per l'algoritmo CDCL
 *
 * ORGANIZZAZIONE:
 * • Livello 0: implicazioni da clausole unitarie e da clausole apprese unitarie (mai rimosso)
 * • Livello i (i>0): decisione i seguita dalle implicazioni derivate, in ordine cronologico
 *
 * L'ordine cronologico all'interno del livello corrente è ciò che permette all'analisi dei
 * conflitti di scorrere la traccia all'indietro fino al primo punto di implicazione unico.
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    private final List<List<AssignedLiteral>> levels;

    public DecisionStack() {
        this.levels = new ArrayList<>();
        this.levels.add(new ArrayList<>());
    }

    //region AGGIUNTA

    /**
     * Apre un nuovo livello con la decisione come primo elemento.
     *
     * @return assegnamento creato
     */
    public AssignedLiteral addDecision(int variable, boolean value) {
        AssignedLiteral decision = new AssignedLiteral(variable, value, levels.size(), null);
        List<AssignedLiteral> newLevel = new ArrayList<>();
        newLevel.add(decision);
        levels.add(newLevel);

        LOGGER.finest(() -> "Decisione: " + decision);
        return decision;
    }

    /**
     * Aggiunge un'implicazione al livello corrente.
     *
     * @param reason clausola unitaria che forza il valore (non null)
     * @return assegnamento creato
     * @throws IllegalArgumentException se la ragione manca
     */
    public AssignedLiteral addImpliedLiteral(int variable, boolean value, int[] reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Clausola di ragione richiesta per le implicazioni");
        }
        AssignedLiteral implication = new AssignedLiteral(variable, value, getLevel(), reason);
        levels.get(levels.size() - 1).add(implication);

        LOGGER.finest(() -> "Implicazione: " + implication);
        return implication;
    }

    //endregion

    //region BACKTRACKING

    /**
     * Backjumping non cronologico: rimuove tutti i livelli sopra il livello indicato.
     *
     * @param targetLevel livello di destinazione (0 ≤ targetLevel ≤ livello corrente)
     * @return assegnamenti rimossi
     * @throws IllegalArgumentException se il livello non è valido
     */
    public List<AssignedLiteral> backtrackToLevel(int targetLevel) {
        int currentLevel = getLevel();
        if (targetLevel < 0 || targetLevel > currentLevel) {
            throw new IllegalArgumentException(
                    String.format("Target level %d fuori range [0, %d]", targetLevel, currentLevel));
        }

        List<AssignedLiteral> removed = new ArrayList<>();
        while (levels.size() - 1 > targetLevel) {
            removed.addAll(levels.remove(levels.size() - 1));
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Backjump %d -> %d, %d assegnamenti rimossi",
                    currentLevel, targetLevel, removed.size()));
        }
        return removed;
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return livello corrente (0 se non ci sono decisioni)
     */
    public int getLevel() {
        return levels.size() - 1;
    }

    /**
     * @return vista non modificabile degli assegnamenti del livello, in ordine cronologico
     */
    public List<AssignedLiteral> getAssignmentsAtLevel(int level) {
        if (level < 0 || level >= levels.size()) {
            throw new IndexOutOfBoundsException(
                    String.format("Level index %d fuori range [0, %d)", level, levels.size()));
        }
        return Collections.unmodifiableList(levels.get(level));
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder representation = new StringBuilder("DecisionStack {\n");
        for (int level = 0; level < levels.size(); level++) {
            representation.append(String.format("  Livello %d: %s%n", level, levels.get(level)));
        }
        return representation.append('}').toString();
    }
}
