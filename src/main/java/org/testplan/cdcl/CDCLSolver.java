package org.testplan.cdcl;

import org.testplan.support.AssignedLiteral;
import org.testplan.support.CNFFormula;
import org.testplan.support.DecisionStack;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SOLVER CDCL - Conflict-Driven Clause Learning con budget di conflitti
 *
 * Ciclo principale:
 * 1. Propagazione unitaria fino al punto fisso (per occorrenze: una clausola viene esaminata
 *    solo quando uno dei suoi letterali diventa falso)
 * 2. Conflitto: analisi 1-UIP sul livello corrente, apprendimento della clausola, backjump al
 *    secondo livello più alto della clausola appresa e asserzione del letterale UIP
 * 3. Nessun conflitto: decisione sulla variabile non assegnata con contatore VSIDS più alto
 *    (parità: ID più basso), polarità negativa
 *
 * TERMINAZIONE:
 * • tutte le variabili assegnate senza conflitti: SATISFIABLE
 * • conflitto a livello 0 o clausola vuota: UNSATISFIABLE
 * • conflitti oltre il budget: UNKNOWN
 *
 * Ogni istanza lavora su una propria formula; lo stato di ricerca viene ricreato a ogni
 * chiamata di {@link #solve()}.
 */
public class CDCLSolver {

    private static final Logger LOGGER = Logger.getLogger(CDCLSolver.class.getName());

    /** Budget di conflitti predefinito prima di dichiarare l'esito indeterminato */
    public static final int DEFAULT_CONFLICT_BUDGET = 100_000;

    //region STRUTTURE DATI CORE

    private final CNFFormula formula;
    private final int conflictBudget;
    private final int variableCount;

    /** Valore corrente per variabile: 0 non assegnata, 1 vera, -1 falsa */
    private int[] values;
    private int[] levels;

    /** Contatori VSIDS incrementati per ogni variabile coinvolta in una clausola appresa */
    private int[] vsidsCounters;

    /** Clausole indicizzate per letterale contenuto (vedi {@link #literalIndex(int)}) */
    private List<List<int[]>> occurrences;

    private DecisionStack decisionStack;
    private ArrayDeque<Integer> propagationQueue;
    private SATStatistics statistics;

    //endregion

    //region INIZIALIZZAZIONE

    public CDCLSolver(CNFFormula formula) {
        this(formula, DEFAULT_CONFLICT_BUDGET);
    }

    /**
     * @param formula formula CNF da risolvere (non null)
     * @param conflictBudget numero massimo di conflitti (≥ 0)
     * @throws IllegalArgumentException per parametri non validi
     */
    public CDCLSolver(CNFFormula formula, int conflictBudget) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula CNF non può essere null");
        }
        if (conflictBudget < 0) {
            throw new IllegalArgumentException("Budget di conflitti negativo: " + conflictBudget);
        }
        this.formula = formula;
        this.conflictBudget = conflictBudget;
        this.variableCount = formula.getVariableCount();
    }

    private void initializeSearchState() {
        this.values = new int[variableCount + 1];
        this.levels = new int[variableCount + 1];
        this.vsidsCounters = new int[variableCount + 1];
        this.occurrences = new ArrayList<>(2 * (variableCount + 1));
        for (int i = 0; i < 2 * (variableCount + 1); i++) {
            occurrences.add(new ArrayList<>());
        }
        this.decisionStack = new DecisionStack();
        this.propagationQueue = new ArrayDeque<>();
        this.statistics = new SATStatistics();

        for (int[] clause : formula.getClauses()) {
            registerClause(clause);
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Risolve la formula.
     *
     * @return esito SAT con modello (variabili ausiliarie escluse), UNSAT, oppure UNKNOWN se il
     *         budget di conflitti si esaurisce
     */
    public SATResult solve() {
        initializeSearchState();
        LOGGER.fine(() -> "Avvio CDCL: " + formula);

        SATResult result = executeCDCLMainAlgorithm();
        statistics.stopTimer();

        LOGGER.fine(() -> "Esito CDCL: " + result);
        return result;
    }

    //endregion

    //region ALGORITMO CDCL PRINCIPALE

    private SATResult executeCDCLMainAlgorithm() {
        if (formula.containsEmptyClause()) {
            return SATResult.unsatisfiable("Clausola vuota nella formula", statistics);
        }
        if (!initializeLevel0WithUnitClauses() || propagate() != null) {
            return SATResult.unsatisfiable("Conflitto a livello 0", statistics);
        }

        while (true) {
            int variable = pickBranchingVariable();
            if (variable == 0) {
                return SATResult.satisfiable(buildModel(), statistics);
            }

            statistics.incrementDecisions();
            AssignedLiteral decision = decisionStack.addDecision(variable, false);
            recordAssignment(decision);

            int[] conflict;
            while ((conflict = propagate()) != null) {
                statistics.incrementConflicts();

                if (decisionStack.getLevel() == 0) {
                    return SATResult.unsatisfiable("Conflitto a livello 0", statistics);
                }
                if (statistics.exceedsConflictBudget(conflictBudget)) {
                    LOGGER.fine("Budget di conflitti esaurito: " + conflictBudget);
                    return SATResult.unknown("budget di " + conflictBudget + " conflitti esaurito", statistics);
                }

                int[] learned = analyzeConflict(conflict);
                backtrack(computeBacktrackLevel(learned));
                learnClause(learned);

                AssignedLiteral assertion = decisionStack.addImpliedLiteral(
                        Math.abs(learned[0]), learned[0] > 0, learned);
                recordAssignment(assertion);
                statistics.incrementPropagations();
            }
        }
    }

    /**
     * Asserisce a livello 0 le clausole unitarie originali.
     *
     * @return false se due clausole unitarie sono contraddittorie
     */
    private boolean initializeLevel0WithUnitClauses() {
        for (int[] clause : formula.getClauses()) {
            if (clause.length != 1) continue;

            int literal = clause[0];
            int current = literalValue(literal);
            if (current < 0) {
                return false;
            }
            if (current == 0) {
                recordAssignment(decisionStack.addImpliedLiteral(Math.abs(literal), literal > 0, clause));
                statistics.incrementPropagations();
            }
        }
        return true;
    }

    //endregion

    //region UNIT PROPAGATION

    /**
     * Propaga gli assegnamenti in coda fino al punto fisso.
     *
     * @return clausola in conflitto, null se il punto fisso è raggiunto senza conflitti
     */
    private int[] propagate() {
        while (!propagationQueue.isEmpty()) {
            int assignedLiteral = propagationQueue.poll();
            List<int[]> watched = occurrences.get(literalIndex(-assignedLiteral));

            for (int i = 0; i < watched.size(); i++) {
                int[] clause = watched.get(i);
                int unassigned = 0;
                int unitLiteral = 0;
                boolean satisfied = false;

                for (int literal : clause) {
                    int value = literalValue(literal);
                    if (value > 0) {
                        satisfied = true;
                        break;
                    }
                    if (value == 0) {
                        unassigned++;
                        unitLiteral = literal;
                    }
                }

                if (satisfied) continue;
                if (unassigned == 0) {
                    propagationQueue.clear();
                    return clause;
                }
                if (unassigned == 1) {
                    recordAssignment(decisionStack.addImpliedLiteral(
                            Math.abs(unitLiteral), unitLiteral > 0, clause));
                    statistics.incrementPropagations();
                }
            }
        }
        return null;
    }

    //endregion

    //region CONFLICT ANALYSIS

    /**
     * Analisi 1-UIP: risolve la clausola di conflitto con le ragioni degli assegnamenti del
     * livello corrente, scorrendo la traccia all'indietro, finché resta un solo letterale del
     * livello corrente. I letterali di livello 0 sono omessi.
     *
     * @return clausola appresa con il letterale asserente in posizione 0
     */
    private int[] analyzeConflict(int[] conflict) {
        int currentLevel = decisionStack.getLevel();
        List<AssignedLiteral> trail = decisionStack.getAssignmentsAtLevel(currentLevel);
        boolean[] seen = new boolean[variableCount + 1];

        List<Integer> learned = new ArrayList<>();
        learned.add(0); // posto riservato al letterale UIP

        int[] clause = conflict;
        int pivot = 0;
        int pending = 0;
        int trailIndex = trail.size() - 1;
        AssignedLiteral uip;

        do {
            for (int literal : clause) {
                int variable = Math.abs(literal);
                if (variable == pivot || seen[variable] || levels[variable] == 0) continue;

                seen[variable] = true;
                vsidsCounters[variable]++;
                if (levels[variable] == currentLevel) {
                    pending++;
                } else {
                    learned.add(literal);
                }
            }

            while (!seen[trail.get(trailIndex).getVariable()]) {
                trailIndex--;
            }
            uip = trail.get(trailIndex--);
            pivot = uip.getVariable();
            clause = uip.getReason();
            pending--;
        } while (pending > 0);

        learned.set(0, -uip.toDIMACSLiteral());
        return learned.stream().mapToInt(Integer::intValue).toArray();
    }

    private int computeBacktrackLevel(int[] learned) {
        int backtrackLevel = 0;
        for (int i = 1; i < learned.length; i++) {
            backtrackLevel = Math.max(backtrackLevel, levels[Math.abs(learned[i])]);
        }
        return backtrackLevel;
    }

    //endregion

    //region LEARNING E BACKTRACKING

    private void learnClause(int[] clause) {
        registerClause(clause);
        statistics.incrementLearnedClauses();
    }

    private void backtrack(int targetLevel) {
        for (AssignedLiteral removed : decisionStack.backtrackToLevel(targetLevel)) {
            values[removed.getVariable()] = 0;
        }
        propagationQueue.clear();
        statistics.incrementBackjumps();
    }

    //endregion

    //region FASE DI DECISIONE

    /**
     * @return variabile non assegnata con contatore VSIDS massimo, 0 se tutte assegnate
     */
    private int pickBranchingVariable() {
        int best = 0;
        for (int variable = 1; variable <= variableCount; variable++) {
            if (values[variable] == 0 && (best == 0 || vsidsCounters[variable] > vsidsCounters[best])) {
                best = variable;
            }
        }
        return best;
    }

    //endregion

    //region SUPPORTO

    private void recordAssignment(AssignedLiteral assignment) {
        int variable = assignment.getVariable();
        values[variable] = assignment.getValue() ? 1 : -1;
        levels[variable] = assignment.getLevel();
        propagationQueue.add(assignment.toDIMACSLiteral());
    }

    private void registerClause(int[] clause) {
        for (int literal : clause) {
            occurrences.get(literalIndex(literal)).add(clause);
        }
    }

    /**
     * @return 1 se il letterale è vero, -1 se falso, 0 se la variabile non è assegnata
     */
    private int literalValue(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    private static int literalIndex(int literal) {
        return literal > 0 ? 2 * literal : 2 * (-literal) + 1;
    }

    private Map<String, Boolean> buildModel() {
        Map<String, Boolean> model = new LinkedHashMap<>();
        for (int variable = 1; variable <= variableCount; variable++) {
            String name = formula.getVariableName(variable);
            if (!name.startsWith(CNFFormula.AUXILIARY_PREFIX)) {
                model.put(name, values[variable] > 0);
            }
        }
        return model;
    }

    //endregion

    public SATStatistics getStatistics() {
        return statistics;
    }
}
