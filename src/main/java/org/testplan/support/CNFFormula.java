package org.testplan.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FORMULA CNF NUMERICA - Clausole su ID interi pronte per il solver CDCL
 *
 * Mantiene il mapping bidirezionale nome simbolico ↔ ID numerico (ID ≥ 1, assegnati in ordine
 * di prima apparizione) e l'elenco delle clausole in formato DIMACS (letterale positivo =
 * variabile vera, negativo = variabile falsa).
 *
 * NORMALIZZAZIONE IN INSERIMENTO:
 * • letterali duplicati rimossi
 * • clausole tautologiche (x | !x) scartate
 * • la clausola vuota è ammessa e rende la formula banalmente insoddisfacibile
 *
 * La formula è modificabile: un modello di base viene costruito una volta sola e ogni
 * interrogazione lavora su una propria {@link #copy()}.
 */
public class CNFFormula {

    /** Prefisso riservato alle variabili ausiliarie introdotte dalla trasformazione di Tseitin */
    public static final String AUXILIARY_PREFIX = "#t";

    private final List<int[]> clauses;
    private final Map<String, Integer> variableMapping;
    private final List<String> variableNames;
    private int auxiliaryCounter;
    private boolean containsEmptyClause;

    public CNFFormula() {
        this.clauses = new ArrayList<>();
        this.variableMapping = new LinkedHashMap<>();
        this.variableNames = new ArrayList<>();
        this.variableNames.add(null); // ID 0 non usato
    }

    private CNFFormula(CNFFormula source) {
        this.clauses = new ArrayList<>(source.clauses);
        this.variableMapping = new LinkedHashMap<>(source.variableMapping);
        this.variableNames = new ArrayList<>(source.variableNames);
        this.auxiliaryCounter = source.auxiliaryCounter;
        this.containsEmptyClause = source.containsEmptyClause;
    }

    //region VARIABILI

    /**
     * Restituisce l'ID della variabile, creandola se non esiste.
     */
    public int variableFor(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile null o vuoto");
        }
        Integer existing = variableMapping.get(name);
        if (existing != null) {
            return existing;
        }
        int id = variableNames.size();
        variableMapping.put(name, id);
        variableNames.add(name);
        return id;
    }

    /**
     * Crea una nuova variabile ausiliaria con nome univoco.
     */
    public int newAuxiliaryVariable() {
        return variableFor(AUXILIARY_PREFIX + (++auxiliaryCounter));
    }

    public String getVariableName(int id) {
        if (id <= 0 || id >= variableNames.size()) {
            throw new IllegalArgumentException("ID variabile fuori range: " + id);
        }
        return variableNames.get(id);
    }

    public int getVariableCount() {
        return variableNames.size() - 1;
    }

    //endregion

    //region CLAUSOLE

    /**
     * Aggiunge una clausola dopo la normalizzazione.
     *
     * @param literals letterali DIMACS (≠ 0, riferiti a variabili registrate)
     * @throws IllegalArgumentException per letterali nulli o non registrati
     */
    public void addClause(List<Integer> literals) {
        Set<Integer> normalized = new LinkedHashSet<>();
        for (Integer literal : literals) {
            if (literal == null || literal == 0 || Math.abs(literal) > getVariableCount()) {
                throw new IllegalArgumentException("Letterale non valido: " + literal);
            }
            if (normalized.contains(-literal)) {
                return; // tautologia
            }
            normalized.add(literal);
        }

        if (normalized.isEmpty()) {
            containsEmptyClause = true;
        }
        clauses.add(normalized.stream().mapToInt(Integer::intValue).toArray());
    }

    public void addClause(Integer... literals) {
        addClause(List.of(literals));
    }

    /**
     * @return vista non modificabile delle clausole (gli array non vanno modificati)
     */
    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int getClausesCount() {
        return clauses.size();
    }

    public boolean containsEmptyClause() {
        return containsEmptyClause;
    }

    //endregion

    /**
     * Copia indipendente: clausole e variabili aggiunte alla copia non toccano l'originale.
     * Gli array delle clausole sono condivisi perché mai modificati dopo l'inserimento.
     */
    public CNFFormula copy() {
        return new CNFFormula(this);
    }

    @Override
    public String toString() {
        return String.format("CNFFormula{variables=%d, clauses=%d}", getVariableCount(), clauses.size());
    }
}
