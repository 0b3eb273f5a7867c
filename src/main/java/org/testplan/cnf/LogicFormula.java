package org.testplan.cnf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FORMULA LOGICA SIMBOLICA - Albero proposizionale con semplificazione delle costanti
 *
 * Rappresenta i vincoli del modello (dominio, visibilità, collegamento) come alberi su
 * variabili booleane atomiche. I costruttori statici applicano sempre le semplificazioni
 * strutturali, così che una condizione "ridotta alla costante falso" sia riconoscibile
 * direttamente dal tipo del nodo.
 *
 * SEMPLIFICAZIONI APPLICATE:
 * • A & FALSE -> FALSE, A & TRUE -> A
 * • A | TRUE -> TRUE, A | FALSE -> A
 * • !TRUE -> FALSE, !!A -> A
 * • appiattimento di AND/OR annidati dello stesso tipo
 * • congiunzione vuota -> TRUE, disgiunzione vuota -> FALSE
 *
 * I nodi sono immutabili; l'uguaglianza è strutturale ed è usata dalla conversione di
 * Tseitin per condividere le variabili ausiliarie tra sottoformule identiche.
 */
public final class LogicFormula {

    //region TIPI E STRUTTURA DATI

    public enum Type {
        AND,    // Congiunzione: A & B & ...
        OR,     // Disgiunzione: A | B | ...
        NOT,    // Negazione: !A
        ATOM,   // Variabile atomica
        TRUE,   // Costante vera
        FALSE   // Costante falsa
    }

    public static final LogicFormula TRUE = new LogicFormula(Type.TRUE, null, null, null);
    public static final LogicFormula FALSE = new LogicFormula(Type.FALSE, null, null, null);

    /** Tipo del nodo */
    public final Type type;

    /** Nome della variabile (solo ATOM) */
    public final String atom;

    /** Operando (solo NOT) */
    public final LogicFormula operand;

    /** Operandi (solo AND e OR, almeno due) */
    public final List<LogicFormula> operands;

    private final int hash;

    private LogicFormula(Type type, String atom, LogicFormula operand, List<LogicFormula> operands) {
        this.type = type;
        this.atom = atom;
        this.operand = operand;
        this.operands = operands;
        this.hash = computeHash();
    }

    //endregion

    //region COSTRUTTORI CON SEMPLIFICAZIONE

    public static LogicFormula atom(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        return new LogicFormula(Type.ATOM, name, null, null);
    }

    public static LogicFormula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LogicFormula not(LogicFormula formula) {
        requireNonNull(formula, "NOT");
        return switch (formula.type) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case NOT -> formula.operand;          // !!A -> A
            default -> new LogicFormula(Type.NOT, null, formula, null);
        };
    }

    public static LogicFormula and(LogicFormula... formulas) {
        return and(Arrays.asList(formulas));
    }

    /**
     * Congiunzione con semplificazione: un operando FALSE annulla tutto, i TRUE vengono scartati,
     * i duplicati rimossi.
     */
    public static LogicFormula and(List<LogicFormula> formulas) {
        Set<LogicFormula> flattened = new LinkedHashSet<>();
        for (LogicFormula formula : formulas) {
            requireNonNull(formula, "AND");
            switch (formula.type) {
                case FALSE -> { return FALSE; }
                case TRUE -> { /* elemento neutro */ }
                case AND -> flattened.addAll(formula.operands);
                default -> flattened.add(formula);
            }
        }
        return buildNary(Type.AND, flattened, TRUE);
    }

    public static LogicFormula or(LogicFormula... formulas) {
        return or(Arrays.asList(formulas));
    }

    /**
     * Disgiunzione con semplificazione: un operando TRUE rende tutto vero, i FALSE vengono
     * scartati, i duplicati rimossi.
     */
    public static LogicFormula or(List<LogicFormula> formulas) {
        Set<LogicFormula> flattened = new LinkedHashSet<>();
        for (LogicFormula formula : formulas) {
            requireNonNull(formula, "OR");
            switch (formula.type) {
                case TRUE -> { return TRUE; }
                case FALSE -> { /* elemento neutro */ }
                case OR -> flattened.addAll(formula.operands);
                default -> flattened.add(formula);
            }
        }
        return buildNary(Type.OR, flattened, FALSE);
    }

    /**
     * A -> B ~ !A | B
     */
    public static LogicFormula implies(LogicFormula antecedent, LogicFormula consequent) {
        return or(not(antecedent), consequent);
    }

    /**
     * A <-> B ~ (!A | B) & (A | !B), con semplificazione diretta quando un lato è costante.
     */
    public static LogicFormula iff(LogicFormula left, LogicFormula right) {
        requireNonNull(left, "IFF");
        requireNonNull(right, "IFF");

        if (left.isConstant()) {
            return left.isTrue() ? right : not(right);
        }
        if (right.isConstant()) {
            return right.isTrue() ? left : not(left);
        }
        if (left.equals(right)) {
            return TRUE;
        }
        return and(implies(left, right), implies(right, left));
    }

    /**
     * Vincolo "esattamente uno" sugli atomi: almeno uno vero e nessuna coppia vera insieme.
     */
    public static LogicFormula exactlyOne(List<LogicFormula> formulas) {
        List<LogicFormula> constraints = new ArrayList<>();
        constraints.add(or(formulas));
        for (int i = 0; i < formulas.size(); i++) {
            for (int j = i + 1; j < formulas.size(); j++) {
                constraints.add(or(not(formulas.get(i)), not(formulas.get(j))));
            }
        }
        return and(constraints);
    }

    private static LogicFormula buildNary(Type type, Set<LogicFormula> operands, LogicFormula empty) {
        if (operands.isEmpty()) {
            return empty;
        }
        if (operands.size() == 1) {
            return operands.iterator().next();
        }
        return new LogicFormula(type, null, null, Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    private static void requireNonNull(LogicFormula formula, String operatorName) {
        if (formula == null) {
            throw new IllegalArgumentException("Operando null per operatore " + operatorName);
        }
    }

    //endregion

    //region INTERROGAZIONE

    public boolean isTrue() {
        return type == Type.TRUE;
    }

    public boolean isFalse() {
        return type == Type.FALSE;
    }

    public boolean isConstant() {
        return type == Type.TRUE || type == Type.FALSE;
    }

    /**
     * Raccoglie i nomi degli atomi nell'ordine di prima apparizione.
     */
    public Set<String> collectAtoms() {
        Set<String> atoms = new LinkedHashSet<>();
        collectAtoms(this, atoms);
        return atoms;
    }

    private static void collectAtoms(LogicFormula formula, Set<String> sink) {
        switch (formula.type) {
            case ATOM -> sink.add(formula.atom);
            case NOT -> collectAtoms(formula.operand, sink);
            case AND, OR -> formula.operands.forEach(operand -> collectAtoms(operand, sink));
            case TRUE, FALSE -> { /* nessun atomo */ }
        }
    }

    /**
     * Valuta la formula su un assegnamento; un atomo assente vale false.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case TRUE -> true;
            case FALSE -> false;
            case ATOM -> Boolean.TRUE.equals(assignment.get(atom));
            case NOT -> !operand.evaluate(assignment);
            case AND -> operands.stream().allMatch(operand -> operand.evaluate(assignment));
            case OR -> operands.stream().anyMatch(operand -> operand.evaluate(assignment));
        };
    }

    //endregion

    //region RAPPRESENTAZIONE E UGUAGLIANZA

    @Override
    public String toString() {
        return switch (type) {
            case TRUE -> "TRUE";
            case FALSE -> "FALSE";
            case ATOM -> atom;
            case NOT -> operand.type == Type.ATOM ? "!" + operand : "!(" + operand + ")";
            case AND -> joinOperands(" & ");
            case OR -> joinOperands(" | ");
        };
    }

    private String joinOperands(String separator) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) builder.append(separator);
            LogicFormula operand = operands.get(i);
            boolean nested = operand.type == Type.AND || operand.type == Type.OR;
            builder.append(nested ? "(" + operand + ")" : operand.toString());
        }
        return builder.toString();
    }

    private int computeHash() {
        int result = type.hashCode();
        result = 31 * result + (atom != null ? atom.hashCode() : 0);
        result = 31 * result + (operand != null ? operand.hashCode() : 0);
        result = 31 * result + (operands != null ? operands.hashCode() : 0);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        LogicFormula other = (LogicFormula) obj;
        if (hash != other.hash || type != other.type) return false;
        return switch (type) {
            case TRUE, FALSE -> true;
            case ATOM -> atom.equals(other.atom);
            case NOT -> operand.equals(other.operand);
            case AND, OR -> operands.equals(other.operands);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion
}
