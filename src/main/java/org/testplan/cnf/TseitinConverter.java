package org.testplan.cnf;

import org.testplan.support.CNFFormula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEITIN - Conversione di formule simboliche in clausole equisoddisfacibili
 *
 * Ogni sottoformula AND/OR non banale riceve una variabile ausiliaria t con le clausole di
 * equivalenza t ↔ sottostruttura; la formula originale diventa una clausola sul letterale che
 * la rappresenta. La dimensione del risultato è lineare in quella dell'albero.
 *
 * OTTIMIZZAZIONI:
 * • AND in radice: ogni operando è asserito separatamente, senza ausiliaria
 * • OR in radice: una sola clausola sui letterali degli operandi
 * • sottoformule strutturalmente uguali condividono la stessa ausiliaria
 *
 * ESEMPIO:
 * (A & B) | (C & D)  ~  t1 ↔ (A & B), t2 ↔ (C & D), clausola (t1 | t2)
 *
 * Il convertitore scrive su una {@link CNFFormula} esistente: può essere usato più volte sulla
 * stessa formula e la cache delle ausiliarie resta valida per tutta la sua vita.
 */
public class TseitinConverter {

    private static final Logger LOGGER = Logger.getLogger(TseitinConverter.class.getName());

    private final CNFFormula target;
    private final Map<LogicFormula, Integer> substructureToLiteral;

    public TseitinConverter(CNFFormula target) {
        if (target == null) {
            throw new IllegalArgumentException("Formula CNF di destinazione null");
        }
        this.target = target;
        this.substructureToLiteral = new HashMap<>();
    }

    //region ASSERZIONE

    /**
     * Aggiunge alla formula di destinazione le clausole che rendono vera la formula data.
     * FALSE produce la clausola vuota, TRUE non produce nulla.
     */
    public void assertFormula(LogicFormula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da asserire null");
        }

        switch (formula.type) {
            case TRUE -> { /* nessun vincolo */ }
            case FALSE -> addClause(List.of());
            case AND -> formula.operands.forEach(this::assertFormula);
            case OR -> {
                List<Integer> clause = new ArrayList<>();
                for (LogicFormula operand : formula.operands) {
                    clause.add(encode(operand));
                }
                addClause(clause);
            }
            default -> addClause(List.of(encode(formula)));
        }
    }

    public void assertAll(List<LogicFormula> formulas) {
        formulas.forEach(this::assertFormula);
    }

    //endregion

    //region CODIFICA RICORSIVA

    /**
     * Restituisce il letterale DIMACS che rappresenta la sottoformula, introducendo le
     * ausiliarie necessarie.
     */
    private int encode(LogicFormula formula) {
        switch (formula.type) {
            case ATOM:
                return target.variableFor(formula.atom);
            case NOT:
                return -encode(formula.operand);
            case TRUE:
            case FALSE:
                return encodeConstant(formula.isTrue());
            default:
                break;
        }

        Integer cached = substructureToLiteral.get(formula);
        if (cached != null) {
            return cached;
        }

        List<Integer> operandLiterals = new ArrayList<>();
        for (LogicFormula operand : formula.operands) {
            operandLiterals.add(encode(operand));
        }

        int auxiliary = target.newAuxiliaryVariable();
        if (formula.type == LogicFormula.Type.AND) {
            // t -> l_i per ogni i, (l_1 & ... & l_n) -> t
            List<Integer> backward = new ArrayList<>();
            backward.add(auxiliary);
            for (int literal : operandLiterals) {
                addClause(List.of(-auxiliary, literal));
                backward.add(-literal);
            }
            addClause(backward);
        } else {
            // l_i -> t per ogni i, t -> (l_1 | ... | l_n)
            List<Integer> forward = new ArrayList<>();
            forward.add(-auxiliary);
            for (int literal : operandLiterals) {
                addClause(List.of(auxiliary, -literal));
                forward.add(literal);
            }
            addClause(forward);
        }

        substructureToLiteral.put(formula, auxiliary);
        LOGGER.finest(() -> "Ausiliaria " + target.getVariableName(auxiliary) + " <-> " + formula);
        return auxiliary;
    }

    /**
     * Le costanti non sopravvivono alla semplificazione, ma un albero costruito a mano può
     * contenerle: sono rappresentate da una variabile fissata con una clausola unitaria.
     */
    private int encodeConstant(boolean value) {
        LogicFormula key = LogicFormula.constant(value);
        Integer cached = substructureToLiteral.get(key);
        if (cached != null) {
            return cached;
        }
        int auxiliary = target.newAuxiliaryVariable();
        int literal = value ? auxiliary : -auxiliary;
        addClause(List.of(literal));
        substructureToLiteral.put(key, literal);
        return literal;
    }

    private void addClause(List<Integer> clause) {
        target.addClause(clause);
    }

    //endregion
}
