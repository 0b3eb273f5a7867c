package org.testplan.cnf;

import org.junit.jupiter.api.Test;
import org.testplan.cdcl.CDCLSolver;
import org.testplan.cdcl.SATResult;
import org.testplan.support.CNFFormula;

import static org.assertj.core.api.Assertions.assertThat;

class TseitinConverterTest {

    private final LogicFormula a = LogicFormula.atom("a");
    private final LogicFormula b = LogicFormula.atom("b");
    private final LogicFormula c = LogicFormula.atom("c");

    @Test
    void assertFormula_shouldPreserveSatisfiability_andHideAuxiliaryVariables() {
        // Given
        CNFFormula formula = new CNFFormula();
        TseitinConverter converter = new TseitinConverter(formula);

        // When
        converter.assertFormula(LogicFormula.iff(a, LogicFormula.or(b, c)));
        converter.assertFormula(a);
        converter.assertFormula(LogicFormula.not(b));
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isSatisfiable()).isTrue();
        assertThat(result.valueOf("c")).isTrue();
        assertThat(result.getAssignment().keySet()).allMatch(name -> !name.startsWith(CNFFormula.AUXILIARY_PREFIX));
    }

    @Test
    void assertFormula_shouldAddEmptyClause_whenFormulaIsFalse() {
        // Given
        CNFFormula formula = new CNFFormula();

        // When
        new TseitinConverter(formula).assertFormula(LogicFormula.FALSE);

        // Then
        assertThat(formula.containsEmptyClause()).isTrue();
        assertThat(new CDCLSolver(formula).solve().isUnsatisfiable()).isTrue();
    }

    @Test
    void assertFormula_shouldAddNothing_whenFormulaIsTrue() {
        // Given
        CNFFormula formula = new CNFFormula();

        // When
        new TseitinConverter(formula).assertFormula(LogicFormula.TRUE);

        // Then
        assertThat(formula.getClausesCount()).isZero();
    }

    @Test
    void assertFormula_shouldDetectContradiction_acrossNestedFormulas() {
        // Given
        CNFFormula formula = new CNFFormula();
        TseitinConverter converter = new TseitinConverter(formula);

        // When
        converter.assertFormula(LogicFormula.or(LogicFormula.and(a, b), LogicFormula.and(a, c)));
        converter.assertFormula(LogicFormula.not(a));

        // Then
        assertThat(new CDCLSolver(formula).solve().isUnsatisfiable()).isTrue();
    }
}
