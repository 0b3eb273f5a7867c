package org.testplan.cdcl;

import org.junit.jupiter.api.Test;
import org.testplan.support.CNFFormula;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CDCLSolverTest {

    @Test
    void solve_shouldFindModel_whenFormulaIsSatisfiable() {
        // Given
        CNFFormula formula = new CNFFormula();
        int a = formula.variableFor("a");
        int b = formula.variableFor("b");
        int c = formula.variableFor("c");
        formula.addClause(a, b);
        formula.addClause(-a);
        formula.addClause(-b, c);

        // When
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isSatisfiable()).isTrue();
        assertThat(result.valueOf("a")).isFalse();
        assertThat(result.valueOf("b")).isTrue();
        assertThat(result.valueOf("c")).isTrue();
    }

    @Test
    void solve_shouldReportUnsat_whenUnitClausesContradict() {
        // Given
        CNFFormula formula = new CNFFormula();
        int a = formula.variableFor("a");
        formula.addClause(a);
        formula.addClause(-a);

        // When
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isUnsatisfiable()).isTrue();
    }

    @Test
    void solve_shouldReportUnsat_forThreePigeonsInTwoHoles() {
        // Given
        CNFFormula formula = pigeonhole(3, 2);

        // When
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isUnsatisfiable()).isTrue();
        assertThat(result.getStatistics().getConflicts()).isPositive();
        assertThat(result.getStatistics().getLearnedClauses()).isPositive();
    }

    @Test
    void solve_shouldFindModel_forTwoPigeonsInTwoHoles() {
        // Given
        CNFFormula formula = pigeonhole(2, 2);

        // When
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isSatisfiable()).isTrue();
        assertThat(result.valueOf("p1_1") || result.valueOf("p1_2")).isTrue();
        assertThat(result.valueOf("p1_1") && result.valueOf("p2_1")).isFalse();
        assertThat(result.valueOf("p1_2") && result.valueOf("p2_2")).isFalse();
    }

    @Test
    void solve_shouldReturnUnknown_whenConflictBudgetIsExhausted() {
        // Given
        CNFFormula formula = pigeonhole(3, 2);

        // When
        SATResult result = new CDCLSolver(formula, 0).solve();

        // Then
        assertThat(result.isUnknown()).isTrue();
        assertThat(result.getMessage()).contains("budget");
    }

    @Test
    void solve_shouldExcludeAuxiliaryVariablesFromModel() {
        // Given
        CNFFormula formula = new CNFFormula();
        int a = formula.variableFor("a");
        int auxiliary = formula.newAuxiliaryVariable();
        formula.addClause(-auxiliary, a);
        formula.addClause(auxiliary);

        // When
        SATResult result = new CDCLSolver(formula).solve();

        // Then
        assertThat(result.isSatisfiable()).isTrue();
        assertThat(result.getAssignment()).containsOnlyKeys("a");
        assertThat(result.valueOf("a")).isTrue();
    }

    @Test
    void solve_shouldBeRepeatable_onTheSameInstance() {
        // Given
        CDCLSolver solver = new CDCLSolver(pigeonhole(3, 2));

        // When
        SATResult first = solver.solve();
        SATResult second = solver.solve();

        // Then
        assertThat(first.getStatus()).isEqualTo(second.getStatus());
    }

    @Test
    void constructor_shouldRejectNegativeBudget() {
        assertThatThrownBy(() -> new CDCLSolver(new CNFFormula(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Variabile p{i}_{j}: il piccione i occupa la buca j.
     */
    private static CNFFormula pigeonhole(int pigeons, int holes) {
        CNFFormula formula = new CNFFormula();
        for (int i = 1; i <= pigeons; i++) {
            Integer[] clause = new Integer[holes];
            for (int j = 1; j <= holes; j++) {
                clause[j - 1] = formula.variableFor("p" + i + "_" + j);
            }
            formula.addClause(clause);
        }
        for (int j = 1; j <= holes; j++) {
            for (int i = 1; i <= pigeons; i++) {
                for (int k = i + 1; k <= pigeons; k++) {
                    formula.addClause(-formula.variableFor("p" + i + "_" + j), -formula.variableFor("p" + k + "_" + j));
                }
            }
        }
        return formula;
    }
}
