package org.testplan.cnf;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogicFormulaTest {

    private final LogicFormula a = LogicFormula.atom("a");
    private final LogicFormula b = LogicFormula.atom("b");

    @Test
    void and_shouldFoldConstants() {
        assertThat(LogicFormula.and(a, LogicFormula.FALSE)).isEqualTo(LogicFormula.FALSE);
        assertThat(LogicFormula.and(a, LogicFormula.TRUE)).isEqualTo(a);
        assertThat(LogicFormula.and(List.of())).isEqualTo(LogicFormula.TRUE);
    }

    @Test
    void or_shouldFoldConstants() {
        assertThat(LogicFormula.or(a, LogicFormula.TRUE)).isEqualTo(LogicFormula.TRUE);
        assertThat(LogicFormula.or(a, LogicFormula.FALSE)).isEqualTo(a);
        assertThat(LogicFormula.or(List.of())).isEqualTo(LogicFormula.FALSE);
    }

    @Test
    void not_shouldRemoveDoubleNegation() {
        assertThat(LogicFormula.not(LogicFormula.not(a))).isEqualTo(a);
        assertThat(LogicFormula.not(LogicFormula.TRUE)).isEqualTo(LogicFormula.FALSE);
    }

    @Test
    void and_shouldFlattenNestedConjunctionsAndDropDuplicates() {
        // When
        LogicFormula formula = LogicFormula.and(LogicFormula.and(a, b), a);

        // Then
        assertThat(formula.type).isEqualTo(LogicFormula.Type.AND);
        assertThat(formula.operands).containsExactly(a, b);
    }

    @Test
    void iff_shouldSimplify_whenOneSideIsConstantOrSidesAreEqual() {
        assertThat(LogicFormula.iff(a, LogicFormula.TRUE)).isEqualTo(a);
        assertThat(LogicFormula.iff(LogicFormula.FALSE, a)).isEqualTo(LogicFormula.not(a));
        assertThat(LogicFormula.iff(a, LogicFormula.atom("a"))).isEqualTo(LogicFormula.TRUE);
    }

    @Test
    void exactlyOne_shouldAcceptOnlySingleTrueOperand() {
        // Given
        LogicFormula c = LogicFormula.atom("c");
        LogicFormula formula = LogicFormula.exactlyOne(List.of(a, b, c));

        // Then
        assertThat(formula.evaluate(Map.of("a", false, "b", true, "c", false))).isTrue();
        assertThat(formula.evaluate(Map.of("a", true, "b", true, "c", false))).isFalse();
        assertThat(formula.evaluate(Map.of())).isFalse();
    }

    @Test
    void collectAtoms_shouldReturnNamesInFirstAppearanceOrder() {
        // When
        LogicFormula formula = LogicFormula.or(LogicFormula.not(b), LogicFormula.and(a, b));

        // Then
        assertThat(formula.collectAtoms()).containsExactly("b", "a");
        assertThat(formula.toString()).isEqualTo("!b | (a & b)");
    }
}
