package org.testplan.model;

import java.util.Objects;

/**
 * Riferimento estratto da una condizione di visibilità: "la risposta a parentLabel
 * viene confrontata con expectedValue tramite operator".
 */
public final class ConditionReference {

    private final String parentLabel;
    private final ComparisonOperator operator;
    private final String expectedValue;

    public ConditionReference(String parentLabel, ComparisonOperator operator, String expectedValue) {
        this.parentLabel = parentLabel;
        this.operator = operator;
        this.expectedValue = expectedValue;
    }

    public String getParentLabel() {
        return parentLabel;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    /**
     * @return valore atteso, null = qualsiasi valore
     */
    public String getExpectedValue() {
        return expectedValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ConditionReference other = (ConditionReference) obj;
        return parentLabel.equals(other.parentLabel)
                && operator == other.operator
                && Objects.equals(expectedValue, other.expectedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentLabel, operator, expectedValue);
    }

    @Override
    public String toString() {
        return parentLabel + " " + operator.getSymbol() + (expectedValue != null ? " " + expectedValue : "");
    }
}
