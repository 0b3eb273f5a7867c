package org.testplan.model;

/**
 * Voce della mappa delle dipendenze inverse: la domanda figlia childNumber/childLabel
 * dipende dalla risposta della domanda padre tramite operator ed expectedValue.
 */
public final class QuestionReference {

    private final int childNumber;
    private final String childLabel;
    private final ComparisonOperator operator;
    private final String expectedValue;

    public QuestionReference(int childNumber, String childLabel, ComparisonOperator operator, String expectedValue) {
        this.childNumber = childNumber;
        this.childLabel = childLabel;
        this.operator = operator;
        this.expectedValue = expectedValue;
    }

    public int getChildNumber() {
        return childNumber;
    }

    public String getChildLabel() {
        return childLabel;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getExpectedValue() {
        return expectedValue;
    }

    @Override
    public String toString() {
        return "Q" + childNumber + " (" + childLabel + ") via " + operator.getSymbol()
                + (expectedValue != null ? " " + expectedValue : "");
    }
}
