package org.testplan.model;

/**
 * Operatori di confronto ammessi nelle foglie di una condizione di visibilità.
 *
 * Il simbolo testuale è quello usato dalla grammatica delle condizioni e dai report.
 */
public enum ComparisonOperator {

    EQUALS("=="),
    NOT_EQUALS("!="),
    CONTAINS("CONTAINS"),
    NOT_CONTAINS("NOT_CONTAINS"),
    INCLUDES("INCLUDES");

    /** Simbolo usato nella forma testuale */
    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true per gli operatori "positivi" (EQUALS, INCLUDES, CONTAINS)
     */
    public boolean isPositive() {
        return this == EQUALS || this == INCLUDES || this == CONTAINS;
    }

    /**
     * Risolve il nome di un operatore così come compare nel documento del questionario.
     *
     * @param name nome dell'operatore (es. "NOT_EQUALS")
     * @return operatore corrispondente, null se il nome non è un operatore di confronto
     */
    public static ComparisonOperator fromName(String name) {
        if (name == null) {
            return null;
        }
        for (ComparisonOperator operator : values()) {
            if (operator.name().equals(name.trim())) {
                return operator;
            }
        }
        return null;
    }
}
