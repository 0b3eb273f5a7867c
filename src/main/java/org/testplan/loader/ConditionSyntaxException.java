package org.testplan.loader;

/**
 * Errore di sintassi in una condizione di visibilità testuale.
 */
public class ConditionSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public ConditionSyntaxException(String message, int line, int column) {
        super(String.format("Errore di sintassi alla riga %d, colonna %d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
