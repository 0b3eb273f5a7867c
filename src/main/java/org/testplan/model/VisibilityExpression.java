package org.testplan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ESPRESSIONE DI VISIBILITÀ - Albero binario che decide quando una domanda è mostrata
 *
 * Variante etichettata con quattro forme:
 * • AND / OR: nodi interni con figli sinistro e destro
 * • COMPARISON: foglia {operatore, etichetta domanda padre, valore atteso}
 * • UNSUPPORTED: foglia con un operatore sconosciuto, conservata solo per diagnostica
 *
 * Il valore atteso di un confronto può mancare (null) e significa "qualsiasi valore".
 * L'albero è immutabile e viene attraversato ricorsivamente da sinistra a destra.
 */
public final class VisibilityExpression {

    //region TIPI E STRUTTURA DATI

    public enum Kind {
        AND,            // Congiunzione: left AND right
        OR,             // Disgiunzione: left OR right
        COMPARISON,     // Confronto sulla risposta di una domanda padre
        UNSUPPORTED     // Operatore non riconosciuto
    }

    private final Kind kind;
    private final VisibilityExpression left;
    private final VisibilityExpression right;
    private final ComparisonOperator operator;
    private final String parentLabel;
    private final String expectedValue;

    /** Nome originale dell'operatore (solo per UNSUPPORTED) */
    private final String rawOperator;

    //endregion

    //region COSTRUZIONE

    private VisibilityExpression(Kind kind, VisibilityExpression left, VisibilityExpression right,
                                 ComparisonOperator operator, String parentLabel, String expectedValue,
                                 String rawOperator) {
        this.kind = kind;
        this.left = left;
        this.right = right;
        this.operator = operator;
        this.parentLabel = parentLabel;
        this.expectedValue = expectedValue;
        this.rawOperator = rawOperator;
    }

    /**
     * Crea un nodo AND. Un figlio null è ammesso (documento incompleto) e verrà
     * ignorato dalla traduzione.
     */
    public static VisibilityExpression and(VisibilityExpression left, VisibilityExpression right) {
        return new VisibilityExpression(Kind.AND, left, right, null, null, null, null);
    }

    public static VisibilityExpression or(VisibilityExpression left, VisibilityExpression right) {
        return new VisibilityExpression(Kind.OR, left, right, null, null, null, null);
    }

    /**
     * Crea una foglia di confronto.
     *
     * @param operator operatore (non null)
     * @param parentLabel etichetta della domanda referenziata (non null)
     * @param expectedValue valore atteso, null = qualsiasi valore
     */
    public static VisibilityExpression comparison(ComparisonOperator operator, String parentLabel,
                                                  String expectedValue) {
        if (operator == null) {
            throw new IllegalArgumentException("Operatore di confronto null");
        }
        if (parentLabel == null) {
            throw new IllegalArgumentException("Etichetta della domanda padre null");
        }
        return new VisibilityExpression(Kind.COMPARISON, null, null, operator, parentLabel, expectedValue, null);
    }

    public static VisibilityExpression unsupported(String rawOperator) {
        return new VisibilityExpression(Kind.UNSUPPORTED, null, null, null, null, null,
                rawOperator != null ? rawOperator : "<null>");
    }

    //endregion

    //region ACCESSORS

    public Kind getKind() {
        return kind;
    }

    public VisibilityExpression getLeft() {
        return left;
    }

    public VisibilityExpression getRight() {
        return right;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getParentLabel() {
        return parentLabel;
    }

    public String getExpectedValue() {
        return expectedValue;
    }

    public boolean hasExpectedValue() {
        return expectedValue != null;
    }

    public String getRawOperator() {
        return rawOperator;
    }

    //endregion

    //region ESTRAZIONE RIFERIMENTI

    /**
     * Estrae tutti i confronti dell'albero nell'ordine di visita (sinistra prima di destra).
     * Le foglie UNSUPPORTED non producono riferimenti.
     *
     * @return lista immutabile dei riferimenti a domande padre
     */
    public List<ConditionReference> references() {
        List<ConditionReference> references = new ArrayList<>();
        collectReferences(this, references);
        return Collections.unmodifiableList(references);
    }

    private static void collectReferences(VisibilityExpression node, List<ConditionReference> sink) {
        if (node == null) return;

        switch (node.kind) {
            case AND, OR -> {
                collectReferences(node.left, sink);
                collectReferences(node.right, sink);
            }
            case COMPARISON -> sink.add(new ConditionReference(node.parentLabel, node.operator, node.expectedValue));
            case UNSUPPORTED -> { /* nessun riferimento */ }
        }
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Forma testuale compatibile con la grammatica VisibilityCondition, es.
     * {@code ServiceType == "B" AND (Region != "EU" OR Consent INCLUDES "Yes")}.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case AND -> operand(left, Kind.OR) + " AND " + operand(right, Kind.OR);
            case OR -> operand(left, null) + " OR " + operand(right, null);
            case COMPARISON -> parentLabel + " " + operator.getSymbol()
                    + (expectedValue != null ? " " + quote(expectedValue) : "");
            case UNSUPPORTED -> "[" + rawOperator + "]";
        };
    }

    private static String operand(VisibilityExpression child, Kind parenthesizedKind) {
        if (child == null) {
            return "[?]";
        }
        String text = child.toString();
        return child.kind == parenthesizedKind ? "(" + text + ")" : text;
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        VisibilityExpression other = (VisibilityExpression) obj;
        return kind == other.kind
                && operator == other.operator
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right)
                && Objects.equals(parentLabel, other.parentLabel)
                && Objects.equals(expectedValue, other.expectedValue)
                && Objects.equals(rawOperator, other.rawOperator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, left, right, operator, parentLabel, expectedValue, rawOperator);
    }
}
