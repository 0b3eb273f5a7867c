package org.testplan.constraint;

import org.testplan.cnf.LogicFormula;
import org.testplan.model.Classification;
import org.testplan.model.ComparisonOperator;
import org.testplan.model.Question;
import org.testplan.model.Questionnaire;
import org.testplan.model.VisibilityExpression;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * TRADUTTORE DI ESPRESSIONI - Albero di visibilità -> formula logica sulle variabili intere
 *
 * Il risultato è una formula oppure null ("non traducibile"); il chiamante decide il
 * fallback. Ogni motivo di mancata traduzione viene registrato come WARNING.
 *
 * REGOLE:
 * • AND/OR: se entrambi i lati si traducono si combinano; se uno solo si traduce si usa quello
 * • padre variabile di test: confronto sul codice della risposta
 * • padre nascosto: confronto valutato subito sul default (template, costante o assente)
 * • padre visibile non variabile di test: TRUE (sovra-approssimazione ottimistica)
 */
public class ExpressionTranslator {

    private static final Logger LOGGER = Logger.getLogger(ExpressionTranslator.class.getName());

    private final Questionnaire questionnaire;
    private final Classification classification;
    private final Map<Integer, IntegerVariable> variables;

    public ExpressionTranslator(Questionnaire questionnaire, Classification classification,
                                Map<Integer, IntegerVariable> variables) {
        this.questionnaire = Objects.requireNonNull(questionnaire, "questionnaire");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    /**
     * @param expression albero da tradurre (null = non traducibile)
     * @return formula semplificata, null se non traducibile
     */
    public LogicFormula translate(VisibilityExpression expression) {
        if (expression == null) {
            return null;
        }

        return switch (expression.getKind()) {
            case AND, OR -> translateConnective(expression);
            case COMPARISON -> translateComparison(expression);
            case UNSUPPORTED -> {
                LOGGER.warning("Operatore non supportato: " + expression.getRawOperator());
                yield null;
            }
        };
    }

    private LogicFormula translateConnective(VisibilityExpression expression) {
        LogicFormula left = translate(expression.getLeft());
        LogicFormula right = translate(expression.getRight());

        if (left == null || right == null) {
            return left != null ? left : right;
        }
        return expression.getKind() == VisibilityExpression.Kind.AND
                ? LogicFormula.and(left, right)
                : LogicFormula.or(left, right);
    }

    //region CONFRONTI

    private LogicFormula translateComparison(VisibilityExpression comparison) {
        Question parent = questionnaire.findByLabel(comparison.getParentLabel());
        if (parent == null) {
            LOGGER.warning("Etichetta non risolta nella condizione: '" + comparison.getParentLabel() + "'");
            return null;
        }

        IntegerVariable variable = variables.get(parent.getNumber());
        if (variable != null && classification.isTestVariable(parent.getNumber())) {
            return translateOnVariable(comparison, variable);
        }
        if (parent.isHidden()) {
            return evaluateOnHiddenParent(comparison, parent);
        }

        LOGGER.fine(() -> "Padre visibile non variabile di test " + parent + ": condizione assunta vera");
        return LogicFormula.TRUE;
    }

    private LogicFormula translateOnVariable(VisibilityExpression comparison, IntegerVariable variable) {
        ComparisonOperator operator = comparison.getOperator();

        if (operator == ComparisonOperator.NOT_EQUALS && !comparison.hasExpectedValue()) {
            return variable.isSet();
        }

        Integer code = variable.getEncoding().encode(comparison.getExpectedValue());
        if (code == null) {
            LOGGER.warning(String.format("Valore '%s' non presente tra le opzioni di Q%d (%s)",
                    comparison.getExpectedValue(), variable.getQuestionNumber(), comparison.getParentLabel()));
            return null;
        }

        return operator.isPositive() ? variable.equalsCode(code) : variable.notEqualsCode(code);
    }

    /**
     * Il campo nascosto non è una variabile: il confronto diventa una costante.
     */
    private LogicFormula evaluateOnHiddenParent(VisibilityExpression comparison, Question parent) {
        ComparisonOperator operator = comparison.getOperator();
        String expected = comparison.getExpectedValue();

        if (parent.hasTemplateDefault()) {
            // il segnaposto si assume risolto al valore atteso
            if (operator == ComparisonOperator.NOT_EQUALS) {
                return LogicFormula.FALSE;
            }
            return LogicFormula.TRUE;
        }

        if (parent.hasDefaultAnswer()) {
            boolean matches = parent.getDefaultAnswer().equals(expected);
            return LogicFormula.constant(operator.isPositive() == matches);
        }

        // mai risposto: solo i confronti negativi con un valore atteso sono soddisfatti
        return LogicFormula.constant(!operator.isPositive() && comparison.hasExpectedValue());
    }

    //endregion
}
