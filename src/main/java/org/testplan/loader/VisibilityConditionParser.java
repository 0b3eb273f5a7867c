package org.testplan.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.testplan.antlr.VisibilityConditionBaseVisitor;
import org.testplan.antlr.VisibilityConditionLexer;
import org.testplan.antlr.VisibilityConditionParser.AndContext;
import org.testplan.antlr.VisibilityConditionParser.ComparatorContext;
import org.testplan.antlr.VisibilityConditionParser.ComparisonContext;
import org.testplan.antlr.VisibilityConditionParser.ConditionContext;
import org.testplan.antlr.VisibilityConditionParser.OrContext;
import org.testplan.antlr.VisibilityConditionParser.ParContext;
import org.testplan.antlr.VisibilityConditionParser.ValueContext;
import org.testplan.model.ComparisonOperator;
import org.testplan.model.VisibilityExpression;

import java.util.logging.Logger;

/**
 * PARSER DELLE CONDIZIONI TESTUALI - Visitor ANTLR che costruisce {@link VisibilityExpression}
 *
 * Le catene AND/OR diventano alberi binari associativi a sinistra; le parentesi sono
 * trasparenti. I valori tra virgolette vengono privati delle virgolette e degli escape.
 * Ogni errore sintattico interrompe il parsing con {@link ConditionSyntaxException}.
 */
public class VisibilityConditionParser extends VisibilityConditionBaseVisitor<VisibilityExpression> {

    private static final Logger LOGGER = Logger.getLogger(VisibilityConditionParser.class.getName());

    /**
     * @param text condizione testuale, es. {@code ServiceType == "B" AND Consent != ""}
     * @throws ConditionSyntaxException se il testo non rispetta la grammatica
     */
    public VisibilityExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionSyntaxException("condizione vuota", 1, 0);
        }

        CharStream input = CharStreams.fromString(text);
        VisibilityConditionLexer lexer = new VisibilityConditionLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        org.testplan.antlr.VisibilityConditionParser parser =
                new org.testplan.antlr.VisibilityConditionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        VisibilityExpression expression = visit(parser.condition());
        LOGGER.finest(() -> "Condizione analizzata: " + text + " -> " + expression);
        return expression;
    }

    //region VISITOR

    @Override
    public VisibilityExpression visitCondition(ConditionContext ctx) {
        return visit(ctx.disjunction());
    }

    @Override
    public VisibilityExpression visitOr(OrContext ctx) {
        VisibilityExpression result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = VisibilityExpression.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public VisibilityExpression visitAnd(AndContext ctx) {
        VisibilityExpression result = visit(ctx.primary(0));
        for (int i = 1; i < ctx.primary().size(); i++) {
            result = VisibilityExpression.and(result, visit(ctx.primary(i)));
        }
        return result;
    }

    @Override
    public VisibilityExpression visitPar(ParContext ctx) {
        return visit(ctx.disjunction());
    }

    @Override
    public VisibilityExpression visitComparison(ComparisonContext ctx) {
        String label = ctx.IDENTIFIER().getText();
        ComparisonOperator operator = toOperator(ctx.comparator());
        String expected = ctx.value() != null ? toValue(ctx.value()) : null;
        return VisibilityExpression.comparison(operator, label, expected);
    }

    private static ComparisonOperator toOperator(ComparatorContext ctx) {
        if (ctx.EQUALS() != null) return ComparisonOperator.EQUALS;
        if (ctx.NOT_EQUALS() != null) return ComparisonOperator.NOT_EQUALS;
        if (ctx.CONTAINS() != null) return ComparisonOperator.CONTAINS;
        if (ctx.NOT_CONTAINS() != null) return ComparisonOperator.NOT_CONTAINS;
        return ComparisonOperator.INCLUDES;
    }

    private static String toValue(ValueContext ctx) {
        if (ctx.STRING() == null) {
            return ctx.getText();
        }
        String quoted = ctx.STRING().getText();
        StringBuilder value = new StringBuilder(quoted.length());
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() - 1) {
                c = quoted.charAt(++i);
            }
            value.append(c);
        }
        return value.toString();
    }

    //endregion

    /**
     * Trasforma i messaggi di errore di lexer e parser in eccezioni.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ConditionSyntaxException(msg, line, charPositionInLine);
        }
    }
}
