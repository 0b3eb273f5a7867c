package org.testplan.constraint;

import org.testplan.cdcl.CDCLSolver;
import org.testplan.cdcl.SATResult;
import org.testplan.cnf.LogicFormula;
import org.testplan.cnf.TseitinConverter;
import org.testplan.support.CNFFormula;

import java.util.logging.Logger;

/**
 * Contesto di risoluzione usa e getta: copia privata dei vincoli di base più i vincoli
 * aggiunti dalla singola interrogazione. Non modifica mai il modello condiviso.
 */
public final class SolvingContext {

    private static final Logger LOGGER = Logger.getLogger(SolvingContext.class.getName());

    private final ConstraintModel model;
    private final CNFFormula formula;
    private final TseitinConverter converter;
    private final int conflictBudget;

    SolvingContext(ConstraintModel model, CNFFormula formula, int conflictBudget) {
        this.model = model;
        this.formula = formula;
        this.converter = new TseitinConverter(formula);
        this.conflictBudget = conflictBudget;
    }

    public SolvingContext add(LogicFormula constraint) {
        converter.assertFormula(constraint);
        return this;
    }

    /**
     * Aggiunge value(questionNumber) == code.
     *
     * @throws IllegalArgumentException se la domanda non è una variabile di test
     */
    public SolvingContext requireCode(int questionNumber, int code) {
        IntegerVariable variable = model.getVariable(questionNumber);
        if (variable == null) {
            throw new IllegalArgumentException("Q" + questionNumber + " non è una variabile di test");
        }
        return add(variable.equalsCode(code));
    }

    /**
     * Aggiunge visible(questionNumber) == true.
     *
     * @throws IllegalArgumentException se la domanda è nascosta o inesistente
     */
    public SolvingContext requireVisible(int questionNumber) {
        LogicFormula atom = model.getVisibilityAtom(questionNumber);
        if (atom == null) {
            throw new IllegalArgumentException("Q" + questionNumber + " non ha una variabile di visibilità");
        }
        return add(atom);
    }

    public SATResult check() {
        SATResult result = new CDCLSolver(formula, conflictBudget).solve();
        LOGGER.finest(() -> result.getStatus() + " " + result.getStatistics().toCompactString());
        return result;
    }
}
