package org.testplan.constraint;

import org.testplan.cnf.LogicFormula;
import org.testplan.model.Classification;
import org.testplan.model.Question;
import org.testplan.model.QuestionnaireAnalysis;
import org.testplan.model.Questionnaire;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DEL MODELLO DEI VINCOLI
 *
 * Ordine di costruzione:
 * 1. vincoli di dominio (variabili di test con almeno un'opzione reale)
 * 2. visibilità di default (domande non nascoste senza condizione)
 * 3. visibilità condizionale: visible(q) ⇔ F, con fallback visible(q) = true se F non è
 *    traducibile; F ridotta a FALSE rende q irraggiungibile
 * 4. collegamento: visible ⇔ value != 0 per le variabili non dinamiche
 */
public class ConstraintModelBuilder {

    private static final Logger LOGGER = Logger.getLogger(ConstraintModelBuilder.class.getName());

    /**
     * Costruisce il modello calcolando la classificazione dal questionario.
     */
    public ConstraintModel build(Questionnaire questionnaire) {
        return build(questionnaire, QuestionnaireAnalysis.classify(questionnaire));
    }

    public ConstraintModel build(Questionnaire questionnaire, Classification classification) {
        if (questionnaire == null || classification == null) {
            throw new IllegalArgumentException("Questionario e classificazione sono obbligatori");
        }

        Map<Integer, IntegerVariable> variables = createVariables(questionnaire, classification);
        Map<Integer, LogicFormula> visibilityAtoms = new HashMap<>();
        for (Question question : questionnaire.getQuestions()) {
            if (!question.isHidden()) {
                visibilityAtoms.put(question.getNumber(), visibilityAtom(question.getNumber()));
            }
        }

        List<LogicFormula> constraints = new ArrayList<>();
        Map<Integer, LogicFormula> visibilityFormulas = new HashMap<>();
        SortedSet<Integer> unreachable = new TreeSet<>();
        SortedSet<Integer> fallback = new TreeSet<>();

        // 1. dominio
        for (IntegerVariable variable : variables.values()) {
            if (variable.isDynamicSource()) {
                LOGGER.fine("Q" + variable.getQuestionNumber() + " a sorgente dinamica: nessun vincolo di dominio");
                continue;
            }
            constraints.add(variable.domainConstraint());
        }

        ExpressionTranslator translator = new ExpressionTranslator(questionnaire, classification, variables);

        for (Question question : questionnaire.getQuestions()) {
            if (question.isHidden()) continue;
            LogicFormula visible = visibilityAtoms.get(question.getNumber());

            // 2. visibili all'apertura
            if (!question.hasVisibilityCondition()) {
                constraints.add(visible);
                continue;
            }

            // 3. visibilità condizionale
            LogicFormula condition = translator.translate(question.getVisibilityCondition());
            if (condition == null) {
                LOGGER.warning(String.format("Condizione di %s non traducibile, assunta sempre visibile: %s",
                        question, question.getVisibilityCondition()));
                fallback.add(question.getNumber());
                constraints.add(visible);
                continue;
            }

            visibilityFormulas.put(question.getNumber(), condition);
            if (condition.isFalse()) {
                LOGGER.info(question + " irraggiungibile: la condizione si riduce a FALSE");
                unreachable.add(question.getNumber());
            }
            constraints.add(LogicFormula.iff(visible, condition));
        }

        // 4. collegamento visibilità-valore
        for (IntegerVariable variable : variables.values()) {
            if (variable.isDynamicSource()) continue;
            LogicFormula visible = visibilityAtoms.get(variable.getQuestionNumber());
            constraints.add(LogicFormula.iff(visible, variable.isSet()));
        }

        ConstraintModel model = new ConstraintModel(questionnaire, classification, variables, visibilityAtoms,
                visibilityFormulas, constraints, unreachable, fallback);
        LOGGER.info("Modello dei vincoli costruito: " + model);
        return model;
    }

    private Map<Integer, IntegerVariable> createVariables(Questionnaire questionnaire, Classification classification) {
        Map<Integer, IntegerVariable> variables = new HashMap<>();
        for (int number : classification.getTestVariables()) {
            Question question = questionnaire.getQuestion(number);
            variables.put(number, new IntegerVariable(ValueEncoding.of(question)));
        }
        return variables;
    }

    static LogicFormula visibilityAtom(int questionNumber) {
        return LogicFormula.atom("visible(Q" + questionNumber + ")");
    }
}
