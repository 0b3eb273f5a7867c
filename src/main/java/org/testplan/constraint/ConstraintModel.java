package org.testplan.constraint;

import org.testplan.cdcl.SATResult;
import org.testplan.cnf.LogicFormula;
import org.testplan.cnf.TseitinConverter;
import org.testplan.model.Classification;
import org.testplan.model.Question;
import org.testplan.model.Questionnaire;
import org.testplan.model.VisibilityExpression;
import org.testplan.support.CNFFormula;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * MODELLO DEI VINCOLI - Rappresentazione simbolica immutabile della logica del questionario
 *
 * CONTENUTO:
 * • una variabile intera per ogni variabile di test, con la relativa codifica dei valori
 * • un atomo "visibile" per ogni domanda non nascosta
 * • la lista dei vincoli di base (dominio, visibilità, collegamento)
 * • l'insieme delle domande strutturalmente irraggiungibili
 *
 * I vincoli di base sono convertiti in CNF una sola volta alla costruzione; ogni
 * interrogazione ne riceve una copia privata tramite {@link #newContext(int)}.
 */
public final class ConstraintModel {

    private final Questionnaire questionnaire;
    private final Classification classification;
    private final Map<Integer, IntegerVariable> variables;
    private final Map<Integer, LogicFormula> visibilityAtoms;
    private final Map<Integer, LogicFormula> visibilityFormulas;
    private final List<LogicFormula> baseConstraints;
    private final SortedSet<Integer> unreachable;
    private final SortedSet<Integer> fallbackQuestions;
    private final CNFFormula baseFormula;

    ConstraintModel(Questionnaire questionnaire, Classification classification,
                    Map<Integer, IntegerVariable> variables, Map<Integer, LogicFormula> visibilityAtoms,
                    Map<Integer, LogicFormula> visibilityFormulas, List<LogicFormula> baseConstraints,
                    SortedSet<Integer> unreachable, SortedSet<Integer> fallbackQuestions) {
        this.questionnaire = questionnaire;
        this.classification = classification;
        this.variables = Collections.unmodifiableMap(new TreeMap<>(variables));
        this.visibilityAtoms = Collections.unmodifiableMap(new TreeMap<>(visibilityAtoms));
        this.visibilityFormulas = Collections.unmodifiableMap(new TreeMap<>(visibilityFormulas));
        this.baseConstraints = List.copyOf(baseConstraints);
        this.unreachable = Collections.unmodifiableSortedSet(new TreeSet<>(unreachable));
        this.fallbackQuestions = Collections.unmodifiableSortedSet(new TreeSet<>(fallbackQuestions));
        this.baseFormula = compileBaseFormula();
    }

    private CNFFormula compileBaseFormula() {
        CNFFormula formula = new CNFFormula();

        // registrazione esplicita: ogni atomo ha un ID anche se le semplificazioni lo eliminano
        visibilityAtoms.values().forEach(atom -> formula.variableFor(atom.atom));
        variables.values().forEach(variable -> variable.atomNames().forEach(formula::variableFor));

        new TseitinConverter(formula).assertAll(baseConstraints);
        return formula;
    }

    //region CONTESTI DI RISOLUZIONE

    /**
     * Crea un contesto di risoluzione usa e getta con i vincoli di base.
     *
     * @param conflictBudget budget di conflitti del solver
     */
    public SolvingContext newContext(int conflictBudget) {
        return new SolvingContext(this, baseFormula.copy(), conflictBudget);
    }

    //endregion

    //region DECODIFICA DEI MODELLI

    /**
     * @return domande non nascoste visibili nel modello, in ordine crescente
     */
    public SortedSet<Integer> decodeVisible(SATResult result) {
        SortedSet<Integer> visible = new TreeSet<>();
        visibilityAtoms.forEach((number, atom) -> {
            if (result.valueOf(atom.atom)) {
                visible.add(number);
            }
        });
        return visible;
    }

    /**
     * @return valori non nulli delle variabili non dinamiche, per numero di domanda
     */
    public SortedMap<Integer, String> decodeCompleteAssignment(SATResult result) {
        SortedMap<Integer, String> assignment = new TreeMap<>();
        for (IntegerVariable variable : variables.values()) {
            if (variable.isDynamicSource()) continue;

            int code = variable.decode(result.getAssignment());
            if (code != ValueEncoding.UNSET) {
                assignment.put(variable.getQuestionNumber(), variable.getEncoding().decode(code));
            }
        }
        return assignment;
    }

    //endregion

    //region ACCESSORS

    public Questionnaire getQuestionnaire() {
        return questionnaire;
    }

    public Classification getClassification() {
        return classification;
    }

    /**
     * @return variabile della domanda, null se non è una variabile di test
     */
    public IntegerVariable getVariable(int questionNumber) {
        return variables.get(questionNumber);
    }

    public Map<Integer, IntegerVariable> getVariables() {
        return variables;
    }

    /**
     * @return codifica della variabile di test, null se assente
     */
    public ValueEncoding getEncoding(int questionNumber) {
        IntegerVariable variable = variables.get(questionNumber);
        return variable != null ? variable.getEncoding() : null;
    }

    /**
     * @return codifiche di tutte le variabili di test, per numero di domanda
     */
    public SortedMap<Integer, ValueEncoding> getEncodings() {
        SortedMap<Integer, ValueEncoding> encodings = new TreeMap<>();
        variables.forEach((number, variable) -> encodings.put(number, variable.getEncoding()));
        return encodings;
    }

    /**
     * @return atomo di visibilità della domanda, null per le domande nascoste
     */
    public LogicFormula getVisibilityAtom(int questionNumber) {
        return visibilityAtoms.get(questionNumber);
    }

    /**
     * @return formula tradotta della condizione (null se assente o non traducibile)
     */
    public LogicFormula getVisibilityFormula(int questionNumber) {
        return visibilityFormulas.get(questionNumber);
    }

    public SortedSet<Integer> getUnreachable() {
        return unreachable;
    }

    public boolean isUnreachable(int questionNumber) {
        return unreachable.contains(questionNumber);
    }

    /**
     * @return domande la cui condizione non è traducibile e sono state assunte sempre visibili
     */
    public SortedSet<Integer> getFallbackQuestions() {
        return fallbackQuestions;
    }

    /**
     * @return condizione originale di ogni domanda irraggiungibile
     */
    public SortedMap<Integer, VisibilityExpression> getUnreachableConditions() {
        SortedMap<Integer, VisibilityExpression> conditions = new TreeMap<>();
        for (int number : unreachable) {
            Question question = questionnaire.getQuestion(number);
            conditions.put(number, question.getVisibilityCondition());
        }
        return conditions;
    }

    /**
     * @return domande non nascoste e non irraggiungibili (obiettivo di copertura)
     */
    public SortedSet<Integer> getCoverageTarget() {
        SortedSet<Integer> target = new TreeSet<>(visibilityAtoms.keySet());
        target.removeAll(unreachable);
        return target;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("ConstraintModel{variables=%d, visibility=%d, constraints=%d, unreachable=%s, cnf=%s}",
                variables.size(), visibilityAtoms.size(), baseConstraints.size(), unreachable, baseFormula);
    }
}
