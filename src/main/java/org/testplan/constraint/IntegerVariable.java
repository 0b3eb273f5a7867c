package org.testplan.constraint;

import org.testplan.cnf.LogicFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * VARIABILE INTERA SIMBOLICA - Risposta di una variabile di test codificata in booleani
 *
 * CODIFICA:
 * • variabile con k opzioni: un atomo "Qn=c" per ogni codice c in {0..k}, esattamente uno vero
 * • variabile a sorgente dinamica: un solo atomo libero "Qn!=0" (ha ricevuto una risposta),
 *   privo di vincoli di dominio
 */
public final class IntegerVariable {

    private final int questionNumber;
    private final ValueEncoding encoding;
    private final List<LogicFormula> codeAtoms;
    private final LogicFormula answeredAtom;

    public IntegerVariable(ValueEncoding encoding) {
        this.questionNumber = encoding.getQuestionNumber();
        this.encoding = encoding;
        this.codeAtoms = new ArrayList<>();

        if (encoding.isDynamicSource()) {
            this.answeredAtom = LogicFormula.atom("Q" + questionNumber + "!=0");
        } else {
            for (int code = 0; code <= encoding.size(); code++) {
                codeAtoms.add(LogicFormula.atom(atomName(questionNumber, code)));
            }
            this.answeredAtom = null;
        }
    }

    static String atomName(int questionNumber, int code) {
        return "Q" + questionNumber + "=" + code;
    }

    public int getQuestionNumber() {
        return questionNumber;
    }

    public ValueEncoding getEncoding() {
        return encoding;
    }

    public boolean isDynamicSource() {
        return encoding.isDynamicSource();
    }

    //region FORMULE

    /**
     * value == code. Un codice fuori dominio produce FALSE.
     */
    public LogicFormula equalsCode(int code) {
        if (isDynamicSource()) {
            return code == ValueEncoding.UNSET ? LogicFormula.not(answeredAtom) : LogicFormula.FALSE;
        }
        return code >= 0 && code < codeAtoms.size() ? codeAtoms.get(code) : LogicFormula.FALSE;
    }

    public LogicFormula notEqualsCode(int code) {
        return LogicFormula.not(equalsCode(code));
    }

    /**
     * value != 0 ("ha ricevuto una risposta")
     */
    public LogicFormula isSet() {
        return notEqualsCode(ValueEncoding.UNSET);
    }

    /**
     * Vincolo di dominio: esattamente un codice in {0..k}. TRUE per le variabili dinamiche.
     */
    public LogicFormula domainConstraint() {
        return isDynamicSource() ? LogicFormula.TRUE : LogicFormula.exactlyOne(codeAtoms);
    }

    //endregion

    //region DECODIFICA

    /**
     * @param model modello SAT per nome di variabile
     * @return codice vero nel modello, 0 se nessuno (o variabile dinamica)
     */
    public int decode(Map<String, Boolean> model) {
        for (int code = 1; code < codeAtoms.size(); code++) {
            if (Boolean.TRUE.equals(model.get(codeAtoms.get(code).atom))) {
                return code;
            }
        }
        return ValueEncoding.UNSET;
    }

    List<String> atomNames() {
        List<String> names = new ArrayList<>();
        if (answeredAtom != null) {
            names.add(answeredAtom.atom);
        }
        codeAtoms.forEach(atom -> names.add(atom.atom));
        return names;
    }

    //endregion

    @Override
    public String toString() {
        return "IntegerVariable{Q" + questionNumber + ", codes=" + (isDynamicSource() ? "dynamic" : encoding.size()) + '}';
    }
}
