package org.testplan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * ANALISI STRUTTURALE DEL QUESTIONARIO - Logica condivisa di classificazione e dipendenze
 *
 * Funzioni pure usate sia dal generatore del piano di test sia dall'indice della struttura:
 * • domande visibili all'apertura (non nascoste, senza condizione)
 * • mappa delle dipendenze inverse (etichetta padre -> domande figlie che la referenziano)
 * • classificazione TEST_VARIABLE / DATA_COLLECTION / HIDDEN
 */
public final class QuestionnaireAnalysis {

    private static final Logger LOGGER = Logger.getLogger(QuestionnaireAnalysis.class.getName());

    private QuestionnaireAnalysis() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Domande visibili all'apertura del questionario: hidden = false e nessuna condizione.
     *
     * @return numeri in ordine crescente
     */
    public static SortedSet<Integer> visibleOnOpen(List<Question> questions) {
        SortedSet<Integer> visible = new TreeSet<>();
        for (Question question : questions) {
            if (!question.isHidden() && !question.hasVisibilityCondition()) {
                visible.add(question.getNumber());
            }
        }
        return visible;
    }

    /**
     * Costruisce la mappa delle dipendenze inverse: per ogni etichetta referenziata, le domande
     * figlie che la usano nella propria condizione, nell'ordine in cui compaiono.
     *
     * Le etichette che non corrispondono ad alcuna domanda sono comunque presenti come chiavi:
     * la risoluzione fallita viene segnalata più avanti, in fase di traduzione.
     */
    public static Map<String, List<QuestionReference>> reverseDependencies(List<Question> questions) {
        Map<String, List<QuestionReference>> reverse = new LinkedHashMap<>();

        for (Question child : questions) {
            for (ConditionReference reference : child.getConditionReferences()) {
                reverse.computeIfAbsent(reference.getParentLabel(), label -> new ArrayList<>())
                        .add(new QuestionReference(child.getNumber(), child.getLabel(),
                                reference.getOperator(), reference.getExpectedValue()));
            }
        }

        reverse.replaceAll((label, children) -> Collections.unmodifiableList(children));
        LOGGER.fine("Dipendenze inverse: " + reverse.size() + " etichette referenziate");
        return Collections.unmodifiableMap(reverse);
    }

    /**
     * Classifica le domande:
     * • HIDDEN: hidden = true
     * • TEST_VARIABLE: visibile e referenziata da almeno una condizione
     * • DATA_COLLECTION: visibile e mai referenziata
     */
    public static Classification classify(List<Question> questions,
                                          Map<String, List<QuestionReference>> reverseDependencies) {
        Map<Integer, QuestionClass> classes = new HashMap<>();

        for (Question question : questions) {
            if (question.isHidden()) {
                classes.put(question.getNumber(), QuestionClass.HIDDEN);
            } else if (reverseDependencies.containsKey(question.getLabel())) {
                classes.put(question.getNumber(), QuestionClass.TEST_VARIABLE);
            } else {
                classes.put(question.getNumber(), QuestionClass.DATA_COLLECTION);
            }
        }

        Classification classification = new Classification(classes);
        LOGGER.fine("Classificazione completata: " + classification);
        return classification;
    }

    /**
     * Scorciatoia: dipendenze inverse + classificazione sulle domande del questionario.
     */
    public static Classification classify(Questionnaire questionnaire) {
        List<Question> questions = questionnaire.getQuestions();
        return classify(questions, reverseDependencies(questions));
    }

    /**
     * @return domande della classe indicata in ordine di documento
     */
    public static List<Question> questionsOf(Questionnaire questionnaire, Classification classification,
                                             QuestionClass questionClass) {
        List<Question> selected = new ArrayList<>();
        for (Question question : questionnaire.getQuestions()) {
            if (classification.classOf(question.getNumber()) == questionClass) {
                selected.add(question);
            }
        }
        return selected;
    }
}
