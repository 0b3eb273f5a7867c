package org.testplan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Questionario normalizzato: nome e domande in ordine di documento.
 *
 * Mantiene gli indici per numero e per etichetta; in caso di etichette duplicate vale la
 * prima occorrenza, come nella ricerca sequenziale dei riferimenti.
 */
public final class Questionnaire {

    private final String name;
    private final List<Question> questions;
    private final Map<Integer, Question> byNumber;
    private final Map<String, Question> byLabel;

    public Questionnaire(String name, List<Question> questions) {
        if (questions == null) {
            throw new IllegalArgumentException("Lista domande null");
        }

        this.name = name != null ? name : "questionnaire";
        this.questions = Collections.unmodifiableList(new ArrayList<>(questions));
        this.byNumber = new HashMap<>();
        this.byLabel = new HashMap<>();

        for (Question question : this.questions) {
            if (byNumber.put(question.getNumber(), question) != null) {
                throw new IllegalArgumentException("Numero di domanda duplicato: Q" + question.getNumber());
            }
            byLabel.putIfAbsent(question.getLabel(), question);
        }
    }

    public String getName() {
        return name;
    }

    public List<Question> getQuestions() {
        return questions;
    }

    public int size() {
        return questions.size();
    }

    /**
     * @return domanda con il numero indicato, null se assente
     */
    public Question getQuestion(int number) {
        return byNumber.get(number);
    }

    /**
     * @return prima domanda con l'etichetta indicata, null se assente
     */
    public Question findByLabel(String label) {
        return label != null ? byLabel.get(label) : null;
    }
}
