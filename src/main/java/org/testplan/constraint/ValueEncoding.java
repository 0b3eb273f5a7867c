package org.testplan.constraint;

import org.testplan.model.Question;
import org.testplan.model.QuestionOption;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CODIFICA DEI VALORI - Mappa iniettiva valore opzione -> codice intero positivo
 *
 * I codici sono assegnati 1..k nell'ordine delle opzioni; il codice 0 è riservato e significa
 * "non impostata / domanda non visibile". Una variabile senza opzioni statiche è a
 * sorgente dinamica: la codifica è vuota e la variabile resta fuori dai vincoli di dominio
 * e di collegamento.
 */
public final class ValueEncoding {

    /** Codice riservato per "nessun valore" */
    public static final int UNSET = 0;

    private final int questionNumber;
    private final Map<String, Integer> codes;
    private final List<String> values;

    public ValueEncoding(int questionNumber, List<String> optionValues) {
        this.questionNumber = questionNumber;
        Map<String, Integer> mapping = new LinkedHashMap<>();
        List<String> ordered = new ArrayList<>();
        ordered.add(null); // posizione del codice riservato

        for (String value : optionValues) {
            if (value == null) {
                throw new IllegalArgumentException("Valore di opzione null per Q" + questionNumber);
            }
            if (mapping.putIfAbsent(value, ordered.size()) != null) {
                throw new IllegalArgumentException("Valore duplicato '" + value + "' per Q" + questionNumber);
            }
            ordered.add(value);
        }

        this.codes = Collections.unmodifiableMap(mapping);
        this.values = Collections.unmodifiableList(ordered);
    }

    public static ValueEncoding of(Question question) {
        List<String> optionValues = new ArrayList<>();
        for (QuestionOption option : question.getOptions()) {
            optionValues.add(option.getValue());
        }
        return new ValueEncoding(question.getNumber(), optionValues);
    }

    public int getQuestionNumber() {
        return questionNumber;
    }

    /**
     * @return codice del valore, null se il valore non è un'opzione
     */
    public Integer encode(String value) {
        return value != null ? codes.get(value) : null;
    }

    /**
     * @return valore del codice, null per il codice riservato
     * @throws IllegalArgumentException per codici fuori dominio
     */
    public String decode(int code) {
        if (code < 0 || code >= values.size()) {
            throw new IllegalArgumentException("Codice " + code + " fuori dominio per Q" + questionNumber);
        }
        return values.get(code);
    }

    /**
     * @return numero di codici reali (k)
     */
    public int size() {
        return codes.size();
    }

    public boolean isDynamicSource() {
        return codes.isEmpty();
    }

    /**
     * @return valori reali in ordine di codice
     */
    public List<String> getValues() {
        return values.subList(1, values.size());
    }

    public Map<String, Integer> asMap() {
        return codes;
    }

    @Override
    public String toString() {
        return "Q" + questionNumber + codes;
    }
}
