package org.testplan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * DOMANDA - Entità normalizzata di un elemento del questionario
 *
 * Il numero è assegnato in ordine di documento a partire da 1 ed è stabile; l'etichetta è
 * l'identificatore logico usato nei riferimenti delle condizioni di visibilità.
 *
 * INVARIANTI:
 * • number ≥ 1
 * • valori delle opzioni distinti all'interno della domanda
 * • defaultAnswer rilevante solo per domande nascoste
 */
public final class Question {

    /** Marcatore di sostituzione che identifica un default "template" non ancora risolto */
    public static final String TEMPLATE_MARKER = "${";

    private final int number;
    private final String label;
    private final String type;
    private final boolean hidden;
    private final boolean required;
    private final List<QuestionOption> options;
    private final VisibilityExpression visibilityCondition;
    private final String defaultAnswer;

    /**
     * @param number numero progressivo (≥ 1)
     * @param label etichetta logica (non null)
     * @param type tipo del campo (es. RadioButtons, Dropdown, Text)
     * @param hidden true per campi di backend
     * @param required true se la risposta è obbligatoria
     * @param options opzioni statiche in ordine (null = nessuna)
     * @param visibilityCondition condizione di visibilità (null = sempre visibile)
     * @param defaultAnswer risposta di default (null = nessuna)
     * @throws IllegalArgumentException se numero, etichetta o opzioni non sono validi
     */
    public Question(int number, String label, String type, boolean hidden, boolean required,
                    List<QuestionOption> options, VisibilityExpression visibilityCondition, String defaultAnswer) {
        if (number < 1) {
            throw new IllegalArgumentException("Il numero della domanda deve essere ≥ 1, ricevuto: " + number);
        }
        if (label == null) {
            throw new IllegalArgumentException("Etichetta null per la domanda Q" + number);
        }

        List<QuestionOption> copy = options != null ? new ArrayList<>(options) : new ArrayList<>();
        Set<String> seenValues = new HashSet<>();
        for (QuestionOption option : copy) {
            if (!seenValues.add(option.getValue())) {
                throw new IllegalArgumentException(
                        "Valore di opzione duplicato '" + option.getValue() + "' nella domanda Q" + number);
            }
        }

        this.number = number;
        this.label = label;
        this.type = type != null ? type : "Unknown";
        this.hidden = hidden;
        this.required = required;
        this.options = Collections.unmodifiableList(copy);
        this.visibilityCondition = visibilityCondition;
        this.defaultAnswer = defaultAnswer;
    }

    public int getNumber() {
        return number;
    }

    public String getLabel() {
        return label;
    }

    public String getType() {
        return type;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isRequired() {
        return required;
    }

    public List<QuestionOption> getOptions() {
        return options;
    }

    /**
     * @return valori delle opzioni in ordine di documento
     */
    public List<String> getOptionValues() {
        List<String> values = new ArrayList<>(options.size());
        for (QuestionOption option : options) {
            values.add(option.getValue());
        }
        return values;
    }

    public VisibilityExpression getVisibilityCondition() {
        return visibilityCondition;
    }

    public boolean hasVisibilityCondition() {
        return visibilityCondition != null;
    }

    public String getDefaultAnswer() {
        return defaultAnswer;
    }

    public boolean hasDefaultAnswer() {
        return defaultAnswer != null;
    }

    /**
     * @return true se il default contiene un segnaposto non risolto (es. ${service.name})
     */
    public boolean hasTemplateDefault() {
        return defaultAnswer != null && defaultAnswer.contains(TEMPLATE_MARKER);
    }

    /**
     * @return riferimenti estratti dalla condizione di visibilità (vuota se assente)
     */
    public List<ConditionReference> getConditionReferences() {
        return visibilityCondition != null ? visibilityCondition.references() : Collections.emptyList();
    }

    @Override
    public String toString() {
        return "Q" + number + " (" + label + ", " + type + (hidden ? ", hidden" : "") + ")";
    }
}
