package org.testplan.model;

import java.util.Objects;

/**
 * Opzione statica di una domanda: valore registrato e testo mostrato all'utente.
 */
public final class QuestionOption {

    /** Valore registrato come risposta (chiave della codifica intera) */
    private final String value;

    /** Testo mostrato nel questionario */
    private final String display;

    public QuestionOption(String value, String display) {
        if (value == null) {
            throw new IllegalArgumentException("Il valore di un'opzione non può essere null");
        }
        this.value = value;
        this.display = display != null ? display : value;
    }

    public String getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        QuestionOption other = (QuestionOption) obj;
        return value.equals(other.value) && display.equals(other.display);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, display);
    }

    @Override
    public String toString() {
        return value.equals(display) ? value : value + " (" + display + ")";
    }
}
