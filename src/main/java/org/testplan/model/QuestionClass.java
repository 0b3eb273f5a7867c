package org.testplan.model;

/**
 * Classi in cui viene partizionato l'insieme delle domande.
 */
public enum QuestionClass {

    /** Visibile e referenziata da almeno una condizione: controlla la ramificazione */
    TEST_VARIABLE("TEST_VAR"),

    /** Visibile e mai referenziata: il valore non influenza il flusso */
    DATA_COLLECTION("DATA_COL"),

    /** Campo di backend nascosto */
    HIDDEN("HIDDEN");

    private final String shortCode;

    QuestionClass(String shortCode) {
        this.shortCode = shortCode;
    }

    /**
     * @return codice breve usato nei report CSV (TEST_VAR, DATA_COL, HIDDEN)
     */
    public String getShortCode() {
        return shortCode;
    }
}
