package org.testplan.output;

/**
 * Nomi dei file di uscita derivati dal nome del questionario.
 */
public final class FileNames {

    private FileNames() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Sostituisce con '_' ogni carattere diverso da lettere, cifre, spazio, '-' e '_'.
     */
    public static String safeName(String questionnaireName) {
        StringBuilder safe = new StringBuilder(questionnaireName.length());
        for (char c : questionnaireName.toCharArray()) {
            safe.append(Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_' ? c : '_');
        }
        return safe.toString();
    }
}
