package org.testplan.loader;

/**
 * Documento del questionario illeggibile o malformato.
 */
public class QuestionnaireFormatException extends RuntimeException {

    public QuestionnaireFormatException(String message) {
        super(message);
    }

    public QuestionnaireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
