package org.testplan.output;

import org.testplan.model.Classification;
import org.testplan.model.ComparisonOperator;
import org.testplan.model.ConditionReference;
import org.testplan.model.Question;
import org.testplan.model.QuestionReference;
import org.testplan.model.Questionnaire;
import org.testplan.model.QuestionnaireAnalysis;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * INDICE DELLA STRUTTURA DEL QUESTIONARIO - Due CSV sulle relazioni di visibilità
 *
 * • {@code <nome>_gating_relationships.csv}: una riga per ogni coppia padre -> figlia
 * • {@code <nome>_question_index.csv}: una riga per ogni domanda non nascosta
 *
 * Usa la stessa analisi (dipendenze inverse e classificazione) del generatore; ogni riga porta
 * il nome del questionario per l'aggregazione a valle.
 */
public class FormStructureIndexWriter {

    private static final Logger LOGGER = Logger.getLogger(FormStructureIndexWriter.class.getName());

    public static final String GATING_SUFFIX = "_gating_relationships.csv";
    public static final String INDEX_SUFFIX = "_question_index.csv";

    private static final List<String> GATING_HEADER = List.of("Questionnaire_Name", "Parent_Question_Number",
            "Parent_Question_Label", "Parent_Is_Test_Variable", "Child_Question_Number", "Child_Question_Label",
            "Operator", "Expected_Value");

    private static final List<String> INDEX_HEADER = List.of("Questionnaire_Name", "Question_Number",
            "Question_Label", "Type", "Classification", "Gated_By_Count", "Gated_By_Questions", "Gates_Count",
            "Gates_Questions");

    /**
     * Scrive entrambi gli indici.
     *
     * @return percorsi dei file scritti (relazioni, indice)
     * @throws IOException se la directory o i file non sono scrivibili
     */
    public List<Path> write(Questionnaire questionnaire, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        String safeName = FileNames.safeName(questionnaire.getName());

        Map<String, List<QuestionReference>> reverse = QuestionnaireAnalysis.reverseDependencies(questionnaire.getQuestions());
        Classification classification = QuestionnaireAnalysis.classify(questionnaire.getQuestions(), reverse);

        Path gatingFile = outputDir.resolve(safeName + GATING_SUFFIX);
        writeCsv(gatingFile, GATING_HEADER, gatingRows(questionnaire, reverse, classification));

        Path indexFile = outputDir.resolve(safeName + INDEX_SUFFIX);
        writeCsv(indexFile, INDEX_HEADER, indexRows(questionnaire, reverse, classification));

        LOGGER.fine("Indici scritti: " + gatingFile + ", " + indexFile);
        return List.of(gatingFile, indexFile);
    }

    //region RIGHE

    List<List<String>> gatingRows(Questionnaire questionnaire, Map<String, List<QuestionReference>> reverse,
                                  Classification classification) {
        List<String> parentLabels = new ArrayList<>(reverse.keySet());
        parentLabels.sort(Comparator.comparingInt(label -> parentNumber(questionnaire, label)));

        List<List<String>> rows = new ArrayList<>();
        for (String parentLabel : parentLabels) {
            Question parent = questionnaire.findByLabel(parentLabel);
            List<QuestionReference> children = new ArrayList<>(reverse.get(parentLabel));
            children.sort(Comparator.comparingInt(QuestionReference::getChildNumber));

            for (QuestionReference child : children) {
                rows.add(List.of(
                        questionnaire.getName(),
                        parent != null ? "Q" + parent.getNumber() : "Q?",
                        parentLabel,
                        parent != null && classification.isTestVariable(parent.getNumber()) ? "Yes" : "No",
                        "Q" + child.getChildNumber(),
                        child.getChildLabel(),
                        displayOperator(child.getOperator()),
                        child.getExpectedValue() != null ? child.getExpectedValue() : ""));
            }
        }
        return rows;
    }

    List<List<String>> indexRows(Questionnaire questionnaire, Map<String, List<QuestionReference>> reverse,
                                 Classification classification) {
        List<List<String>> rows = new ArrayList<>();
        for (Question question : questionnaire.getQuestions()) {
            if (question.isHidden()) continue;

            SortedSet<String> gatedBy = new TreeSet<>();
            for (ConditionReference reference : question.getConditionReferences()) {
                Question parent = questionnaire.findByLabel(reference.getParentLabel());
                gatedBy.add(parent != null ? "Q" + parent.getNumber() : "Q?");
            }

            SortedSet<String> gates = new TreeSet<>();
            for (QuestionReference child : reverse.getOrDefault(question.getLabel(), List.of())) {
                gates.add("Q" + child.getChildNumber());
            }

            rows.add(List.of(
                    questionnaire.getName(),
                    "Q" + question.getNumber(),
                    question.getLabel(),
                    question.getType(),
                    classification.classOf(question.getNumber()).getShortCode(),
                    String.valueOf(gatedBy.size()),
                    String.join(", ", gatedBy),
                    String.valueOf(gates.size()),
                    String.join(", ", gates)));
        }
        return rows;
    }

    private static int parentNumber(Questionnaire questionnaire, String label) {
        Question parent = questionnaire.findByLabel(label);
        return parent != null ? parent.getNumber() : Integer.MAX_VALUE;
    }

    static String displayOperator(ComparisonOperator operator) {
        return switch (operator) {
            case EQUALS -> "==";
            case NOT_EQUALS -> "!=";
            case CONTAINS -> "contains";
            case NOT_CONTAINS -> "does not contain";
            case INCLUDES -> "includes";
        };
    }

    //endregion

    //region CSV

    private static void writeCsv(Path file, List<String> header, List<List<String>> rows) throws IOException {
        try (FileWriter writer = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            writer.write(csvLine(header));
            for (List<String> row : rows) {
                writer.write(csvLine(row));
            }
        }
    }

    /**
     * Riga CSV terminata da CRLF; i campi con virgole, virgolette o a capo sono racchiusi tra
     * virgolette e le virgolette interne raddoppiate.
     */
    static String csvLine(List<String> fields) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) line.append(',');
            String field = fields.get(i);
            if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
                line.append('"').append(field.replace("\"", "\"\"")).append('"');
            } else {
                line.append(field);
            }
        }
        return line.append("\r\n").toString();
    }

    //endregion
}
