package org.testplan.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testplan.model.ComparisonOperator;
import org.testplan.model.Question;
import org.testplan.model.QuestionOption;
import org.testplan.model.Questionnaire;
import org.testplan.model.VisibilityExpression;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CARICATORE DEL QUESTIONARIO - Documento JSON -> {@link Questionnaire}
 *
 * STRUTTURA ATTESA:
 * <pre>
 * { "name": ..., "pages": [ { "pageItems": [ item, ... ] }, ... ] }
 * </pre>
 * Gli elementi sono numerati da 1 nell'ordine complessivo di pagine e pageItems.
 * La condizione di visibilità può essere un albero {@code {"expression": nodo}} oppure una
 * stringa nella sintassi di {@link VisibilityConditionParser}.
 *
 * Campi mancanti: label e type valgono "Unknown", hidden e required false, nessuna opzione.
 * Un operatore sconosciuto diventa una foglia UNSUPPORTED e non blocca il caricamento.
 * Un valore di opzione ripetuto è ignorato: resta la prima occorrenza.
 */
public class QuestionnaireLoader {

    private static final Logger LOGGER = Logger.getLogger(QuestionnaireLoader.class.getName());

    static final String UNKNOWN = "Unknown";
    static final String DEFAULT_NAME = "questionnaire";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final VisibilityConditionParser conditionParser = new VisibilityConditionParser();

    //region INTERFACCIA PUBBLICA

    /**
     * @throws QuestionnaireFormatException se il file non è leggibile o il contenuto non è valido
     */
    public Questionnaire load(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("Percorso del questionario null");
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new QuestionnaireFormatException("Impossibile leggere il file " + file + ": " + e.getMessage(), e);
        }

        LOGGER.fine("Caricamento questionario da " + file);
        return parse(content);
    }

    /**
     * @param json contenuto del documento
     * @throws QuestionnaireFormatException se il JSON è malformato o una condizione testuale non è valida
     */
    public Questionnaire parse(String json) {
        if (json == null) {
            throw new QuestionnaireFormatException("Documento del questionario null");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QuestionnaireFormatException("JSON malformato: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new QuestionnaireFormatException("Il documento deve essere un oggetto JSON");
        }

        String name = root.hasNonNull("name") ? root.get("name").asText() : DEFAULT_NAME;
        List<Question> questions = new ArrayList<>();

        for (JsonNode page : root.path("pages")) {
            for (JsonNode item : page.path("pageItems")) {
                questions.add(readQuestion(questions.size() + 1, item));
            }
        }

        LOGGER.info("Questionario '" + name + "' caricato: " + questions.size() + " domande");
        return new Questionnaire(name, questions);
    }

    //endregion

    //region ELEMENTI

    private Question readQuestion(int number, JsonNode item) {
        String label = textOrDefault(item, "label", UNKNOWN);
        String type = textOrDefault(item, "type", UNKNOWN);
        boolean hidden = item.path("hidden").asBoolean(false);
        boolean required = item.path("required").asBoolean(false);
        String defaultAnswer = item.hasNonNull("defaultAnswer") ? item.get("defaultAnswer").asText() : null;

        List<QuestionOption> options = new ArrayList<>();
        Set<String> seenValues = new HashSet<>();
        for (JsonNode option : item.path("options")) {
            String value = textOrDefault(option, "dataValue", "");
            if (!seenValues.add(value)) {
                LOGGER.warning(String.format("Q%d (%s): opzione duplicata '%s' ignorata", number, label, value));
                continue;
            }
            options.add(new QuestionOption(value, textOrDefault(option, "displayValue", null)));
        }

        VisibilityExpression condition = readCondition(number, item.get("visibilityCondition"));

        try {
            return new Question(number, label, type, hidden, required, options, condition, defaultAnswer);
        } catch (IllegalArgumentException e) {
            throw new QuestionnaireFormatException("Domanda Q" + number + " non valida: " + e.getMessage(), e);
        }
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    //endregion

    //region CONDIZIONI DI VISIBILITÀ

    /**
     * @return albero della condizione, null se l'elemento non ne ha
     */
    private VisibilityExpression readCondition(int number, JsonNode condition) {
        if (condition == null || condition.isNull()) {
            return null;
        }

        if (condition.isTextual()) {
            try {
                return conditionParser.parse(condition.asText());
            } catch (ConditionSyntaxException e) {
                throw new QuestionnaireFormatException(
                        "Condizione di visibilità non valida per Q" + number + ": " + e.getMessage(), e);
            }
        }

        JsonNode expression = condition.get("expression");
        if (expression == null || expression.isNull()) {
            // Condizione dichiarata ma vuota: la domanda resta condizionata, la traduzione ricadrà su "visibile"
            LOGGER.fine("Q" + number + ": condizione di visibilità senza espressione");
            return VisibilityExpression.unsupported("<missing expression>");
        }
        return readNode(expression);
    }

    private VisibilityExpression readNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }

        String operatorName = node.path("operator").asText(null);
        if ("AND".equals(operatorName)) {
            return VisibilityExpression.and(readNode(node.get("left")), readNode(node.get("right")));
        }
        if ("OR".equals(operatorName)) {
            return VisibilityExpression.or(readNode(node.get("left")), readNode(node.get("right")));
        }

        ComparisonOperator operator = ComparisonOperator.fromName(operatorName);
        if (operator == null) {
            LOGGER.fine("Operatore non supportato: " + operatorName);
            return VisibilityExpression.unsupported(operatorName);
        }

        JsonNode left = node.path("left");
        if (!left.hasNonNull("label") || left.get("label").asText().isEmpty()) {
            return VisibilityExpression.unsupported(operatorName + " senza etichetta");
        }
        return VisibilityExpression.comparison(operator, left.get("label").asText(), expectedValue(node.path("right")));
    }

    /**
     * Valore atteso: right.value, altrimenti il primo elemento di right.values.
     */
    private static String expectedValue(JsonNode right) {
        if (right.hasNonNull("value")) {
            return right.get("value").asText();
        }
        JsonNode values = right.path("values");
        if (values.isArray() && values.size() > 0 && !values.get(0).isNull()) {
            return values.get(0).asText();
        }
        return null;
    }

    //endregion
}
