package org.testplan.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testplan.model.ComparisonOperator;
import org.testplan.model.Question;
import org.testplan.model.QuestionOption;
import org.testplan.model.Questionnaire;
import org.testplan.model.VisibilityExpression.Kind;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionnaireLoaderTest {

    private final QuestionnaireLoader loader = new QuestionnaireLoader();

    @Test
    void load_shouldNumberItemsAcrossPages() throws URISyntaxException {
        // When
        Questionnaire questionnaire = loader.load(fixture("service_request.json"));

        // Then
        assertThat(questionnaire.getName()).isEqualTo("Service Request");
        assertThat(questionnaire.size()).isEqualTo(10);
        assertThat(questionnaire.getQuestion(1).getLabel()).isEqualTo("ServiceType");
        assertThat(questionnaire.getQuestion(3).getLabel()).isEqualTo("DetailsA");
        assertThat(questionnaire.getQuestion(10).getLabel()).isEqualTo("FlagDetail");
    }

    @Test
    void load_shouldReadOptionsHiddenFlagsAndDefaults() throws URISyntaxException {
        // When
        Questionnaire questionnaire = loader.load(fixture("service_request.json"));

        // Then
        Question serviceType = questionnaire.getQuestion(1);
        assertThat(serviceType.getOptionValues()).containsExactly("A", "B", "C");
        assertThat(serviceType.getOptions().get(0).getDisplay()).isEqualTo("Type A");
        assertThat(serviceType.isRequired()).isTrue();

        Question hiddenMode = questionnaire.findByLabel("HiddenMode");
        assertThat(hiddenMode.isHidden()).isTrue();
        assertThat(hiddenMode.getDefaultAnswer()).isEqualTo("B");
        assertThat(questionnaire.findByLabel("Flag").hasDefaultAnswer()).isFalse();
    }

    @Test
    void load_shouldAcceptTreeAndTextualConditions() throws URISyntaxException {
        // When
        Questionnaire questionnaire = loader.load(fixture("service_request.json"));

        // Then
        assertThat(questionnaire.getQuestion(3).getVisibilityCondition().getExpectedValue()).isEqualTo("A");
        assertThat(questionnaire.getQuestion(4).getVisibilityCondition().getParentLabel()).isEqualTo("ServiceType");
        assertThat(questionnaire.getQuestion(4).getVisibilityCondition().getExpectedValue()).isEqualTo("B");
        assertThat(questionnaire.getQuestion(5).getVisibilityCondition().getOperator())
                .isEqualTo(ComparisonOperator.INCLUDES);
        assertThat(questionnaire.getQuestion(5).getVisibilityCondition().getExpectedValue()).isEqualTo("C");
    }

    @Test
    void parse_shouldApplyDefaults_whenFieldsAreMissing() {
        // Given
        String json = "{\"pages\":[{\"pageItems\":[{}]}]}";

        // When
        Questionnaire questionnaire = loader.parse(json);

        // Then
        Question question = questionnaire.getQuestion(1);
        assertThat(questionnaire.getName()).isEqualTo(QuestionnaireLoader.DEFAULT_NAME);
        assertThat(question.getLabel()).isEqualTo("Unknown");
        assertThat(question.getType()).isEqualTo("Unknown");
        assertThat(question.isHidden()).isFalse();
        assertThat(question.getOptions()).isEmpty();
        assertThat(question.hasVisibilityCondition()).isFalse();
    }

    @Test
    void parse_shouldBuildNestedExpressions() {
        // Given
        String json = "{\"name\":\"N\",\"pages\":[{\"pageItems\":[{\"label\":\"X\",\"visibilityCondition\":"
                + "{\"expression\":{\"operator\":\"OR\","
                + "\"left\":{\"operator\":\"EQUALS\",\"left\":{\"label\":\"A\"},\"right\":{\"value\":\"1\"}},"
                + "\"right\":{\"operator\":\"NOT_EQUALS\",\"left\":{\"label\":\"B\"},\"right\":{}}}}}]}]}";

        // When
        Question question = loader.parse(json).getQuestion(1);

        // Then
        assertThat(question.getVisibilityCondition().getKind()).isEqualTo(Kind.OR);
        assertThat(question.getConditionReferences()).hasSize(2);
        assertThat(question.getConditionReferences().get(1).getExpectedValue()).isNull();
    }

    @Test
    void parse_shouldKeepUnknownOperatorAsUnsupportedLeaf() {
        // Given
        String json = "{\"pages\":[{\"pageItems\":[{\"label\":\"X\",\"visibilityCondition\":"
                + "{\"expression\":{\"operator\":\"GREATER_THAN\",\"left\":{\"label\":\"A\"},\"right\":{\"value\":\"1\"}}}}]}]}";

        // When
        Question question = loader.parse(json).getQuestion(1);

        // Then
        assertThat(question.hasVisibilityCondition()).isTrue();
        assertThat(question.getVisibilityCondition().getKind()).isEqualTo(Kind.UNSUPPORTED);
        assertThat(question.getVisibilityCondition().getRawOperator()).isEqualTo("GREATER_THAN");
        assertThat(question.getConditionReferences()).isEmpty();
    }

    @Test
    void parse_shouldThrow_whenJsonIsMalformed() {
        assertThatThrownBy(() -> loader.parse("{\"pages\": ["))
                .isInstanceOf(QuestionnaireFormatException.class)
                .hasMessageContaining("JSON malformato");
    }

    @Test
    void parse_shouldThrow_whenTextualConditionIsInvalid() {
        // Given
        String json = "{\"pages\":[{\"pageItems\":[{\"label\":\"X\",\"visibilityCondition\":\"A == (\"}]}]}";

        // Then
        assertThatThrownBy(() -> loader.parse(json))
                .isInstanceOf(QuestionnaireFormatException.class)
                .hasCauseInstanceOf(ConditionSyntaxException.class);
    }

    @Test
    void parse_shouldKeepFirstOption_whenOptionValuesRepeat() {
        // Given
        String json = "{\"pages\":[{\"pageItems\":[{\"label\":\"X\",\"options\":"
                + "[{\"dataValue\":\"a\",\"displayValue\":\"First\"},{\"dataValue\":\"b\"},"
                + "{\"dataValue\":\"a\",\"displayValue\":\"Second\"}]}]}]}";

        // When
        Question question = loader.parse(json).getQuestion(1);

        // Then
        assertThat(question.getOptions()).extracting(QuestionOption::getValue).containsExactly("a", "b");
        assertThat(question.getOptions().get(0).getDisplay()).isEqualTo("First");
    }

    @Test
    void load_shouldThrow_whenFileIsMissing(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(QuestionnaireFormatException.class)
                .hasMessageContaining("Impossibile leggere");
    }

    static Path fixture(String name) throws URISyntaxException {
        return Paths.get(QuestionnaireLoaderTest.class.getResource("/forms/" + name).toURI());
    }
}
