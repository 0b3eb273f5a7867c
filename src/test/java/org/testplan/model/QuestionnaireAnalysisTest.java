package org.testplan.model;

import org.junit.jupiter.api.Test;
import org.testplan.QuestionnaireFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.testplan.QuestionnaireFixtures.eq;
import static org.testplan.QuestionnaireFixtures.form;

class QuestionnaireAnalysisTest {

    @Test
    void classify_shouldAssignEveryQuestionToExactlyOneClass() {
        // Given
        Questionnaire questionnaire = QuestionnaireFixtures.serviceRequest();

        // When
        Classification classification = QuestionnaireAnalysis.classify(questionnaire);

        // Then
        assertThat(classification.getTestVariables()).containsExactly(1);
        assertThat(classification.getHidden()).containsExactly(6, 9);
        assertThat(classification.getDataCollection()).containsExactly(2, 3, 4, 5, 7, 8, 10);
        assertThat(classification.asMap()).hasSize(questionnaire.size());
    }

    @Test
    void classify_shouldKeepHiddenQuestionsHidden_whenTheyAreReferenced() {
        // Given
        Questionnaire questionnaire = form("Hidden parent")
                .hidden("Mode", "B")
                .text("Child", eq("Mode", "B"))
                .build();

        // When
        Classification classification = QuestionnaireAnalysis.classify(questionnaire);

        // Then
        assertThat(classification.classOf(1)).isEqualTo(QuestionClass.HIDDEN);
        assertThat(classification.getTestVariables()).isEmpty();
    }

    @Test
    void visibleOnOpen_shouldSkipHiddenAndConditionalQuestions() {
        // Given
        Questionnaire questionnaire = QuestionnaireFixtures.serviceRequest();

        // When / Then
        assertThat(QuestionnaireAnalysis.visibleOnOpen(questionnaire.getQuestions())).containsExactly(1, 2);
    }

    @Test
    void reverseDependencies_shouldListChildrenInDocumentOrder_includingUnknownLabels() {
        // Given
        Questionnaire questionnaire = form("Dependencies")
                .choice("Gate", null, "Yes", "No")
                .text("First", eq("Gate", "Yes"))
                .text("Second", eq("Gate", "No"))
                .text("Orphan", eq("Missing", "1"))
                .build();

        // When
        Map<String, List<QuestionReference>> reverse = QuestionnaireAnalysis.reverseDependencies(questionnaire.getQuestions());

        // Then
        assertThat(reverse).containsOnlyKeys("Gate", "Missing");
        assertThat(reverse.get("Gate")).extracting(QuestionReference::getChildNumber).containsExactly(2, 3);
        assertThat(reverse.get("Gate").get(1).getExpectedValue()).isEqualTo("No");
    }

    @Test
    void questionsOf_shouldReturnQuestionsOfTheRequestedClass() {
        // Given
        Questionnaire questionnaire = QuestionnaireFixtures.nestedGate();
        Classification classification = QuestionnaireAnalysis.classify(questionnaire);

        // When
        List<Question> testVariables = QuestionnaireAnalysis.questionsOf(questionnaire, classification,
                QuestionClass.TEST_VARIABLE);

        // Then
        assertThat(testVariables).extracting(Question::getLabel).containsExactly("Gate", "Sub");
    }
}
