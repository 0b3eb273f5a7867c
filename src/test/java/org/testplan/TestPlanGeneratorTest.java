package org.testplan;

import org.junit.jupiter.api.Test;
import org.testplan.cover.TestCase;
import org.testplan.loader.QuestionnaireLoader;
import org.testplan.model.Questionnaire;
import org.testplan.output.TestPlan;

import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.testplan.QuestionnaireFixtures.eq;
import static org.testplan.QuestionnaireFixtures.form;

class TestPlanGeneratorTest {

    private final TestPlanGenerator generator = new TestPlanGenerator();

    @Test
    void generate_shouldProduceOneCasePerServiceType_andExcludeUnreachableQuestions() {
        // When
        TestPlan plan = generator.generate(QuestionnaireFixtures.serviceRequest());

        // Then
        assertThat(plan.getTestCases()).hasSize(3);
        assertThat(plan.getTestCases()).extracting(testCase -> testCase.getCompleteAssignment().get(1))
                .containsExactlyInAnyOrder("A", "B", "C");
        assertThat(plan.getUnreachable()).containsExactly(8, 10);
        assertThat(plan.getUncovered()).isEmpty();
        assertThat(plan.getCoverageTarget()).containsExactly(1, 2, 3, 4, 5, 7);
        for (TestCase testCase : plan.getTestCases()) {
            assertThat(testCase.getVisibleQuestionNumbers()).contains(1, 2, 7).doesNotContain(8, 10);
        }
        assertThat(plan.getStatusMessage()).isNull();
    }

    @Test
    void generate_shouldMatchInMemoryFixture_whenLoadedFromJson() throws URISyntaxException {
        // Given
        Questionnaire questionnaire = new QuestionnaireLoader()
                .load(Paths.get(getClass().getResource("/forms/service_request.json").toURI()));

        // When
        TestPlan plan = generator.generate(questionnaire);

        // Then
        assertThat(plan.getQuestionnaireName()).isEqualTo("Service Request");
        assertThat(plan.getTestCases()).hasSize(3);
        assertThat(plan.getUnreachable()).containsExactly(8, 10);
        assertThat(plan.getCovered()).containsExactly(1, 2, 3, 4, 5, 7);
    }

    @Test
    void generate_shouldCoverEveryReachableQuestion_withNestedGates() {
        // When
        TestPlan plan = generator.generate(QuestionnaireFixtures.nestedGate());

        // Then
        Set<Integer> covered = new HashSet<>();
        plan.getTestCases().forEach(testCase -> covered.addAll(testCase.getVisibleQuestionNumbers()));
        assertThat(covered).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(plan.getTestCases()).hasSize(1);
    }

    @Test
    void generate_shouldReturnEmptyPlan_whenThereAreNoTestVariables() {
        // Given
        Questionnaire questionnaire = form("Flat").text("Name", null).text("Email", null).build();

        // When
        TestPlan plan = generator.generate(questionnaire);

        // Then
        assertThat(plan.hasTestCases()).isFalse();
        assertThat(plan.getStatusMessage()).isEqualTo(TestPlanGenerator.NO_TEST_VARIABLES);
        assertThat(plan.getUncovered()).containsExactly(1, 2);
    }

    @Test
    void generate_shouldReportUnreachableChild_ofHiddenParentWithoutDefault() {
        // Given
        Questionnaire questionnaire = form("Hidden flag")
                .choice("Gate", null, "Yes", "No")
                .text("Detail", eq("Gate", "Yes"))
                .hidden("Flag", null)
                .text("FlagDetail", eq("Flag", "X"))
                .build();

        // When
        TestPlan plan = generator.generate(questionnaire);

        // Then
        assertThat(plan.getUnreachable()).containsExactly(4);
        assertThat(plan.getUnreachableConditions().get(4).toString()).isEqualTo("Flag == \"X\"");
        assertThat(plan.getCoverageTarget()).doesNotContain(4);
        assertThat(plan.getUncovered()).isEmpty();
    }

    @Test
    void generate_shouldReturnEmptyPlan_whenOnlyDynamicSourcesBranch() {
        // Given
        Questionnaire questionnaire = form("Dynamic")
                .text("Lookup", null)
                .text("Shown", QuestionnaireFixtures.neq("Lookup", null))
                .build();

        // When
        TestPlan plan = generator.generate(questionnaire);

        // Then
        assertThat(plan.hasTestCases()).isFalse();
        assertThat(plan.getStatusMessage()).isEqualTo(TestPlanGenerator.NO_VALID_ASSIGNMENTS);
    }
}
