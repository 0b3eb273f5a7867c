package org.testplan.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testplan.QuestionnaireFixtures;
import org.testplan.TestPlanGenerator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.testplan.QuestionnaireFixtures.form;

class TestPlanReportWriterTest {

    private final TestPlanReportWriter writer = new TestPlanReportWriter();

    @Test
    void render_shouldContainSummaryCasesAndUnreachableSection() {
        // Given
        TestPlan plan = new TestPlanGenerator().generate(QuestionnaireFixtures.serviceRequest());

        // When
        String report = writer.render(plan);

        // Then
        assertThat(report)
                .contains("TEST PLAN - Service Request")
                .contains("Test variables: 1")
                .contains("Total test cases: 3")
                .contains("Coverage: 6/6 (100%)")
                .contains("INSTRUCTIONS FOR TESTERS")
                .contains("Q1: ServiceType")
                .contains("  Options: A, B, C")
                .contains("Test Case 1")
                .contains("  Q1 (ServiceType): A")
                .contains("UNREACHABLE QUESTIONS (Cannot be tested)")
                .contains("Q8: NeverShown")
                .contains("  Visibility condition: HiddenMode == \"A\"")
                .contains("Q10: FlagDetail (DATA COL) (UNREACHABLE)")
                .doesNotContain("UNCOVERED QUESTIONS");
    }

    @Test
    void render_shouldExplainMissingCases_whenPlanIsEmpty() {
        // Given
        TestPlan plan = new TestPlanGenerator().generate(form("Flat").text("Name", null).build());

        // When
        String report = writer.render(plan);

        // Then
        assertThat(report)
                .contains("No test cases generated")
                .contains("Status: " + TestPlanGenerator.NO_TEST_VARIABLES)
                .contains("UNCOVERED QUESTIONS");
    }

    @Test
    void write_shouldUseSafeQuestionnaireName(@TempDir Path tempDir) throws IOException {
        // Given
        TestPlan plan = new TestPlanGenerator().generate(QuestionnaireFixtures.serviceRequest());

        // When
        Path written = writer.write(plan, tempDir.resolve("plans"));

        // Then
        assertThat(written.getFileName().toString()).isEqualTo("Service Request_test_plan.txt");
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo(writer.render(plan));
    }

    @Test
    void safeName_shouldReplaceUnsafeCharacters() {
        assertThat(FileNames.safeName("Form: A/B v1.0")).isEqualTo("Form_ A_B v1_0");
    }
}
