package org.testplan.output;

import org.testplan.constraint.ValueEncoding;
import org.testplan.cover.TestCase;
import org.testplan.model.Classification;
import org.testplan.model.Question;
import org.testplan.model.VisibilityExpression;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * RENDERER DEL PIANO DI TEST - Report testuale per i tester
 *
 * SEZIONI:
 * • SUMMARY: variabili, casi, domande raggiungibili e irraggiungibili, statistiche, copertura
 * • INSTRUCTIONS FOR TESTERS
 * • TEST VARIABLES con le opzioni
 * • TEST CASES: valori delle variabili visibili e domande di raccolta dati visibili
 * • COMPLETE QUESTION REFERENCE
 * • UNREACHABLE QUESTIONS e UNCOVERED QUESTIONS, se presenti
 */
public class TestPlanReportWriter {

    private static final Logger LOGGER = Logger.getLogger(TestPlanReportWriter.class.getName());

    public static final String FILE_SUFFIX = "_test_plan.txt";

    private static final String HEAVY_RULE = "=".repeat(100);
    private static final String LIGHT_RULE = "-".repeat(100);

    /**
     * Scrive il report in {@code <outputDir>/<nome sicuro>_test_plan.txt}.
     *
     * @return percorso del file scritto
     * @throws IOException se la directory o il file non sono scrivibili
     */
    public Path write(TestPlan plan, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path outputFile = outputDir.resolve(FileNames.safeName(plan.getQuestionnaireName()) + FILE_SUFFIX);

        try (FileWriter writer = new FileWriter(outputFile.toFile(), StandardCharsets.UTF_8)) {
            writer.write(render(plan));
        }

        LOGGER.fine("Report scritto: " + outputFile);
        return outputFile;
    }

    public String render(TestPlan plan) {
        StringBuilder out = new StringBuilder();
        Classification classification = plan.getClassification();

        section(out, "TEST PLAN - " + plan.getQuestionnaireName());
        renderSummary(out, plan);

        section(out, "INSTRUCTIONS FOR TESTERS");
        out.append("TEST VARIABLES (vary these to cover all paths):\n")
                .append("  These questions control form flow. Their answers determine which other questions appear.\n")
                .append("  Follow the assignments in each test case exactly.\n\n")
                .append("DATA COLLECTION QUESTIONS (enter any valid value):\n")
                .append("  These questions do NOT affect form flow. Their specific values don't matter for testing.\n")
                .append("  Required fields must be filled in, optional fields can be skipped.\n\n");

        section(out, "TEST VARIABLES");
        for (int number : classification.getTestVariables()) {
            Question question = plan.getQuestionnaire().getQuestion(number);
            out.append("Q").append(number).append(": ").append(question.getLabel()).append('\n');
            ValueEncoding encoding = plan.getEncodings().get(number);
            if (encoding != null && !encoding.isDynamicSource()) {
                out.append("  Options: ").append(String.join(", ", encoding.getValues())).append('\n');
            } else {
                out.append("  Options: (dynamic source, not test-decidable)\n");
            }
        }
        out.append('\n');

        section(out, "TEST CASES");
        for (TestCase testCase : plan.getTestCases()) {
            renderTestCase(out, plan, testCase);
        }

        section(out, "COMPLETE QUESTION REFERENCE");
        out.append("All questions in this questionnaire (for tester reference):\n\n");
        for (Question question : plan.getQuestions()) {
            if (question.isHidden()) continue;
            out.append("Q").append(question.getNumber()).append(": ").append(question.getLabel())
                    .append(" (").append(classification.isTestVariable(question.getNumber()) ? "TEST VAR" : "DATA COL")
                    .append(')')
                    .append(plan.getUnreachable().contains(question.getNumber()) ? " (UNREACHABLE)" : "")
                    .append('\n');
        }
        out.append('\n');

        if (!plan.getUnreachable().isEmpty()) {
            section(out, "UNREACHABLE QUESTIONS (Cannot be tested)");
            out.append("These questions have visibility conditions that are always False.\n")
                    .append("They cannot be displayed to users and are excluded from test coverage.\n\n");
            for (Map.Entry<Integer, VisibilityExpression> entry : plan.getUnreachableConditions().entrySet()) {
                Question question = plan.getQuestionnaire().getQuestion(entry.getKey());
                out.append("Q").append(entry.getKey()).append(": ").append(question.getLabel()).append('\n')
                        .append("  Visibility condition: ").append(entry.getValue()).append("\n\n");
            }
        }

        if (!plan.getUncovered().isEmpty()) {
            section(out, "UNCOVERED QUESTIONS");
            out.append("No valid combination of answers found for these reachable questions:\n\n");
            for (int number : plan.getUncovered()) {
                out.append("Q").append(number).append(": ")
                        .append(plan.getQuestionnaire().getQuestion(number).getLabel()).append('\n');
            }
            out.append('\n');
        }

        return out.toString();
    }

    //region SEZIONI

    private void renderSummary(StringBuilder out, TestPlan plan) {
        out.append("SUMMARY\n").append(LIGHT_RULE).append('\n');
        out.append("Test variables: ").append(plan.getClassification().getTestVariables().size()).append('\n');
        out.append("Total test cases: ").append(plan.getTestCases().size()).append('\n');
        out.append("Reachable questions: ").append(plan.getCoverageTarget().size()).append('\n');
        if (!plan.getUnreachable().isEmpty()) {
            out.append("Unreachable questions (excluded from coverage): ").append(plan.getUnreachable().size()).append('\n');
        }

        if (plan.hasTestCases()) {
            IntSummaryStatistics counts = plan.getTestCases().stream()
                    .mapToInt(TestCase::getQuestionCount)
                    .summaryStatistics();
            int target = plan.getCoverageTarget().size();
            int covered = plan.getCovered().size();

            out.append("Min questions per case: ").append(counts.getMin()).append('\n');
            out.append("Max questions per case: ").append(counts.getMax()).append('\n');
            out.append(String.format("Avg questions per case: %.1f%n", counts.getAverage()));
            out.append(String.format("Coverage: %d/%d (%.0f%%)%n", covered, target,
                    target > 0 ? covered * 100.0 / target : 100.0));
        } else {
            out.append("No test cases generated\n");
        }
        if (plan.getStatusMessage() != null) {
            out.append("Status: ").append(plan.getStatusMessage()).append('\n');
        }
        out.append('\n');
    }

    private void renderTestCase(StringBuilder out, TestPlan plan, TestCase testCase) {
        Classification classification = plan.getClassification();
        out.append("Test Case ").append(testCase.getSequenceNumber()).append('\n').append(LIGHT_RULE).append('\n');
        out.append("TEST VARIABLE ASSIGNMENTS (required - follow exactly):\n");

        List<String> dataCollection = new ArrayList<>();
        for (int number : testCase.getVisibleQuestionNumbers()) {
            if (!classification.isTestVariable(number)) {
                dataCollection.add("Q" + number);
                continue;
            }
            String value = testCase.getCompleteAssignment().get(number);
            if (value == null) {
                value = testCase.getAssignment().getOrDefault(number, "[any value]");
            }
            out.append("  Q").append(number).append(" (")
                    .append(plan.getQuestionnaire().getQuestion(number).getLabel()).append("): ")
                    .append(value).append('\n');
        }

        out.append("\nVisible questions (").append(testCase.getQuestionCount()).append("):\n");
        if (!dataCollection.isEmpty()) {
            out.append("  DATA COLLECTION (enter any valid value): ").append(String.join(", ", dataCollection)).append('\n');
        }
        out.append('\n');
    }

    private static void section(StringBuilder out, String title) {
        out.append(HEAVY_RULE).append('\n').append(title).append('\n').append(HEAVY_RULE).append("\n\n");
    }

    //endregion
}
