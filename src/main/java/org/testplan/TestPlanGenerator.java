package org.testplan;

import org.testplan.constraint.ConstraintModel;
import org.testplan.constraint.ConstraintModelBuilder;
import org.testplan.cover.CoverResult;
import org.testplan.cover.GreedyCoverSelector;
import org.testplan.enumeration.BranchAwareEnumerator;
import org.testplan.enumeration.EnumerationResult;
import org.testplan.model.Classification;
import org.testplan.model.QuestionnaireAnalysis;
import org.testplan.model.Questionnaire;
import org.testplan.output.TestPlan;

import java.util.List;
import java.util.logging.Logger;

/**
 * GENERATORE DEL PIANO DI TEST - Pipeline completa
 *
 * Questionario -> classificazione -> modello dei vincoli -> enumerazione in tre fasi ->
 * copertura greedy -> {@link TestPlan}.
 *
 * I questionari degeneri non producono eccezioni: il piano restituito non ha casi e porta un
 * messaggio di stato.
 */
public class TestPlanGenerator {

    private static final Logger LOGGER = Logger.getLogger(TestPlanGenerator.class.getName());

    public static final String NO_TEST_VARIABLES = "No test variables: the form has no branching questions";
    public static final String NO_VALID_ASSIGNMENTS = "No valid test variable assignments found";

    private final GeneratorConfiguration configuration;
    private final ConstraintModelBuilder modelBuilder;
    private final GreedyCoverSelector coverSelector;

    public TestPlanGenerator() {
        this(GeneratorConfiguration.defaults());
    }

    public TestPlanGenerator(GeneratorConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione null");
        }
        this.configuration = configuration;
        this.modelBuilder = new ConstraintModelBuilder();
        this.coverSelector = new GreedyCoverSelector();
    }

    public TestPlan generate(Questionnaire questionnaire) {
        if (questionnaire == null) {
            throw new IllegalArgumentException("Questionario null");
        }
        LOGGER.info(String.format("Generazione piano per '%s' (%d domande) con %s",
                questionnaire.getName(), questionnaire.size(), configuration));

        Classification classification = QuestionnaireAnalysis.classify(questionnaire);
        ConstraintModel model = modelBuilder.build(questionnaire, classification);

        if (classification.getTestVariables().isEmpty()) {
            LOGGER.info(NO_TEST_VARIABLES);
            return emptyPlan(model, NO_TEST_VARIABLES);
        }

        EnumerationResult enumeration = new BranchAwareEnumerator(configuration).enumerate(model);
        if (enumeration.isEmpty()) {
            LOGGER.info(NO_VALID_ASSIGNMENTS);
            return emptyPlan(model, NO_VALID_ASSIGNMENTS);
        }

        CoverResult cover = coverSelector.select(enumeration.getCandidates(), enumeration.getCoverageTarget());
        TestPlan plan = new TestPlan(questionnaire, classification, model.getEncodings(), cover.getTestCases(),
                model.getUnreachable(), model.getUnreachableConditions(), enumeration.getCoverageTarget(),
                cover.getUncovered(), enumeration.getCandidates().size(), null);

        LOGGER.info("Piano generato: " + plan);
        return plan;
    }

    private TestPlan emptyPlan(ConstraintModel model, String statusMessage) {
        return new TestPlan(model.getQuestionnaire(), model.getClassification(), model.getEncodings(), List.of(),
                model.getUnreachable(), model.getUnreachableConditions(), model.getCoverageTarget(),
                model.getCoverageTarget(), 0, statusMessage);
    }

    public GeneratorConfiguration getConfiguration() {
        return configuration;
    }
}
