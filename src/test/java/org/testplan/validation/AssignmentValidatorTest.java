package org.testplan.validation;

import org.junit.jupiter.api.Test;
import org.testplan.QuestionnaireFixtures;
import org.testplan.constraint.ConstraintModel;
import org.testplan.constraint.ConstraintModelBuilder;
import org.testplan.model.Questionnaire;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.testplan.QuestionnaireFixtures.form;
import static org.testplan.QuestionnaireFixtures.neq;

class AssignmentValidatorTest {

    private final AssignmentValidator validator = new AssignmentValidator();
    private final ConstraintModel nestedGate = new ConstraintModelBuilder().build(QuestionnaireFixtures.nestedGate());

    @Test
    void validate_shouldReturnVisibleSetAndCompleteAssignment_whenAssignmentIsConsistent() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(1, "Yes", 2, "Yes"), nestedGate);

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getVisibleQuestionNumbers()).containsExactly(1, 2, 3);
        assertThat(outcome.getCompleteAssignment()).containsEntry(1, "Yes").containsEntry(2, "Yes");
        assertThat(outcome.getReason()).isNull();
    }

    @Test
    void validate_shouldHideDependentQuestions_whenGateIsClosed() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(1, "No"), nestedGate);

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getVisibleQuestionNumbers()).containsExactly(1);
        assertThat(outcome.getCompleteAssignment()).containsOnlyKeys(1);
    }

    @Test
    void validate_shouldBeIdempotent_whenRevalidatingCompleteAssignment() {
        // Given
        ValidationOutcome first = validator.validate(Map.of(1, "Yes"), nestedGate);

        // When
        ValidationOutcome second = validator.validate(first.getCompleteAssignment(), nestedGate);

        // Then
        assertThat(second.isOk()).isTrue();
        assertThat(second.getVisibleQuestionNumbers()).isEqualTo(first.getVisibleQuestionNumbers());
        assertThat(second.getCompleteAssignment()).isEqualTo(first.getCompleteAssignment());
    }

    @Test
    void validate_shouldFailWithUnsatReason_whenAnswerIsGivenToHiddenBranch() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(1, "No", 2, "Yes"), nestedGate);

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.getReason()).isEqualTo(ValidationOutcome.UNSAT_REASON);
    }

    @Test
    void validate_shouldFailWithoutSolving_whenValueIsNotAnOption() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(1, "Maybe"), nestedGate);

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.getReason()).isEqualTo("Value 'Maybe' not valid for Q1");
    }

    @Test
    void validate_shouldFail_whenQuestionIsNotTestVariable() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(3, "text"), nestedGate);

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.getReason()).isEqualTo("Question Q3 is not a test variable");
    }

    @Test
    void validate_shouldReject_whenDynamicSourceReceivesValue() {
        // Given
        Questionnaire questionnaire = form("Dynamic")
                .text("Lookup", null)
                .text("Shown", neq("Lookup", null))
                .build();
        ConstraintModel model = new ConstraintModelBuilder().build(questionnaire);

        // When
        ValidationOutcome outcome = validator.validate(Map.of(1, "anything"), model);

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.getReason()).contains("anything").contains("Q1");
    }

    @Test
    void validate_shouldAcceptEmptyAssignment() {
        // When
        ValidationOutcome outcome = validator.validate(Map.of(), nestedGate);

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getVisibleQuestionNumbers()).contains(1);
    }
}
