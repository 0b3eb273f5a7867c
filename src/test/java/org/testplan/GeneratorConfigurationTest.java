package org.testplan;

import org.junit.jupiter.api.Test;
import org.testplan.cdcl.CDCLSolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneratorConfigurationTest {

    @Test
    void defaults_shouldUseDocumentedValues() {
        // When
        GeneratorConfiguration configuration = GeneratorConfiguration.defaults();

        // Then
        assertThat(configuration.getSamplingCap()).isEqualTo(500);
        assertThat(configuration.getSeed()).isNull();
        assertThat(configuration.getGatekeeperLimit()).isEqualTo(3);
        assertThat(configuration.getGatekeeperThreshold()).isEqualTo(2);
        assertThat(configuration.getConflictBudget()).isEqualTo(CDCLSolver.DEFAULT_CONFLICT_BUDGET);
    }

    @Test
    void builder_shouldKeepExplicitValues() {
        // When
        GeneratorConfiguration configuration = GeneratorConfiguration.builder()
                .samplingCap(10).seed(42L).conflictBudget(0).build();

        // Then
        assertThat(configuration.getSamplingCap()).isEqualTo(10);
        assertThat(configuration.getSeed()).isEqualTo(42L);
        assertThat(configuration.getConflictBudget()).isZero();
    }

    @Test
    void builder_shouldRejectNonPositiveSamplingCap() {
        assertThatThrownBy(() -> GeneratorConfiguration.builder().samplingCap(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
