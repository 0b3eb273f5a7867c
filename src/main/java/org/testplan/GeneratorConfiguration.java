package org.testplan;

import org.testplan.cdcl.CDCLSolver;

/**
 * Configurazione validata del generatore.
 *
 * Contiene tutti i parametri della ricerca in forma immutabile; i valori non impostati nel
 * builder restano ai default.
 */
public final class GeneratorConfiguration {

    public static final int DEFAULT_SAMPLING_CAP = 500;
    public static final int DEFAULT_GATEKEEPER_LIMIT = 3;
    public static final int DEFAULT_GATEKEEPER_THRESHOLD = 2;

    private final int samplingCap;
    private final Long seed;
    private final int gatekeeperLimit;
    private final int gatekeeperThreshold;
    private final int conflictBudget;

    private GeneratorConfiguration(Builder builder) {
        this.samplingCap = builder.samplingCap;
        this.seed = builder.seed;
        this.gatekeeperLimit = builder.gatekeeperLimit;
        this.gatekeeperThreshold = builder.gatekeeperThreshold;
        this.conflictBudget = builder.conflictBudget;
    }

    public static GeneratorConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return numero massimo di combinazioni del campionamento di ripiego
     */
    public int getSamplingCap() {
        return samplingCap;
    }

    /**
     * @return seme del campionamento, null per un campionamento non riproducibile
     */
    public Long getSeed() {
        return seed;
    }

    public int getGatekeeperLimit() {
        return gatekeeperLimit;
    }

    /**
     * @return dimensione minima dell'insieme controllato per essere un gatekeeper
     */
    public int getGatekeeperThreshold() {
        return gatekeeperThreshold;
    }

    public int getConflictBudget() {
        return conflictBudget;
    }

    @Override
    public String toString() {
        return String.format("GeneratorConfiguration{cap=%d, seed=%s, gatekeepers=%d (>= %d), conflicts=%d}",
                samplingCap, seed, gatekeeperLimit, gatekeeperThreshold, conflictBudget);
    }

    public static final class Builder {
        private int samplingCap = DEFAULT_SAMPLING_CAP;
        private Long seed = null;
        private int gatekeeperLimit = DEFAULT_GATEKEEPER_LIMIT;
        private int gatekeeperThreshold = DEFAULT_GATEKEEPER_THRESHOLD;
        private int conflictBudget = CDCLSolver.DEFAULT_CONFLICT_BUDGET;

        private Builder() {
        }

        public Builder samplingCap(int samplingCap) {
            if (samplingCap < 1) {
                throw new IllegalArgumentException("Il limite di campionamento deve essere ≥ 1: " + samplingCap);
            }
            this.samplingCap = samplingCap;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder gatekeeperLimit(int gatekeeperLimit) {
            if (gatekeeperLimit < 0) {
                throw new IllegalArgumentException("Numero di gatekeeper negativo: " + gatekeeperLimit);
            }
            this.gatekeeperLimit = gatekeeperLimit;
            return this;
        }

        public Builder gatekeeperThreshold(int gatekeeperThreshold) {
            if (gatekeeperThreshold < 1) {
                throw new IllegalArgumentException("Soglia gatekeeper deve essere ≥ 1: " + gatekeeperThreshold);
            }
            this.gatekeeperThreshold = gatekeeperThreshold;
            return this;
        }

        public Builder conflictBudget(int conflictBudget) {
            if (conflictBudget < 0) {
                throw new IllegalArgumentException("Budget di conflitti negativo: " + conflictBudget);
            }
            this.conflictBudget = conflictBudget;
            return this;
        }

        public GeneratorConfiguration build() {
            return new GeneratorConfiguration(this);
        }
    }
}
