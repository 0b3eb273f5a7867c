package org.testplan.validation;

import org.testplan.cdcl.CDCLSolver;
import org.testplan.cdcl.SATResult;
import org.testplan.constraint.ConstraintModel;
import org.testplan.constraint.SolvingContext;
import org.testplan.constraint.ValueEncoding;

import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * VALIDATORE DI ASSEGNAMENTI - Verifica senza stato di un assegnamento parziale
 *
 * Ogni voce deve riferire una variabile di test con codifica e un valore tra le sue opzioni;
 * altrimenti il fallimento è immediato e nessun solver viene invocato. Le voci valide
 * diventano vincoli di uguaglianza in un contesto di risoluzione nuovo.
 */
public class AssignmentValidator {

    private static final Logger LOGGER = Logger.getLogger(AssignmentValidator.class.getName());

    private final int conflictBudget;

    public AssignmentValidator() {
        this(CDCLSolver.DEFAULT_CONFLICT_BUDGET);
    }

    public AssignmentValidator(int conflictBudget) {
        if (conflictBudget < 0) {
            throw new IllegalArgumentException("Budget di conflitti negativo: " + conflictBudget);
        }
        this.conflictBudget = conflictBudget;
    }

    /**
     * @param assignment numero variabile di test -> valore scelto
     * @param model modello dei vincoli
     * @return esito con insieme visibile e assegnamento completo, oppure con il motivo del rifiuto
     */
    public ValidationOutcome validate(Map<Integer, String> assignment, ConstraintModel model) {
        if (assignment == null || model == null) {
            throw new IllegalArgumentException("Assegnamento e modello sono obbligatori");
        }

        SolvingContext context = model.newContext(conflictBudget);
        for (Map.Entry<Integer, String> entry : new TreeMap<>(assignment).entrySet()) {
            int number = entry.getKey();
            ValueEncoding encoding = model.getEncoding(number);
            if (encoding == null) {
                return ValidationOutcome.failure("Question Q" + number + " is not a test variable");
            }

            Integer code = encoding.encode(entry.getValue());
            if (code == null) {
                return ValidationOutcome.failure("Value '" + entry.getValue() + "' not valid for Q" + number);
            }
            context.requireCode(number, code);
        }

        SATResult result = context.check();
        return switch (result.getStatus()) {
            case SATISFIABLE -> ValidationOutcome.success(
                    model.decodeVisible(result), model.decodeCompleteAssignment(result));
            case UNSATISFIABLE -> {
                LOGGER.fine(() -> "Assegnamento contraddittorio: " + assignment);
                yield ValidationOutcome.failure(ValidationOutcome.UNSAT_REASON);
            }
            case UNKNOWN -> {
                LOGGER.fine(() -> "Esito indeterminato per " + assignment + ": " + result.getMessage());
                yield ValidationOutcome.failure("solver outcome indeterminate (" + result.getMessage() + ")");
            }
        };
    }

    public int getConflictBudget() {
        return conflictBudget;
    }
}
