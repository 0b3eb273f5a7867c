package org.testplan.enumeration;

import org.testplan.GeneratorConfiguration;
import org.testplan.cdcl.SATResult;
import org.testplan.constraint.ConstraintModel;
import org.testplan.constraint.IntegerVariable;
import org.testplan.constraint.SolvingContext;
import org.testplan.model.ConditionReference;
import org.testplan.model.Question;
import org.testplan.model.Questionnaire;
import org.testplan.validation.AssignmentValidator;
import org.testplan.validation.ValidationOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * MOTORE DI ENUMERAZIONE CONSAPEVOLE DEI RAMI
 *
 * Trova combinazioni di risposte valide e diverse senza enumerare il prodotto cartesiano di
 * tutte le variabili di test.
 *
 * FASI:
 * 1. Campionamento guidato dai gatekeeper: per ogni gatekeeper si enumera il prodotto dei
 *    valori reali di {gatekeeper} ∪ dipendenze dirette e si validano le combinazioni. Senza
 *    gatekeeper si usa il prodotto di tutte le variabili, campionato oltre il limite.
 * 2. Conteggio della copertura: domande raggiungibili non ancora visibili in alcun candidato.
 * 3. Sintesi guidata dal solver: per ogni domanda scoperta si chiede un modello con
 *    visible(q) = true.
 */
public class BranchAwareEnumerator {

    private static final Logger LOGGER = Logger.getLogger(BranchAwareEnumerator.class.getName());

    private final GeneratorConfiguration configuration;
    private final AssignmentValidator validator;

    public BranchAwareEnumerator(GeneratorConfiguration configuration) {
        this(configuration, new AssignmentValidator(configuration.getConflictBudget()));
    }

    public BranchAwareEnumerator(GeneratorConfiguration configuration, AssignmentValidator validator) {
        if (configuration == null || validator == null) {
            throw new IllegalArgumentException("Configurazione e validatore sono obbligatori");
        }
        this.configuration = configuration;
        this.validator = validator;
    }

    //region ENTRY POINT

    public EnumerationResult enumerate(ConstraintModel model) {
        SortedSet<Integer> coverageTarget = model.getCoverageTarget();
        SortedMap<Integer, List<String>> enumerable = enumerableVariables(model);

        if (enumerable.isEmpty()) {
            LOGGER.info("Nessuna variabile di test con opzioni statiche da enumerare");
            return EnumerationResult.empty(coverageTarget);
        }

        // Fase 1
        List<Integer> gatekeepers = identifyGatekeepers(model, enumerable);
        List<Candidate> phaseOne = gatekeepers.isEmpty()
                ? sampleAllVariables(model, enumerable)
                : enumerateGatekeeperBranches(model, enumerable, gatekeepers);
        LOGGER.info(String.format("Fase 1: %d candidati validi (gatekeeper: %s)", phaseOne.size(), gatekeepers));

        // Fase 2
        SortedSet<Integer> uncovered = new TreeSet<>(coverageTarget);
        phaseOne.forEach(candidate -> uncovered.removeAll(candidate.getVisibleQuestionNumbers()));
        LOGGER.info(String.format("Fase 2: copertura %d/%d, scoperte: %s",
                coverageTarget.size() - uncovered.size(), coverageTarget.size(), uncovered));

        // Fase 3
        List<Candidate> phaseThree = synthesizeForUncovered(model, uncovered);
        phaseThree.forEach(candidate -> uncovered.removeAll(candidate.getVisibleQuestionNumbers()));
        if (!phaseThree.isEmpty() || !uncovered.isEmpty()) {
            LOGGER.info(String.format("Fase 3: %d candidati sintetizzati, ancora scoperte: %s",
                    phaseThree.size(), uncovered));
        }

        return new EnumerationResult(phaseOne, phaseThree, gatekeepers, coverageTarget, uncovered);
    }

    /**
     * Variabili enumerabili: variabili di test non dinamiche e non irraggiungibili, con i loro
     * valori reali in ordine di codice.
     */
    static SortedMap<Integer, List<String>> enumerableVariables(ConstraintModel model) {
        SortedMap<Integer, List<String>> enumerable = new TreeMap<>();
        for (IntegerVariable variable : model.getVariables().values()) {
            int number = variable.getQuestionNumber();
            if (variable.isDynamicSource() || model.isUnreachable(number)) continue;
            enumerable.put(number, variable.getEncoding().getValues());
        }
        return enumerable;
    }

    //endregion

    //region FASE 1 - GATEKEEPER

    /**
     * Insieme controllato di ogni variabile enumerabile: numeri delle domande la cui condizione
     * la referenzia.
     */
    static Map<Integer, SortedSet<Integer>> controlledSets(Questionnaire questionnaire,
                                                           Set<Integer> enumerable) {
        Map<Integer, SortedSet<Integer>> controlled = new LinkedHashMap<>();
        for (Question question : questionnaire.getQuestions()) {
            for (ConditionReference reference : question.getConditionReferences()) {
                for (Question parent : questionnaire.getQuestions()) {
                    if (parent.getLabel().equals(reference.getParentLabel()) && enumerable.contains(parent.getNumber())) {
                        controlled.computeIfAbsent(parent.getNumber(), number -> new TreeSet<>())
                                .add(question.getNumber());
                    }
                }
            }
        }
        return controlled;
    }

    /**
     * Ordina per dimensione dell'insieme controllato (decrescente, parità per numero crescente)
     * e tiene al massimo il limite configurato con dimensione ≥ soglia.
     */
    List<Integer> identifyGatekeepers(ConstraintModel model, SortedMap<Integer, List<String>> enumerable) {
        Map<Integer, SortedSet<Integer>> controlled = controlledSets(model.getQuestionnaire(), enumerable.keySet());

        List<Integer> ranked = new ArrayList<>(controlled.keySet());
        ranked.sort(Comparator.<Integer>comparingInt(number -> controlled.get(number).size()).reversed()
                .thenComparing(Comparator.naturalOrder()));

        List<Integer> gatekeepers = new ArrayList<>();
        for (int number : ranked) {
            if (gatekeepers.size() >= configuration.getGatekeeperLimit()) break;
            if (controlled.get(number).size() >= configuration.getGatekeeperThreshold()) {
                gatekeepers.add(number);
                LOGGER.fine(String.format("Gatekeeper Q%d controlla %d domande", number, controlled.get(number).size()));
            }
        }
        return gatekeepers;
    }

    /**
     * Dipendenze dirette: variabili enumerabili referenziate dalla condizione del gatekeeper.
     */
    static SortedSet<Integer> directDependencies(Questionnaire questionnaire, int gatekeeper,
                                                 Set<Integer> enumerable) {
        SortedSet<Integer> dependencies = new TreeSet<>();
        Question question = questionnaire.getQuestion(gatekeeper);
        for (ConditionReference reference : question.getConditionReferences()) {
            for (Question parent : questionnaire.getQuestions()) {
                if (parent.getLabel().equals(reference.getParentLabel()) && enumerable.contains(parent.getNumber())) {
                    dependencies.add(parent.getNumber());
                }
            }
        }
        dependencies.remove(gatekeeper);
        return dependencies;
    }

    private List<Candidate> enumerateGatekeeperBranches(ConstraintModel model,
                                                        SortedMap<Integer, List<String>> enumerable,
                                                        List<Integer> gatekeepers) {
        List<Candidate> candidates = new ArrayList<>();

        for (int gatekeeper : gatekeepers) {
            SortedSet<Integer> branchVariables =
                    directDependencies(model.getQuestionnaire(), gatekeeper, enumerable.keySet());
            branchVariables.add(gatekeeper);

            List<Integer> numbers = new ArrayList<>(branchVariables);
            List<List<String>> options = new ArrayList<>();
            numbers.forEach(number -> options.add(enumerable.get(number)));

            int before = candidates.size();
            forEachCombination(options, combination ->
                    validateInto(model, toAssignment(numbers, combination), candidates));
            LOGGER.fine(String.format("Gatekeeper Q%d con variabili %s: %d candidati",
                    gatekeeper, numbers, candidates.size() - before));
        }
        return candidates;
    }

    //endregion

    //region FASE 1 - CAMPIONAMENTO DI RIPIEGO

    /**
     * Prodotto di tutte le variabili enumerabili: completo se non supera il limite, altrimenti
     * un campione uniforme di combinazioni distinte di dimensione pari al limite. Il prodotto
     * non viene mai materializzato.
     */
    private List<Candidate> sampleAllVariables(ConstraintModel model, SortedMap<Integer, List<String>> enumerable) {
        List<Integer> numbers = new ArrayList<>(enumerable.keySet());
        List<List<String>> options = new ArrayList<>(enumerable.values());
        int cap = configuration.getSamplingCap();
        List<Candidate> candidates = new ArrayList<>();

        if (productSize(options, cap) <= cap) {
            LOGGER.fine("Nessun gatekeeper: enumerazione completa di " + productSize(options, cap) + " combinazioni");
            forEachCombination(options, combination ->
                    validateInto(model, toAssignment(numbers, combination), candidates));
            return candidates;
        }

        Random random = configuration.getSeed() != null ? new Random(configuration.getSeed()) : new Random();
        Set<List<Integer>> drawn = new HashSet<>();
        LOGGER.fine("Nessun gatekeeper: campionamento di " + cap + " combinazioni");

        while (drawn.size() < cap) {
            List<Integer> indexes = new ArrayList<>(options.size());
            for (List<String> values : options) {
                indexes.add(random.nextInt(values.size()));
            }
            if (!drawn.add(indexes)) continue;

            List<String> combination = new ArrayList<>(indexes.size());
            for (int i = 0; i < indexes.size(); i++) {
                combination.add(options.get(i).get(indexes.get(i)));
            }
            validateInto(model, toAssignment(numbers, combination), candidates);
        }
        return candidates;
    }

    /**
     * @return dimensione del prodotto, saturata a limit + 1
     */
    static long productSize(List<List<String>> options, int limit) {
        long size = 1;
        for (List<String> values : options) {
            size *= values.size();
            if (size > limit) {
                return limit + 1L;
            }
        }
        return size;
    }

    /**
     * Visita il prodotto cartesiano in ordine lessicografico (l'ultima variabile varia più
     * velocemente).
     */
    static void forEachCombination(List<List<String>> options, Consumer<List<String>> visitor) {
        for (List<String> values : options) {
            if (values.isEmpty()) return;
        }

        int[] indexes = new int[options.size()];
        while (true) {
            List<String> combination = new ArrayList<>(options.size());
            for (int i = 0; i < indexes.length; i++) {
                combination.add(options.get(i).get(indexes[i]));
            }
            visitor.accept(combination);

            int position = indexes.length - 1;
            while (position >= 0 && ++indexes[position] == options.get(position).size()) {
                indexes[position] = 0;
                position--;
            }
            if (position < 0) return;
        }
    }

    //endregion

    //region FASE 3 - SINTESI

    private List<Candidate> synthesizeForUncovered(ConstraintModel model, SortedSet<Integer> uncovered) {
        List<Candidate> synthesized = new ArrayList<>();
        Set<Integer> coveredBySynthesis = new HashSet<>();

        for (int number : uncovered) {
            if (coveredBySynthesis.contains(number)) continue;

            SolvingContext context = model.newContext(configuration.getConflictBudget()).requireVisible(number);
            SATResult result = context.check();

            switch (result.getStatus()) {
                case SATISFIABLE -> {
                    SortedMap<Integer, String> complete = model.decodeCompleteAssignment(result);
                    Candidate candidate = new Candidate(complete, complete, model.decodeVisible(result));
                    synthesized.add(candidate);
                    coveredBySynthesis.addAll(candidate.getVisibleQuestionNumbers());
                    LOGGER.fine(String.format("Sintetizzato candidato per Q%d: copre %d domande",
                            number, candidate.getVisibleQuestionNumbers().size()));
                }
                case UNSATISFIABLE -> LOGGER.info("Q" + number + " non raggiungibile da alcuna combinazione di risposte");
                case UNKNOWN -> LOGGER.warning("Q" + number + ": esito indeterminato (" + result.getMessage() + ")");
            }
        }
        return synthesized;
    }

    //endregion

    //region SUPPORTO

    private void validateInto(ConstraintModel model, SortedMap<Integer, String> assignment, List<Candidate> sink) {
        ValidationOutcome outcome = validator.validate(assignment, model);
        if (outcome.isOk()) {
            sink.add(new Candidate(assignment, outcome.getCompleteAssignment(), outcome.getVisibleQuestionNumbers()));
        } else {
            LOGGER.finest(() -> "Combinazione scartata " + assignment + ": " + outcome.getReason());
        }
    }

    private static SortedMap<Integer, String> toAssignment(List<Integer> numbers, List<String> combination) {
        SortedMap<Integer, String> assignment = new TreeMap<>();
        for (int i = 0; i < numbers.size(); i++) {
            assignment.put(numbers.get(i), combination.get(i));
        }
        return assignment;
    }

    //endregion
}
