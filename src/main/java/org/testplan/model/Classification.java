package org.testplan.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partizione dei numeri di domanda in TEST_VARIABLE, DATA_COLLECTION e HIDDEN.
 *
 * Ogni domanda appartiene esattamente a una classe; gli insiemi restituiti sono ordinati
 * e immutabili.
 */
public final class Classification {

    private final Map<Integer, QuestionClass> classes;
    private final Map<QuestionClass, SortedSet<Integer>> members;

    public Classification(Map<Integer, QuestionClass> classes) {
        this.classes = Collections.unmodifiableMap(new TreeMap<>(classes));
        this.members = new EnumMap<>(QuestionClass.class);

        for (QuestionClass questionClass : QuestionClass.values()) {
            members.put(questionClass, new TreeSet<>());
        }
        classes.forEach((number, questionClass) -> members.get(questionClass).add(number));
        members.replaceAll((questionClass, set) -> Collections.unmodifiableSortedSet(set));
    }

    /**
     * @return classe della domanda, null se il numero non è classificato
     */
    public QuestionClass classOf(int number) {
        return classes.get(number);
    }

    public SortedSet<Integer> membersOf(QuestionClass questionClass) {
        return members.get(questionClass);
    }

    public SortedSet<Integer> getTestVariables() {
        return members.get(QuestionClass.TEST_VARIABLE);
    }

    public SortedSet<Integer> getDataCollection() {
        return members.get(QuestionClass.DATA_COLLECTION);
    }

    public SortedSet<Integer> getHidden() {
        return members.get(QuestionClass.HIDDEN);
    }

    public boolean isTestVariable(int number) {
        return classes.get(number) == QuestionClass.TEST_VARIABLE;
    }

    public Map<Integer, QuestionClass> asMap() {
        return classes;
    }

    @Override
    public String toString() {
        return String.format("Classification{test=%d, data=%d, hidden=%d}",
                getTestVariables().size(), getDataCollection().size(), getHidden().size());
    }
}
