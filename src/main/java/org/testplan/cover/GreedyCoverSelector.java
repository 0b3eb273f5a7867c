package org.testplan.cover;

import org.testplan.enumeration.Candidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * SELETTORE DI COPERTURA MINIMA - Set cover greedy sui candidati
 *
 * A ogni passo sceglie il candidato il cui insieme visibile copre più domande ancora scoperte
 * (parità: il primo in ordine di input) e lo rimuove dal pool. Si ferma quando tutto è coperto
 * o nessun candidato aggiunge copertura, quindi il numero di scoperte decresce strettamente a
 * ogni selezione.
 */
public class GreedyCoverSelector {

    private static final Logger LOGGER = Logger.getLogger(GreedyCoverSelector.class.getName());

    /**
     * @param candidates candidati in ordine di input (non modificati)
     * @param universe domande da coprire
     */
    public CoverResult select(List<Candidate> candidates, Set<Integer> universe) {
        if (candidates == null || universe == null) {
            throw new IllegalArgumentException("Candidati e universo sono obbligatori");
        }

        List<Candidate> pool = new ArrayList<>(candidates);
        SortedSet<Integer> uncovered = new TreeSet<>(universe);
        List<TestCase> selected = new ArrayList<>();

        while (!uncovered.isEmpty() && !pool.isEmpty()) {
            int bestIndex = -1;
            int bestGain = 0;

            for (int i = 0; i < pool.size(); i++) {
                int gain = intersectionSize(pool.get(i).getVisibleQuestionNumbers(), uncovered);
                if (gain > bestGain) {
                    bestGain = gain;
                    bestIndex = i;
                }
            }
            if (bestIndex < 0) break;

            Candidate chosen = pool.remove(bestIndex);
            uncovered.removeAll(chosen.getVisibleQuestionNumbers());
            selected.add(new TestCase(selected.size() + 1, chosen));
            LOGGER.fine(String.format("Caso #%d: +%d domande, scoperte %d", selected.size(), bestGain, uncovered.size()));
        }

        CoverResult result = new CoverResult(selected, new TreeSet<>(universe), uncovered);
        LOGGER.info(String.format("Copertura greedy: %d casi da %d candidati, copertura %.1f%%, scoperte %s",
                selected.size(), candidates.size(), result.getCoverage() * 100, uncovered));
        return result;
    }

    private static int intersectionSize(Set<Integer> visible, Set<Integer> uncovered) {
        int count = 0;
        for (Integer number : visible) {
            if (uncovered.contains(number)) count++;
        }
        return count;
    }
}
