package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Enumerates the guesses the search iterates over: the centre's
 * (activity, group size) and the set of activities leaves may use.
 *
 * Both orders are deterministic so search traces are reproducible.
 */
public class HypothesisGenerator {

    private final boolean restrictToCenterActivities;

    public HypothesisGenerator() {
        this(true);
    }

    public HypothesisGenerator(boolean restrictToCenterActivities) {
        this.restrictToCenterActivities = restrictToCenterActivities;
    }

    /**
     * Capacity style: every activity, every k in 1..min(capacity, population),
     * activity-major. Preference style: the centre's own list, in its order.
     */
    public List<CenterHypothesis> centerHypotheses(StarConfiguration config) {
        List<CenterHypothesis> guesses = new ArrayList<>();

        if (config.isPreferenceStyle()) {
            for (PreferenceEntry entry : config.getPreferences(config.getCentralPlayer()).getEntries()) {
                guesses.add(CenterHypothesis.of(entry));
            }
            return guesses;
        }

        int population = config.getPopulation();
        for (String activity : config.getActivities()) {
            int maxSize = config.getCapacity(activity).clip(population);
            for (int k = 1; k <= maxSize; k++) {
                guesses.add(new CenterHypothesis(activity, k));
            }
        }
        return guesses;
    }

    /**
     * Capacity style (or preference style without restriction): every non-empty
     * subset of the declared activities, by size and then declaration order.
     * Preference style with restriction: the single subset of activities the
     * centre lists.
     */
    public List<List<String>> activitySubsets(StarConfiguration config) {
        if (config.isPreferenceStyle() && restrictToCenterActivities) {
            List<String> centerActivities = new ArrayList<>();
            for (String activity : config.getPreferences(config.getCentralPlayer()).activities()) {
                if (!StarConfiguration.isVoid(activity)) {
                    centerActivities.add(activity);
                }
            }
            // keep declaration order
            List<String> ordered = new ArrayList<>(config.getActivities());
            ordered.retainAll(centerActivities);
            return ordered.isEmpty() ? Collections.emptyList() : List.of(List.copyOf(ordered));
        }
        return nonEmptySubsets(config.getActivities());
    }

    /**
     * Lexicographic combinations of each size, smallest size first.
     */
    static List<List<String>> nonEmptySubsets(List<String> items) {
        List<List<String>> subsets = new ArrayList<>();
        int n = items.size();
        for (int size = 1; size <= n; size++) {
            int[] idx = new int[size];
            for (int i = 0; i < size; i++) {
                idx[i] = i;
            }
            while (true) {
                List<String> subset = new ArrayList<>(size);
                for (int i : idx) {
                    subset.add(items.get(i));
                }
                subsets.add(Collections.unmodifiableList(subset));

                int pos = size - 1;
                while (pos >= 0 && idx[pos] == n - size + pos) {
                    pos--;
                }
                if (pos < 0) {
                    break;
                }
                idx[pos]++;
                for (int i = pos + 1; i < size; i++) {
                    idx[i] = idx[i - 1] + 1;
                }
            }
        }
        return subsets;
    }
}
