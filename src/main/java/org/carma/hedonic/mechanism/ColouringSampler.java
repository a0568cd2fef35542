package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Produces candidate leaf to activity mappings ("colourings") for one active
 * subset.
 *
 * Every mapping covers every leaf and uses only colours from the subset plus
 * {@link StarConfiguration#VOID_ACTIVITY}. Samplers never modify the
 * configuration; randomness comes only from the {@link Random} passed in, so a
 * worker with its own seeded source reproduces its run exactly.
 */
public interface ColouringSampler {

    /**
     * Candidate colourings, finite and safe to iterate once.
     */
    Iterable<Map<String, String>> sample(StarConfiguration config, List<String> activitySubset, Random random);

    String getName();

    /**
     * The subset's activities followed by void.
     */
    static List<String> fullColours(List<String> activitySubset) {
        List<String> colours = new ArrayList<>(activitySubset.size() + 1);
        colours.addAll(activitySubset);
        colours.add(StarConfiguration.VOID_ACTIVITY);
        return colours;
    }

    /**
     * Colours a leaf could ever accept: subset activities named in its
     * preference list, then void. Capacity-style leaves accept every colour.
     */
    static List<String> acceptableColours(StarConfiguration config, String leaf, List<String> activitySubset) {
        if (!config.isPreferenceStyle()) {
            return fullColours(activitySubset);
        }
        PreferenceList prefs = config.getPreferences(leaf);
        List<String> colours = new ArrayList<>();
        for (String activity : activitySubset) {
            if (prefs.mentions(activity)) {
                colours.add(activity);
            }
        }
        colours.add(StarConfiguration.VOID_ACTIVITY);
        return colours;
    }
}
