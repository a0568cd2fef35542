package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Preference-filtered sampling where an activity ranked at index i in a list
 * of length n carries weight n - i. Void always weighs 1, the minimum.
 * Capacity-style leaves have no ranking, so every colour weighs 1.
 */
public class RankWeightedSampler extends RandomizedSampler {

    public RankWeightedSampler(int trials) {
        super(trials);
    }

    @Override
    protected String pick(StarConfiguration config, String leaf, List<String> activitySubset, Random random) {
        List<String> colours = ColouringSampler.acceptableColours(config, leaf, activitySubset);
        int[] weights = weights(config, leaf, colours);

        int total = 0;
        for (int w : weights) {
            total += w;
        }
        if (total <= 0) {
            return StarConfiguration.VOID_ACTIVITY;
        }

        int roll = random.nextInt(total);
        for (int i = 0; i < colours.size(); i++) {
            roll -= weights[i];
            if (roll < 0) {
                return colours.get(i);
            }
        }
        return StarConfiguration.VOID_ACTIVITY;
    }

    static int[] weights(StarConfiguration config, String leaf, List<String> colours) {
        int[] weights = new int[colours.size()];
        PreferenceList prefs = config.getPreferences(leaf);
        for (int i = 0; i < colours.size(); i++) {
            String colour = colours.get(i);
            if (StarConfiguration.isVoid(colour) || !config.isPreferenceStyle()) {
                weights[i] = 1;
            } else {
                weights[i] = Math.max(1, prefs.weightOf(colour));
            }
        }
        return weights;
    }

    @Override
    public String getName() {
        return "Rank Weighted";
    }
}
