package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Each leaf uniform over the subset activities it lists, plus void.
 * Skips colourings no leaf could ever accept.
 */
public class PreferenceFilteredSampler extends RandomizedSampler {

    public PreferenceFilteredSampler(int trials) {
        super(trials);
    }

    @Override
    protected String pick(StarConfiguration config, String leaf, List<String> activitySubset, Random random) {
        return uniform(ColouringSampler.acceptableColours(config, leaf, activitySubset), random);
    }

    @Override
    public String getName() {
        return "Preference Filtered";
    }
}
