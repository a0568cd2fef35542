package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Each leaf independently uniform over the subset plus void.
 */
public class UniformRandomSampler extends RandomizedSampler {

    public UniformRandomSampler(int trials) {
        super(trials);
    }

    @Override
    protected String pick(StarConfiguration config, String leaf, List<String> activitySubset, Random random) {
        return uniform(ColouringSampler.fullColours(activitySubset), random);
    }

    @Override
    public String getName() {
        return "Uniform Random";
    }
}
