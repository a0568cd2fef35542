package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

/**
 * Preference style: a player is satisfied iff its (activity, occupancy) pair
 * appears in its own list. Rank plays no part here.
 */
public class PreferenceRule implements StabilityRule {

    @Override
    public boolean admitsCenter(StarConfiguration config, CenterHypothesis hypothesis) {
        return config.getPreferences(config.getCentralPlayer())
            .accepts(hypothesis.activity(), hypothesis.groupSize());
    }

    @Override
    public boolean admitsMember(StarConfiguration config, String leaf, String activity, int occupancy) {
        return config.getPreferences(leaf).accepts(activity, occupancy);
    }

    @Override
    public boolean admitsJoining(StarConfiguration config, String leaf, String activity, int occupancy) {
        return config.getPreferences(leaf).accepts(activity, occupancy + 1);
    }

    @Override
    public String getName() {
        return "Preference Membership";
    }
}
