package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

/**
 * Capacity style: any non-void activity within its limit is acceptable, and a
 * void leaf blocks whenever some activity still has room.
 */
public class CapacityRule implements StabilityRule {

    @Override
    public boolean admitsCenter(StarConfiguration config, CenterHypothesis hypothesis) {
        return config.getCapacity(hypothesis.activity()).allows(hypothesis.groupSize());
    }

    @Override
    public boolean admitsMember(StarConfiguration config, String leaf, String activity, int occupancy) {
        return config.getCapacity(activity).allows(occupancy);
    }

    @Override
    public boolean admitsJoining(StarConfiguration config, String leaf, String activity, int occupancy) {
        return config.getCapacity(activity).hasRoomAfter(occupancy);
    }

    @Override
    public String getName() {
        return "Capacity Bound";
    }
}
