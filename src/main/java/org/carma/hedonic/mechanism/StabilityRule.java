package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

/**
 * The constraint source the stability verifier consults.
 *
 * The verifier owns the structure of the check (occupancy, centre, members,
 * void deviations); a rule only answers whether a given player accepts a given
 * (activity, occupancy) situation. One rule exists per {@link ConfigurationStyle}.
 */
public interface StabilityRule {

    /**
     * Whether the centre accepts its hypothesis.
     */
    boolean admitsCenter(StarConfiguration config, CenterHypothesis hypothesis);

    /**
     * Whether {@code leaf} accepts sitting in {@code activity} with
     * {@code occupancy} participants in total, itself included.
     */
    boolean admitsMember(StarConfiguration config, String leaf, String activity, int occupancy);

    /**
     * Whether a void {@code leaf} could join {@code activity}, currently holding
     * {@code occupancy} participants, and be accepted there.
     */
    boolean admitsJoining(StarConfiguration config, String leaf, String activity, int occupancy);

    String getName();

    static StabilityRule forStyle(ConfigurationStyle style) {
        return style == ConfigurationStyle.PREFERENCE ? new PreferenceRule() : new CapacityRule();
    }
}
