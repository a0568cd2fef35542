package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Base for samplers that draw a fixed number of independent trials.
 *
 * The trial count is a heuristic bound: a stable colouring may exist and still
 * not be drawn.
 */
public abstract class RandomizedSampler implements ColouringSampler {

    private final int trials;

    protected RandomizedSampler(int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("Trial count must be at least 1");
        }
        this.trials = trials;
    }

    public int getTrials() {
        return trials;
    }

    @Override
    public List<Map<String, String>> sample(StarConfiguration config, List<String> activitySubset, Random random) {
        List<Map<String, String>> colourings = new ArrayList<>(trials);
        for (int t = 0; t < trials; t++) {
            Map<String, String> colouring = new LinkedHashMap<>();
            for (String leaf : config.getLeafPlayers()) {
                String colour = pick(config, leaf, activitySubset, random);
                colouring.put(leaf, colour != null ? colour : StarConfiguration.VOID_ACTIVITY);
            }
            colourings.add(colouring);
        }
        return colourings;
    }

    /**
     * Draw one colour for {@code leaf}; null is read as void.
     */
    protected abstract String pick(StarConfiguration config, String leaf, List<String> activitySubset, Random random);

    protected static String uniform(List<String> colours, Random random) {
        if (colours.isEmpty()) {
            return StarConfiguration.VOID_ACTIVITY;
        }
        return colours.get(random.nextInt(colours.size()));
    }

    @Override
    public String toString() {
        return getName() + "[trials=" + trials + "]";
    }
}
