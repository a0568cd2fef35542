package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Deterministic round-robin: in trial t, the leaf at position j receives
 * colour (j + t) mod |colours|. At most |colours| distinct colourings are
 * produced, so this is a cheap baseline rather than a real search.
 */
public class CyclicSampler implements ColouringSampler {

    private final int trials;

    public CyclicSampler(int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("Trial count must be at least 1");
        }
        this.trials = trials;
    }

    @Override
    public List<Map<String, String>> sample(StarConfiguration config, List<String> activitySubset, Random random) {
        List<String> colours = ColouringSampler.fullColours(activitySubset);
        List<String> leaves = config.getLeafPlayers();
        List<Map<String, String>> colourings = new ArrayList<>(trials);

        for (int t = 0; t < trials; t++) {
            Map<String, String> colouring = new LinkedHashMap<>();
            for (int j = 0; j < leaves.size(); j++) {
                colouring.put(leaves.get(j), colours.get((j + t) % colours.size()));
            }
            colourings.add(colouring);
        }
        return colourings;
    }

    public int getTrials() {
        return trials;
    }

    @Override
    public String getName() {
        return "Cyclic";
    }
}
