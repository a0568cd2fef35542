package org.carma.hedonic.mechanism;

import org.carma.hedonic.mechanism.SearchPolicy.DeviationScope;
import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Decides whether a (centre hypothesis, active subset, leaf colouring) triple
 * is Nash-stable.
 *
 * Check order:
 * 1. Occupancy of every activity in U ∪ {a*} ∪ {void}, with the centre counted
 *    in a*. A colouring that misses a leaf or uses a colour outside U ∪ {void}
 *    is rejected.
 * 2. occupancy(a*) must equal k*, and the centre must accept (a*, k*).
 * 3. Every non-void leaf must accept (its activity, that occupancy).
 * 4. No void leaf may have an acceptable activity to join within the
 *    deviation scope.
 *
 * The check is pure and total: it reads only the immutable configuration and
 * never throws on a well-formed call.
 */
public class StabilityVerifier {

    private final StarConfiguration config;
    private final StabilityRule rule;
    private final DeviationScope deviationScope;

    public StabilityVerifier(StarConfiguration config) {
        this(config, StabilityRule.forStyle(config.getStyle()), DeviationScope.DECLARED_ACTIVITIES);
    }

    public StabilityVerifier(StarConfiguration config, DeviationScope deviationScope) {
        this(config, StabilityRule.forStyle(config.getStyle()), deviationScope);
    }

    public StabilityVerifier(StarConfiguration config, StabilityRule rule, DeviationScope deviationScope) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null");
        this.deviationScope = Objects.requireNonNull(deviationScope, "Deviation scope cannot be null");
    }

    public StabilityRule getRule() {
        return rule;
    }

    public DeviationScope getDeviationScope() {
        return deviationScope;
    }

    // ========================================================================
    // Verification
    // ========================================================================

    public boolean isStable(CenterHypothesis hypothesis, List<String> activitySubset,
                            Map<String, String> leafColouring) {
        Map<String, Integer> occupancy = occupancy(hypothesis, activitySubset, leafColouring);
        if (occupancy == null) {
            return false;
        }

        // Centre
        if (occupancy.get(hypothesis.activity()) != hypothesis.groupSize()) {
            return false;
        }
        if (!rule.admitsCenter(config, hypothesis)) {
            return false;
        }

        // Members
        for (String leaf : config.getLeafPlayers()) {
            String activity = leafColouring.get(leaf);
            if (StarConfiguration.isVoid(activity)) {
                continue;
            }
            if (!rule.admitsMember(config, leaf, activity, occupancy.get(activity))) {
                return false;
            }
        }

        // Void deviations
        Collection<String> alternatives = deviationTargets(hypothesis, activitySubset);
        for (String leaf : config.getLeafPlayers()) {
            if (!StarConfiguration.isVoid(leafColouring.get(leaf))) {
                continue;
            }
            for (String alternative : alternatives) {
                if (rule.admitsJoining(config, leaf, alternative, occupancy.getOrDefault(alternative, 0))) {
                    return false;
                }
            }
        }

        return true;
    }

    /**
     * The full assignment when the triple is stable, empty otherwise.
     */
    public Optional<Assignment> verify(CenterHypothesis hypothesis, List<String> activitySubset,
                                       Map<String, String> leafColouring) {
        if (!isStable(hypothesis, activitySubset, leafColouring)) {
            return Optional.empty();
        }
        Map<String, Integer> occupancy = occupancy(hypothesis, activitySubset, leafColouring);
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String leaf : config.getLeafPlayers()) {
            ordered.put(leaf, leafColouring.get(leaf));
        }
        return Optional.of(new Assignment(
            config.getCentralPlayer(), hypothesis, activitySubset, ordered, occupancy));
    }

    /**
     * Participants per activity in U ∪ {a*} ∪ {void}, the centre counted in a*.
     * Null when the colouring is not a complete mapping into U ∪ {void}.
     */
    public Map<String, Integer> occupancy(CenterHypothesis hypothesis, List<String> activitySubset,
                                          Map<String, String> leafColouring) {
        if (leafColouring == null || leafColouring.size() != config.getLeafPlayers().size()) {
            return null;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String activity : activitySubset) {
            counts.put(activity, 0);
        }
        counts.putIfAbsent(hypothesis.activity(), 0);
        counts.put(StarConfiguration.VOID_ACTIVITY, 0);
        counts.merge(hypothesis.activity(), 1, Integer::sum);

        for (String leaf : config.getLeafPlayers()) {
            String activity = leafColouring.get(leaf);
            if (activity == null) {
                return null;
            }
            if (!StarConfiguration.isVoid(activity) && !activitySubset.contains(activity)) {
                return null;
            }
            counts.merge(activity, 1, Integer::sum);
        }
        return counts;
    }

    private Collection<String> deviationTargets(CenterHypothesis hypothesis, List<String> activitySubset) {
        if (deviationScope == DeviationScope.DECLARED_ACTIVITIES) {
            return config.getActivities();
        }
        Set<String> targets = new LinkedHashSet<>(activitySubset);
        targets.add(hypothesis.activity());
        return targets;
    }
}
