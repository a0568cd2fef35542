package org.carma.hedonic.mechanism;

import org.carma.hedonic.event.Event;
import org.carma.hedonic.event.EventBus;
import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.*;

import java.time.Instant;
import java.util.*;

/**
 * Single-threaded traversal with a reproducible order.
 *
 * One {@link Random} seeded from the policy feeds every sampler call, so two
 * runs with the same configuration and policy visit the same colourings and
 * return the same result. Find-all ordering is hypothesis order, then subset
 * order, then enumeration order.
 */
public class SequentialStabilitySearch implements StabilitySearch {

    private final StarConfiguration config;
    private final SearchPolicy policy;
    private final HypothesisGenerator generator;
    private final StabilityVerifier verifier;
    private final EventBus eventBus;

    public SequentialStabilitySearch(StarConfiguration config) {
        this(config, SearchPolicy.DEFAULT, null);
    }

    public SequentialStabilitySearch(StarConfiguration config, SearchPolicy policy) {
        this(config, policy, null);
    }

    /**
     * @param eventBus receives the search trace; may be null
     */
    public SequentialStabilitySearch(StarConfiguration config, SearchPolicy policy, EventBus eventBus) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
        this.generator = new HypothesisGenerator(policy.isRestrictToCenterActivities());
        this.verifier = new StabilityVerifier(config, policy.getDeviationScope());
        this.eventBus = eventBus;
    }

    @Override
    public SearchPolicy getPolicy() {
        return policy;
    }

    public StabilityVerifier getVerifier() {
        return verifier;
    }

    @Override
    public SearchResult findOne() {
        SearchPolicy.SamplerStrategy strategy = policy.resolveSampler(config.getStyle());
        return run(Mode.FIND_ONE, strategy.create(policy.getTrials()));
    }

    @Override
    public SearchResult findAll() {
        return run(Mode.FIND_ALL, new ExhaustiveSampler());
    }

    // ========================================================================
    // Traversal
    // ========================================================================

    private SearchResult run(Mode mode, ColouringSampler sampler) {
        long startTime = System.currentTimeMillis();
        Random random = new Random(policy.getSeed());

        List<CenterHypothesis> hypotheses = generator.centerHypotheses(config);
        List<List<String>> subsets = generator.activitySubsets(config);
        publish(new Event.SearchStartedEvent(Instant.now(), mode, config.getStyle(),
            sampler.getName(), hypotheses.size(), subsets.size()));

        List<Assignment> found = new ArrayList<>();
        long hypothesesTried = 0;
        long subsetsTried = 0;
        long verified = 0;

        search:
        for (CenterHypothesis hypothesis : hypotheses) {
            hypothesesTried++;
            for (List<String> subset : subsets) {
                subsetsTried++;
                publish(new Event.HypothesisSelectedEvent(Instant.now(), hypothesis, subset));

                for (Map<String, String> colouring : sampler.sample(config, subset, random)) {
                    verified++;
                    Optional<Assignment> stable = verifier.verify(hypothesis, subset, colouring);
                    if (stable.isPresent()) {
                        found.add(stable.get());
                        publish(new Event.StableAssignmentEvent(Instant.now(), stable.get(), verified));
                        if (mode == Mode.FIND_ONE) {
                            break search;
                        }
                    }
                }
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        SearchResult result = new SearchResult(mode, found, hypothesesTried, subsetsTried, verified, elapsed);
        publish(new Event.SearchCompletedEvent(Instant.now(), mode, result.getStatus(),
            found.size(), verified, elapsed));
        return result;
    }

    private void publish(Event event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }
}
