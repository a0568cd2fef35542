package org.carma.hedonic.mechanism;

import org.carma.hedonic.event.EventBus;
import org.carma.hedonic.model.StarConfiguration;

/**
 * Guess-and-check search for Nash-stable assignments.
 *
 * Traversal: centre hypotheses (outer), then active subsets, then colourings
 * from the sampler (inner); every triple goes through the
 * {@link StabilityVerifier}.
 *
 * State progression:
 *   SELECT_CENTER → SELECT_SUBSET → SAMPLE → VERIFY → (FOUND | CONTINUE) → EXHAUSTED
 */
public interface StabilitySearch {

    /**
     * First stable assignment, using the policy's sampler. Stops at the first hit.
     */
    SearchResult findOne();

    /**
     * Every stable assignment, enumerating colourings exhaustively.
     */
    SearchResult findAll();

    /**
     * Runs whichever of {@link #findOne()} / {@link #findAll()} the policy selects.
     */
    default SearchResult search() {
        return getPolicy().getMode() == SearchPolicy.Mode.FIND_ALL ? findAll() : findOne();
    }

    SearchPolicy getPolicy();

    /**
     * Sequential search unless the policy asks for more than one thread.
     * Only the sequential search publishes a trace to {@code eventBus}.
     */
    static StabilitySearch create(StarConfiguration config, SearchPolicy policy, EventBus eventBus) {
        if (policy.isParallel()) {
            return new ParallelStabilitySearch(config, policy);
        }
        return new SequentialStabilitySearch(config, policy, eventBus);
    }
}
