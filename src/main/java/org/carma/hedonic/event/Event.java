package org.carma.hedonic.event;

import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.mechanism.SearchResult.Status;
import org.carma.hedonic.model.Assignment;
import org.carma.hedonic.model.CenterHypothesis;
import org.carma.hedonic.model.ConfigurationStyle;

import java.time.Instant;
import java.util.List;

/**
 * Base interface for search trace events.
 * Published in traversal order by the single-threaded search.
 */
public sealed interface Event permits
        Event.SearchStartedEvent,
        Event.HypothesisSelectedEvent,
        Event.StableAssignmentEvent,
        Event.SearchCompletedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * Search began over the given hypothesis space.
     */
    record SearchStartedEvent(
            Instant timestamp,
            Mode mode,
            ConfigurationStyle style,
            String sampler,
            int hypothesisCount,
            int subsetCount
    ) implements Event {
        public String eventType() { return "SEARCH_STARTED"; }
    }

    /**
     * A (centre hypothesis, active subset) pair is about to be sampled.
     */
    record HypothesisSelectedEvent(
            Instant timestamp,
            CenterHypothesis hypothesis,
            List<String> activitySubset
    ) implements Event {
        public String eventType() { return "HYPOTHESIS_SELECTED"; }
    }

    /**
     * The verifier accepted a candidate.
     */
    record StableAssignmentEvent(
            Instant timestamp,
            Assignment assignment,
            long colouringsVerified
    ) implements Event {
        public String eventType() { return "STABLE_ASSIGNMENT"; }
    }

    /**
     * Search finished, either on the first hit or after exhausting every pair.
     */
    record SearchCompletedEvent(
            Instant timestamp,
            Mode mode,
            Status status,
            int assignmentsFound,
            long colouringsVerified,
            long computationTimeMs
    ) implements Event {
        public String eventType() { return "SEARCH_COMPLETED"; }
    }
}
