package org.carma.hedonic.mechanism;

import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.Assignment;

import java.util.*;

/**
 * Outcome of a stability search.
 *
 * Contains:
 * - The stable assignments found, in traversal order (at most one for find-one)
 * - Whether the search found something or exhausted its space
 * - Work counters and wall-clock time
 *
 * {@link Status#EXHAUSTED} is a normal outcome. Unless every subset was
 * enumerated exhaustively it only means nothing was found among the sampled
 * colourings.
 */
public class SearchResult {

    public enum Status {
        FOUND,
        EXHAUSTED
    }

    private final Mode mode;
    private final List<Assignment> assignments;
    private final long hypothesesTried;
    private final long subsetsTried;
    private final long colouringsVerified;
    private final long computationTimeMs;

    public SearchResult(Mode mode, List<Assignment> assignments, long hypothesesTried,
                        long subsetsTried, long colouringsVerified, long computationTimeMs) {
        this.mode = Objects.requireNonNull(mode, "Mode cannot be null");
        this.assignments = List.copyOf(assignments);
        this.hypothesesTried = hypothesesTried;
        this.subsetsTried = subsetsTried;
        this.colouringsVerified = colouringsVerified;
        this.computationTimeMs = computationTimeMs;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Mode getMode() {
        return mode;
    }

    public Status getStatus() {
        return assignments.isEmpty() ? Status.EXHAUSTED : Status.FOUND;
    }

    public boolean isFound() {
        return !assignments.isEmpty();
    }

    /**
     * First stable assignment, empty when none was found.
     */
    public Optional<Assignment> getAssignment() {
        return assignments.isEmpty() ? Optional.empty() : Optional.of(assignments.get(0));
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public int getAssignmentCount() {
        return assignments.size();
    }

    public long getHypothesesTried() {
        return hypothesesTried;
    }

    public long getSubsetsTried() {
        return subsetsTried;
    }

    public long getColouringsVerified() {
        return colouringsVerified;
    }

    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult[").append(mode).append("]:\n");
        sb.append("  Status: ").append(getStatus()).append("\n");
        sb.append("  Hypotheses: ").append(hypothesesTried)
          .append(", subsets: ").append(subsetsTried)
          .append(", colourings: ").append(colouringsVerified).append("\n");
        sb.append("  Time: ").append(computationTimeMs).append(" ms\n");
        for (Assignment assignment : assignments) {
            sb.append("    ").append(assignment).append("\n");
        }
        return sb.toString();
    }
}
