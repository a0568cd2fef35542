package org.carma.hedonic.safety;

import org.carma.hedonic.mechanism.ExhaustiveSampler;
import org.carma.hedonic.mechanism.HypothesisGenerator;
import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Static analysis of a scenario before any search runs.
 *
 * A configuration that built successfully is structurally sound; this looks
 * for things that make the search pointless or misleading:
 * - Centre with an empty hypothesis space (error)
 * - Preference entries whose group size exceeds the population
 * - Leaves that can only ever be void under the centre-activity restriction
 * - Leaves with no non-void entry at all
 * - Exhaustive enumeration larger than the configured budget
 */
public class ScenarioValidator {

    /** Colourings above which exhaustive enumeration is flagged. */
    public static final long DEFAULT_ENUMERATION_BUDGET = 1_000_000L;

    private final long enumerationBudget;

    public ScenarioValidator() {
        this(DEFAULT_ENUMERATION_BUDGET);
    }

    public ScenarioValidator(long enumerationBudget) {
        this.enumerationBudget = enumerationBudget;
    }

    /**
     * Result of scenario validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        public boolean hasWarning(String category) {
            return warnings.stream().anyMatch(w -> w.getCategory().equals(category));
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(isValid() ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(isValid() ? "VALID" : "INVALID").append("\n");
            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  ✗ ").append(error).append("\n");
                }
            }
            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ⚠ ").append(warning).append("\n");
                }
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String message;

        public ValidationError(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    public ValidationResult validate(StarConfiguration config, SearchPolicy policy) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        HypothesisGenerator generator = new HypothesisGenerator(policy.isRestrictToCenterActivities());
        List<CenterHypothesis> hypotheses = generator.centerHypotheses(config);
        List<List<String>> subsets = generator.activitySubsets(config);

        if (hypotheses.isEmpty()) {
            errors.add(new ValidationError("Hypotheses",
                "Central player " + config.getCentralPlayer() + " has no acceptable (activity, size) pair"));
        }

        if (config.isPreferenceStyle()) {
            validateGroupSizes(config, warnings);
            validateReachability(config, policy, subsets, warnings);
        }

        validateEnumerationCost(config, policy, hypotheses.size(), subsets, warnings);

        return new ValidationResult(errors, warnings);
    }

    private void validateGroupSizes(StarConfiguration config, List<ValidationWarning> warnings) {
        List<String> players = new ArrayList<>();
        players.add(config.getCentralPlayer());
        players.addAll(config.getLeafPlayers());

        for (String player : players) {
            for (PreferenceEntry entry : config.getPreferences(player).getEntries()) {
                if (entry.groupSize() > config.getPopulation()) {
                    warnings.add(new ValidationWarning("GroupSize", "Preference " + entry + " of " + player
                        + " needs more players than the " + config.getPopulation() + " available"));
                }
            }
        }
    }

    private void validateReachability(StarConfiguration config, SearchPolicy policy,
                                      List<List<String>> subsets, List<ValidationWarning> warnings) {
        Set<String> reachable = new HashSet<>();
        for (List<String> subset : subsets) {
            reachable.addAll(subset);
        }

        for (String leaf : config.getLeafPlayers()) {
            List<String> wanted = new ArrayList<>();
            for (String activity : config.getPreferences(leaf).activities()) {
                if (!StarConfiguration.isVoid(activity)) {
                    wanted.add(activity);
                }
            }

            if (wanted.isEmpty()) {
                warnings.add(new ValidationWarning("Preferences",
                    "Leaf " + leaf + " accepts no activity and will always be void"));
                continue;
            }

            if (policy.isRestrictToCenterActivities() && Collections.disjoint(wanted, reachable)) {
                warnings.add(new ValidationWarning("Reachability", "Leaf " + leaf + " only accepts " + wanted
                    + ", none of which the central player lists; it can only be void in this search"));
            }
        }
    }

    private void validateEnumerationCost(StarConfiguration config, SearchPolicy policy, int hypothesisCount,
                                         List<List<String>> subsets, List<ValidationWarning> warnings) {
        boolean enumerates = policy.getMode() == SearchPolicy.Mode.FIND_ALL
            || policy.resolveSampler(config.getStyle()) == SearchPolicy.SamplerStrategy.EXHAUSTIVE;
        if (!enumerates) {
            return;
        }

        long estimate = estimateEnumeration(config, hypothesisCount, subsets);
        if (estimate > enumerationBudget) {
            warnings.add(new ValidationWarning("Cost", String.format(
                "Exhaustive search verifies up to %s colourings (budget %d)",
                estimate == Long.MAX_VALUE ? "more than 2^63" : String.valueOf(estimate), enumerationBudget)));
        }
    }

    /**
     * Upper bound on verified colourings: hypotheses × Σ over subsets of the product of colour counts.
     */
    public long estimateEnumeration(StarConfiguration config, int hypothesisCount, List<List<String>> subsets) {
        ExhaustiveSampler sampler = new ExhaustiveSampler();
        long perHypothesis = 0;
        for (List<String> subset : subsets) {
            long count = sampler.count(config, subset);
            if (count == Long.MAX_VALUE || perHypothesis > Long.MAX_VALUE - count) {
                return Long.MAX_VALUE;
            }
            perHypothesis += count;
        }
        if (hypothesisCount > 0 && perHypothesis > Long.MAX_VALUE / hypothesisCount) {
            return Long.MAX_VALUE;
        }
        return perHypothesis * hypothesisCount;
    }
}
