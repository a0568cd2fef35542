package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

/**
 * Tunable settings for the stability search.
 *
 * <h2>Policy Dimensions</h2>
 *
 * <h3>1. Sampler</h3>
 * How leaf colourings are produced for each (hypothesis, subset) pair. The
 * randomized samplers draw a fixed number of trials; they are a bounded
 * heuristic, not a colour-coding scheme with a success-probability guarantee.
 * Only {@link SamplerStrategy#EXHAUSTIVE} makes "no assignment found" mean
 * "none exists" for the explored subsets.
 *
 * <h3>2. Deviation Scope</h3>
 * Which activities a void leaf is allowed to deviate to when the verifier looks
 * for a blocking move.
 *
 * <h3>3. Subset Restriction</h3>
 * In preference style, whether leaves may only use activities the centre itself
 * lists. Restricting keeps one subset per hypothesis but can hide stable
 * assignments that use other activities.
 *
 * <h3>4. Parallelism</h3>
 * Number of worker threads; 1 runs the single-threaded traversal whose order is
 * reproducible.
 */
public class SearchPolicy {

    // ========================================================================
    // Constants
    // ========================================================================

    public static final int DEFAULT_TRIALS = 100;

    public static final long DEFAULT_SEED = 42L;

    /** Style-dependent sampler, 100 trials, seed 42, sequential. */
    public static final SearchPolicy DEFAULT = new SearchPolicy.Builder().build();

    /** Complete enumeration of every colouring. */
    public static final SearchPolicy EXHAUSTIVE = new SearchPolicy.Builder()
        .sampler(SamplerStrategy.EXHAUSTIVE)
        .build();

    // ========================================================================
    // Enums
    // ========================================================================

    public enum SamplerStrategy {
        /** Round-robin over the colours; a deterministic baseline. */
        CYCLIC,
        /** Each leaf uniform over the subset plus void. */
        UNIFORM_RANDOM,
        /** Each leaf uniform over its own acceptable colours plus void. */
        PREFERENCE_FILTERED,
        /** Like PREFERENCE_FILTERED, weighted by preference rank. */
        RANK_WEIGHTED,
        /** Full Cartesian product of every leaf's colour list. */
        EXHAUSTIVE;

        public ColouringSampler create(int trials) {
            switch (this) {
                case CYCLIC:
                    return new CyclicSampler(trials);
                case UNIFORM_RANDOM:
                    return new UniformRandomSampler(trials);
                case PREFERENCE_FILTERED:
                    return new PreferenceFilteredSampler(trials);
                case RANK_WEIGHTED:
                    return new RankWeightedSampler(trials);
                case EXHAUSTIVE:
                default:
                    return new ExhaustiveSampler();
            }
        }

        public static SamplerStrategy defaultFor(ConfigurationStyle style) {
            return style == ConfigurationStyle.PREFERENCE ? PREFERENCE_FILTERED : UNIFORM_RANDOM;
        }
    }

    public enum DeviationScope {
        /** A void leaf may move to any declared activity. */
        DECLARED_ACTIVITIES,
        /** A void leaf may only move to the active subset or the centre's activity. */
        ACTIVE_SUBSET
    }

    public enum Mode {
        FIND_ONE,
        FIND_ALL
    }

    // ========================================================================
    // Fields
    // ========================================================================

    private final SamplerStrategy sampler;
    private final int trials;
    private final long seed;
    private final DeviationScope deviationScope;
    private final boolean restrictToCenterActivities;
    private final int parallelism;
    private final Mode mode;

    private SearchPolicy(Builder builder) {
        this.sampler = builder.sampler;
        this.trials = builder.trials;
        this.seed = builder.seed;
        this.deviationScope = builder.deviationScope;
        this.restrictToCenterActivities = builder.restrictToCenterActivities;
        this.parallelism = builder.parallelism;
        this.mode = builder.mode;
    }

    // ========================================================================
    // Getters
    // ========================================================================

    /**
     * Explicitly chosen sampler, or null to use the style default.
     */
    public SamplerStrategy getSampler() {
        return sampler;
    }

    public SamplerStrategy resolveSampler(ConfigurationStyle style) {
        return sampler != null ? sampler : SamplerStrategy.defaultFor(style);
    }

    public int getTrials() {
        return trials;
    }

    public long getSeed() {
        return seed;
    }

    public DeviationScope getDeviationScope() {
        return deviationScope;
    }

    public boolean isRestrictToCenterActivities() {
        return restrictToCenterActivities;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isParallel() {
        return parallelism > 1;
    }

    public Mode getMode() {
        return mode;
    }

    public Builder toBuilder() {
        return new Builder()
            .sampler(sampler)
            .trials(trials)
            .seed(seed)
            .deviationScope(deviationScope)
            .restrictToCenterActivities(restrictToCenterActivities)
            .parallelism(parallelism)
            .mode(mode);
    }

    @Override
    public String toString() {
        return String.format(
            "SearchPolicy[sampler=%s, trials=%d, seed=%d, deviation=%s, restrict=%s, parallelism=%d, mode=%s]",
            sampler != null ? sampler : "default", trials, seed, deviationScope,
            restrictToCenterActivities, parallelism, mode);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private SamplerStrategy sampler;
        private int trials = DEFAULT_TRIALS;
        private long seed = DEFAULT_SEED;
        private DeviationScope deviationScope = DeviationScope.DECLARED_ACTIVITIES;
        private boolean restrictToCenterActivities = true;
        private int parallelism = 1;
        private Mode mode = Mode.FIND_ONE;

        public Builder sampler(SamplerStrategy sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder trials(int trials) {
            if (trials < 1) {
                throw new IllegalArgumentException("Trial count must be at least 1");
            }
            this.trials = trials;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder deviationScope(DeviationScope scope) {
            if (scope == null) {
                throw new IllegalArgumentException("Deviation scope cannot be null");
            }
            this.deviationScope = scope;
            return this;
        }

        public Builder restrictToCenterActivities(boolean restrict) {
            this.restrictToCenterActivities = restrict;
            return this;
        }

        public Builder parallelism(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Parallelism must be at least 1");
            }
            this.parallelism = threads;
            return this;
        }

        public Builder mode(Mode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("Mode cannot be null");
            }
            this.mode = mode;
            return this;
        }

        public SearchPolicy build() {
            return new SearchPolicy(this);
        }
    }
}
