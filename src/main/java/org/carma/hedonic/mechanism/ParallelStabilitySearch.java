package org.carma.hedonic.mechanism;

import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Distributes (hypothesis, subset) pairs over a fixed thread pool.
 *
 * Each pair is one task with its own {@code Random(seed + taskIndex)}, so
 * workers never share a random source and a task's colourings do not depend
 * on scheduling. Workers share only read access to the configuration.
 *
 * - Find-one: a shared flag is raised by the first worker to find a stable
 *   assignment; every worker checks it before each colouring and no new work
 *   starts once it is set. When several workers hit concurrently the lowest
 *   task index wins.
 * - Find-all: per-task results are appended to a synchronized list and
 *   re-ordered by task index, matching the sequential order.
 */
public class ParallelStabilitySearch implements StabilitySearch {

    private final StarConfiguration config;
    private final SearchPolicy policy;
    private final HypothesisGenerator generator;
    private final StabilityVerifier verifier;

    public ParallelStabilitySearch(StarConfiguration config, SearchPolicy policy) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
        this.generator = new HypothesisGenerator(policy.isRestrictToCenterActivities());
        this.verifier = new StabilityVerifier(config, policy.getDeviationScope());
    }

    @Override
    public SearchPolicy getPolicy() {
        return policy;
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
    // Execution
    // ========================================================================

    private SearchResult run(Mode mode, ColouringSampler sampler) {
        long startTime = System.currentTimeMillis();

        List<CenterHypothesis> hypotheses = generator.centerHypotheses(config);
        List<List<String>> subsets = generator.activitySubsets(config);

        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicLong subsetsTried = new AtomicLong();
        AtomicLong verified = new AtomicLong();
        Set<CenterHypothesis> hypothesesTried = ConcurrentHashMap.newKeySet();
        List<TaskOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());

        List<Callable<Void>> tasks = new ArrayList<>();
        int index = 0;
        for (CenterHypothesis hypothesis : hypotheses) {
            for (List<String> subset : subsets) {
                final int taskIndex = index++;
                tasks.add(() -> {
                    if (mode == Mode.FIND_ONE && cancelled.get()) {
                        return null;
                    }
                    hypothesesTried.add(hypothesis);
                    subsetsTried.incrementAndGet();
                    Random random = new Random(policy.getSeed() + taskIndex);
                    List<Assignment> local = new ArrayList<>();

                    for (Map<String, String> colouring : sampler.sample(config, subset, random)) {
                        if (mode == Mode.FIND_ONE && cancelled.get()) {
                            break;
                        }
                        verified.incrementAndGet();
                        Optional<Assignment> stable = verifier.verify(hypothesis, subset, colouring);
                        if (stable.isPresent()) {
                            local.add(stable.get());
                            if (mode == Mode.FIND_ONE) {
                                cancelled.set(true);
                                break;
                            }
                        }
                    }
                    if (!local.isEmpty()) {
                        outcomes.add(new TaskOutcome(taskIndex, local));
                    }
                    return null;
                });
            }
        }

        ExecutorService executor = Executors.newFixedThreadPool(policy.getParallelism());
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Stability search interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stability search worker failed: " + e.getCause().getMessage(),
                e.getCause());
        } finally {
            executor.shutdownNow();
        }

        List<TaskOutcome> ordered;
        synchronized (outcomes) {
            ordered = new ArrayList<>(outcomes);
        }
        ordered.sort(Comparator.comparingInt(TaskOutcome::taskIndex));

        List<Assignment> found = new ArrayList<>();
        for (TaskOutcome outcome : ordered) {
            found.addAll(outcome.assignments());
            if (mode == Mode.FIND_ONE && !found.isEmpty()) {
                found = found.subList(0, 1);
                break;
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        return new SearchResult(mode, found, hypothesesTried.size(), subsetsTried.get(), verified.get(), elapsed);
    }

    private record TaskOutcome(int taskIndex, List<Assignment> assignments) {
    }
}
