package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ColouringSamplerTest {

    private static final String VOID = StarConfiguration.VOID_ACTIVITY;

    private static List<Map<String, String>> collect(Iterable<Map<String, String>> colourings) {
        List<Map<String, String>> list = new ArrayList<>();
        colourings.forEach(list::add);
        return list;
    }

    private static void assertWellFormed(StarConfiguration config, List<String> subset,
                                         Map<String, String> colouring) {
        assertEquals(new HashSet<>(config.getLeafPlayers()), colouring.keySet());
        for (String colour : colouring.values()) {
            assertTrue(subset.contains(colour) || VOID.equals(colour), "unexpected colour " + colour);
        }
    }

    @Nested
    @DisplayName("Cyclic")
    class Cyclic {

        @Test
        void rotatesColoursEachTrial() {
            StarConfiguration config = new StarConfiguration.Builder()
                .centralPlayer("C").leafPlayers("L1", "L2", "L3").activity("A").activity("B").build();
            List<Map<String, String>> colourings = new CyclicSampler(100)
                .sample(config, List.of("A", "B"), new Random(1));

            assertEquals(100, colourings.size());
            assertEquals(TestScenarios.colouring("L1", "A", "L2", "B", "L3", VOID), colourings.get(0));
            assertEquals(TestScenarios.colouring("L1", "B", "L2", VOID, "L3", "A"), colourings.get(1));
            assertEquals(colourings.get(0), colourings.get(3));
            assertEquals(3, new HashSet<>(colourings).size());
        }
    }

    @Nested
    @DisplayName("Uniform random")
    class UniformRandom {

        @Test
        void producesCompleteMappingsWithinSubsetAndVoid() {
            StarConfiguration config = TestScenarios.weekendTrip();
            List<String> subset = List.of("hiking", "picnic");
            List<Map<String, String>> colourings = new UniformRandomSampler(100)
                .sample(config, subset, new Random(42));

            assertEquals(100, colourings.size());
            for (Map<String, String> colouring : colourings) {
                assertWellFormed(config, subset, colouring);
            }
        }

        @Test
        void sameSeedGivesSameColourings() {
            StarConfiguration config = TestScenarios.weekendTrip();
            UniformRandomSampler sampler = new UniformRandomSampler(50);
            assertEquals(
                sampler.sample(config, List.of("museum"), new Random(9)),
                sampler.sample(config, List.of("museum"), new Random(9)));
        }

        @Test
        void drawsEveryColourEventually() {
            StarConfiguration config = TestScenarios.capacityPair();
            Set<String> seen = new HashSet<>();
            for (Map<String, String> colouring : new UniformRandomSampler(200)
                    .sample(config, List.of("A", "B"), new Random(5))) {
                seen.addAll(colouring.values());
            }
            assertEquals(Set.of("A", "B", VOID), seen);
        }
    }

    @Nested
    @DisplayName("Preference filtered")
    class PreferenceFiltered {

        @Test
        void leafWithoutAcceptableActivityIsAlwaysVoid() {
            StarConfiguration config = TestScenarios.preferenceUnreachable();
            for (Map<String, String> colouring : new PreferenceFilteredSampler(100)
                    .sample(config, List.of("A"), new Random(42))) {
                assertEquals(VOID, colouring.get("L2"));
                assertTrue(Set.of("A", VOID).contains(colouring.get("L1")));
            }
        }

        @Test
        void acceptableColoursKeepSubsetOrderThenVoid() {
            StarConfiguration config = TestScenarios.rankedClub();
            assertEquals(List.of("hiking", "museum", VOID),
                ColouringSampler.acceptableColours(config, "L3", List.of("hiking", "museum")));
            assertEquals(List.of("hiking", VOID),
                ColouringSampler.acceptableColours(config, "L2", List.of("hiking", "museum")));
        }

        @Test
        void capacityStyleFallsBackToFullColours() {
            StarConfiguration config = TestScenarios.capacityPair();
            assertEquals(List.of("A", "B", VOID),
                ColouringSampler.acceptableColours(config, "L1", List.of("A", "B")));
        }
    }

    @Nested
    @DisplayName("Rank weighted")
    class RankWeighted {

        private final StarConfiguration config = new StarConfiguration.Builder()
            .centralPlayer("C").leafPlayer("L1")
            .activity("A").activity("B")
            .preferences("C", PreferenceList.of("A", 2))
            .preferences("L1", PreferenceList.of("A", 2, "B", 1, "A", 3))
            .build();

        @Test
        void weightsFollowRankWithVoidAtOne() {
            int[] weights = RankWeightedSampler.weights(config, "L1", List.of("A", "B", VOID));
            assertArrayEquals(new int[] {3, 2, 1}, weights);
        }

        @Test
        void betterRankedActivitiesAreDrawnMoreOften() {
            Map<String, Integer> counts = new HashMap<>();
            for (Map<String, String> colouring : new RankWeightedSampler(3000)
                    .sample(config, List.of("A", "B"), new Random(11))) {
                counts.merge(colouring.get("L1"), 1, Integer::sum);
            }
            assertTrue(counts.get("A") > counts.get("B"));
            assertTrue(counts.get("B") > counts.get(VOID));
        }

        @Test
        void emptyAcceptableListGivesVoid() {
            for (Map<String, String> colouring : new RankWeightedSampler(20)
                    .sample(TestScenarios.preferenceUnreachable(), List.of("A"), new Random(3))) {
                assertEquals(VOID, colouring.get("L2"));
            }
        }
    }

    @Nested
    @DisplayName("Exhaustive")
    class Exhaustive {

        @Test
        void enumeratesCartesianProductFirstLeafSlowest() {
            StarConfiguration config = TestScenarios.capacityPair();
            List<Map<String, String>> all = collect(new ExhaustiveSampler()
                .sample(config, List.of("A", "B"), new Random(0)));

            assertEquals(9, all.size());
            assertEquals(9, new HashSet<>(all).size());
            assertEquals(TestScenarios.colouring("L1", "A", "L2", "A"), all.get(0));
            assertEquals(TestScenarios.colouring("L1", "A", "L2", "B"), all.get(1));
            assertEquals(TestScenarios.colouring("L1", VOID, "L2", VOID), all.get(8));
        }

        @Test
        void preferenceStyleUsesFilteredDomains() {
            StarConfiguration config = TestScenarios.preferenceUnreachable();
            List<Map<String, String>> all = collect(new ExhaustiveSampler()
                .sample(config, List.of("A"), new Random(0)));
            assertEquals(List.of(
                TestScenarios.colouring("L1", "A", "L2", VOID),
                TestScenarios.colouring("L1", VOID, "L2", VOID)), all);
        }

        @Test
        void noLeavesGivesSingleEmptyColouring() {
            StarConfiguration config = new StarConfiguration.Builder()
                .centralPlayer("C").activity("A", 1).build();
            List<Map<String, String>> all = collect(new ExhaustiveSampler()
                .sample(config, List.of("A"), new Random(0)));
            assertEquals(1, all.size());
            assertTrue(all.get(0).isEmpty());
        }

        @Test
        void countMatchesEnumeration() {
            StarConfiguration config = TestScenarios.weekendTrip();
            ExhaustiveSampler sampler = new ExhaustiveSampler();
            List<String> subset = List.of("hiking", "museum");
            assertEquals(81, sampler.count(config, subset));
            assertEquals(81, collect(sampler.sample(config, subset, new Random(0))).size());
        }

        @Test
        void iterableCanBeReplayed() {
            Iterable<Map<String, String>> colourings = new ExhaustiveSampler()
                .sample(TestScenarios.capacityPair(), List.of("A"), new Random(0));
            assertEquals(collect(colourings), collect(colourings));
        }
    }

    @Test
    void strategyFactoryCreatesMatchingSamplers() {
        assertTrue(SearchPolicy.SamplerStrategy.CYCLIC.create(5) instanceof CyclicSampler);
        assertTrue(SearchPolicy.SamplerStrategy.UNIFORM_RANDOM.create(5) instanceof UniformRandomSampler);
        assertTrue(SearchPolicy.SamplerStrategy.PREFERENCE_FILTERED.create(5) instanceof PreferenceFilteredSampler);
        assertTrue(SearchPolicy.SamplerStrategy.RANK_WEIGHTED.create(5) instanceof RankWeightedSampler);
        assertTrue(SearchPolicy.SamplerStrategy.EXHAUSTIVE.create(5) instanceof ExhaustiveSampler);
        assertEquals(SearchPolicy.SamplerStrategy.PREFERENCE_FILTERED,
            SearchPolicy.SamplerStrategy.defaultFor(ConfigurationStyle.PREFERENCE));
    }
}
