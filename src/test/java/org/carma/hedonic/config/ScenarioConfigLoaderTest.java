package org.carma.hedonic.config;

import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.mechanism.SearchPolicy.DeviationScope;
import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.mechanism.SearchPolicy.SamplerStrategy;
import org.carma.hedonic.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioConfigLoaderTest {

    private final ScenarioConfigLoader loader = new ScenarioConfigLoader();

    private Path resource(String name) throws URISyntaxException {
        return Paths.get(getClass().getResource("/scenarios/" + name).toURI());
    }

    @Nested
    @DisplayName("Loading files")
    class FileLoading {

        @Test
        void yamlWithSearchBlock() throws Exception {
            ScenarioDefinition scenario = loader.loadScenario(resource("shared-hike.yaml"));

            assertEquals("shared-hike", scenario.getName());
            assertEquals("Capacity scenario with a search block", scenario.getDescription());
            StarConfiguration config = scenario.getConfiguration();
            assertEquals(ConfigurationStyle.CAPACITY, config.getStyle());
            assertEquals(2, config.getCapacity("A").getLimit().getAsInt());

            SearchPolicy policy = scenario.getPolicy();
            assertEquals(SamplerStrategy.CYCLIC, policy.getSampler());
            assertEquals(10, policy.getTrials());
            assertEquals(3L, policy.getSeed());
            assertEquals(Mode.FIND_ALL, policy.getMode());
            assertEquals(DeviationScope.DECLARED_ACTIVITIES, policy.getDeviationScope());
        }

        @Test
        void testFileGoesThroughLineParser() throws Exception {
            ScenarioDefinition scenario = loader.loadScenario(resource("preference-unreachable.test"));
            assertEquals("preference-unreachable", scenario.getName());
            assertEquals(ConfigurationStyle.PREFERENCE, scenario.getConfiguration().getStyle());
            assertSame(SearchPolicy.DEFAULT, scenario.getPolicy());
        }

        @Test
        void directoryUsesItsName(@TempDir Path dir) throws IOException {
            Path scenarioDir = dir.resolve("club-night");
            Files.createDirectories(scenarioDir);
            Files.writeString(scenarioDir.resolve("scenario.yaml"),
                "central_player: C\nleaf_players: [L1]\nactivities: {A: .inf}\n");

            ScenarioDefinition scenario = loader.loadScenario(scenarioDir);
            assertEquals("club-night", scenario.getName());
            assertTrue(scenario.getConfiguration().getCapacity("A").isUnbounded());
        }

        @Test
        void missingFile(@TempDir Path dir) {
            assertThrows(IOException.class, () -> loader.loadScenario(dir.resolve("nowhere.yaml")));
            assertThrows(IOException.class, () -> loader.loadScenario(dir));
        }

        @Test
        void listsScenariosSorted(@TempDir Path root) throws IOException {
            Path scenarios = root.resolve("scenarios");
            Files.createDirectories(scenarios.resolve("c-dir"));
            Files.createDirectories(scenarios.resolve("empty-dir"));
            Files.writeString(scenarios.resolve("c-dir").resolve("scenario.yaml"), "central_player: C\n");
            Files.writeString(scenarios.resolve("b.yaml"), "");
            Files.writeString(scenarios.resolve("a.test"), "");
            Files.writeString(scenarios.resolve("notes.txt"), "");

            assertEquals(List.of("a.test", "b.yaml", "c-dir"), loader.listScenarios(root));
            assertTrue(loader.listScenarios(root.resolve("missing")).isEmpty());
        }
    }

    @Nested
    @DisplayName("YAML content")
    class Content {

        @Test
        void preferenceFormsCanBeMixed() {
            ScenarioDefinition scenario = loader.loadFromString(String.join("\n",
                "central_player: C",
                "leaf_players: L1, L2",
                "activities: [A, B]",
                "preferences:",
                "  C: [[A, 2]]",
                "  L1: [\"(A, 2)\", [B, 1]]",
                "  L2: \"(B, 1) > (void, 1)\""));
            StarConfiguration config = scenario.getConfiguration();

            assertEquals("unnamed", scenario.getName());
            assertEquals(List.of(new PreferenceEntry("A", 2), new PreferenceEntry("B", 1)),
                config.getPreferences("L1").getEntries());
            assertEquals(2, config.getPreferences("L2").size());
        }

        @Test
        void capacityStrings() {
            StarConfiguration config = loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities:\n  A: 3\n  B: inf\n").getConfiguration();
            assertEquals(3, config.getCapacity("A").getLimit().getAsInt());
            assertTrue(config.getCapacity("B").isUnbounded());
        }

        @Test
        void fullSearchBlock() {
            SearchPolicy policy = loader.loadFromString(String.join("\n",
                "central_player: C",
                "leaf_players: [L1]",
                "activities: [A]",
                "search:",
                "  sampler: rank-weighted",
                "  deviation_scope: active_subset",
                "  restrict_to_center_activities: false",
                "  parallelism: 4",
                "  mode: find_one")).getPolicy();

            assertEquals(SamplerStrategy.RANK_WEIGHTED, policy.getSampler());
            assertEquals(DeviationScope.ACTIVE_SUBSET, policy.getDeviationScope());
            assertFalse(policy.isRestrictToCenterActivities());
            assertEquals(4, policy.getParallelism());
            assertTrue(policy.isParallel());
            assertEquals(Mode.FIND_ONE, policy.getMode());
            assertEquals(SearchPolicy.DEFAULT_TRIALS, policy.getTrials());
        }

        @Test
        void wideSeedIsKept() {
            SearchPolicy policy = loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities: [A]\nsearch:\n  seed: 4294967297\n").getPolicy();
            assertEquals(4294967297L, policy.getSeed());
        }

        @Test
        void modeAliases() {
            assertEquals(Mode.FIND_ALL, ScenarioConfigLoader.parseMode("find-all"));
            assertEquals(Mode.FIND_ALL, ScenarioConfigLoader.parseMode("ALL"));
            assertEquals(Mode.FIND_ONE, ScenarioConfigLoader.parseMode("one"));
            assertThrows(ConfigurationException.class, () -> ScenarioConfigLoader.parseMode("some"));
        }
    }

    @Nested
    @DisplayName("Rejected content")
    class Rejected {

        @Test
        void duplicateKeys() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\ncentral_player: D\nleaf_players: [L1]\nactivities: [A]\n"));
            assertTrue(e.getMessage().contains("invalid YAML"), e.getMessage());
        }

        @Test
        void unknownSampler() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "search:\n  sampler: psychic\n"));
            assertTrue(e.getMessage().contains("unknown sampler 'psychic'"), e.getMessage());
        }

        @Test
        void zeroTrials() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "search:\n  trials: 0\n"));
            assertTrue(e.getMessage().contains("search:"), e.getMessage());
        }

        @Test
        void capacityBeyondIntRange() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\nleaf_players: [L1]\nactivities: {A: 4294967297}\n"));
            assertTrue(e.getMessage().contains("out of range"), e.getMessage());
        }

        @Test
        void fractionalCapacity() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\nleaf_players: [L1]\nactivities: {A: 2.5}\n"));
            assertTrue(e.getMessage().contains("must be an integer"), e.getMessage());
        }

        @Test
        void trialsBeyondIntRange() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                loader.loadFromString("central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "search:\n  trials: 4294967297\n"));
            assertTrue(e.getMessage().contains("trials out of range"), e.getMessage());
        }

        @Test
        void groupSizeBeyondIntRange() {
            assertThrows(ConfigurationException.class, () -> loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "preferences:\n  C: [[A, 4294967297]]\n  L1: [[A, 2]]\n"));
            assertThrows(ConfigurationException.class, () -> loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "preferences:\n  C: \"(A, 99999999999)\"\n  L1: [[A, 2]]\n"));
        }

        @Test
        void nonMappingDocument() {
            assertThrows(ConfigurationException.class, () -> loader.loadFromString("- just\n- a list\n"));
        }

        @Test
        void centreListingVoid() {
            assertThrows(ConfigurationException.class, () -> loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities: [A]\n"
                    + "preferences:\n  C: [[void, 1]]\n  L1: [[A, 2]]\n"));
        }

        @Test
        void capacityWithPreferences() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.loadFromString(
                "central_player: C\nleaf_players: [L1]\nactivities: {A: 2}\n"
                    + "preferences:\n  C: [[A, 2]]\n  L1: [[A, 2]]\n"));
            assertTrue(e.getMessage().startsWith("<string>: "), e.getMessage());
        }
    }
}
