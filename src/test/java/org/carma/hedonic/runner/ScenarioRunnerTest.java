package org.carma.hedonic.runner;

import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.Assignment;
import org.carma.hedonic.model.StarConfiguration;
import org.carma.hedonic.runner.ScenarioRunner.ScenarioResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRunnerTest {

    private static Path scenario(String name) throws Exception {
        return Paths.get(ScenarioRunnerTest.class.getResource("/scenarios/" + name).toURI());
    }

    private final ScenarioRunner runner = new ScenarioRunner().verbose(false);

    @Test
    void capacityScenario_findsAssignment() throws Exception {
        ScenarioResult result = runner.run(scenario("capacity-basic.test"));

        assertEquals("capacity-basic", result.getScenarioName());
        assertTrue(result.validation.isValid());
        assertTrue(result.isFound());
        Assignment assignment = result.searchResult.getAssignment().orElseThrow();
        assertEquals("A", assignment.getCenterActivity());
        assertEquals(2, assignment.getOccupancy("A"));
    }

    @Test
    void modeOverride_listsEveryAssignment() throws Exception {
        ScenarioResult result = new ScenarioRunner().verbose(false).mode(Mode.FIND_ALL)
            .run(scenario("capacity-basic.test"));
        assertEquals(Mode.FIND_ALL, result.searchResult.getMode());
        assertEquals(4, result.searchResult.getAssignmentCount());
    }

    @Test
    void yamlSearchBlock_isHonoured() throws Exception {
        ScenarioResult result = runner.trace(true).run(scenario("shared-hike.yaml"));
        assertEquals(Mode.FIND_ALL, result.searchResult.getMode());
        assertEquals(4, result.searchResult.getAssignmentCount());
    }

    @Test
    void unreachablePreferences_reportNothing() throws Exception {
        ScenarioResult result = runner.run(scenario("preference-unreachable.test"));
        assertFalse(result.isFound());
        assertTrue(result.validation.hasWarning("Reachability"));
    }

    @Test
    void singleSeat_leavesLeafVoid() throws Exception {
        ScenarioResult result = runner.run(scenario("single-seat.test"));
        Assignment assignment = result.searchResult.getAssignment().orElseThrow();
        assertEquals(StarConfiguration.VOID_ACTIVITY, assignment.getActivity("L1"));
    }

    @Test
    void invalidScenario_skipsSearch() throws Exception {
        ScenarioResult result = runner.run(scenario("empty-center.yaml"));
        assertFalse(result.validation.isValid());
        assertFalse(result.isFound());
        assertEquals(0, result.searchResult.getColouringsVerified());
    }

    @Test
    void parallelPolicy_runsThroughTheSameReport() throws Exception {
        ScenarioResult loaded = runner.run(scenario("capacity-basic.test"));
        SearchPolicy parallel = new SearchPolicy.Builder().parallelism(2).mode(Mode.FIND_ALL).build();
        ScenarioResult result = runner.run(loaded.scenario.withPolicy(parallel));
        assertEquals(4, result.searchResult.getAssignmentCount());
    }

    @Test
    void listsResourceScenarios() throws Exception {
        Path root = scenario("capacity-basic.test").getParent().getParent();
        List<String> names = runner.listScenarios(root);
        assertTrue(names.contains("capacity-basic.test"));
        assertTrue(names.contains("shared-hike.yaml"));
        assertEquals(5, names.size());
    }
}
