package org.carma.hedonic.runner;

import org.carma.hedonic.config.ScenarioConfigLoader;
import org.carma.hedonic.config.ScenarioDefinition;
import org.carma.hedonic.event.Event;
import org.carma.hedonic.event.EventBus;
import org.carma.hedonic.mechanism.*;
import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.*;
import org.carma.hedonic.safety.ScenarioValidator;
import org.carma.hedonic.safety.ScenarioValidator.ValidationResult;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Executes scenarios loaded from configuration files.
 *
 * Key features:
 * - Loads a {@code .test} or YAML scenario
 * - Reports players, activities and constraints
 * - Runs static validation and skips the search on errors
 * - Runs find-one or find-all as the scenario's policy (or an override) asks
 * - Reports the stable assignment(s) and timing
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner();
 * ScenarioResult result = runner.run(Paths.get("config/scenarios/capacity-basic.test"));
 * System.out.println(result);
 * </pre>
 */
public class ScenarioRunner {

    private final ScenarioConfigLoader loader;
    private final ScenarioValidator validator;

    private boolean verbose = true;
    private boolean trace = false;
    private Mode modeOverride;

    public ScenarioRunner() {
        this.loader = new ScenarioConfigLoader();
        this.validator = new ScenarioValidator();
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Print every search event as it happens (sequential search only).
     */
    public ScenarioRunner trace(boolean trace) {
        this.trace = trace;
        return this;
    }

    /**
     * Force find-one or find-all regardless of the scenario's policy; null clears it.
     */
    public ScenarioRunner mode(Mode mode) {
        this.modeOverride = mode;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    public ScenarioResult run(Path scenarioPath) throws IOException {
        log("Loading scenario from: " + scenarioPath);
        return run(loader.loadScenario(scenarioPath));
    }

    public ScenarioResult run(ScenarioDefinition scenario) {
        StarConfiguration config = scenario.getConfiguration();
        SearchPolicy policy = scenario.getPolicy();
        if (modeOverride != null && modeOverride != policy.getMode()) {
            policy = policy.toBuilder().mode(modeOverride).build();
        }

        // 1. Describe the game
        log("Scenario: " + scenario.getName());
        if (!scenario.getDescription().isEmpty()) {
            log("Description: " + scenario.getDescription());
        }
        log("Style: " + config.getStyle());
        log("Central player: " + config.getCentralPlayer());
        log("Leaf players: " + config.getLeafPlayers());
        log("Activities: " + config.getActivities());
        if (config.isPreferenceStyle()) {
            log("Preferences:");
            log("  " + config.getCentralPlayer() + ": " + config.getPreferences(config.getCentralPlayer()));
            for (String leaf : config.getLeafPlayers()) {
                log("  " + leaf + ": " + config.getPreferences(leaf));
            }
        } else {
            log("Capacities: " + config.getCapacities());
        }
        log("Policy: " + policy);
        log("");

        // 2. Static validation
        ValidationResult validation = validator.validate(config, policy);
        for (ScenarioValidator.ValidationWarning warning : validation.getWarnings()) {
            log("  ⚠ " + warning);
        }
        if (!validation.isValid()) {
            for (ScenarioValidator.ValidationError error : validation.getErrors()) {
                log("  ✗ " + error);
            }
            log("Search skipped: scenario failed validation.");
            SearchResult skipped = new SearchResult(policy.getMode(), Collections.emptyList(), 0, 0, 0, 0);
            return new ScenarioResult(scenario, validation, skipped);
        }

        // 3. Search
        EventBus bus = new EventBus(trace);
        if (trace) {
            bus.subscribeAll(this::logEvent);
        }
        StabilitySearch search = StabilitySearch.create(config, policy, bus);
        SearchResult result = search.search();

        // 4. Report
        log("=== RESULT ===");
        if (!result.isFound()) {
            log("No Nash-stable assignment found.");
        } else if (result.getMode() == Mode.FIND_ONE) {
            log("Nash-stable assignment found: " + result.getAssignment().get().asMap());
        } else {
            log("Nash-stable assignments found: " + result.getAssignmentCount());
            for (Assignment assignment : result.getAssignments()) {
                log("  " + assignment.asMap() + " center=" + assignment.getHypothesis());
            }
        }
        if (trace) {
            log(String.format("Trace: %d event(s), %d (hypothesis, subset) pair(s) visited",
                bus.getHistory().size(), bus.getHistory(Event.HypothesisSelectedEvent.class).size()));
        }
        log(String.format("Verified %d colouring(s) over %d hypothesis(es) and %d subset(s) in %d ms",
            result.getColouringsVerified(), result.getHypothesesTried(),
            result.getSubsetsTried(), result.getComputationTimeMs()));

        return new ScenarioResult(scenario, validation, result);
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Complete result for a scenario.
     */
    public static class ScenarioResult {
        public final ScenarioDefinition scenario;
        public final ValidationResult validation;
        public final SearchResult searchResult;

        public ScenarioResult(ScenarioDefinition scenario, ValidationResult validation, SearchResult searchResult) {
            this.scenario = scenario;
            this.validation = validation;
            this.searchResult = searchResult;
        }

        public String getScenarioName() {
            return scenario.getName();
        }

        public boolean isFound() {
            return searchResult.isFound();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ScenarioResult[").append(scenario.getName()).append("]\n");
            sb.append("  Validation: ").append(validation).append("\n");
            sb.append("  Status: ").append(searchResult.getStatus()).append("\n");
            sb.append("  Assignments: ").append(searchResult.getAssignmentCount()).append("\n");
            sb.append("  Time: ").append(searchResult.getComputationTimeMs()).append(" ms\n");
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void logEvent(Event event) {
        if (event instanceof Event.HypothesisSelectedEvent) {
            Event.HypothesisSelectedEvent e = (Event.HypothesisSelectedEvent) event;
            log("  [trace] center=" + e.hypothesis() + " subset=" + e.activitySubset());
        } else if (event instanceof Event.StableAssignmentEvent) {
            Event.StableAssignmentEvent e = (Event.StableAssignmentEvent) event;
            log("  [trace] stable after " + e.colouringsVerified() + " colouring(s): " + e.assignment().asMap());
        } else {
            log("  [trace] " + event.eventType());
        }
    }

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    public List<String> listScenarios(Path configRoot) throws IOException {
        return loader.listScenarios(configRoot);
    }
}
