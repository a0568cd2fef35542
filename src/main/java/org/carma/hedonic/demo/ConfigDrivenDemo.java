package org.carma.hedonic.demo;

import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.model.ConfigurationException;
import org.carma.hedonic.runner.ScenarioRunner;
import org.carma.hedonic.runner.ScenarioRunner.ScenarioResult;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * Runs stability searches on scenarios from config/scenarios/.
 *
 * Usage:
 *   mvn exec:java -Dexec.mainClass=org.carma.hedonic.demo.ConfigDrivenDemo
 *
 * Options (any order):
 *   &lt;scenario&gt;   name under config/scenarios/ or a path to a .test / .yaml file
 *   --all        enumerate every stable assignment instead of stopping at the first
 *   --trace      print the search trace
 */
public class ConfigDrivenDemo {

    private static final String SEP = "=".repeat(70);
    private static final String SUBSEP = "-".repeat(50);

    public static void main(String[] args) {
        List<String> scenarioArgs = new ArrayList<>();
        ScenarioRunner runner = new ScenarioRunner();

        for (String arg : args) {
            switch (arg) {
                case "--all":
                    runner.mode(Mode.FIND_ALL);
                    break;
                case "--trace":
                    runner.trace(true);
                    break;
                case "--help":
                case "-h":
                    printUsage();
                    return;
                default:
                    if (arg.startsWith("--")) {
                        System.err.println("Unknown option: " + arg);
                        printUsage();
                        System.exit(2);
                    }
                    scenarioArgs.add(arg);
            }
        }

        System.out.println(SEP);
        System.out.println("NASH-STABLE ASSIGNMENT SEARCH");
        System.out.println(SEP);
        System.out.println();

        Path configRoot = findConfigRoot();
        int failures = 0;

        try {
            if (!scenarioArgs.isEmpty()) {
                for (String scenario : scenarioArgs) {
                    failures += runScenario(runner, resolve(configRoot, scenario)) ? 0 : 1;
                }
            } else if (configRoot == null) {
                System.err.println("ERROR: Could not find config directory.");
                System.err.println("Expected: ./config/scenarios/");
                System.exit(1);
            } else {
                failures += runAllScenarios(runner, configRoot);
            }
        } catch (IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(1);
        }

        if (failures > 0) {
            System.exit(1);
        }
    }

    private static int runAllScenarios(ScenarioRunner runner, Path configRoot) throws IOException {
        List<String> scenarios = runner.listScenarios(configRoot);
        if (scenarios.isEmpty()) {
            System.out.println("No scenarios found in: " + configRoot.resolve("scenarios"));
            return 0;
        }

        int failures = 0;
        for (int i = 0; i < scenarios.size(); i++) {
            String scenario = scenarios.get(i);
            System.out.println(SEP);
            System.out.println("SCENARIO " + (i + 1) + "/" + scenarios.size() + ": " + scenario.toUpperCase(Locale.ROOT));
            System.out.println(SEP);

            failures += runScenario(runner, configRoot.resolve("scenarios").resolve(scenario)) ? 0 : 1;

            if (i < scenarios.size() - 1) {
                System.out.println();
                System.out.println(SUBSEP);
            }
        }
        return failures;
    }

    private static boolean runScenario(ScenarioRunner runner, Path scenarioPath) {
        try {
            ScenarioResult result = runner.run(scenarioPath);
            System.out.println();
            System.out.println(result);
            return true;
        } catch (ConfigurationException e) {
            System.err.println("Invalid scenario: " + e.getMessage());
        } catch (IOException e) {
            System.err.println("ERROR reading scenario: " + e.getMessage());
        }
        return false;
    }

    private static Path resolve(Path configRoot, String scenario) {
        Path direct = Paths.get(scenario);
        if (Files.exists(direct) || configRoot == null) {
            return direct;
        }
        return configRoot.resolve("scenarios").resolve(scenario);
    }

    private static Path findConfigRoot() {
        for (Path candidate : List.of(Paths.get("config"), Paths.get("../config"))) {
            if (Files.exists(candidate.resolve("scenarios"))) {
                return candidate;
            }
        }
        String userDir = System.getProperty("user.dir");
        if (userDir != null) {
            Path candidate = Paths.get(userDir, "config");
            if (Files.exists(candidate.resolve("scenarios"))) {
                return candidate;
            }
        }
        return null;
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  ConfigDrivenDemo                     - Run every scenario in config/scenarios");
        System.out.println("  ConfigDrivenDemo <scenario> [...]    - Run specific scenarios");
        System.out.println("  ConfigDrivenDemo --all <scenario>    - Enumerate every stable assignment");
        System.out.println("  ConfigDrivenDemo --trace <scenario>  - Print the search trace");
    }
}
