package org.carma.hedonic.config;

import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.mechanism.SearchPolicy.DeviationScope;
import org.carma.hedonic.mechanism.SearchPolicy.Mode;
import org.carma.hedonic.mechanism.SearchPolicy.SamplerStrategy;
import org.carma.hedonic.model.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.math.BigInteger;
import java.nio.file.*;
import java.util.*;

/**
 * Loads scenarios from YAML files, or from {@code .test} files via
 * {@link ScenarioFileParser}.
 *
 * A YAML scenario:
 * <pre>
 * name: shared-hike
 * central_player: C
 * leaf_players: [L1, L2]
 * activities:          # list (unbounded) or map to capacity / inf
 *   A: 2
 *   B: inf
 * preferences:         # preference style only
 *   C: [[A, 2]]
 *   L1: ["(A, 2)", "(B, 1)"]
 * search:
 *   sampler: exhaustive
 *   trials: 100
 *   seed: 42
 *   deviation_scope: declared_activities
 *   restrict_to_center_activities: true
 *   parallelism: 1
 *   mode: one          # one | all
 * </pre>
 *
 * Directory structure for {@link #listScenarios(Path)}:
 * <pre>
 * config/
 *   scenarios/
 *     capacity-basic.test
 *     shared-hike.yaml
 *     club-night/
 *       scenario.yaml
 * </pre>
 */
public class ScenarioConfigLoader {

    private final Yaml yaml;
    private final ScenarioFileParser testParser;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.testParser = new ScenarioFileParser();
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Load a scenario from a YAML file, a {@code .test} file, or a directory
     * holding {@code scenario.yaml}.
     */
    public ScenarioDefinition loadScenario(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            Path scenarioFile = path.resolve("scenario.yaml");
            if (!Files.exists(scenarioFile)) {
                throw new IOException("scenario.yaml not found in: " + path);
            }
            return loadYaml(scenarioFile);
        }
        if (!Files.exists(path)) {
            throw new IOException("Scenario file not found: " + path);
        }
        return isYaml(path) ? loadYaml(path) : testParser.parse(path);
    }

    public ScenarioDefinition loadYaml(Path yamlFile) throws IOException {
        String fallbackName = yamlFile.getFileName().toString();
        if (fallbackName.equals("scenario.yaml") && yamlFile.getParent() != null) {
            fallbackName = yamlFile.getParent().getFileName().toString();
        }
        try (InputStream is = Files.newInputStream(yamlFile)) {
            return parse(loadMap(is, yamlFile.toString()), fallbackName, yamlFile.toString());
        }
    }

    public ScenarioDefinition loadFromString(String yamlContent) {
        return parse(loadMap(yamlContent, "<string>"), "unnamed", "<string>");
    }

    private Map<String, Object> loadMap(InputStream source, String sourceName) {
        try {
            return asMapping(yaml.load(source), sourceName);
        } catch (YAMLException e) {
            throw new ConfigurationException(sourceName + ": invalid YAML: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> loadMap(String source, String sourceName) {
        try {
            return asMapping(yaml.load(source), sourceName);
        } catch (YAMLException e) {
            throw new ConfigurationException(sourceName + ": invalid YAML: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMapping(Object raw, String sourceName) {
        if (!(raw instanceof Map)) {
            throw new ConfigurationException(sourceName + ": scenario must be a YAML mapping");
        }
        return (Map<String, Object>) raw;
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private ScenarioDefinition parse(Map<String, Object> raw, String fallbackName, String sourceName) {
        try {
            StarConfiguration.Builder builder = new StarConfiguration.Builder();
            builder.centralPlayer(getString(raw, "central_player", null));
            builder.leafPlayers(getStringList(raw, "leaf_players"));
            parseActivities(raw.get("activities"), builder);
            parsePreferences(raw.get("preferences"), builder);

            SearchPolicy policy = buildPolicy(raw.get("search"));
            return new ScenarioDefinition(
                getString(raw, "name", stripExtension(fallbackName)),
                getString(raw, "description", ""),
                builder.build(),
                policy);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(sourceName + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private void parseActivities(Object value, StarConfiguration.Builder builder) {
        if (value == null) {
            return;
        }
        if (value instanceof List) {
            for (Object activity : (List<Object>) value) {
                builder.activity(String.valueOf(activity));
            }
        } else if (value instanceof Map) {
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
                builder.activity(String.valueOf(entry.getKey()), toCapacity(entry.getValue()));
            }
        } else {
            for (String activity : splitList(value.toString())) {
                builder.activity(activity);
            }
        }
    }

    private Capacity toCapacity(Object value) {
        if (value == null) {
            return Capacity.unbounded();
        }
        if (value instanceof Number) {
            if (value instanceof Double && ((Double) value).isInfinite()) {
                return Capacity.unbounded();
            }
            return Capacity.of(toInt(value, "capacity"));
        }
        return ScenarioFileParser.parseCapacity(value.toString().trim());
    }

    @SuppressWarnings("unchecked")
    private void parsePreferences(Object value, StarConfiguration.Builder builder) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("preferences must map each player to a list");
        }
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
            String player = String.valueOf(entry.getKey());
            builder.preferences(player, toPreferenceList(player, entry.getValue()));
        }
    }

    @SuppressWarnings("unchecked")
    private PreferenceList toPreferenceList(String player, Object value) {
        if (value == null) {
            return new PreferenceList(Collections.emptyList());
        }
        if (value instanceof String) {
            return ScenarioFileParser.parsePreferences(((String) value).trim());
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("preferences of '" + player + "' must be a list");
        }
        List<PreferenceEntry> entries = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (item instanceof List && ((List<Object>) item).size() == 2) {
                List<Object> pair = (List<Object>) item;
                entries.add(new PreferenceEntry(String.valueOf(pair.get(0)), toInt(pair.get(1), "group size")));
            } else if (item instanceof String) {
                entries.addAll(ScenarioFileParser.parsePreferences(((String) item).trim()).getEntries());
            } else {
                throw new ConfigurationException("preference '" + item + "' of '" + player
                    + "' must be [activity, size] or \"(activity, size)\"");
            }
        }
        return new PreferenceList(entries);
    }

    @SuppressWarnings("unchecked")
    private SearchPolicy buildPolicy(Object value) {
        if (value == null) {
            return SearchPolicy.DEFAULT;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("search must be a mapping");
        }
        Map<String, Object> search = (Map<String, Object>) value;
        SearchPolicy.Builder builder = new SearchPolicy.Builder();

        try {
            if (search.containsKey("sampler")) {
                builder.sampler(enumValue(SamplerStrategy.class, search.get("sampler"), "sampler"));
            }
            if (search.containsKey("trials")) {
                builder.trials(toInt(search.get("trials"), "trials"));
            }
            if (search.containsKey("seed")) {
                Object seed = search.get("seed");
                if (!(seed instanceof Integer || seed instanceof Long)) {
                    throw new ConfigurationException("seed must be a 64-bit integer, got '" + seed + "'");
                }
                builder.seed(((Number) seed).longValue());
            }
            if (search.containsKey("deviation_scope")) {
                builder.deviationScope(enumValue(DeviationScope.class, search.get("deviation_scope"),
                    "deviation_scope"));
            }
            if (search.containsKey("restrict_to_center_activities")) {
                builder.restrictToCenterActivities(getBoolean(search, "restrict_to_center_activities", true));
            }
            if (search.containsKey("parallelism")) {
                builder.parallelism(toInt(search.get("parallelism"), "parallelism"));
            }
            if (search.containsKey("mode")) {
                builder.mode(parseMode(String.valueOf(search.get("mode"))));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("search: " + e.getMessage(), e);
        }
        return builder.build();
    }

    static Mode parseMode(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "one":
            case "find_one":
                return Mode.FIND_ONE;
            case "all":
            case "find_all":
                return Mode.FIND_ALL;
            default:
                throw new ConfigurationException("mode must be 'one' or 'all', got '" + value + "'");
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, Object value, String field) {
        String normalized = String.valueOf(value).trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown " + field + " '" + value + "', expected one of "
                + Arrays.toString(type.getEnumConstants()));
        }
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List scenario files and directories under {@code configRoot/scenarios}, sorted by name.
     */
    public List<String> listScenarios(Path configRoot) throws IOException {
        Path scenariosDir = configRoot.resolve("scenarios");
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(p -> Files.isDirectory(p)
                        ? Files.exists(p.resolve("scenario.yaml"))
                        : isYaml(p) || p.getFileName().toString().endsWith(".test"))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString().trim() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        List<String> items = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                items.add(String.valueOf(item).trim());
            }
        } else if (value != null) {
            items.addAll(splitList(value.toString()));
        }
        return items;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value != null) {
            throw new ConfigurationException(key + " must be true or false, got '" + value + "'");
        }
        return defaultValue;
    }

    /**
     * Integer-valued YAML scalar that fits an int; fractions and wider values are rejected.
     */
    private static int toInt(Object value, String field) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            throw new ConfigurationException(field + " out of range, got '" + value + "'");
        }
        throw new ConfigurationException(field + " must be an integer, got '" + value + "'");
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
