package org.carma.hedonic.config;

import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.model.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.regex.*;

/**
 * Parses the line-oriented {@code .test} scenario format.
 *
 * <pre>
 * # comment
 * name: two-activities
 * central_player: C
 * leaf_players: L1, L2
 * activities:
 *   A: 2
 *   B: inf
 * </pre>
 *
 * Activities may instead be listed inline ({@code activities: A, B}), which
 * leaves them unbounded. Preference-style scenarios add a block:
 *
 * <pre>
 * preferences:
 *   C: (A, 2)
 *   L1: (A, 2) > (B, 1)
 * </pre>
 *
 * Any malformed line raises a {@link ConfigurationException} naming the line.
 */
public class ScenarioFileParser {

    private static final Pattern PAIR = Pattern.compile("\\(\\s*([^,()\\s][^,()]*?)\\s*,\\s*(-?\\d+)\\s*\\)");

    private static final Set<String> HEADERS = Set.of(
        "name", "description", "central_player", "leaf_players", "activities", "preferences");

    private enum Block { NONE, ACTIVITIES, PREFERENCES }

    public ScenarioDefinition parse(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return parse(content, file.getFileName().toString());
    }

    public ScenarioDefinition parse(String content, String sourceName) {
        StarConfiguration.Builder builder = new StarConfiguration.Builder();
        Set<String> seenHeaders = new HashSet<>();
        Set<String> preferencePlayers = new HashSet<>();
        String name = stripExtension(sourceName);
        String description = "";
        Block block = Block.NONE;

        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            int colon = line.indexOf(':');
            if (colon < 0) {
                throw error(sourceName, lineNo, "expected 'key: value', got '" + line + "'");
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();

            if (HEADERS.contains(key)) {
                if (!seenHeaders.add(key)) {
                    throw error(sourceName, lineNo, "section '" + key + "' appears twice");
                }
                block = Block.NONE;
                switch (key) {
                    case "name":
                        name = value;
                        break;
                    case "description":
                        description = value;
                        break;
                    case "central_player":
                        builder.centralPlayer(value);
                        break;
                    case "leaf_players":
                        builder.leafPlayers(splitList(value));
                        break;
                    case "activities":
                        if (value.isEmpty()) {
                            block = Block.ACTIVITIES;
                        } else {
                            for (String activity : splitList(value)) {
                                builder.activity(activity);
                            }
                        }
                        break;
                    case "preferences":
                        if (!value.isEmpty()) {
                            throw error(sourceName, lineNo, "preferences must be listed one player per line");
                        }
                        block = Block.PREFERENCES;
                        break;
                    default:
                        break;
                }
                continue;
            }

            try {
                switch (block) {
                    case ACTIVITIES:
                        builder.activity(key, parseCapacity(value));
                        break;
                    case PREFERENCES:
                        if (!preferencePlayers.add(key)) {
                            throw new ConfigurationException("preferences for '" + key + "' appear twice");
                        }
                        builder.preferences(key, parsePreferences(value));
                        break;
                    default:
                        throw new ConfigurationException("unrecognized section '" + key + "'");
                }
            } catch (ConfigurationException e) {
                throw error(sourceName, lineNo, e.getMessage());
            }
        }

        try {
            return new ScenarioDefinition(name, description, builder.build(), SearchPolicy.DEFAULT);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(sourceName + ": " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Value parsing
    // ========================================================================

    static Capacity parseCapacity(String value) {
        if (value.equalsIgnoreCase("inf")) {
            return Capacity.unbounded();
        }
        try {
            return Capacity.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("capacity must be a positive integer or 'inf', got '" + value + "'");
        }
    }

    /**
     * Parses {@code (a, k) > (b, m) > ...}.
     */
    static PreferenceList parsePreferences(String value) {
        List<PreferenceEntry> entries = new ArrayList<>();
        if (value.isEmpty()) {
            return new PreferenceList(entries);
        }
        for (String part : value.split(">")) {
            Matcher m = PAIR.matcher(part.trim());
            if (!m.matches()) {
                throw new ConfigurationException("malformed preference '" + part.trim() + "', expected (activity, size)");
            }
            int groupSize;
            try {
                groupSize = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("group size out of range in '" + part.trim() + "'");
            }
            entries.add(new PreferenceEntry(m.group(1).trim(), groupSize));
        }
        return new PreferenceList(entries);
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value.isEmpty()) {
            return items;
        }
        for (String item : value.split(",")) {
            items.add(item.trim());
        }
        return items;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static ConfigurationException error(String source, int line, String message) {
        return new ConfigurationException(source + ":" + line + ": " + message);
    }
}
