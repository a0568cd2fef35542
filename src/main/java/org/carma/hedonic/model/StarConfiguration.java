package org.carma.hedonic.model;

import java.util.*;

/**
 * Immutable description of a star-shaped hedonic game.
 *
 * Holds:
 * - One central player and an ordered list of leaf players
 * - The declared activities, in declaration order
 * - Either a capacity per activity (capacity style) or a ranked
 *   preference list per player (preference style)
 *
 * The reserved {@link #VOID_ACTIVITY} is always available to every leaf with no
 * occupancy limit and is never declared explicitly.
 *
 * Instances are only obtainable through {@link Builder}, which rejects
 * inconsistent input with a {@link ConfigurationException}.
 */
public final class StarConfiguration {

    /** Sentinel activity meaning "opt out of every activity". */
    public static final String VOID_ACTIVITY = "void";

    private final String centralPlayer;
    private final List<String> leafPlayers;
    private final List<String> activities;
    private final Map<String, Capacity> capacities;
    private final Map<String, PreferenceList> preferences;
    private final ConfigurationStyle style;

    private StarConfiguration(Builder builder, ConfigurationStyle style) {
        this.centralPlayer = builder.centralPlayer;
        this.leafPlayers = List.copyOf(builder.leafPlayers);
        this.activities = List.copyOf(builder.capacities.keySet());
        this.capacities = Collections.unmodifiableMap(new LinkedHashMap<>(builder.capacities));
        this.preferences = Collections.unmodifiableMap(new LinkedHashMap<>(builder.preferences));
        this.style = style;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String getCentralPlayer() {
        return centralPlayer;
    }

    public List<String> getLeafPlayers() {
        return leafPlayers;
    }

    public List<String> getActivities() {
        return activities;
    }

    public ConfigurationStyle getStyle() {
        return style;
    }

    public boolean isPreferenceStyle() {
        return style == ConfigurationStyle.PREFERENCE;
    }

    /**
     * Number of players including the centre; no group can be larger.
     */
    public int getPopulation() {
        return leafPlayers.size() + 1;
    }

    /**
     * Capacity of an activity. Void and preference-style activities are unbounded.
     */
    public Capacity getCapacity(String activity) {
        return capacities.getOrDefault(activity, Capacity.unbounded());
    }

    public Map<String, Capacity> getCapacities() {
        return capacities;
    }

    /**
     * Preference list of a player, or an empty list when none was declared.
     */
    public PreferenceList getPreferences(String playerId) {
        PreferenceList list = preferences.get(playerId);
        return list != null ? list : new PreferenceList(Collections.emptyList());
    }

    public boolean hasPreferences(String playerId) {
        return preferences.containsKey(playerId);
    }

    public boolean isDeclaredActivity(String activity) {
        return capacities.containsKey(activity);
    }

    public static boolean isVoid(String activity) {
        return VOID_ACTIVITY.equals(activity);
    }

    @Override
    public String toString() {
        return String.format("StarConfiguration[%s, center=%s, leaves=%d, activities=%s]",
            style, centralPlayer, leafPlayers.size(), activities);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String centralPlayer;
        private final List<String> leafPlayers = new ArrayList<>();
        private final Map<String, Capacity> capacities = new LinkedHashMap<>();
        private final Map<String, PreferenceList> preferences = new LinkedHashMap<>();
        private final List<String> duplicateActivities = new ArrayList<>();
        private final List<String> duplicatePreferencePlayers = new ArrayList<>();
        private ConfigurationStyle style;

        public Builder centralPlayer(String id) {
            this.centralPlayer = id;
            return this;
        }

        public Builder leafPlayer(String id) {
            leafPlayers.add(id);
            return this;
        }

        public Builder leafPlayers(Collection<String> ids) {
            leafPlayers.addAll(ids);
            return this;
        }

        public Builder leafPlayers(String... ids) {
            return leafPlayers(Arrays.asList(ids));
        }

        /**
         * Declare an activity without a limit.
         */
        public Builder activity(String id) {
            return activity(id, Capacity.unbounded());
        }

        public Builder activity(String id, int capacity) {
            return activity(id, Capacity.of(capacity));
        }

        public Builder activity(String id, Capacity capacity) {
            if (capacities.containsKey(id)) {
                duplicateActivities.add(id);
            }
            capacities.put(id, Objects.requireNonNull(capacity, "Capacity cannot be null"));
            return this;
        }

        public Builder preferences(String playerId, PreferenceList list) {
            if (preferences.containsKey(playerId)) {
                duplicatePreferencePlayers.add(playerId);
            }
            preferences.put(playerId, Objects.requireNonNull(list, "Preference list cannot be null"));
            return this;
        }

        /**
         * Force a style; by default it is inferred from whether preferences were given.
         */
        public Builder style(ConfigurationStyle style) {
            this.style = style;
            return this;
        }

        public StarConfiguration build() {
            if (centralPlayer == null || centralPlayer.isBlank()) {
                throw new ConfigurationException("Central player id is missing");
            }
            if (isVoid(centralPlayer)) {
                throw new ConfigurationException("'" + VOID_ACTIVITY + "' cannot be used as a player id");
            }

            Set<String> seen = new HashSet<>();
            for (String leaf : leafPlayers) {
                if (leaf == null || leaf.isBlank()) {
                    throw new ConfigurationException("Leaf player id cannot be empty");
                }
                if (isVoid(leaf)) {
                    throw new ConfigurationException("'" + VOID_ACTIVITY + "' cannot be used as a player id");
                }
                if (leaf.equals(centralPlayer)) {
                    throw new ConfigurationException(
                        "Central player '" + centralPlayer + "' is also listed as a leaf");
                }
                if (!seen.add(leaf)) {
                    throw new ConfigurationException("Duplicate leaf player '" + leaf + "'");
                }
            }

            if (!duplicateActivities.isEmpty()) {
                throw new ConfigurationException("Duplicate activity '" + duplicateActivities.get(0) + "'");
            }
            if (!duplicatePreferencePlayers.isEmpty()) {
                throw new ConfigurationException(
                    "Preferences given twice for player '" + duplicatePreferencePlayers.get(0) + "'");
            }
            if (capacities.isEmpty()) {
                throw new ConfigurationException("At least one activity must be declared");
            }
            for (String activity : capacities.keySet()) {
                if (activity == null || activity.isBlank()) {
                    throw new ConfigurationException("Activity id cannot be empty");
                }
                if (isVoid(activity)) {
                    throw new ConfigurationException(
                        "'" + VOID_ACTIVITY + "' is reserved and cannot be declared as an activity");
                }
            }

            ConfigurationStyle resolved = style != null ? style
                : (preferences.isEmpty() ? ConfigurationStyle.CAPACITY : ConfigurationStyle.PREFERENCE);

            if (resolved == ConfigurationStyle.CAPACITY) {
                if (!preferences.isEmpty()) {
                    throw new ConfigurationException(
                        "Preference lists given for a capacity-style configuration");
                }
            } else {
                validatePreferences();
            }

            return new StarConfiguration(this, resolved);
        }

        private void validatePreferences() {
            for (Map.Entry<String, Capacity> entry : capacities.entrySet()) {
                if (!entry.getValue().isUnbounded()) {
                    throw new ConfigurationException("Activity '" + entry.getKey()
                        + "' has a capacity, which cannot be combined with preference lists");
                }
            }

            Set<String> players = new HashSet<>(leafPlayers);
            players.add(centralPlayer);
            for (String player : preferences.keySet()) {
                if (!players.contains(player)) {
                    throw new ConfigurationException("Preferences given for unknown player '" + player + "'");
                }
            }

            List<String> everyone = new ArrayList<>();
            everyone.add(centralPlayer);
            everyone.addAll(leafPlayers);
            for (String player : everyone) {
                PreferenceList list = preferences.get(player);
                if (list == null) {
                    throw new ConfigurationException("Player '" + player + "' has no preference list");
                }
                for (PreferenceEntry entry : list.getEntries()) {
                    if (player.equals(centralPlayer) && isVoid(entry.activity())) {
                        throw new ConfigurationException(
                            "Central player cannot list '" + VOID_ACTIVITY + "' as a preference");
                    }
                    if (!isVoid(entry.activity()) && !capacities.containsKey(entry.activity())) {
                        throw new ConfigurationException("Preference " + entry + " of player '" + player
                            + "' references undeclared activity '" + entry.activity() + "'");
                    }
                }
            }
        }
    }
}
