package org.carma.hedonic.model;

import java.util.*;

/**
 * A complete assignment of every player, centre included, to an activity.
 *
 * Carries the centre hypothesis and active subset it was verified under, and
 * the resulting occupancy of every activity in use (centre counted).
 */
public final class Assignment {

    private final String centralPlayer;
    private final CenterHypothesis hypothesis;
    private final List<String> activeSubset;
    private final Map<String, String> leafActivities;
    private final Map<String, Integer> occupancy;

    public Assignment(String centralPlayer, CenterHypothesis hypothesis, List<String> activeSubset,
                      Map<String, String> leafActivities, Map<String, Integer> occupancy) {
        this.centralPlayer = Objects.requireNonNull(centralPlayer, "Central player cannot be null");
        this.hypothesis = Objects.requireNonNull(hypothesis, "Hypothesis cannot be null");
        this.activeSubset = List.copyOf(activeSubset);
        this.leafActivities = Collections.unmodifiableMap(new LinkedHashMap<>(leafActivities));
        this.occupancy = Collections.unmodifiableMap(new LinkedHashMap<>(occupancy));
    }

    public String getCentralPlayer() {
        return centralPlayer;
    }

    public CenterHypothesis getHypothesis() {
        return hypothesis;
    }

    public List<String> getActiveSubset() {
        return activeSubset;
    }

    public String getCenterActivity() {
        return hypothesis.activity();
    }

    /**
     * Leaf to activity mapping, in leaf declaration order.
     */
    public Map<String, String> getLeafActivities() {
        return leafActivities;
    }

    /**
     * Activity of any player, or null for an unknown id.
     */
    public String getActivity(String playerId) {
        if (centralPlayer.equals(playerId)) {
            return hypothesis.activity();
        }
        return leafActivities.get(playerId);
    }

    /**
     * Every player's activity: the leaves in order, then the centre.
     */
    public Map<String, String> asMap() {
        Map<String, String> all = new LinkedHashMap<>(leafActivities);
        all.put(centralPlayer, hypothesis.activity());
        return all;
    }

    public int getOccupancy(String activity) {
        return occupancy.getOrDefault(activity, 0);
    }

    public Map<String, Integer> getOccupancies() {
        return occupancy;
    }

    public List<String> getPlayersIn(String activity) {
        List<String> players = new ArrayList<>();
        if (hypothesis.activity().equals(activity)) {
            players.add(centralPlayer);
        }
        for (Map.Entry<String, String> entry : leafActivities.entrySet()) {
            if (entry.getValue().equals(activity)) {
                players.add(entry.getKey());
            }
        }
        return players;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Assignment that = (Assignment) o;
        return centralPlayer.equals(that.centralPlayer)
            && hypothesis.equals(that.hypothesis)
            && leafActivities.equals(that.leafActivities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(centralPlayer, hypothesis, leafActivities);
    }

    @Override
    public String toString() {
        return "Assignment" + asMap() + " under " + hypothesis;
    }
}
