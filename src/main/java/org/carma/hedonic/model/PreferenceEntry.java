package org.carma.hedonic.model;

/**
 * One acceptable (activity, total group size) combination for a player.
 */
public record PreferenceEntry(String activity, int groupSize) {

    public PreferenceEntry {
        if (activity == null || activity.isBlank()) {
            throw new ConfigurationException("Preference entry needs an activity");
        }
        if (groupSize < 1) {
            throw new ConfigurationException(
                "Group size must be at least 1 in (" + activity + ", " + groupSize + ")");
        }
    }

    @Override
    public String toString() {
        return "(" + activity + ", " + groupSize + ")";
    }
}
