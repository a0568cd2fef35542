package org.carma.hedonic.model;

/**
 * The two mutually exclusive ways a configuration constrains leaf players.
 */
public enum ConfigurationStyle {
    CAPACITY("Capacity", "Activities carry a maximum occupancy shared by all players"),
    PREFERENCE("Preference", "Each player ranks acceptable (activity, group size) pairs");

    private final String displayName;
    private final String description;

    ConfigurationStyle(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
