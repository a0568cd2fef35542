package org.carma.hedonic.model;

/**
 * A guess at the central player's activity and the total number of
 * participants (centre included) in it.
 */
public record CenterHypothesis(String activity, int groupSize) {

    public CenterHypothesis {
        if (groupSize < 1) {
            throw new IllegalArgumentException("Group size must be at least 1, got " + groupSize);
        }
    }

    public static CenterHypothesis of(PreferenceEntry entry) {
        return new CenterHypothesis(entry.activity(), entry.groupSize());
    }

    @Override
    public String toString() {
        return "(" + activity + ", " + groupSize + ")";
    }
}
