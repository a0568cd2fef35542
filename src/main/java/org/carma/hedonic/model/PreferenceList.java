package org.carma.hedonic.model;

import java.util.*;

/**
 * Strictly ordered list of acceptable (activity, group size) pairs.
 *
 * Earlier entries are preferred. Stability only asks for membership; the rank
 * is used as a sampling weight by the rank-weighted sampler:
 *   weight(a) = |list| - min{ i : entry_i.activity = a }
 */
public final class PreferenceList {

    private final List<PreferenceEntry> entries;

    public PreferenceList(List<PreferenceEntry> entries) {
        Objects.requireNonNull(entries, "Preference entries cannot be null");
        Set<PreferenceEntry> seen = new HashSet<>();
        for (PreferenceEntry entry : entries) {
            if (!seen.add(entry)) {
                throw new ConfigurationException("Duplicate preference entry " + entry);
            }
        }
        this.entries = List.copyOf(entries);
    }

    /**
     * Create a preference list from varargs (activity, size) pairs.
     */
    public static PreferenceList of(Object... args) {
        if (args.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must be (String, Integer) pairs");
        }
        List<PreferenceEntry> list = new ArrayList<>();
        for (int i = 0; i < args.length; i += 2) {
            String activity = (String) args[i];
            int size = ((Number) args[i + 1]).intValue();
            list.add(new PreferenceEntry(activity, size));
        }
        return new PreferenceList(list);
    }

    public List<PreferenceEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean accepts(String activity, int groupSize) {
        for (PreferenceEntry entry : entries) {
            if (entry.groupSize() == groupSize && entry.activity().equals(activity)) {
                return true;
            }
        }
        return false;
    }

    public boolean mentions(String activity) {
        return rankOf(activity) >= 0;
    }

    /**
     * Index of the best-ranked entry naming {@code activity}, or -1.
     */
    public int rankOf(String activity) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).activity().equals(activity)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Sampling weight of an activity; 0 when it is not mentioned.
     */
    public int weightOf(String activity) {
        int rank = rankOf(activity);
        return rank < 0 ? 0 : entries.size() - rank;
    }

    /**
     * Distinct activities in first-mention order.
     */
    public List<String> activities() {
        Set<String> ordered = new LinkedHashSet<>();
        for (PreferenceEntry entry : entries) {
            ordered.add(entry.activity());
        }
        return new ArrayList<>(ordered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((PreferenceList) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PreferenceEntry entry : entries) {
            if (sb.length() > 0) {
                sb.append(" > ");
            }
            sb.append(entry);
        }
        return sb.toString();
    }
}
