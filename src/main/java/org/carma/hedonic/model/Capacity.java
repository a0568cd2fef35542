package org.carma.hedonic.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Maximum occupancy of an activity in a capacity-style configuration.
 *
 * "Unbounded" is an explicit absent limit rather than a numeric infinity, so
 * every comparison stays in integer arithmetic.
 */
public final class Capacity {

    private static final Capacity UNBOUNDED = new Capacity(null);

    private final Integer limit;

    private Capacity(Integer limit) {
        this.limit = limit;
    }

    public static Capacity of(int limit) {
        if (limit <= 0) {
            throw new ConfigurationException("Capacity must be positive, got " + limit);
        }
        return new Capacity(limit);
    }

    public static Capacity unbounded() {
        return UNBOUNDED;
    }

    public boolean isUnbounded() {
        return limit == null;
    }

    public OptionalInt getLimit() {
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    /**
     * Whether {@code occupancy} players fit into the activity.
     */
    public boolean allows(int occupancy) {
        return limit == null || occupancy <= limit;
    }

    /**
     * Whether one more player could join an activity currently holding {@code occupancy}.
     */
    public boolean hasRoomAfter(int occupancy) {
        return allows(occupancy + 1);
    }

    /**
     * Largest group size reachable given the total population.
     */
    public int clip(int population) {
        return limit == null ? population : Math.min(limit, population);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(limit, ((Capacity) o).limit);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(limit);
    }

    @Override
    public String toString() {
        return limit == null ? "inf" : limit.toString();
    }
}
