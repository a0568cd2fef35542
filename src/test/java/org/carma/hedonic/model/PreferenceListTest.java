package org.carma.hedonic.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreferenceListTest {

    private final PreferenceList list = PreferenceList.of("A", 2, "B", 1, "A", 3);

    @Test
    void acceptsOnlyListedPairs() {
        assertTrue(list.accepts("A", 2));
        assertTrue(list.accepts("A", 3));
        assertFalse(list.accepts("A", 1));
        assertFalse(list.accepts("C", 1));
    }

    @Test
    void rankUsesBestEntry() {
        assertEquals(0, list.rankOf("A"));
        assertEquals(1, list.rankOf("B"));
        assertEquals(-1, list.rankOf("C"));
    }

    @Test
    void weightIsLengthMinusRank() {
        assertEquals(3, list.weightOf("A"));
        assertEquals(2, list.weightOf("B"));
        assertEquals(0, list.weightOf("C"));
    }

    @Test
    void activitiesInFirstMentionOrder() {
        assertEquals(List.of("A", "B"), list.activities());
    }

    @Test
    void duplicateEntryRejected() {
        assertThrows(ConfigurationException.class, () -> PreferenceList.of("A", 2, "A", 2));
    }

    @Test
    void rendersAsRankedChain() {
        assertEquals("(A, 2) > (B, 1) > (A, 3)", list.toString());
    }

    @Test
    void capacityComparisons() {
        Capacity two = Capacity.of(2);
        assertTrue(two.allows(2));
        assertFalse(two.allows(3));
        assertTrue(two.hasRoomAfter(1));
        assertFalse(two.hasRoomAfter(2));
        assertEquals(2, two.clip(5));
        assertEquals(5, Capacity.unbounded().clip(5));
        assertTrue(Capacity.unbounded().hasRoomAfter(Integer.MAX_VALUE - 1));
        assertEquals("inf", Capacity.unbounded().toString());
    }
}
