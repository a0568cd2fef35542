package org.carma.hedonic.mechanism;

import org.carma.hedonic.model.*;

import java.util.*;

/**
 * Full Cartesian product of every leaf's colour list, enumerated lazily.
 *
 * Capacity-style leaves range over the subset plus void; preference-style
 * leaves over their acceptable colours only. The first leaf varies slowest.
 * Cost is the product of the list sizes, exponential in the number of leaves.
 */
public class ExhaustiveSampler implements ColouringSampler {

    @Override
    public Iterable<Map<String, String>> sample(StarConfiguration config, List<String> activitySubset, Random random) {
        List<String> leaves = config.getLeafPlayers();
        List<List<String>> domains = new ArrayList<>(leaves.size());
        for (String leaf : leaves) {
            domains.add(ColouringSampler.acceptableColours(config, leaf, activitySubset));
        }
        return () -> new ProductIterator(leaves, domains);
    }

    /**
     * Number of colourings this sampler yields for the subset.
     */
    public long count(StarConfiguration config, List<String> activitySubset) {
        long total = 1;
        for (String leaf : config.getLeafPlayers()) {
            int size = ColouringSampler.acceptableColours(config, leaf, activitySubset).size();
            if (total > Long.MAX_VALUE / size) {
                return Long.MAX_VALUE;
            }
            total *= size;
        }
        return total;
    }

    @Override
    public String getName() {
        return "Exhaustive";
    }

    // ========================================================================
    // Odometer
    // ========================================================================

    private static final class ProductIterator implements Iterator<Map<String, String>> {
        private final List<String> leaves;
        private final List<List<String>> domains;
        private final int[] digits;
        private boolean hasNext;

        ProductIterator(List<String> leaves, List<List<String>> domains) {
            this.leaves = leaves;
            this.domains = domains;
            this.digits = new int[leaves.size()];
            this.hasNext = domains.stream().noneMatch(List::isEmpty);
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public Map<String, String> next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            Map<String, String> colouring = new LinkedHashMap<>();
            for (int i = 0; i < leaves.size(); i++) {
                colouring.put(leaves.get(i), domains.get(i).get(digits[i]));
            }
            advance();
            return colouring;
        }

        private void advance() {
            for (int i = digits.length - 1; i >= 0; i--) {
                digits[i]++;
                if (digits[i] < domains.get(i).size()) {
                    return;
                }
                digits[i] = 0;
            }
            hasNext = false;
        }
    }
}
