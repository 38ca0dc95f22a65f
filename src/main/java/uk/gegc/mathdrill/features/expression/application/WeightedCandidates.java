package uk.gegc.mathdrill.features.expression.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * Integer candidates with draw weights, stored as contiguous buckets.
 *
 * <p>Each bucket covers {@code [from, to]} and gives every value inside it the same weight, so a
 * wide interval costs one entry. Drawing walks the cumulative weights with a binary search.</p>
 */
public final class WeightedCandidates {

    private static final WeightedCandidates EMPTY = new WeightedCandidates(List.of(), new long[0]);

    private final List<Bucket> buckets;
    private final long[] cumulativeWeights;

    private WeightedCandidates(List<Bucket> buckets, long[] cumulativeWeights) {
        this.buckets = buckets;
        this.cumulativeWeights = cumulativeWeights;
    }

    public static WeightedCandidates empty() {
        return EMPTY;
    }

    public static WeightedCandidates uniform(long from, long to) {
        return builder().addRange(from, to, 1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public long totalWeight() {
        return cumulativeWeights.length == 0 ? 0 : cumulativeWeights[cumulativeWeights.length - 1];
    }

    public long distinctCount() {
        long count = 0;
        for (Bucket bucket : buckets) {
            count += bucket.to() - bucket.from() + 1;
        }
        return count;
    }

    public boolean contains(long value) {
        return weightOf(value) > 0;
    }

    /**
     * Total weight of {@code value}, summed over every bucket that covers it.
     */
    public long weightOf(long value) {
        long weight = 0;
        for (Bucket bucket : buckets) {
            if (value >= bucket.from() && value <= bucket.to()) {
                weight += bucket.weightEach();
            }
        }
        return weight;
    }

    /**
     * Distinct values in ascending order. Meant for small candidate sets.
     */
    public List<Integer> values() {
        TreeSet<Integer> values = new TreeSet<>();
        for (Bucket bucket : buckets) {
            for (long v = bucket.from(); v <= bucket.to(); v++) {
                values.add((int) v);
            }
        }
        return new ArrayList<>(values);
    }

    public int draw(Random random) {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot draw from an empty candidate set");
        }
        long ticket = random.nextLong(totalWeight());
        int index = bucketIndexFor(ticket);
        Bucket bucket = buckets.get(index);
        long offset = ticket - (index == 0 ? 0 : cumulativeWeights[index - 1]);
        return Math.toIntExact(bucket.from() + offset / bucket.weightEach());
    }

    // first bucket whose cumulative weight exceeds the ticket
    private int bucketIndexFor(long ticket) {
        int low = 0;
        int high = cumulativeWeights.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulativeWeights[mid] > ticket) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        return "WeightedCandidates" + buckets;
    }

    record Bucket(long from, long to, long weightEach) {
    }

    public static final class Builder {
        private final List<Bucket> buckets = new ArrayList<>();

        private Builder() {
        }

        public Builder add(long value, long weight) {
            return addRange(value, value, weight);
        }

        /**
         * Adds every value in {@code [from, to]} with the given weight. Empty intervals and
         * non-positive weights are ignored.
         */
        public Builder addRange(long from, long to, long weightEach) {
            if (from <= to && weightEach > 0) {
                buckets.add(new Bucket(from, to, weightEach));
            }
            return this;
        }

        public WeightedCandidates build() {
            if (buckets.isEmpty()) {
                return EMPTY;
            }
            long[] cumulative = new long[buckets.size()];
            long running = 0;
            for (int i = 0; i < buckets.size(); i++) {
                Bucket bucket = buckets.get(i);
                running = Math.addExact(running, Math.multiplyExact(bucket.to() - bucket.from() + 1, bucket.weightEach()));
                cumulative[i] = running;
            }
            return new WeightedCandidates(List.copyOf(buckets), cumulative);
        }
    }
}
