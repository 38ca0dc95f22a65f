package uk.gegc.mathdrill.features.expression.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.domain.model.NumberRange;
import uk.gegc.mathdrill.shared.config.ExpressionGenerationProperties;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Random;
import java.util.TreeSet;

/**
 * Composite integers inside a range, used to seed multiplication results.
 *
 * <p>A value counts when it is neither prime nor one of {@code -1, 0, 1}; negative composites are
 * the negations of positive ones. Zero is added whenever the range spans it.</p>
 *
 * <p>One prime table is shared by every range. It holds a sieve up to the largest magnitude seen
 * so far, capped at the configured absolute bound, together with per-word prime counts, so
 * counting and selecting composites in a range never materializes them.</p>
 */
@Slf4j
@Component
public class CompositeIndex {

    private final int maxBound;
    private volatile PrimeTable table = PrimeTable.build(1);

    public CompositeIndex(ExpressionGenerationProperties properties) {
        this.maxBound = properties.getMaxAbsoluteBound();
    }

    /**
     * Number of composites in {@code range}, zero included when the range spans it.
     */
    public long count(NumberRange range) {
        PrimeTable primes = tableFor(range);
        return negativeCount(primes, range) + (range.spansZero() ? 1 : 0) + positiveCount(primes, range);
    }

    /**
     * The composite at position {@code rank} when the composites of {@code range} are sorted
     * ascending.
     */
    public int select(NumberRange range, long rank) {
        PrimeTable primes = tableFor(range);
        long negatives = negativeCount(primes, range);
        long zero = range.spansZero() ? 1 : 0;
        long positives = positiveCount(primes, range);
        if (rank < 0 || rank >= negatives + zero + positives) {
            throw new IndexOutOfBoundsException("Rank " + rank + " outside the composites of " + range);
        }
        if (rank < negatives) {
            // ascending values run through the magnitudes in descending order
            return -primes.nthComposite(negativeFrom(range), -range.min(), negatives - 1 - rank);
        }
        if (rank < negatives + zero) {
            return 0;
        }
        return primes.nthComposite(positiveFrom(range), range.max(), rank - negatives - zero);
    }

    /**
     * Uniform draw over the composites of {@code range}.
     *
     * @throws IllegalStateException when the range holds no composite
     */
    public int draw(NumberRange range, Random random) {
        long total = count(range);
        if (total == 0) {
            throw new IllegalStateException("No composite in range " + range);
        }
        return select(range, random.nextLong(total));
    }

    /**
     * Composites of {@code range} as weighted candidates, one bucket per run of consecutive
     * composites.
     */
    public WeightedCandidates candidates(NumberRange range) {
        PrimeTable primes = tableFor(range);
        WeightedCandidates.Builder builder = WeightedCandidates.builder();
        if (range.min() <= -2) {
            List<long[]> runs = primes.compositeRuns(negativeFrom(range), -range.min());
            for (int i = runs.size() - 1; i >= 0; i--) {
                builder.addRange(-runs.get(i)[1], -runs.get(i)[0], 1);
            }
        }
        if (range.spansZero()) {
            builder.add(0, 1);
        }
        if (range.max() >= 2) {
            for (long[] run : primes.compositeRuns(positiveFrom(range), range.max())) {
                builder.addRange(run[0], run[1], 1);
            }
        }
        return builder.build();
    }

    /**
     * All composites of {@code [min, max]}, materialized. Meant for small ranges.
     */
    public static NavigableSet<Integer> composites(int min, int max) {
        int bound = Math.toIntExact(Math.max(Math.abs((long) min), Math.abs((long) max)));
        BitSet primes = sieve(bound);
        NavigableSet<Integer> result = new TreeSet<>();

        if (max > 0) {
            for (int x = Math.max(2, min); x <= max; x++) {
                if (!primes.get(x)) {
                    result.add(x);
                }
            }
        }
        if (min < 0) {
            int from = max >= 0 ? 2 : Math.max(2, -max);
            for (int x = from; x <= -min; x++) {
                if (!primes.get(x)) {
                    result.add(-x);
                }
            }
        }
        if (min <= 0 && max >= 0) {
            result.add(0);
        }
        return result;
    }

    /**
     * Sieve of Eratosthenes; bit {@code i} is set when {@code i} is prime.
     */
    static BitSet sieve(int n) {
        BitSet primes = new BitSet(n + 1);
        if (n < 2) {
            return primes;
        }
        primes.set(2, n + 1);
        for (long i = 2; i * i <= n; i++) {
            if (primes.get((int) i)) {
                for (long j = i * i; j <= n; j += i) {
                    primes.clear((int) j);
                }
            }
        }
        return primes;
    }

    int tableLimit() {
        return table.limit();
    }

    private static int positiveFrom(NumberRange range) {
        return Math.max(2, range.min());
    }

    private static int negativeFrom(NumberRange range) {
        return range.max() >= 0 ? 2 : Math.max(2, -range.max());
    }

    private static long positiveCount(PrimeTable primes, NumberRange range) {
        return range.max() < 2 ? 0 : primes.compositeCount(positiveFrom(range), range.max());
    }

    private static long negativeCount(PrimeTable primes, NumberRange range) {
        return range.min() > -2 ? 0 : primes.compositeCount(negativeFrom(range), -range.min());
    }

    private PrimeTable tableFor(NumberRange range) {
        return tableFor(range.maxAbsolute());
    }

    private PrimeTable tableFor(long bound) {
        if (bound > maxBound) {
            throw new IllegalArgumentException(
                    "Magnitude " + bound + " exceeds the composite index bound of " + maxBound);
        }
        PrimeTable current = table;
        if (current.limit() >= bound) {
            return current;
        }
        synchronized (this) {
            if (table.limit() < bound) {
                int limit = (int) Math.min(maxBound, Math.max(bound, 2L * table.limit()));
                table = PrimeTable.build(limit);
                log.debug("Extended prime table to {}", limit);
            }
            return table;
        }
    }

    /**
     * Immutable sieve over {@code [0, limit]} with prime counts per 64-bit word.
     */
    private record PrimeTable(int limit, BitSet primes, long[] words, int[] wordPrefix) {

        static PrimeTable build(int limit) {
            BitSet primes = sieve(limit);
            long[] words = primes.toLongArray();
            int[] prefix = new int[words.length + 1];
            for (int i = 0; i < words.length; i++) {
                prefix[i + 1] = prefix[i] + Long.bitCount(words[i]);
            }
            return new PrimeTable(limit, primes, words, prefix);
        }

        // primes strictly below x
        long primesBelow(long x) {
            int word = (int) (x >>> 6);
            if (word >= words.length) {
                return wordPrefix[words.length];
            }
            return wordPrefix[word] + Long.bitCount(words[word] & ((1L << (x & 63)) - 1));
        }

        // composites in [2, x), for x >= 2
        long compositesBelow(long x) {
            return (x - 2) - primesBelow(x);
        }

        long compositeCount(long from, long to) {
            return from > to ? 0 : compositesBelow(to + 1) - compositesBelow(from);
        }

        // k-th (0-based) composite in [from, to]
        int nthComposite(long from, long to, long k) {
            long target = compositesBelow(from) + k;
            long low = from;
            long high = to;
            while (low < high) {
                long mid = (low + high) >>> 1;
                if (compositesBelow(mid + 1) > target) {
                    high = mid;
                } else {
                    low = mid + 1;
                }
            }
            return (int) low;
        }

        List<long[]> compositeRuns(long from, long to) {
            List<long[]> runs = new ArrayList<>();
            long cursor = from;
            while (cursor <= to) {
                int nextPrime = primes.nextSetBit((int) cursor);
                long end = (nextPrime < 0 || nextPrime > to) ? to : nextPrime - 1;
                if (cursor <= end) {
                    runs.add(new long[]{cursor, end});
                }
                cursor = nextPrime < 0 ? to + 1 : (long) nextPrime + 1;
            }
            return runs;
        }
    }
}
