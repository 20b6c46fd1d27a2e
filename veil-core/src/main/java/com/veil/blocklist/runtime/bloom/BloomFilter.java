package com.veil.blocklist.runtime.bloom;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Probabilistic fast-reject set over domain keys.
 *
 * <p>{@link #mightContain(CharSequence)} never returns {@code false} for a key
 * that was {@link #put(CharSequence) put}; it may return {@code true} for a key
 * that was not. Bit positions are derived by double hashing the two halves of a
 * single Murmur3-128 hash: {@code h1 + i * h2} for {@code i in [0, k)}.
 *
 * <p>There is no removal. Removing a pattern from the exact structures leaves
 * its bits set, so the false-positive rate creeps up under churn; the exact
 * structures stay authoritative and {@link #usage()} exposes saturation.
 *
 * <p>Not thread-safe for concurrent writers.
 */
public final class BloomFilter {

    private static final HashFunction HASH = Hashing.murmur3_128();
    private static final double LN2 = Math.log(2);
    private static final double LN2_SQUARED = LN2 * LN2;
    private static final int MIN_BITS = 64;

    private final BitSet bits;
    private final int numBits;
    private final int numHashFunctions;

    private BloomFilter(int numBits, int numHashFunctions) {
        this.numBits = numBits;
        this.numHashFunctions = numHashFunctions;
        this.bits = new BitSet(numBits);
    }

    /**
     * Sizes the filter so that the false-positive probability stays at or
     * below {@code falsePositiveRate} once {@code expectedInsertions} keys are in.
     */
    public static BloomFilter forExpectedInsertions(long expectedInsertions, double falsePositiveRate) {
        checkArgument(expectedInsertions > 0, "expectedInsertions must be positive: %s", expectedInsertions);
        checkArgument(falsePositiveRate > 0.0 && falsePositiveRate < 1.0,
                "falsePositiveRate must be in (0, 1): %s", falsePositiveRate);
        int numBits = optimalNumBits(expectedInsertions, falsePositiveRate);
        return new BloomFilter(numBits, optimalNumHashFunctions(expectedInsertions, numBits));
    }

    /**
     * Creates a filter with explicit geometry.
     */
    public static BloomFilter withSize(int numBits, int numHashFunctions) {
        checkArgument(numBits > 0, "numBits must be positive: %s", numBits);
        checkArgument(numHashFunctions > 0, "numHashFunctions must be positive: %s", numHashFunctions);
        return new BloomFilter(numBits, numHashFunctions);
    }

    static int optimalNumBits(long expectedInsertions, double falsePositiveRate) {
        double bits = -expectedInsertions * Math.log(falsePositiveRate) / LN2_SQUARED;
        return (int) Math.min(Integer.MAX_VALUE - 1, Math.max(MIN_BITS, Math.ceil(bits)));
    }

    static int optimalNumHashFunctions(long expectedInsertions, long numBits) {
        return Math.max(1, (int) Math.round((double) numBits / expectedInsertions * LN2));
    }

    public void put(CharSequence key) {
        long[] halves = hash(key);
        long combined = halves[0];
        for (int i = 0; i < numHashFunctions; i++) {
            bits.set(index(combined));
            combined += halves[1];
        }
    }

    /**
     * @return {@code false} if the key was definitely never put
     */
    public boolean mightContain(CharSequence key) {
        long[] halves = hash(key);
        long combined = halves[0];
        for (int i = 0; i < numHashFunctions; i++) {
            if (!bits.get(index(combined))) {
                return false;
            }
            combined += halves[1];
        }
        return true;
    }

    /**
     * @return fraction of bits currently set, in {@code [0, 1]}
     */
    public double usage() {
        return (double) bits.cardinality() / numBits;
    }

    /**
     * Theoretical false-positive probability at the current fill level.
     */
    public double expectedFalsePositiveRate() {
        return Math.pow(usage(), numHashFunctions);
    }

    public void clear() {
        bits.clear();
    }

    public int numBits() {
        return numBits;
    }

    public int numHashFunctions() {
        return numHashFunctions;
    }

    private int index(long combined) {
        return (int) ((combined & Long.MAX_VALUE) % numBits);
    }

    private static long[] hash(CharSequence key) {
        HashCode code = HASH.hashString(key, StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.wrap(code.asBytes()).order(ByteOrder.LITTLE_ENDIAN);
        return new long[]{buffer.getLong(0), buffer.getLong(8)};
    }

    @Override
    public String toString() {
        return String.format("BloomFilter{bits=%d, hashes=%d, usage=%.4f}", numBits, numHashFunctions, usage());
    }
}
