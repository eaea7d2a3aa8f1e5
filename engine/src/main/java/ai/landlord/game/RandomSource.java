package ai.landlord.game;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of randomness for shuffling and AI decisions.
 * <p>
 * Production code uses {@link #threadLocal()}; tests inject {@link #seeded(long)} so that a deal
 * and every AI decision made during it are reproducible.
 */
public interface RandomSource {

    /**
     * Returns a uniformly distributed int in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * Returns a uniformly distributed double in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Shuffles the list in place with an unbiased Fisher–Yates permutation.
     */
    <T> void shuffle(List<T> list);

    static RandomSource threadLocal() {
        return new RandomSource() {
            @Override
            public int nextInt(int bound) {
                return ThreadLocalRandom.current().nextInt(bound);
            }

            @Override
            public double nextDouble() {
                return ThreadLocalRandom.current().nextDouble();
            }

            @Override
            public <T> void shuffle(List<T> list) {
                Collections.shuffle(list, ThreadLocalRandom.current());
            }
        };
    }

    /**
     * Creates a deterministic source. Backed by {@link Random}, so it may be shared between
     * threads; the sequence is only reproducible when a single thread draws from it.
     *
     * @param seed the seed
     * @return a reproducible random source
     */
    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return new RandomSource() {
            @Override
            public int nextInt(int bound) {
                return random.nextInt(bound);
            }

            @Override
            public double nextDouble() {
                return random.nextDouble();
            }

            @Override
            public <T> void shuffle(List<T> list) {
                Collections.shuffle(list, random);
            }
        };
    }
}
