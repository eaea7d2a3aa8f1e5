package ai.landlord.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.landlord.game.RandomSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RandomSourceTest {

    @Test
    void sameSeedGivesTheSameSequenceOnOneThread() {
        RandomSource first = RandomSource.seeded(42);
        RandomSource second = RandomSource.seeded(42);
        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextInt(54), second.nextInt(54));
        }
    }

    @Test
    void seededSourceCanBeSharedBetweenTables() throws Exception {
        RandomSource shared = RandomSource.seeded(7);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                results.add(pool.submit(() -> {
                    for (int i = 0; i < 10_000; i++) {
                        int value = shared.nextInt(3);
                        double p = shared.nextDouble();
                        if (value < 0 || value >= 3 || p < 0.0 || p >= 1.0) {
                            return false;
                        }
                    }
                    return true;
                }));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
