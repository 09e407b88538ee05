package com.planguard.core.validator;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedSymbolicValidatorTest {

    @Test
    void testNeverExceedsPermitCount() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxSeen  = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        SymbolicValidator slow = (domain, problem, lines) -> {
            int now = inFlight.incrementAndGet();
            maxSeen.accumulateAndGet(now, Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return ExternalValidation.valid("", 0);
        };

        BoundedSymbolicValidator bounded = new BoundedSymbolicValidator(slow, 2);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<ExternalValidation>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> bounded.validate(Path.of("d"), Path.of("p"), List.of("(pick-up a)"))));
            }

            Thread.sleep(200);
            assertEquals(0, bounded.availablePermits());
            release.countDown();

            for (Future<ExternalValidation> f : futures) {
                assertTrue(f.get(10, TimeUnit.SECONDS).isValid());
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(maxSeen.get() <= 2);
        assertEquals(2, bounded.availablePermits());
    }

    @Test
    void testPermitIsReleasedWhenDelegateThrows() {
        SymbolicValidator failing = (domain, problem, lines) -> {
            throw new IllegalStateException("boom");
        };
        BoundedSymbolicValidator bounded = new BoundedSymbolicValidator(failing, 1);

        assertThrows(IllegalStateException.class,
                () -> bounded.validate(Path.of("d"), Path.of("p"), List.of("(pick-up a)")));
        assertEquals(1, bounded.availablePermits());
    }

    @Test
    void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> new BoundedSymbolicValidator((d, p, l) -> ExternalValidation.valid("", 0), 0));
    }
}
