package com.szwego.ecommerce.flink.retry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class RetryControllerTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryController controller(int maxAttempts, AtomicBoolean stop) {
        return new RetryController(maxAttempts, Duration.ofSeconds(1), sleeps::add, stop::get);
    }

    @Test
    void firstAttemptSucceeds() {
        RetryOutcome outcome = controller(3, new AtomicBoolean()).execute("t", n -> { });

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void succeedsOnThirdAttemptWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();
        RetryOutcome outcome = controller(3, new AtomicBoolean()).execute("t", n -> {
            if (calls.incrementAndGet() < 3) throw new SQLException("connection refused");
        });

        assertEquals(RetryController.State.SUCCEEDED, outcome.getState());
        assertEquals(3, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(sleeps, outcome.getBackoffs());
    }

    @Test
    void exhaustedWithoutSleepingAfterLastAttempt() {
        AtomicInteger calls = new AtomicInteger();
        RetryOutcome outcome = controller(3, new AtomicBoolean()).execute("t", n -> {
            calls.incrementAndGet();
            throw new SQLException("boom " + n);
        });

        assertEquals(RetryController.State.EXHAUSTED, outcome.getState());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
        assertEquals("boom 3", outcome.getLastError().getMessage());
    }

    @Test
    void singleAttemptNeverSleeps() {
        RetryOutcome outcome = controller(1, new AtomicBoolean()).execute("t", n -> {
            throw new IllegalStateException("x");
        });
        assertEquals(RetryController.State.EXHAUSTED, outcome.getState());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void stopRequestAbortsFurtherAttempts() {
        AtomicBoolean stop = new AtomicBoolean();
        AtomicInteger calls = new AtomicInteger();
        RetryOutcome outcome = controller(5, stop).execute("t", n -> {
            calls.incrementAndGet();
            stop.set(true);
            throw new SQLException("down");
        });

        assertEquals(RetryController.State.ABORTED, outcome.getState());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void interruptedSleepAborts() {
        RetryController c = new RetryController(3, Duration.ofMillis(10),
                d -> { throw new InterruptedException(); }, () -> false);
        try {
            RetryOutcome outcome = c.execute("t", n -> { throw new SQLException("down"); });
            assertEquals(RetryController.State.ABORTED, outcome.getState());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void backoffDoubles() {
        Duration base = Duration.ofMillis(500);
        assertEquals(Duration.ofMillis(500), RetryController.backoffFor(base, 0));
        assertEquals(Duration.ofMillis(1000), RetryController.backoffFor(base, 1));
        assertEquals(Duration.ofMillis(4000), RetryController.backoffFor(base, 3));
        assertEquals(Duration.ZERO, RetryController.backoffFor(Duration.ZERO, 2));
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RetryController(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetryController(3, Duration.ofSeconds(-1)));
    }
}
