package com.szwego.ecommerce.flink.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * 有界重试 + 指数退避, 显式状态机
 *
 * <pre>
 * IDLE → ATTEMPTING(n) ─ok──→ SUCCEEDED
 *              │ fail, n &lt; max, 未请求停止 → sleep(base * 2^(n-1)) → ATTEMPTING(n+1)
 *              │ fail, n == max            → EXHAUSTED
 *              │ fail, 已请求停止 / sleep 被中断 → ABORTED
 * </pre>
 *
 * <p>所有异常一视同仁按瞬时故障处理; 这是安全的, 因为被重试的 sink 本身幂等
 */
public class RetryController {

    private static final Logger LOG = LoggerFactory.getLogger(RetryController.class);

    public enum State { IDLE, ATTEMPTING, SUCCEEDED, EXHAUSTED, ABORTED }

    @FunctionalInterface
    public interface Attempt {
        /** @param attemptNumber 从 1 开始 */
        void run(int attemptNumber) throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;
    private final BooleanSupplier stopRequested;

    public RetryController(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, d -> Thread.sleep(d.toMillis()), () -> false);
    }

    public RetryController(int maxAttempts, Duration baseDelay, Sleeper sleeper,
                           BooleanSupplier stopRequested) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got " + baseDelay);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
        this.stopRequested = stopRequested;
    }

    /** 第 attemptIndex 次 (从 0 开始) 失败后的等待时长: base * 2^attemptIndex */
    public static Duration backoffFor(Duration baseDelay, int attemptIndex) {
        int shift = Math.min(Math.max(attemptIndex, 0), 30);
        return baseDelay.multipliedBy(1L << shift);
    }

    public RetryOutcome execute(String label, Attempt attempt) {
        State state = State.IDLE;
        int attemptNumber = 0;
        Exception lastError = null;
        List<Duration> backoffs = new ArrayList<>();

        while (state != State.SUCCEEDED && state != State.EXHAUSTED && state != State.ABORTED) {
            switch (state) {
                case IDLE:
                    state = State.ATTEMPTING;
                    attemptNumber = 1;
                    break;

                case ATTEMPTING:
                    try {
                        LOG.debug("{}: attempt {}/{}", label, attemptNumber, maxAttempts);
                        attempt.run(attemptNumber);
                        state = State.SUCCEEDED;
                    } catch (Exception e) {
                        lastError = e;
                        LOG.warn("{}: attempt {} failed: {}", label, attemptNumber, e.getMessage());
                        state = next(label, attemptNumber, backoffs);
                        if (state == State.ATTEMPTING) {
                            attemptNumber++;
                        }
                    }
                    break;

                default:
                    throw new IllegalStateException("Unexpected retry state " + state);
            }
        }

        if (state == State.EXHAUSTED) {
            LOG.error("{}: All {} attempts failed. Final error: {}",
                    label, maxAttempts, lastError == null ? null : lastError.getMessage());
        } else if (state == State.ABORTED) {
            LOG.warn("{}: retry aborted after attempt {}", label, attemptNumber);
        }
        return new RetryOutcome(state, attemptNumber, lastError, backoffs);
    }

    /** 失败后的迁移: 退避后继续 / 用尽 / 中止 */
    private State next(String label, int attemptNumber, List<Duration> backoffs) {
        if (attemptNumber >= maxAttempts) {
            return State.EXHAUSTED;
        }
        if (stopRequested.getAsBoolean()) {
            LOG.info("{}: stop requested, not scheduling attempt {}", label, attemptNumber + 1);
            return State.ABORTED;
        }
        Duration delay = backoffFor(baseDelay, attemptNumber - 1);
        try {
            sleeper.sleep(delay);
            backoffs.add(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return State.ABORTED;
        }
        return State.ATTEMPTING;
    }
}
