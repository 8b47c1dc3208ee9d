package com.szwego.ecommerce.flink.retry;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * 重试终态: SUCCEEDED / EXHAUSTED / ABORTED
 */
public class RetryOutcome {

    private final RetryController.State state;
    private final int attempts;
    private final Exception lastError;
    private final List<Duration> backoffs;

    RetryOutcome(RetryController.State state, int attempts, Exception lastError,
                 List<Duration> backoffs) {
        this.state = state;
        this.attempts = attempts;
        this.lastError = lastError;
        this.backoffs = Collections.unmodifiableList(backoffs);
    }

    public boolean isSuccess() {
        return state == RetryController.State.SUCCEEDED;
    }

    public RetryController.State getState() { return state; }
    public int getAttempts() { return attempts; }
    public Exception getLastError() { return lastError; }

    /** 实际执行过的退避时长, 按顺序 */
    public List<Duration> getBackoffs() { return backoffs; }
}
