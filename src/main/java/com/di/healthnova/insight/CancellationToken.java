package com.di.healthnova.insight;

import com.di.healthnova.exception.EvaluationCancelledException;
import com.di.healthnova.exception.EvaluationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative stop signal of one evaluation: explicit cancellation or an exhausted execution budget.
 * Work checks {@link #checkpoint()} between units; nothing is interrupted.
 */
public final class CancellationToken {

    private final String userId;
    private final Clock clock;
    private volatile boolean cancelled;
    private volatile Instant deadline;
    private volatile Duration budget;

    public CancellationToken(String userId, Clock clock) {
        this.userId = userId;
        this.clock = clock;
    }

    /** Starts the budget clock; checkpoints after {@code budget} has elapsed fail with a timeout. */
    public void startBudget(Duration budget) {
        this.budget = budget;
        this.deadline = clock.instant().plus(budget);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws EvaluationCancelledException if cancelled
     * @throws EvaluationTimeoutException   if the budget is exhausted
     */
    public void checkpoint() {
        if (cancelled) {
            throw new EvaluationCancelledException(userId);
        }
        Instant limit = deadline;
        if (limit != null && !clock.instant().isBefore(limit)) {
            throw new EvaluationTimeoutException(userId, budget);
        }
    }
}
