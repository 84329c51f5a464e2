package com.di.healthnova.insight;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.profile.UserProfileProvider;
import com.di.healthnova.store.TimeSeriesStore;
import com.di.healthnova.util.IngestionMetrics;
import com.di.healthnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Schedules evaluation cycles: at most one in flight per user, any number of users in parallel.
 *
 * <p>Deleting a user cancels the user's in-flight cycle and waits for it to stop before the user's records and
 * results are removed, so a cycle never commits results for a deleted user.
 */
@Slf4j
@Service
public class InsightEvaluationCoordinator {

    private final InsightRuleCatalog catalog;
    private final InsightEngine engine;
    private final TimeSeriesStore store;
    private final InsightRepository repository;
    private final UserProfileProvider profiles;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;
    private final Duration budget;

    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private record InFlight(InsightEvaluationTask task, CompletableFuture<EvaluationReport> future) {
    }

    public InsightEvaluationCoordinator(InsightRuleCatalog catalog, InsightEngine engine, TimeSeriesStore store,
                                        InsightRepository repository, UserProfileProvider profiles,
                                        IngestionMetrics metrics, Clock clock,
                                        @Qualifier("insightExecutor") ExecutorService executor,
                                        HealthNovaProperties properties) {
        this.catalog = catalog;
        this.engine = engine;
        this.store = store;
        this.repository = repository;
        this.profiles = profiles;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = MdcPropagation.wrapExecutor(executor);
        this.budget = properties.getInsights().getEvaluationBudget();
    }

    public InsightEvaluationTask newTask(String userId) {
        return newTask(userId, budget);
    }

    public InsightEvaluationTask newTask(String userId, Duration budget) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return new InsightEvaluationTask(userId, profiles.zoneFor(userId), catalog, engine, store, repository,
                budget, clock);
    }

    /**
     * Runs a cycle and waits for its report. If a cycle for the user is already in flight, waits for that one.
     */
    public EvaluationReport evaluateNow(String userId) {
        return submit(userId).join();
    }

    /**
     * Starts a cycle on the insight executor, or returns the one already in flight for the user.
     */
    public CompletableFuture<EvaluationReport> submit(String userId) {
        return submit(newTask(userId));
    }

    public CompletableFuture<EvaluationReport> submit(InsightEvaluationTask task) {
        String userId = task.getUserId();
        InFlight created = new InFlight(task, new CompletableFuture<>());
        InFlight existing = inFlight.putIfAbsent(userId, created);
        if (existing != null) {
            log.debug("[INSIGHT] user={} already has a cycle in flight", userId);
            return existing.future();
        }
        executor.execute(() -> run(created));
        return created.future();
    }

    /**
     * The entry leaves the in-flight map before its future completes: a caller that resubmits as soon as it
     * observes the result always starts a new cycle.
     */
    private void run(InFlight entry) {
        String userId = entry.task().getUserId();
        EvaluationReport report;
        try {
            report = entry.task().call();
        } catch (RuntimeException e) {
            inFlight.remove(userId, entry);
            log.error("[INSIGHT] user={} cycle failed: {}", userId, e.getMessage(), e);
            entry.future().completeExceptionally(e);
            return;
        }
        inFlight.remove(userId, entry);
        metrics.recordEvaluation(report.getOutcome().name().toLowerCase(Locale.ROOT), report.getEmitted().size(),
                report.getElapsed());
        entry.future().complete(report);
    }

    /** Requests cooperative cancellation of the user's in-flight cycle; false when none is running. */
    public boolean cancel(String userId) {
        InFlight entry = inFlight.get(userId);
        if (entry == null) {
            return false;
        }
        entry.task().cancel();
        log.info("[INSIGHT] user={} cancellation requested", userId);
        return true;
    }

    public boolean isInFlight(String userId) {
        return inFlight.containsKey(userId);
    }

    /**
     * Removes every record and insight result of the user, after stopping any cycle in flight.
     *
     * @return number of canonical records removed
     * @throws IllegalStateException if the in-flight cycle does not stop within the evaluation budget
     */
    public int deleteUser(String userId) {
        InFlight entry = inFlight.get(userId);
        if (entry != null) {
            entry.task().cancel();
            try {
                if (!entry.task().awaitCompletion(budget.plusSeconds(5))) {
                    throw new IllegalStateException("Evaluation for user " + userId + " did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while stopping evaluation for user " + userId, e);
            }
        }
        int records = store.deleteUser(userId);
        int results = repository.deleteUser(userId);
        log.info("[INSIGHT] user={} deleted: {} record(s), {} insight(s)", userId, records, results);
        return records;
    }

    /**
     * Submits one cycle per user and waits for all of them.
     */
    public List<EvaluationReport> sweep(Collection<String> userIds) {
        List<CompletableFuture<EvaluationReport>> futures = new ArrayList<>(userIds.size());
        for (String userId : userIds) {
            futures.add(submit(userId));
        }
        List<EvaluationReport> reports = new ArrayList<>(futures.size());
        for (CompletableFuture<EvaluationReport> f : futures) {
            try {
                reports.add(f.join());
            } catch (RuntimeException e) {
                log.warn("[INSIGHT] sweep: a cycle failed: {}", e.getMessage());
            }
        }
        log.info("[INSIGHT] sweep finished: {} of {} user(s) evaluated", reports.size(), userIds.size());
        return reports;
    }
}
