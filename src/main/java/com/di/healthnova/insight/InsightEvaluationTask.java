package com.di.healthnova.insight;

import com.di.healthnova.exception.EvaluationCancelledException;
import com.di.healthnova.exception.EvaluationTimeoutException;
import com.di.healthnova.model.TimeRange;
import com.di.healthnova.store.StoreSnapshot;
import com.di.healthnova.store.TimeSeriesStore;
import com.di.healthnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One user's evaluation cycle as an explicit unit of work: snapshot the user's data, evaluate every rule,
 * commit each rule's outcome on its own. Stops cooperatively at the next checkpoint when cancelled or when
 * the budget runs out; rules already committed stay committed. Runs once.
 */
@Slf4j
public class InsightEvaluationTask implements Callable<EvaluationReport> {

    private final String userId;
    private final ZoneId zone;
    private final InsightRuleCatalog catalog;
    private final InsightEngine engine;
    private final TimeSeriesStore store;
    private final InsightRepository repository;
    private final Duration budget;
    private final Clock clock;
    private final CancellationToken token;
    private final CountDownLatch done = new CountDownLatch(1);

    public InsightEvaluationTask(String userId, ZoneId zone, InsightRuleCatalog catalog, InsightEngine engine,
                                 TimeSeriesStore store, InsightRepository repository, Duration budget, Clock clock) {
        this.userId = userId;
        this.zone = zone;
        this.catalog = catalog;
        this.engine = engine;
        this.store = store;
        this.repository = repository;
        this.budget = budget;
        this.clock = clock;
        this.token = new CancellationToken(userId, clock);
    }

    @Override
    public EvaluationReport call() {
        Instant started = clock.instant();
        token.startBudget(budget);
        List<InsightResult> emitted = new ArrayList<>();
        int evaluated = 0;
        int silent = 0;
        EvaluationReport.Outcome outcome = EvaluationReport.Outcome.COMPLETED;
        try (MDC.MDCCloseable u = MDC.putCloseable(MdcPropagation.USER_ID, userId)) {
            token.checkpoint();
            StoreSnapshot snapshot = store.snapshot(userId, catalog.referencedMetricTypes(), TimeRange.all());
            log.debug("[INSIGHT] user={} snapshot: {} record(s)", userId, snapshot.recordCount());
            for (InsightRule rule : catalog.getRules()) {
                token.checkpoint();
                Optional<InsightResult> result = engine.evaluate(rule, snapshot, zone, token);
                token.checkpoint();
                commit(rule, result);
                evaluated++;
                if (result.isPresent()) {
                    emitted.add(result.get());
                } else {
                    silent++;
                }
            }
        } catch (EvaluationTimeoutException e) {
            outcome = EvaluationReport.Outcome.TIMEOUT;
            log.warn("[INSIGHT] user={} stopped after {} rule(s): {}", userId, evaluated, e.getMessage());
        } catch (EvaluationCancelledException e) {
            outcome = EvaluationReport.Outcome.CANCELLED;
            log.info("[INSIGHT] user={} cancelled after {} rule(s)", userId, evaluated);
        } finally {
            done.countDown();
        }
        Duration elapsed = Duration.between(started, clock.instant());
        log.info("[INSIGHT] user={} {}: {} emitted, {} silent, {} ms", userId, outcome, emitted.size(), silent,
                elapsed.toMillis());
        return EvaluationReport.builder()
                .userId(userId)
                .outcome(outcome)
                .emitted(List.copyOf(emitted))
                .rulesEvaluated(evaluated)
                .rulesSilent(silent)
                .elapsed(elapsed)
                .build();
    }

    /** Each cycle's outcome replaces whatever the rule held for the user, including results of older windows. */
    private void commit(InsightRule rule, Optional<InsightResult> result) {
        repository.replaceRule(userId, rule.getRuleId(), result.orElse(null));
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public String getUserId() {
        return userId;
    }

    /** Waits until {@link #call()} has finished; false on timeout. */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
