package com.di.healthnova.insight;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.exception.EvaluationCancelledException;
import com.di.healthnova.model.TimeRange;
import com.di.healthnova.stats.StatisticsEngine;
import com.di.healthnova.store.InMemoryTimeSeriesStore;
import com.di.healthnova.store.StoreSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static com.di.healthnova.insight.InsightFixtures.DAY0;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightEngine Tests")
class InsightEngineTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");
    private static final ZoneId UTC = ZoneOffset.UTC;

    private final Clock clock = Clock.fixed(NOW, UTC);
    private final InsightEngine engine = new InsightEngine(new StatisticsEngine(new HealthNovaProperties()), clock);

    private InMemoryTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
        InsightFixtures.seedStepsAndSleep(store, "u1");
    }

    private StoreSnapshot snapshot(InsightRule rule) {
        return store.snapshot("u1", InsightRuleCatalog.of(rule).referencedMetricTypes(), TimeRange.all());
    }

    @Test
    @DisplayName("Should pick the lag with the strongest significant correlation")
    void testEvaluate_FindsLag() {
        InsightRule rule = InsightFixtures.stepsSleepRule("steps_sleep", 14);

        InsightResult result = engine.evaluate(rule, snapshot(rule), UTC, new CancellationToken("u1", clock)).orElseThrow();

        assertEquals("steps_sleep", result.getRuleId());
        assertEquals("u1", result.getUserId());
        assertEquals(1, result.getLagDays());
        assertEquals(1.0, result.getEffectSize(), 1e-9);
        assertEquals(20, result.getSampleCount());
        assertTrue(result.getConfidence() > 0.99);
        assertEquals(DAY0.plusDays(20), result.getWindowEnd());
        assertEquals(DAY0.plusDays(20).minusDays(27), result.getWindowStart());
        assertEquals(NOW, result.getComputedAt());
        assertEquals("steps higher sleep_duration lag 1 n=20", result.getRenderedText());
    }

    @Test
    @DisplayName("Should use labels in rendered text when the rule has them")
    void testEvaluate_Labels() {
        InsightRule rule = InsightFixtures.stepsSleepRule("steps_sleep", 14);
        rule.setPredicateLabel("daily steps");
        rule.setEffectLabel("sleep");
        rule.setTemplate("More {predicate}, {direction} {effect} ({confidence})");

        String text = engine.evaluate(rule, snapshot(rule), UTC, new CancellationToken("u1", clock))
                .orElseThrow().getRenderedText();

        assertEquals("More daily steps, higher sleep (100%)", text);
    }

    @Test
    @DisplayName("Should stay silent below the minimum sample count")
    void testEvaluate_TooFewSamples() {
        InsightRule rule = InsightFixtures.stepsSleepRule("steps_sleep", 25);

        assertTrue(engine.evaluate(rule, snapshot(rule), UTC, new CancellationToken("u1", clock)).isEmpty());
    }

    @Test
    @DisplayName("Should stay silent without data")
    void testEvaluate_NoData() {
        InsightRule rule = InsightFixtures.weightRule();

        assertTrue(engine.evaluate(rule, snapshot(rule), UTC, new CancellationToken("u1", clock)).isEmpty());
    }

    @Test
    @DisplayName("Should ignore records of other providers when the rule pins one")
    void testEvaluate_ProviderPinned() {
        InsightRule rule = InsightFixtures.stepsSleepRule("steps_sleep", 14);
        rule.setProvider("fitbit");

        assertTrue(engine.evaluate(rule, snapshot(rule), UTC, new CancellationToken("u1", clock)).isEmpty());
    }

    @Test
    @DisplayName("Should stop at a checkpoint once cancelled")
    void testEvaluate_Cancelled() {
        InsightRule rule = InsightFixtures.stepsSleepRule("steps_sleep", 14);
        CancellationToken token = new CancellationToken("u1", clock);
        token.cancel();

        assertThrows(EvaluationCancelledException.class, () -> engine.evaluate(rule, snapshot(rule), UTC, token));
    }
}
