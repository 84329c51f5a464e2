package com.di.healthnova.insight;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightFeed Tests")
class InsightFeedTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);

    private InMemoryInsightRepository repository;
    private InsightFeed feed;

    @BeforeEach
    void setUp() {
        repository = new InMemoryInsightRepository();
        feed = new InsightFeed(repository);
    }

    private static InsightResult result(String ruleId, LocalDate start, LocalDate end, double confidence) {
        return InsightResult.builder()
                .ruleId(ruleId)
                .userId("u1")
                .windowStart(start)
                .windowEnd(end)
                .confidence(confidence)
                .effectSize(0.6)
                .sampleCount(20)
                .renderedText(ruleId + " " + end)
                .computedAt(Instant.EPOCH)
                .build();
    }

    private static List<String> texts(List<InsightResult> results) {
        return results.stream().map(InsightResult::getRenderedText).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should rank by confidence, then recency, then rule id")
    void testQuery_Ranking() {
        repository.save(result("b_rule", MARCH_1, MARCH_1.plusDays(27), 0.97));
        repository.save(result("a_rule", MARCH_1, MARCH_1.plusDays(27), 0.97));
        repository.save(result("c_rule", MARCH_1, MARCH_1.plusDays(27), 0.99));
        repository.save(result("d_rule", MARCH_1.plusDays(2), MARCH_1.plusDays(29), 0.97));

        assertEquals(List.of("c_rule 2024-03-28", "d_rule 2024-03-30", "a_rule 2024-03-28", "b_rule 2024-03-28"),
                texts(feed.query("u1")));
    }

    @Test
    @DisplayName("Should return only the best of a rule's overlapping windows")
    void testQuery_OverlappingWindows() {
        repository.save(result("steps_sleep", MARCH_1, MARCH_1.plusDays(27), 0.96));
        repository.save(result("steps_sleep", MARCH_1.plusDays(7), MARCH_1.plusDays(34), 0.98));
        repository.save(result("steps_sleep", MARCH_1.plusDays(60), MARCH_1.plusDays(87), 0.95));

        assertEquals(List.of("steps_sleep 2024-04-04", "steps_sleep 2024-05-27"), texts(feed.query("u1")));
    }

    @Test
    @DisplayName("Should keep overlapping windows of different rules")
    void testQuery_DifferentRules() {
        repository.save(result("steps_sleep", MARCH_1, MARCH_1.plusDays(27), 0.96));
        repository.save(result("protein_deep_sleep", MARCH_1, MARCH_1.plusDays(27), 0.96));

        assertEquals(2, feed.query("u1").size());
    }

    @Test
    @DisplayName("Should honour the limit and return nothing for unknown users")
    void testQuery_LimitAndUnknownUser() {
        repository.save(result("a_rule", MARCH_1, MARCH_1.plusDays(27), 0.97));
        repository.save(result("b_rule", MARCH_1, MARCH_1.plusDays(27), 0.98));

        assertEquals(List.of("b_rule 2024-03-28"), texts(feed.query("u1", 1)));
        assertTrue(feed.query("u2").isEmpty());
    }

    @Test
    @DisplayName("Should treat windows sharing a day as overlapping")
    void testOverlaps() {
        InsightResult a = result("r", MARCH_1, MARCH_1.plusDays(6), 0.9);
        InsightResult touching = result("r", MARCH_1.plusDays(6), MARCH_1.plusDays(12), 0.9);
        InsightResult after = result("r", MARCH_1.plusDays(7), MARCH_1.plusDays(12), 0.9);

        assertTrue(a.overlaps(touching));
        assertTrue(touching.overlaps(a));
        assertFalse(a.overlaps(after));
    }
}
