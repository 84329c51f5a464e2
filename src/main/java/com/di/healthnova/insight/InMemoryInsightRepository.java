package com.di.healthnova.insight;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory insight repository, partitioned by user. Suitable for single-node and testing.
 * A user's partition is copied on write, so readers never observe a half-applied replacement.
 */
@Component
public class InMemoryInsightRepository implements InsightRepository {

    private record ResultKey(String ruleId, LocalDate windowStart, LocalDate windowEnd) {

        static ResultKey of(InsightResult result) {
            return new ResultKey(result.getRuleId(), result.getWindowStart(), result.getWindowEnd());
        }
    }

    private final Map<String, Map<ResultKey, InsightResult>> resultsByUser = new ConcurrentHashMap<>();

    @Override
    public void save(InsightResult result) {
        resultsByUser.compute(result.getUserId(), (user, partition) -> {
            Map<ResultKey, InsightResult> copy = partition == null ? new LinkedHashMap<>() : new LinkedHashMap<>(partition);
            copy.put(ResultKey.of(result), result);
            return Collections.unmodifiableMap(copy);
        });
    }

    @Override
    public void replaceRule(String userId, String ruleId, InsightResult current) {
        resultsByUser.compute(userId, (user, partition) -> {
            Map<ResultKey, InsightResult> copy = partition == null ? new LinkedHashMap<>() : new LinkedHashMap<>(partition);
            copy.keySet().removeIf(key -> key.ruleId().equals(ruleId));
            if (current != null) {
                copy.put(ResultKey.of(current), current);
            }
            return copy.isEmpty() ? null : Collections.unmodifiableMap(copy);
        });
    }

    @Override
    public List<InsightResult> findByUser(String userId) {
        Map<ResultKey, InsightResult> partition = resultsByUser.get(userId);
        return partition == null ? List.of() : new ArrayList<>(partition.values());
    }

    @Override
    public int deleteUser(String userId) {
        Map<ResultKey, InsightResult> removed = resultsByUser.remove(userId);
        return removed == null ? 0 : removed.size();
    }
}
