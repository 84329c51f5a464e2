package com.di.healthnova.insight;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read side of insight results: a user's current insights ranked by confidence, then recency.
 * When one rule has results for overlapping windows, only the highest-ranked of them is returned.
 */
@Service
@RequiredArgsConstructor
public class InsightFeed {

    static final Comparator<InsightResult> RANKING = Comparator
            .comparingDouble(InsightResult::getConfidence).reversed()
            .thenComparing(InsightResult::getWindowEnd, Comparator.reverseOrder())
            .thenComparing(InsightResult::getRuleId);

    private final InsightRepository repository;

    public List<InsightResult> query(String userId) {
        return query(userId, Integer.MAX_VALUE);
    }

    public List<InsightResult> query(String userId, int limit) {
        List<InsightResult> ranked = new ArrayList<>(repository.findByUser(userId));
        ranked.sort(RANKING);
        List<InsightResult> feed = new ArrayList<>();
        for (InsightResult candidate : ranked) {
            if (feed.size() >= limit) break;
            boolean shadowed = feed.stream()
                    .anyMatch(kept -> kept.getRuleId().equals(candidate.getRuleId()) && kept.overlaps(candidate));
            if (!shadowed) {
                feed.add(candidate);
            }
        }
        return feed;
    }
}
