package com.di.healthnova.insight;

import com.di.healthnova.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic evaluation of every user with data. Enabled by healthnova.insights.schedule-enabled=true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "healthnova.insights.schedule-enabled", havingValue = "true")
public class InsightSweepScheduler {

    private final InsightEvaluationCoordinator coordinator;
    private final TimeSeriesStore store;

    @Scheduled(fixedDelayString = "${healthnova.insights.schedule-interval:PT6H}",
            initialDelayString = "${healthnova.insights.schedule-initial-delay:PT1M}")
    public void sweep() {
        List<String> users = store.listUsers();
        log.info("[INSIGHT] scheduled sweep over {} user(s)", users.size());
        coordinator.sweep(users);
    }
}
