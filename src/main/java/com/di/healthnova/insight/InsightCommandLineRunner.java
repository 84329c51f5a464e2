package com.di.healthnova.insight;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Evaluates a user's insights at startup when started with {@code --insights.user=<id>} and logs the ranked
 * feed. Runs after a file given with {@code --ingest.file} has been ingested.
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class InsightCommandLineRunner implements ApplicationRunner {

    static final String USER = "insights.user";

    private final InsightEvaluationCoordinator coordinator;
    private final InsightFeed feed;

    @Override
    public void run(ApplicationArguments args) {
        List<String> values = args.getOptionValues(USER);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return;
        }
        String user = values.get(0).trim();
        EvaluationReport report = coordinator.evaluateNow(user);
        log.info("[INSIGHT-CLI] user={} {}: {} rule(s) evaluated, {} emitted", user, report.getOutcome(),
                report.getRulesEvaluated(), report.getEmitted().size());
        List<InsightResult> ranked = feed.query(user);
        if (ranked.isEmpty()) {
            log.info("[INSIGHT-CLI] No significant insights for user {}", user);
        }
        ranked.forEach(r -> log.info("[INSIGHT-CLI]   [{}] {} ({} to {})", r.getRuleId(), r.getRenderedText(),
                r.getWindowStart(), r.getWindowEnd()));
    }
}
