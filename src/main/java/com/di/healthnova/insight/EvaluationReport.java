package com.di.healthnova.insight;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one user's evaluation cycle. Results of rules finished before a timeout or cancellation are
 * kept and listed in {@code emitted}.
 */
@Value
@Builder
public class EvaluationReport {

    public enum Outcome { COMPLETED, TIMEOUT, CANCELLED }

    String userId;
    Outcome outcome;
    @Builder.Default
    List<InsightResult> emitted = List.of();
    int rulesEvaluated;
    int rulesSilent;
    Duration elapsed;
}
