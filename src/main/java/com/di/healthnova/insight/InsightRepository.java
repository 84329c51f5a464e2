package com.di.healthnova.insight;

import java.util.List;

/**
 * Current insight results. A result is identified by (user, rule, window); writing one supersedes the
 * previous result for the same identity in a single step.
 */
public interface InsightRepository {

    /** Stores the result, replacing any result with the same user, rule and window. */
    void save(InsightResult result);

    /**
     * Makes {@code current} the only result of the rule for the user, whatever windows earlier cycles stored.
     * A null {@code current} leaves the rule without a result. Readers see either the old or the new state.
     */
    void replaceRule(String userId, String ruleId, InsightResult current);

    List<InsightResult> findByUser(String userId);

    int deleteUser(String userId);
}
