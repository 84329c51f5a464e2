package com.di.healthnova.insight;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code insight-rules.yml}.
 */
@Data
public class InsightRulesDocument {
    private String version;
    private List<InsightRule> rules = new ArrayList<>();
}
