package com.di.healthnova.stats;

import lombok.Value;
import org.apache.commons.math3.distribution.TDistribution;

import java.time.LocalDate;

/**
 * Pearson coefficient of paired daily values plus its two-sided significance.
 * {@code confidence = 1 - p}, where p comes from the t statistic {@code r * sqrt((n-2) / (1-r^2))}
 * with n-2 degrees of freedom; it grows with |r| and with n.
 */
@Value
public class CorrelationResult {
    double coefficient;
    int sampleCount;
    int lagDays;
    /** First and last day of the effect series that took part in the pairing. */
    LocalDate windowStart;
    LocalDate windowEnd;
    double pValue;

    public static CorrelationResult of(double coefficient, int sampleCount, int lagDays,
                                       LocalDate windowStart, LocalDate windowEnd) {
        return new CorrelationResult(coefficient, sampleCount, lagDays, windowStart, windowEnd,
                pValue(coefficient, sampleCount));
    }

    public double getConfidence() {
        return 1.0 - pValue;
    }

    static double pValue(double r, int n) {
        if (n < 3 || Double.isNaN(r)) {
            return 1.0;
        }
        double r2 = r * r;
        if (r2 >= 1.0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - r2));
        TDistribution distribution = new TDistribution(n - 2);
        return Math.min(1.0, 2.0 * (1.0 - distribution.cumulativeProbability(t)));
    }
}
