package com.creditpath.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.creditpath.backend.enums.Bureau;

/**
 * Thresholds for trend, anomaly and projection analytics.
 * Bound from application.properties under "creditpath.analytics"; missing or
 * non-positive values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "creditpath.analytics")
public record ScoreAnalyticsProperties(
        int trendWindowMonths,
        int anomalyWindowDays,
        int suddenDropThreshold,
        int suddenDropCriticalThreshold,
        int bureauSpreadThreshold,
        int bureauSpreadCriticalThreshold,
        int stagnationRange,
        int expirationMinAgeYears,
        int expirationWarningMonths,
        int expirationCriticalMonths,
        Bureau defaultBureau,
        int defaultCurrentScore,
        int historyLimit
) {
    public ScoreAnalyticsProperties {
        trendWindowMonths = orDefault(trendWindowMonths, 6);
        anomalyWindowDays = orDefault(anomalyWindowDays, 90);
        suddenDropThreshold = orDefault(suddenDropThreshold, 30);
        suddenDropCriticalThreshold = orDefault(suddenDropCriticalThreshold, 60);
        bureauSpreadThreshold = orDefault(bureauSpreadThreshold, 40);
        bureauSpreadCriticalThreshold = orDefault(bureauSpreadCriticalThreshold, 80);
        stagnationRange = orDefault(stagnationRange, 10);
        expirationMinAgeYears = orDefault(expirationMinAgeYears, 6);
        expirationWarningMonths = orDefault(expirationWarningMonths, 78);
        expirationCriticalMonths = orDefault(expirationCriticalMonths, 82);
        if (defaultBureau == null) {
            defaultBureau = Bureau.EQUIFAX;
        }
        defaultCurrentScore = orDefault(defaultCurrentScore, 600);
        historyLimit = orDefault(historyLimit, 12);
    }

    public static ScoreAnalyticsProperties defaults() {
        return new ScoreAnalyticsProperties(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, 0, 0);
    }

    private static int orDefault(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
