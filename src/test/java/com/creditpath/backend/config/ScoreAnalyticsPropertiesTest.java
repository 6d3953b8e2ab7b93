package com.creditpath.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.creditpath.backend.enums.Bureau;

class ScoreAnalyticsPropertiesTest {

    @Test
    void missingValuesFallBackToDefaults() {
        ScoreAnalyticsProperties props = ScoreAnalyticsProperties.defaults();

        assertEquals(6, props.trendWindowMonths());
        assertEquals(90, props.anomalyWindowDays());
        assertEquals(30, props.suddenDropThreshold());
        assertEquals(60, props.suddenDropCriticalThreshold());
        assertEquals(40, props.bureauSpreadThreshold());
        assertEquals(80, props.bureauSpreadCriticalThreshold());
        assertEquals(10, props.stagnationRange());
        assertEquals(6, props.expirationMinAgeYears());
        assertEquals(78, props.expirationWarningMonths());
        assertEquals(82, props.expirationCriticalMonths());
        assertEquals(Bureau.EQUIFAX, props.defaultBureau());
        assertEquals(600, props.defaultCurrentScore());
        assertEquals(12, props.historyLimit());
    }

    @Test
    void explicitValuesAreKept() {
        ScoreAnalyticsProperties props = new ScoreAnalyticsProperties(
                3, 30, 25, 50, 35, 70, 5, 5, 70, 80, Bureau.EXPERIAN, 650, 6);

        assertEquals(3, props.trendWindowMonths());
        assertEquals(30, props.anomalyWindowDays());
        assertEquals(Bureau.EXPERIAN, props.defaultBureau());
        assertEquals(650, props.defaultCurrentScore());
    }
}
