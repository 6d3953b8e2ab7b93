package com.creditpath.backend.enums;

public enum ScoreBand {
    EXCELLENT(800, "Excellent", "Superior credit profile"),
    VERY_GOOD(740, "Very Good", "Strong credit profile"),
    GOOD(670, "Good", "Acceptable credit profile"),
    FAIR(580, "Fair", "Below average credit profile"),
    POOR(0, "Poor", "Significant credit challenges");

    private final int lowerBound;
    private final String displayName;
    private final String description;

    ScoreBand(int lowerBound, String displayName, String description) {
        this.lowerBound = lowerBound;
        this.displayName = displayName;
        this.description = description;
    }

    public int getLowerBound() {
        return lowerBound;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public static ScoreBand of(int score) {
        for (ScoreBand band : values()) {
            if (score >= band.lowerBound) {
                return band;
            }
        }
        return POOR;
    }
}
