package com.creditpath.backend.services.strategy;

import lombok.Value;

/**
 * Points a score is expected to recover when an item is removed.
 */
@Value
public class ScoreImpactRange {
    int min;
    int max;
}
