package com.creditpath.backend.entities;

import java.time.LocalDate;
import java.util.UUID;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.exceptions.InvalidScoreException;

import lombok.Builder;
import lombok.Value;

/**
 * One bureau score as reported on a given date. Observations are append-only and
 * keyed by (client, bureau, observed date).
 */
@Value
public class ScoreObservation {

    public static final int MIN_SCORE = 300;
    public static final int MAX_SCORE = 850;

    UUID id;
    UUID clientId;
    Bureau bureau;
    int score;
    LocalDate observedDate;
    String note;

    @Builder
    public ScoreObservation(UUID id, UUID clientId, Bureau bureau, int score, LocalDate observedDate, String note) {
        if (clientId == null) {
            throw new InvalidScoreException("Credit score requires a client");
        }
        if (bureau == null) {
            throw new InvalidScoreException("Credit score requires a bureau");
        }
        if (observedDate == null) {
            throw new InvalidScoreException("Credit score requires an observation date");
        }
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidScoreException(
                    String.format("Credit score must be between %d and %d, got %d", MIN_SCORE, MAX_SCORE, score));
        }
        this.id = id;
        this.clientId = clientId;
        this.bureau = bureau;
        this.score = score;
        this.observedDate = observedDate;
        this.note = note;
    }

    public static int clamp(int score) {
        return Math.min(MAX_SCORE, Math.max(MIN_SCORE, score));
    }
}
