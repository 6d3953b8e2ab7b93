package com.creditpath.backend.services;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.repositories.DisputeHistoryRepository;
import com.creditpath.backend.repositories.ScoreRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Single read path into the collaborator stores. A store that is not deployed
 * reads as empty, as does a null result.
 */
@Slf4j
@Component
public class ClientRecordsReader {

    private final ObjectProvider<ScoreRecordRepository> scoreRecords;
    private final ObjectProvider<DisputeHistoryRepository> disputeHistory;

    public ClientRecordsReader(
            ObjectProvider<ScoreRecordRepository> scoreRecords,
            ObjectProvider<DisputeHistoryRepository> disputeHistory
    ) {
        this.scoreRecords = scoreRecords;
        this.disputeHistory = disputeHistory;
    }

    public boolean hasScoreRecords() {
        return scoreRecords.getIfAvailable() != null;
    }

    public boolean hasDisputeHistory() {
        return disputeHistory.getIfAvailable() != null;
    }

    public List<ScoreObservation> observations(UUID clientId) {
        return read(scoreRecords, "score records", r -> r.findByClientIdOrderByObservedDateAsc(clientId));
    }

    public List<ScoreObservation> observations(UUID clientId, Bureau bureau) {
        return read(scoreRecords, "score records", r -> r.findByClientIdAndBureauOrderByObservedDateAsc(clientId, bureau));
    }

    public List<NegativeItem> items(UUID clientId) {
        return read(scoreRecords, "score records", r -> r.findItemsByClientId(clientId));
    }

    public List<DisputeAttempt> disputes(UUID clientId) {
        return read(disputeHistory, "dispute history", r -> r.findByClientId(clientId));
    }

    public List<DisputeAttempt> disputes(UUID creditItemId, Bureau bureau) {
        if (creditItemId == null) {
            return List.of();
        }
        return read(disputeHistory, "dispute history", r -> r.findByCreditItemIdAndBureau(creditItemId, bureau));
    }

    private static <R, T> List<T> read(ObjectProvider<R> provider, String store, Function<R, List<T>> query) {
        R repository = provider.getIfAvailable();
        if (repository == null) {
            log.debug("[Records] No {} store configured, reading as empty", store);
            return List.of();
        }
        List<T> values = query.apply(repository);
        return values != null ? values : List.of();
    }
}
