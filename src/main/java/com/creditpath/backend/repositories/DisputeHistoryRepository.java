package com.creditpath.backend.repositories;

import java.util.List;
import java.util.UUID;

import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.enums.Bureau;

/**
 * Read access to prior dispute attempts. Implemented by the persistence layer.
 */
public interface DisputeHistoryRepository {

    List<DisputeAttempt> findByCreditItemIdAndBureau(UUID creditItemId, Bureau bureau);

    List<DisputeAttempt> findByClientId(UUID clientId);
}
