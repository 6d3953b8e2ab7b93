package com.creditpath.backend.dto.strategy;

import com.creditpath.backend.enums.PreviousResult;
import com.creditpath.backend.enums.StrategyRound;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RoundDecisionDTO {
    private StrategyRound round;
    private PreviousResult previousResult;
    private int priorAttempts;

    public int getRoundNumber() {
        return round.getNumber();
    }
}
