package com.creditpath.backend.dto.strategy;

import com.creditpath.backend.enums.StrategyRound;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RoundDTO {
    private int id;
    private String name;
    private String description;
    private String approach;
    private int waitDays;
    private String nextAction;
    private boolean terminal;

    public static RoundDTO from(StrategyRound round) {
        return RoundDTO.builder()
                .id(round.getNumber())
                .name(round.getDisplayName())
                .description(round.getDescription())
                .approach(round.getApproach())
                .waitDays(round.getWaitDays())
                .nextAction(round.getNextAction())
                .terminal(round.isTerminal())
                .build();
    }
}
