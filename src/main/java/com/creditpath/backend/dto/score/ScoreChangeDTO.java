package com.creditpath.backend.dto.score;

import java.time.LocalDate;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.ScoreMovement;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoreChangeDTO {
    private Bureau bureau;
    private int score;
    private LocalDate observedDate;
    private Integer previousScore;
    private int change;
    private ScoreMovement movement;
}
