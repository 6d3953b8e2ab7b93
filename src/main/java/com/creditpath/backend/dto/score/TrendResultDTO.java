package com.creditpath.backend.dto.score;

import java.math.BigDecimal;

import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.TrendDirection;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TrendResultDTO {
    private Bureau bureau;
    private TrendDirection trend;
    private Integer currentScore;
    private Integer pastScore;
    private Integer change;
    private BigDecimal percentChange;
    private int dataPoints;
    private int periodMonths;

    public String getPeriod() {
        return periodMonths + " months";
    }
}
