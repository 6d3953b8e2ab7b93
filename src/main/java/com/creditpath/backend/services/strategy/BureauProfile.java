package com.creditpath.backend.services.strategy;

import java.util.List;

import com.creditpath.backend.enums.Bureau;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class BureauProfile {
    Bureau bureau;
    String name;
    String address;
    String onlineDispute;
    @Singular("weakness")
    List<String> weaknesses;
    @Singular("bestTactic")
    List<String> bestTactics;
    String mailingTips;
}
