package com.creditpath.backend.enums;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EnumCodesTest {

    @Test
    void unknownItemTypesFallBackToOther() {
        assertEquals(ItemType.COLLECTION, ItemType.fromCode(" Collection "));
        assertEquals(ItemType.OTHER, ItemType.fromCode("student_loan"));
        assertEquals(ItemType.OTHER, ItemType.fromCode(null));
    }

    @Test
    void bureauLookupIsLenient() {
        assertEquals(Bureau.TRANSUNION, Bureau.fromCode("TransUnion").orElseThrow());
        assertFalse(Bureau.fromCode("all").isPresent());
        assertFalse(Bureau.fromCode("").isPresent());
    }

    @Test
    void scoreBandsFollowTheUsualCutoffs() {
        assertEquals(ScoreBand.EXCELLENT, ScoreBand.of(800));
        assertEquals(ScoreBand.VERY_GOOD, ScoreBand.of(799));
        assertEquals(ScoreBand.VERY_GOOD, ScoreBand.of(740));
        assertEquals(ScoreBand.GOOD, ScoreBand.of(670));
        assertEquals(ScoreBand.FAIR, ScoreBand.of(580));
        assertEquals(ScoreBand.POOR, ScoreBand.of(579));
        assertEquals(ScoreBand.POOR, ScoreBand.of(0));
    }

    @Test
    void statusHelpers() {
        assertFalse(ItemStatus.DELETED.isActive());
        assertTrue(ItemStatus.VERIFIED.isActive());
        assertNull(ItemStatus.fromCode("resolved"));
        assertFalse(DisputeStatus.DRAFT.isSent());
        assertTrue(DisputeStatus.INVESTIGATING.isSent());
        assertEquals(PreviousResult.NONE, PreviousResult.fromCode(null));
        assertEquals(PreviousResult.VERIFIED, PreviousResult.fromCode("verified"));
    }

    @Test
    void roundNumbersOutsideThePathAreClamped() {
        assertEquals(StrategyRound.INITIAL_DISPUTE, StrategyRound.ofNumber(0));
        assertEquals(StrategyRound.INITIAL_DISPUTE, StrategyRound.ofNumber(-3));
        assertEquals(StrategyRound.REGULATORY_COMPLAINT, StrategyRound.ofNumber(5));
        assertEquals(StrategyRound.REGULATORY_COMPLAINT, StrategyRound.ofNumber(7));
        assertEquals(StrategyRound.ESCALATION_WARNING, StrategyRound.ofNumber(3));
        assertTrue(StrategyRound.REGULATORY_COMPLAINT.isTerminal());
    }
}
