package com.creditpath.backend.services;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.creditpath.backend.config.ScoreAnalyticsProperties;
import com.creditpath.backend.dto.projection.ScoreImprovementEstimateDTO;
import com.creditpath.backend.dto.strategy.ItemStrategyDTO;
import com.creditpath.backend.dto.strategy.ItemTypeSummaryDTO;
import com.creditpath.backend.dto.strategy.RoundDTO;
import com.creditpath.backend.dto.strategy.RoundDecisionDTO;
import com.creditpath.backend.dto.strategy.StrategyOverviewDTO;
import com.creditpath.backend.dto.strategy.StrategyRecommendationDTO;
import com.creditpath.backend.entities.DisputeAttempt;
import com.creditpath.backend.entities.NegativeItem;
import com.creditpath.backend.entities.ScoreObservation;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.DisputeStatus;
import com.creditpath.backend.enums.ItemType;
import com.creditpath.backend.enums.PreviousResult;
import com.creditpath.backend.enums.StrategyRound;
import com.creditpath.backend.services.strategy.BureauTacticsCatalog;
import com.creditpath.backend.services.strategy.EscalationAction;
import com.creditpath.backend.services.strategy.ItemTypeStrategy;
import com.creditpath.backend.services.strategy.ItemTypeStrategyCatalog;
import com.creditpath.backend.services.strategy.RoundEscalationStateMachine;
import com.creditpath.backend.services.strategy.ScoreImpactEstimator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class DisputeStrategyService {

    private static final int OVERVIEW_TIPS = 3;

    private final ItemTypeStrategyCatalog itemTypeStrategyCatalog;
    private final BureauTacticsCatalog bureauTacticsCatalog;
    private final RoundEscalationStateMachine roundEscalationStateMachine;
    private final ScoreImpactEstimator scoreImpactEstimator;
    private final ClientRecordsReader clientRecordsReader;
    private final ScoreAnalyticsProperties properties;

    public StrategyRecommendationDTO selectStrategy(ItemType itemType, Bureau bureau, StrategyRound round, PreviousResult previousResult) {
        StrategyRound currentRound = round != null ? round : StrategyRound.INITIAL_DISPUTE;
        PreviousResult previous = previousResult != null ? previousResult : PreviousResult.NONE;

        ItemTypeStrategy strategy = itemTypeStrategyCatalog.forType(itemType);
        EscalationAction action = roundEscalationStateMachine.actionFor(currentRound, previous);

        log.debug("[Strategy] itemType={} bureau={} round={} previous={} action={}",
                strategy.getItemType().getCode(), bureau, currentRound.getNumber(), previous.getCode(), action);

        return StrategyRecommendationDTO.builder()
                .itemType(strategy.getItemType())
                .itemTypeName(strategy.getName())
                .recommendedDisputeType(action.resolve(strategy))
                .alternativeStrategies(strategy.getAlternativeStrategies())
                .round(RoundDTO.from(currentRound))
                .previousResult(previous)
                .estimatedScoreImpact(strategy.getEstimatedScoreImpact())
                .tips(strategy.getTips())
                .legalArguments(strategy.getLegalArguments())
                .bureauStrategy(bureauTacticsCatalog.forBureau(bureau))
                .build();
    }

    /**
     * Lenient entry point for raw codes: unknown item types use the "other"
     * playbook, unknown bureaus yield no tactics profile, round numbers below 1
     * start at round 1 and numbers past 4 stay in the terminal round.
     */
    public StrategyRecommendationDTO selectStrategy(String itemType, String bureau, int round, String previousResult) {
        return selectStrategy(
                ItemType.fromCode(itemType),
                Bureau.fromCode(bureau).orElse(null),
                StrategyRound.ofNumber(round),
                PreviousResult.fromCode(previousResult));
    }

    public RoundDecisionDTO determineRound(int priorAttemptCount, DisputeStatus lastAttemptStatus) {
        return roundEscalationStateMachine.determineRound(priorAttemptCount, lastAttemptStatus);
    }

    public ScoreImprovementEstimateDTO estimateScoreImprovement(ItemType itemType, int currentScore, int totalNegativeItems) {
        return scoreImpactEstimator.estimate(itemType, currentScore, totalNegativeItems);
    }

    /**
     * Full recommendation for one of the client's items, reading the round from
     * the dispute history and the current score from the latest observation.
     */
    public ItemStrategyDTO recommendForItem(UUID clientId, NegativeItem item, Bureau requestedBureau) {
        Objects.requireNonNull(item, "item");
        Bureau targetBureau = requestedBureau != null ? requestedBureau
                : item.getBureau() != null ? item.getBureau()
                : properties.defaultBureau();

        log.info("[Strategy] Recommending strategy clientId={} itemId={} bureau={}", clientId, item.getId(), targetBureau.getCode());

        List<DisputeAttempt> attempts = clientRecordsReader.disputes(item.getId(), targetBureau);
        RoundDecisionDTO decision = roundEscalationStateMachine.determineRound(attempts);

        StrategyRecommendationDTO strategy = selectStrategy(item.getItemType(), targetBureau, decision.getRound(), decision.getPreviousResult());

        int currentScore = latestScore(clientId);
        int totalNegativeItems = countActiveItems(clientId);
        ScoreImprovementEstimateDTO impact = scoreImpactEstimator.estimate(item.getItemType(), currentScore, totalNegativeItems);

        return ItemStrategyDTO.builder()
                .creditItemId(item.getId())
                .itemType(item.getItemType())
                .creditorName(item.getCreditorName())
                .balance(item.getBalance())
                .bureau(targetBureau)
                .strategy(strategy)
                .currentRound(decision.getRoundNumber())
                .previousResult(decision.getPreviousResult())
                .scoreImpact(impact)
                .allRounds(allRounds())
                .build();
    }

    public StrategyOverviewDTO overview() {
        List<ItemTypeSummaryDTO> itemTypes = itemTypeStrategyCatalog.all().stream()
                .map(s -> ItemTypeSummaryDTO.builder()
                        .value(s.getItemType())
                        .name(s.getName())
                        .primaryStrategy(s.getPrimaryStrategy())
                        .estimatedScoreImpact(s.getEstimatedScoreImpact())
                        .tips(s.getTips().subList(0, Math.min(OVERVIEW_TIPS, s.getTips().size())))
                        .legalArguments(s.getLegalArguments())
                        .build())
                .toList();

        return StrategyOverviewDTO.builder()
                .rounds(allRounds())
                .bureaus(List.copyOf(bureauTacticsCatalog.all()))
                .itemTypes(itemTypes)
                .build();
    }

    private List<RoundDTO> allRounds() {
        return Arrays.stream(StrategyRound.values()).map(RoundDTO::from).toList();
    }

    private int latestScore(UUID clientId) {
        List<ScoreObservation> observations = clientRecordsReader.observations(clientId);
        if (observations.isEmpty()) {
            return properties.defaultCurrentScore();
        }
        return observations.stream()
                .filter(Objects::nonNull)
                .max(Comparator.comparing(ScoreObservation::getObservedDate))
                .map(ScoreObservation::getScore)
                .orElse(properties.defaultCurrentScore());
    }

    private int countActiveItems(UUID clientId) {
        return (int) clientRecordsReader.items(clientId).stream()
                .filter(Objects::nonNull)
                .filter(NegativeItem::isActive)
                .count();
    }
}
