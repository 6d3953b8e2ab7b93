package com.creditpath.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.creditpath.backend.enums.StrategyRound;
import com.creditpath.backend.services.ClientRecordsReader;
import com.creditpath.backend.services.strategy.BureauTacticsCatalog;
import com.creditpath.backend.services.strategy.ItemTypeStrategyCatalog;

/**
 * Touches the reference catalogs at startup so an incomplete table fails the
 * boot instead of the first request.
 */
@Component
public class ReferenceDataStartupValidation implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataStartupValidation.class);

    private final ItemTypeStrategyCatalog itemTypeStrategyCatalog;
    private final BureauTacticsCatalog bureauTacticsCatalog;
    private final ScoreAnalyticsProperties properties;
    private final ClientRecordsReader clientRecordsReader;

    public ReferenceDataStartupValidation(
            ItemTypeStrategyCatalog itemTypeStrategyCatalog,
            BureauTacticsCatalog bureauTacticsCatalog,
            ScoreAnalyticsProperties properties,
            ClientRecordsReader clientRecordsReader
    ) {
        this.itemTypeStrategyCatalog = itemTypeStrategyCatalog;
        this.bureauTacticsCatalog = bureauTacticsCatalog;
        this.properties = properties;
        this.clientRecordsReader = clientRecordsReader;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Reference data loaded: itemTypes={}, bureaus={}, rounds={}",
                itemTypeStrategyCatalog.all().size(),
                bureauTacticsCatalog.all().size(),
                StrategyRound.values().length);

        log.info("Analytics config: trendWindowMonths={}, anomalyWindowDays={}, suddenDrop={}/{}, bureauSpread={}/{}, stagnationRange={}, expirationMonths={}/{}",
                properties.trendWindowMonths(),
                properties.anomalyWindowDays(),
                properties.suddenDropThreshold(),
                properties.suddenDropCriticalThreshold(),
                properties.bureauSpreadThreshold(),
                properties.bureauSpreadCriticalThreshold(),
                properties.stagnationRange(),
                properties.expirationWarningMonths(),
                properties.expirationCriticalMonths());

        if (properties.suddenDropCriticalThreshold() < properties.suddenDropThreshold()
                || properties.bureauSpreadCriticalThreshold() < properties.bureauSpreadThreshold()
                || properties.expirationCriticalMonths() < properties.expirationWarningMonths()) {
            log.warn("Critical anomaly thresholds are below their warning thresholds; alerts will skip the warning level");
        }

        if (!clientRecordsReader.hasScoreRecords() || !clientRecordsReader.hasDisputeHistory()) {
            log.warn("Record stores missing: scoreRecords={}, disputeHistory={}. Client reports will be empty.",
                    clientRecordsReader.hasScoreRecords(), clientRecordsReader.hasDisputeHistory());
        }
    }
}
