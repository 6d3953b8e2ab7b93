package com.creditpath.backend.services.strategy;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.creditpath.backend.enums.DisputeType;
import com.creditpath.backend.enums.ItemType;

/**
 * Dispute playbook per negative-item category: the argument to lead with, the
 * fallbacks, the expected score recovery and the statutes to cite.
 */
@Component
public class ItemTypeStrategyCatalog {

    private static final Map<ItemType, ItemTypeStrategy> STRATEGIES;

    static {
        Map<ItemType, ItemTypeStrategy> m = new EnumMap<>(ItemType.class);

        m.put(ItemType.LATE_PAYMENT, ItemTypeStrategy.builder()
                .itemType(ItemType.LATE_PAYMENT)
                .name("Late Payment")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.OTHER)
                .estimatedScoreImpact(new ScoreImpactRange(15, 110))
                .tip("Challenge the exact date reported as late: even a 1-day discrepancy invalidates the record")
                .tip("Request proof of the exact payment posting date from the original creditor")
                .tip("If payment was made on time but processed late, dispute as inaccurate")
                .tip("Goodwill letters to the original creditor can also result in removal")
                .tip("A single 30-day late payment can drop scores 60-110 points for excellent credit profiles")
                .legalArgument("FCRA §623(a)(1)(A): Furnisher duty to report only accurate information")
                .legalArgument("FCRA §623(a)(2): Furnisher must update/correct incomplete or inaccurate info")
                .legalArgument("Metro 2 Format: Payment date must reflect actual date payment was received and applied")
                .build());

        m.put(ItemType.COLLECTION, ItemTypeStrategy.builder()
                .itemType(ItemType.COLLECTION)
                .name("Collection Account")
                .primaryStrategy(DisputeType.NOT_MINE)
                .alternativeStrategy(DisputeType.PAID)
                .alternativeStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(50, 150))
                .tip("Demand debt validation under FDCPA §1692g before acknowledging the debt")
                .tip("Challenge the chain of title: can the collector prove they own the debt?")
                .tip("If original creditor AND collector both report, dispute as duplicate")
                .tip("Collections under $100 are excluded from newer FICO models (FICO 9)")
                .tip("Medical collections have special rules and are removed once paid under new FICO models")
                .tip("Paid collections still hurt your score in FICO 8, so negotiate \"pay for delete\"")
                .legalArgument("FDCPA §1692g: Right to debt validation within 30 days of first contact")
                .legalArgument("FDCPA §1692e: False/misleading representation if amount is wrong")
                .legalArgument("FCRA §623(a)(1)(A): Collector must verify debt accuracy before reporting")
                .legalArgument("FCRA §605(a): 7-year limit from date of first delinquency with original creditor")
                .build());

        m.put(ItemType.CHARGE_OFF, ItemTypeStrategy.builder()
                .itemType(ItemType.CHARGE_OFF)
                .name("Charge-Off")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.PAID)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(75, 150))
                .tip("Challenge the charge-off date: it must match 180 days after first missed payment")
                .tip("If balance shows amount after charge-off, dispute the balance as inaccurate")
                .tip("Charge-offs must show $0 balance once sold to collections")
                .tip("If both charge-off and collection appear for same debt, dispute as duplicate")
                .tip("The date of first delinquency CANNOT be changed, so watch for re-aging")
                .legalArgument("FCRA §623(a)(1)(A): Balance must be accurate at time of reporting")
                .legalArgument("FCRA §605(c): Reporting period starts from date of first delinquency and cannot be re-aged")
                .legalArgument("Metro 2 Guidelines: Charge-offs sold to collectors must report $0 balance")
                .build());

        m.put(ItemType.BANKRUPTCY, ItemTypeStrategy.builder()
                .itemType(ItemType.BANKRUPTCY)
                .name("Bankruptcy")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(130, 240))
                .tip("Verify the exact filing date and discharge date: both must be accurate")
                .tip("Chapter 7 can be reported for 10 years; Chapter 13 for 7 years from filing")
                .tip("Individual accounts included in bankruptcy should show \"Included in Bankruptcy\", not separate delinquencies")
                .tip("Challenge any account included in bankruptcy that still shows a balance")
                .tip("After discharge, all included debts must show $0 balance")
                .legalArgument("FCRA §605(a)(1): Chapter 7 is reportable 10 years from filing; Chapter 13 is 7 years from filing")
                .legalArgument("FCRA §623(a)(1)(A): Accounts in bankruptcy must accurately reflect $0 balance post-discharge")
                .legalArgument("11 U.S.C. §524: Discharge injunction; creditors cannot continue to report discharged debts as owed")
                .build());

        m.put(ItemType.FORECLOSURE, ItemTypeStrategy.builder()
                .itemType(ItemType.FORECLOSURE)
                .name("Foreclosure")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(85, 160))
                .tip("Verify the exact date of foreclosure sale: it must be accurate")
                .tip("Challenge any deficiency balance reported after foreclosure (varies by state)")
                .tip("If property was sold for more than owed, no deficiency should be reported")
                .tip("Date of first delinquency must be accurate for 7-year calculation")
                .legalArgument("FCRA §605(a): 7-year reporting limit from date of first delinquency")
                .legalArgument("State law deficiency regulations (varies by jurisdiction)")
                .legalArgument("FCRA §623(a)(1)(A): Balance and status must be accurately reported post-sale")
                .build());

        m.put(ItemType.REPOSSESSION, ItemTypeStrategy.builder()
                .itemType(ItemType.REPOSSESSION)
                .name("Repossession")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.PAID)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(75, 150))
                .tip("Challenge the deficiency balance: was the vehicle sold at fair market value?")
                .tip("Request proof of commercially reasonable sale under UCC §9-610")
                .tip("Verify that proper notice was given before and after the sale")
                .tip("If deficiency balance is inaccurate, dispute the specific amount")
                .legalArgument("UCC §9-610: Vehicle must be sold in commercially reasonable manner")
                .legalArgument("UCC §9-611: Notice requirements before disposition")
                .legalArgument("FCRA §623(a)(1)(A): Deficiency balance must accurately reflect sale proceeds")
                .build());

        m.put(ItemType.INQUIRY, ItemTypeStrategy.builder()
                .itemType(ItemType.INQUIRY)
                .name("Hard Inquiry")
                .primaryStrategy(DisputeType.NOT_MINE)
                .alternativeStrategy(DisputeType.OTHER)
                .estimatedScoreImpact(new ScoreImpactRange(5, 15))
                .tip("Hard inquiries require your written authorization: did you apply?")
                .tip("Unauthorized inquiries may indicate identity theft or permissible purpose violation")
                .tip("Inquiries fall off after 2 years but only affect scores for 12 months")
                .tip("Multiple inquiries for same type within 14-45 days count as one (rate shopping)")
                .tip("Challenge any inquiry where you did NOT apply for credit")
                .legalArgument("FCRA §604: Permissible purposes for accessing credit report")
                .legalArgument("FCRA §615(a): Notice requirements when credit is denied based on report")
                .legalArgument("FCRA §616: Civil liability for unauthorized access ($100-$1,000 per inquiry)")
                .build());

        m.put(ItemType.OTHER, ItemTypeStrategy.builder()
                .itemType(ItemType.OTHER)
                .name("Other Negative Item")
                .primaryStrategy(DisputeType.INACCURATE_INFO)
                .alternativeStrategy(DisputeType.NOT_MINE)
                .alternativeStrategy(DisputeType.OUTDATED)
                .estimatedScoreImpact(new ScoreImpactRange(10, 100))
                .tip("Challenge every data point: creditor name, account number, balance, dates, status")
                .tip("Even minor inaccuracies (wrong address, incorrect account type) make the item disputable")
                .tip("Request the original agreement or documentation supporting the account")
                .legalArgument("FCRA §611(a): Right to dispute any information believed to be inaccurate")
                .legalArgument("FCRA §611(a)(6)(B)(iii): Unverifiable information must be deleted")
                .legalArgument("FCRA §623(a)(1)(A): Accuracy requirement for all furnished information")
                .build());

        for (ItemType type : ItemType.values()) {
            if (!m.containsKey(type)) {
                throw new IllegalStateException("Missing dispute strategy for item type " + type.getCode());
            }
        }
        STRATEGIES = Collections.unmodifiableMap(m);
    }

    public ItemTypeStrategy forType(ItemType itemType) {
        return STRATEGIES.get(itemType != null ? itemType : ItemType.OTHER);
    }

    /**
     * Unknown codes get the "other" playbook.
     */
    public ItemTypeStrategy forCode(String itemTypeCode) {
        return forType(ItemType.fromCode(itemTypeCode));
    }

    public Collection<ItemTypeStrategy> all() {
        return STRATEGIES.values();
    }
}
