package com.creditpath.backend.services.strategy;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.creditpath.backend.enums.Bureau;

/**
 * Known procedural weaknesses of each bureau's dispute handling and the tactics
 * that work against them.
 */
@Component
public class BureauTacticsCatalog {

    private static final Map<Bureau, BureauProfile> PROFILES;

    static {
        Map<Bureau, BureauProfile> m = new EnumMap<>(Bureau.class);

        m.put(Bureau.EQUIFAX, BureauProfile.builder()
                .bureau(Bureau.EQUIFAX)
                .name("Equifax")
                .address("Equifax Information Services LLC\nP.O. Box 740256\nAtlanta, GA 30374-0256")
                .onlineDispute("https://www.equifax.com/personal/disputes/")
                .weakness("Heavy reliance on ACDV automated system: challenge as inadequate investigation")
                .weakness("History of data breaches (2017): leverage security concerns for identity-related disputes")
                .weakness("Often fails to conduct meaningful re-investigation after initial verification")
                .weakness("Known for not forwarding complete consumer documentation to furnishers")
                .bestTactic("Demand human review, not automated ACDV processing")
                .bestTactic("Request the specific individual who conducted the investigation")
                .bestTactic("Reference Equifax's consent decree requirements for thorough investigations")
                .bestTactic("Send disputes via certified mail to create paper trail for potential litigation")
                .mailingTips("Send to P.O. Box 740256 for disputes. Include a copy of ID and proof of address.")
                .build());

        m.put(Bureau.EXPERIAN, BureauProfile.builder()
                .bureau(Bureau.EXPERIAN)
                .name("Experian")
                .address("Experian\nP.O. Box 4500\nAllen, TX 75013")
                .onlineDispute("https://www.experian.com/disputes/main.html")
                .weakness("Frequently fails to forward complete consumer documentation to furnishers via e-OSCAR")
                .weakness("Often summarizes disputes with 2-digit codes instead of forwarding full dispute narrative")
                .weakness("Known for verifying accounts based on limited furnisher response")
                .weakness("Sometimes stalls disputes by requesting additional documentation unnecessarily")
                .bestTactic("Explicitly state in your letter: \"Forward this COMPLETE letter to the furnisher\"")
                .bestTactic("Demand they not reduce your dispute to a code, citing §611(a)(5)(A)")
                .bestTactic("If they request more info, send via certified mail with tracking")
                .bestTactic("Reference Experian's duty under §611(a)(1)(A) to forward all relevant information")
                .mailingTips("Send to P.O. Box 4500 for disputes. Include \"ATTENTION: Consumer Disputes Department\".")
                .build());

        m.put(Bureau.TRANSUNION, BureauProfile.builder()
                .bureau(Bureau.TRANSUNION)
                .name("TransUnion")
                .address("TransUnion Consumer Solutions\nP.O. Box 2000\nChester, PA 19016")
                .onlineDispute("https://www.transunion.com/credit-disputes/dispute-your-credit")
                .weakness("Frequently verifies without meaningful investigation: challenge the process")
                .weakness("Uses automated matching that can result in mixed files")
                .weakness("Known for delays in updating resolved disputes on consumer reports")
                .weakness("Sometimes fails to provide complete MOV upon request")
                .bestTactic("Always request Method of Verification with specific details")
                .bestTactic("Demand the name, address, and phone of the person who verified")
                .bestTactic("If disputing mixed file issues, demand manual file separation")
                .bestTactic("Reference TransUnion's obligation under §611(a)(6)(B)(iii) for unverifiable items")
                .mailingTips("Send to P.O. Box 2000 for disputes. Use certified mail with return receipt.")
                .build());

        for (Bureau bureau : Bureau.values()) {
            if (!m.containsKey(bureau)) {
                throw new IllegalStateException("Missing tactics profile for bureau " + bureau.getCode());
            }
        }
        PROFILES = Collections.unmodifiableMap(m);
    }

    /**
     * @return the profile, or null when no bureau is given
     */
    public BureauProfile forBureau(Bureau bureau) {
        return bureau != null ? PROFILES.get(bureau) : null;
    }

    public BureauProfile forCode(String bureauCode) {
        return Bureau.fromCode(bureauCode).map(PROFILES::get).orElse(null);
    }

    public Collection<BureauProfile> all() {
        return PROFILES.values();
    }
}
