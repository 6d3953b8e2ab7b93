package com.creditpath.backend.enums;

/**
 * The four stages of the dispute escalation path. {@link #REGULATORY_COMPLAINT}
 * is terminal: past it, the next step is outside the bureau process.
 */
public enum StrategyRound {
    INITIAL_DISPUTE(
            1,
            "Initial Dispute",
            "Formal dispute requesting investigation and Method of Verification",
            "Assert rights under FCRA §611, request investigation, and demand MOV",
            35,
            "If verified, proceed to Round 2 challenging the verification method"),
    VERIFICATION_CHALLENGE(
            2,
            "Verification Challenge",
            "Challenge the adequacy of the bureau investigation and demand procedural proof",
            "Cite §611(a)(5)(A): bureau must forward ALL relevant evidence. Challenge e-OSCAR automated verification as inadequate.",
            35,
            "If still verified, escalate to Round 3 with regulatory threat"),
    ESCALATION_WARNING(
            3,
            "Escalation & Warning",
            "Final warning before regulatory complaints, citing civil liability",
            "Reference §616/§617 civil liability ($100-$1,000/violation + punitive damages). Announce intent to file CFPB complaint and contact state AG.",
            30,
            "File CFPB complaint and state AG complaint in Round 4"),
    REGULATORY_COMPLAINT(
            4,
            "Regulatory Complaint",
            "File formal complaints with CFPB and state Attorney General",
            "Document full dispute history. File CFPB complaint at consumerfinance.gov. File state AG complaint. Prepare for potential litigation.",
            60,
            "Consult attorney for potential FCRA lawsuit");

    private final int number;
    private final String displayName;
    private final String description;
    private final String approach;
    private final int waitDays;
    private final String nextAction;

    StrategyRound(int number, String displayName, String description, String approach, int waitDays, String nextAction) {
        this.number = number;
        this.displayName = displayName;
        this.description = description;
        this.approach = approach;
        this.waitDays = waitDays;
        this.nextAction = nextAction;
    }

    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getApproach() {
        return approach;
    }

    public int getWaitDays() {
        return waitDays;
    }

    public String getNextAction() {
        return nextAction;
    }

    public boolean isTerminal() {
        return this == REGULATORY_COMPLAINT;
    }

    /**
     * Numbers below 1 map to the initial round, numbers past the last round to
     * the terminal one.
     */
    public static StrategyRound ofNumber(int number) {
        if (number > REGULATORY_COMPLAINT.number) {
            return REGULATORY_COMPLAINT;
        }
        for (StrategyRound round : values()) {
            if (round.number == number) {
                return round;
            }
        }
        return INITIAL_DISPUTE;
    }
}
