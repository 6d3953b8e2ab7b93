package com.creditpath.backend.services.strategy;

import com.creditpath.backend.enums.DisputeType;

/**
 * What the next letter argues, relative to the item type's playbook.
 */
public enum EscalationAction {
    PRIMARY,
    FIRST_ALTERNATIVE,
    ACCURACY_CHALLENGE;

    public DisputeType resolve(ItemTypeStrategy strategy) {
        switch (this) {
            case FIRST_ALTERNATIVE:
                return strategy.firstAlternativeOrPrimary();
            case ACCURACY_CHALLENGE:
                return DisputeType.INACCURATE_INFO;
            case PRIMARY:
            default:
                return strategy.getPrimaryStrategy();
        }
    }
}
