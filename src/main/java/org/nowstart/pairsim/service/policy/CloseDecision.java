package org.nowstart.pairsim.service.policy;

import org.nowstart.pairsim.data.type.CloseReason;

public record CloseDecision(
        CloseReason reason,
        double spreadPrice
) {}
