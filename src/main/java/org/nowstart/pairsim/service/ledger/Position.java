package org.nowstart.pairsim.service.ledger;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;
import org.nowstart.pairsim.data.type.Direction;

@Getter
@Builder
public class Position {

    private final String pairId;
    private final Direction direction;
    private final LocalDate openDate;
    private final double entrySpread;
    private final double entryPrice;
    private final double size;
    private final double investedCapital;
    private final double entryCost;
    // outcome mode only
    private final LocalDate scheduledCloseDate;
    private final double pendingPnl;
    private double unrealizedPnl;
    private double lastSpreadPrice;

    void mark(double spreadPrice, double unrealizedPnl) {
        this.lastSpreadPrice = spreadPrice;
        this.unrealizedPnl = unrealizedPnl;
    }
}
