package org.nowstart.pairsim.data.dto;

import java.time.LocalDate;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.Direction;
import org.nowstart.pairsim.data.type.TradeEventType;

public record TradeRecord(
        LocalDate date,
        String pairId,
        TradeEventType eventType,
        Direction direction,
        double investedCapital,
        double price,
        double cost,
        double realizedPnl,
        double pnlPct,
        CloseReason closeReason
) {

    public static TradeRecord entry(
            LocalDate date,
            String pairId,
            Direction direction,
            double investedCapital,
            double price,
            double cost
    ) {
        return new TradeRecord(date, pairId, TradeEventType.ENTRY, direction, investedCapital, price, cost,
                Double.NaN, Double.NaN, null);
    }

    public static TradeRecord exit(
            LocalDate date,
            String pairId,
            Direction direction,
            double investedCapital,
            double price,
            double realizedPnl,
            CloseReason closeReason
    ) {
        double pnlPct = investedCapital != 0.0 ? realizedPnl / investedCapital * 100.0 : 0.0;
        return new TradeRecord(date, pairId, TradeEventType.EXIT, direction, investedCapital, price, 0.0,
                realizedPnl, pnlPct, closeReason);
    }

    public boolean isExit() {
        return eventType == TradeEventType.EXIT;
    }
}
