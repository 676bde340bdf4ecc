package org.nowstart.pairsim.data.dto;

import java.util.List;

public record SimulationResult(
        String variant,
        double initialCapital,
        double finalEquity,
        List<EquityPoint> equityCurve,
        List<TradeRecord> trades,
        int skippedEntries,
        double totalCosts
) {

    public SimulationResult {
        equityCurve = List.copyOf(equityCurve);
        trades = List.copyOf(trades);
    }

    public int tradeCount() {
        int count = 0;
        for (TradeRecord trade : trades) {
            if (trade.isExit()) {
                count++;
            }
        }
        return count;
    }
}
