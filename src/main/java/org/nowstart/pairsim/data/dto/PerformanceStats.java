package org.nowstart.pairsim.data.dto;

public record PerformanceStats(
        String variant,
        double finalEquity,
        double totalReturnPct,
        double maxEquity,
        double minEquity,
        double maxDrawdownPct,
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRatePct,
        double avgWin,
        double avgLoss,
        double totalPnl
) {}
