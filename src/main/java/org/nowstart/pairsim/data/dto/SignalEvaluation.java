package org.nowstart.pairsim.data.dto;

public record SignalEvaluation(
        String variant,
        int actionableOpportunities,
        int totalTrades,
        double winRatePct,
        int longTrades,
        double longWinRatePct,
        int shortTrades,
        double shortWinRatePct
) {}
