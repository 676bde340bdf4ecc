package org.nowstart.pairsim.data.dto;

public record VariantSummary(
        String variant,
        double initialCapital,
        double finalEquity,
        double totalReturnPct,
        int tradeCount,
        int skippedEntries
) {

    public static VariantSummary of(SimulationResult result) {
        double initial = result.initialCapital();
        double finalEquity = result.finalEquity();
        return new VariantSummary(
                result.variant(),
                initial,
                finalEquity,
                (finalEquity - initial) / initial * 100.0,
                result.tradeCount(),
                result.skippedEntries()
        );
    }
}
