package org.nowstart.pairsim.data.dto;

import java.util.List;
import java.util.Map;

public record AggregationResult(
        List<EquityTableRow> equityTable,
        Map<String, SimulationResult> results,
        List<VariantSummary> summaries
) {

    public SimulationResult result(String variant) {
        SimulationResult result = results.get(variant);
        if (result == null) {
            throw new IllegalArgumentException("Unknown variant: " + variant);
        }
        return result;
    }
}
