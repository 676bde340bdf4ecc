package org.nowstart.pairsim.data.dto;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.pairsim.data.type.SimulationMode;

public record BacktestReport(
        SimulationMode mode,
        LocalDate fromDate,
        LocalDate toDate,
        List<VariantSummary> summaries,
        List<PerformanceStats> performance,
        List<SignalEvaluation> signalEvaluations
) {}
