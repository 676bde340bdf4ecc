package org.nowstart.pairsim.runner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.AggregationResult;
import org.nowstart.pairsim.data.dto.BacktestReport;
import org.nowstart.pairsim.data.dto.PerformanceStats;
import org.nowstart.pairsim.data.dto.SignalEvaluation;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.dto.VariantSummary;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.service.EquityAggregationService;
import org.nowstart.pairsim.service.PerformanceAnalysisService;
import org.nowstart.pairsim.service.ReportExportService;
import org.nowstart.pairsim.service.SignalCsvLoader;
import org.nowstart.pairsim.service.SignalEvaluationService;
import org.nowstart.pairsim.service.SignalStreamValidator;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties properties;
    private final SignalCsvLoader signalCsvLoader;
    private final SignalStreamValidator signalStreamValidator;
    private final SignalEvaluationService signalEvaluationService;
    private final EquityAggregationService equityAggregationService;
    private final PerformanceAnalysisService performanceAnalysisService;
    private final ReportExportService reportExportService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("pairsim.backtest.enabled=false; pass --pairsim.backtest.enabled=true to run");
            return;
        }

        logSection("BACKTEST START");
        log.info("[Overview] mode={} initialCapital={} riskPct={} capitalPerTrade={} maxPositions={} entryZ={} exitZ={} confidence={} holdPeriod={}",
                properties.mode(),
                properties.initialCapital(),
                properties.positionRiskPct(),
                properties.capitalPerTrade(),
                properties.maxPositions(),
                properties.entryZThreshold(),
                properties.exitZThreshold(),
                properties.modelConfidenceThreshold(),
                properties.holdPeriod());

        List<SignalRow> rows = signalCsvLoader.load(properties);
        signalStreamValidator.validate(rows, properties);
        if (rows.isEmpty()) {
            log.warn("[Overview] signal stream is empty; nothing to simulate");
            return;
        }
        log.info("[Overview] rows={} range={} -> {}", rows.size(), rows.get(0).date(), rows.get(rows.size() - 1).date());

        logSection("SIGNAL EVALUATION");
        List<SignalEvaluation> evaluations = signalEvaluationService.evaluate(
                rows,
                properties.resolveVariants(),
                properties.entryZThreshold()
        );
        for (SignalEvaluation evaluation : evaluations) {
            log.info("[{}] trades={} winRate={} longWR={} shortWR={}",
                    evaluation.variant(),
                    evaluation.totalTrades(),
                    formatPercent(evaluation.winRatePct()),
                    formatPercent(evaluation.longWinRatePct()),
                    formatPercent(evaluation.shortWinRatePct()));
        }

        logSection("SIMULATION");
        AggregationResult aggregation = equityAggregationService.aggregate(rows, properties);
        List<PerformanceStats> performance = new ArrayList<>();
        for (SimulationResult result : aggregation.results().values()) {
            performance.add(performanceAnalysisService.analyze(result));
        }

        logSection("SUMMARY");
        for (VariantSummary summary : aggregation.summaries()) {
            log.info("[{}] final={} return={} trades={} skipped={}",
                    summary.variant(),
                    String.format(Locale.US, "%.2f", summary.finalEquity()),
                    formatPercent(summary.totalReturnPct()),
                    summary.tradeCount(),
                    summary.skippedEntries());
        }
        for (PerformanceStats stats : performance) {
            log.info("[{}] pnl={} mdd={} wins={} losses={} winRate={} avgWin={} avgLoss={}",
                    stats.variant(),
                    String.format(Locale.US, "%.2f", stats.totalPnl()),
                    formatPercent(stats.maxDrawdownPct()),
                    stats.winningTrades(),
                    stats.losingTrades(),
                    formatPercent(stats.winRatePct()),
                    String.format(Locale.US, "%.2f", stats.avgWin()),
                    String.format(Locale.US, "%.2f", stats.avgLoss()));
        }
        performance.stream()
                .max(Comparator.comparingDouble(PerformanceStats::totalPnl))
                .ifPresent(best -> log.info("[Overview] winner={} pnl={}",
                        best.variant(), String.format(Locale.US, "%.2f", best.totalPnl())));

        logSection("EXPORT");
        BacktestReport report = new BacktestReport(
                properties.mode(),
                rows.get(0).date(),
                rows.get(rows.size() - 1).date(),
                aggregation.summaries(),
                List.copyOf(performance),
                evaluations
        );
        reportExportService.export(Path.of(properties.outputDir()), aggregation, report);
        logSection("BACKTEST END");
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double pct) {
        if (!Double.isFinite(pct)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", pct);
    }
}
