package org.nowstart.pairsim.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.AggregationResult;
import org.nowstart.pairsim.data.dto.EquityPoint;
import org.nowstart.pairsim.data.dto.EquityTableRow;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.dto.VariantSummary;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.strategy.StrategyVariant;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EquityAggregationService {

    private final SimulationEngine simulationEngine;

    public AggregationResult aggregate(List<SignalRow> rows, BacktestProperties properties) {
        List<StrategyVariant> variants = properties.resolveVariants();
        List<SignalRow> stream = List.copyOf(rows);

        List<SimulationResult> results = runVariants(stream, variants, properties);

        Map<String, SimulationResult> byVariant = new LinkedHashMap<>();
        List<VariantSummary> summaries = new ArrayList<>(results.size());
        for (SimulationResult result : results) {
            byVariant.put(result.variant(), result);
            summaries.add(VariantSummary.of(result));
        }

        return new AggregationResult(
                buildEquityTable(results),
                Collections.unmodifiableMap(byVariant),
                List.copyOf(summaries)
        );
    }

    private List<SimulationResult> runVariants(
            List<SignalRow> stream,
            List<StrategyVariant> variants,
            BacktestProperties properties
    ) {
        int parallelism = Math.min(properties.variantParallelism(), Math.max(1, variants.size()));
        if (parallelism <= 1) {
            List<SimulationResult> out = new ArrayList<>(variants.size());
            for (StrategyVariant variant : variants) {
                out.add(simulationEngine.run(stream, variant, properties));
            }
            return out;
        }

        log.info("event=variant_runs_parallel variants={} parallelism={}", variants.size(), parallelism);
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> variants.parallelStream()
                    .map(variant -> simulationEngine.run(stream, variant, properties))
                    .toList()
            ).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Variant simulation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Variant simulation failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private List<EquityTableRow> buildEquityTable(List<SimulationResult> results) {
        TreeMap<LocalDate, Map<String, Double>> equityByDate = new TreeMap<>();
        TreeMap<LocalDate, Map<String, Integer>> positionsByDate = new TreeMap<>();
        for (SimulationResult result : results) {
            for (EquityPoint point : result.equityCurve()) {
                equityByDate.computeIfAbsent(point.date(), ignored -> new LinkedHashMap<>())
                        .put(result.variant(), point.equity());
                positionsByDate.computeIfAbsent(point.date(), ignored -> new LinkedHashMap<>())
                        .put(result.variant(), point.openPositions());
            }
        }

        List<EquityTableRow> table = new ArrayList<>(equityByDate.size());
        equityByDate.forEach((date, equity) -> table.add(new EquityTableRow(
                date,
                Collections.unmodifiableMap(equity),
                Collections.unmodifiableMap(positionsByDate.get(date))
        )));
        return List.copyOf(table);
    }
}
