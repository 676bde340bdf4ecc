package org.nowstart.pairsim.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.EquityPoint;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.Direction;
import org.nowstart.pairsim.service.ledger.Position;
import org.nowstart.pairsim.service.ledger.PositionLedger;
import org.nowstart.pairsim.service.ledger.TransactionCostModel;
import org.nowstart.pairsim.service.policy.CloseDecision;
import org.nowstart.pairsim.service.policy.ExitPolicy;
import org.nowstart.pairsim.service.policy.ExitPolicyRegistry;
import org.nowstart.pairsim.strategy.StrategyVariant;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationEngine {

    private final ExitPolicyRegistry exitPolicyRegistry;

    public SimulationResult run(List<SignalRow> rows, StrategyVariant variant, BacktestProperties properties) {
        ExitPolicy exitPolicy = exitPolicyRegistry.getRequired(properties.mode());
        PositionLedger ledger = new PositionLedger(properties, TransactionCostModel.from(properties));
        double confidence = properties.effectiveConfidence();

        TreeMap<LocalDate, List<SignalRow>> rowsByDate = groupByDate(rows);
        List<EquityPoint> equityCurve = new ArrayList<>(rowsByDate.size());
        log.info("event=simulation_started variant={} mode={} rows={} dates={}",
                variant.name(), properties.mode(), rows.size(), rowsByDate.size());

        for (Map.Entry<LocalDate, List<SignalRow>> day : rowsByDate.entrySet()) {
            LocalDate date = day.getKey();
            Map<String, SignalRow> rowsByPair = indexByPair(day.getValue());

            expire(ledger, exitPolicy, date, rowsByPair, properties);

            for (SignalRow row : day.getValue()) {
                if (ledger.isOpen(row.pairId())) {
                    continue;
                }
                Optional<Direction> direction = variant.entryDirection(row, properties.entryZThreshold(), confidence);
                direction.ifPresent(value -> ledger.open(row.pairId(), value, date, row));
            }

            double equity = ledger.markToMarket(date, spreadPrices(rowsByPair));
            equityCurve.add(new EquityPoint(date, equity, ledger.openPositionCount()));
        }

        if (!rowsByDate.isEmpty()) {
            drain(ledger, rowsByDate.lastKey(), indexByPair(rowsByDate.lastEntry().getValue()));
        }

        SimulationResult result = new SimulationResult(
                variant.name(),
                ledger.getInitialCapital(),
                ledger.getRealizedEquity(),
                equityCurve,
                ledger.trades(),
                ledger.getSkippedEntries(),
                ledger.getTotalCosts()
        );
        log.info("event=simulation_finished variant={} finalEquity={} trades={} skipped={} costs={}",
                variant.name(), result.finalEquity(), result.tradeCount(), result.skippedEntries(), result.totalCosts());
        return result;
    }

    private void expire(
            PositionLedger ledger,
            ExitPolicy exitPolicy,
            LocalDate date,
            Map<String, SignalRow> rowsByPair,
            BacktestProperties properties
    ) {
        Map<String, CloseDecision> decisions = new LinkedHashMap<>();
        for (String pairId : ledger.openPairIds()) {
            Optional<Position> position = ledger.position(pairId);
            if (position.isEmpty()) {
                continue;
            }
            exitPolicy.evaluate(position.get(), date, rowsByPair.get(pairId), properties)
                    .ifPresent(decision -> decisions.put(pairId, decision));
        }
        decisions.forEach((pairId, decision) -> ledger.close(pairId, date, decision.reason(), decision.spreadPrice()));
    }

    private void drain(PositionLedger ledger, LocalDate lastDate, Map<String, SignalRow> lastRows) {
        for (String pairId : ledger.openPairIds()) {
            SignalRow row = lastRows.get(pairId);
            double spread = row == null ? Double.NaN : row.spreadPrice();
            ledger.close(pairId, lastDate, CloseReason.END_OF_BACKTEST, spread);
        }
    }

    private TreeMap<LocalDate, List<SignalRow>> groupByDate(List<SignalRow> rows) {
        TreeMap<LocalDate, List<SignalRow>> out = new TreeMap<>();
        for (SignalRow row : rows) {
            out.computeIfAbsent(row.date(), ignored -> new ArrayList<>()).add(row);
        }
        return out;
    }

    private Map<String, SignalRow> indexByPair(List<SignalRow> rows) {
        Map<String, SignalRow> out = new LinkedHashMap<>();
        for (SignalRow row : rows) {
            out.putIfAbsent(row.pairId(), row);
        }
        return out;
    }

    private Map<String, Double> spreadPrices(Map<String, SignalRow> rowsByPair) {
        Map<String, Double> out = new LinkedHashMap<>();
        rowsByPair.forEach((pairId, row) -> out.put(pairId, row.spreadPrice()));
        return out;
    }
}
