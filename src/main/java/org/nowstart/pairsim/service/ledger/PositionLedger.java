package org.nowstart.pairsim.service.ledger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.dto.TradeRecord;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.Direction;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.nowstart.pairsim.util.TradingCalendar;

/**
 * Capital and open-position book of a single simulation run. Not thread-safe; each run owns one.
 *
 * <p>At every point {@code availableCapital + investedCapital() == realizedEquity} and
 * {@code realizedEquity == initialCapital + closedGrossPnl - totalCosts}.
 */
@Slf4j
public class PositionLedger {

    private final BacktestProperties properties;
    private final TransactionCostModel costModel;
    private final Map<String, Position> openPositions = new LinkedHashMap<>();
    private final List<TradeRecord> trades = new ArrayList<>();

    @Getter
    private final double initialCapital;
    @Getter
    private double availableCapital;
    @Getter
    private double realizedEquity;
    @Getter
    private double totalCosts;
    @Getter
    private double closedGrossPnl;
    @Getter
    private int skippedEntries;

    public PositionLedger(BacktestProperties properties, TransactionCostModel costModel) {
        this.properties = properties;
        this.costModel = costModel;
        this.initialCapital = properties.initialCapital();
        this.availableCapital = initialCapital;
        this.realizedEquity = initialCapital;
    }

    public Optional<Position> open(String pairId, Direction direction, LocalDate date, SignalRow row) {
        if (openPositions.containsKey(pairId)) {
            return Optional.empty();
        }

        boolean priceMode = properties.mode() == SimulationMode.SPREAD_PRICE;
        if (priceMode && !row.hasSpreadPrice()) {
            log.debug("event=entry_ignored date={} pair={} reason=no_spread_price", date, pairId);
            return Optional.empty();
        }
        if (!priceMode && !row.hasTargetOutcome()) {
            log.debug("event=entry_ignored date={} pair={} reason=no_target_outcome", date, pairId);
            return Optional.empty();
        }

        double capital = properties.resolveCapitalPerTrade(realizedEquity);
        if (openPositions.size() >= properties.maxPositions()) {
            return skip(date, pairId, "max_positions");
        }
        if (!(capital > 0.0) || availableCapital < capital * properties.capitalBufferFactor()) {
            return skip(date, pairId, "insufficient_capital");
        }

        Position position = priceMode
                ? spreadPricedPosition(pairId, direction, date, row.spreadPrice(), capital)
                : outcomePosition(pairId, direction, date, row, capital);

        double cost = position.getEntryCost();
        availableCapital -= capital + cost;
        realizedEquity -= cost;
        totalCosts += cost;
        openPositions.put(pairId, position);
        trades.add(TradeRecord.entry(date, pairId, direction, capital, position.getEntrySpread(), cost));
        log.debug(
                "event=position_opened date={} pair={} direction={} capital={} cost={} scheduledClose={}",
                date,
                pairId,
                direction,
                capital,
                cost,
                position.getScheduledCloseDate()
        );
        return Optional.of(position);
    }

    /**
     * Revalues open positions. Pairs without a finite price today keep yesterday's valuation.
     */
    public double markToMarket(LocalDate date, Map<String, Double> spreadPrices) {
        if (properties.mode() != SimulationMode.SPREAD_PRICE) {
            return realizedEquity;
        }

        double unrealized = 0.0;
        for (Position position : openPositions.values()) {
            Double price = spreadPrices.get(position.getPairId());
            if (price != null && Double.isFinite(price) && price != 0.0) {
                position.mark(price, spreadPnl(position, price));
            }
            unrealized += position.getUnrealizedPnl();
        }
        return realizedEquity + unrealized;
    }

    /**
     * Closes the pair's position and returns the round-trip PnL net of entry cost. Closing a pair
     * with no open position does nothing and returns 0.
     */
    public double close(String pairId, LocalDate date, CloseReason reason, double spreadPrice) {
        Position position = openPositions.remove(pairId);
        if (position == null) {
            return 0.0;
        }

        double exitSpread = Double.NaN;
        double grossPnl;
        if (properties.mode() == SimulationMode.SPREAD_PRICE) {
            exitSpread = Double.isFinite(spreadPrice) && spreadPrice != 0.0 ? spreadPrice : position.getLastSpreadPrice();
            grossPnl = spreadPnl(position, exitSpread);
        } else {
            grossPnl = position.getPendingPnl();
        }

        double invested = position.getInvestedCapital();
        availableCapital += invested + grossPnl;
        realizedEquity += grossPnl;
        closedGrossPnl += grossPnl;

        double netPnl = grossPnl - position.getEntryCost();
        trades.add(TradeRecord.exit(date, pairId, position.getDirection(), invested, exitSpread, netPnl, reason));
        log.debug(
                "event=position_closed date={} pair={} direction={} reason={} pnl={}",
                date,
                pairId,
                position.getDirection(),
                reason,
                netPnl
        );
        return netPnl;
    }

    public boolean isOpen(String pairId) {
        return openPositions.containsKey(pairId);
    }

    public int openPositionCount() {
        return openPositions.size();
    }

    public List<String> openPairIds() {
        return List.copyOf(openPositions.keySet());
    }

    public Optional<Position> position(String pairId) {
        return Optional.ofNullable(openPositions.get(pairId));
    }

    public Map<String, Position> openPositions() {
        return Collections.unmodifiableMap(openPositions);
    }

    public double investedCapital() {
        double invested = 0.0;
        for (Position position : openPositions.values()) {
            invested += position.getInvestedCapital();
        }
        return invested;
    }

    public List<TradeRecord> trades() {
        return List.copyOf(trades);
    }

    private Position spreadPricedPosition(String pairId, Direction direction, LocalDate date, double spread, double capital) {
        return Position.builder()
                .pairId(pairId)
                .direction(direction)
                .openDate(date)
                .entrySpread(spread)
                .entryPrice(costModel.entryPrice(direction, spread))
                .size(capital / Math.abs(spread))
                .investedCapital(capital)
                .entryCost(0.0)
                .lastSpreadPrice(spread)
                .build();
    }

    private Position outcomePosition(String pairId, Direction direction, LocalDate date, SignalRow row, double capital) {
        LocalDate scheduledClose = TradingCalendar.addTradingDays(date, properties.holdPeriod());
        long holdingDays = ChronoUnit.DAYS.between(date, scheduledClose);
        double cost = costModel.totalCost(direction, capital, properties.commission(), holdingDays);
        return Position.builder()
                .pairId(pairId)
                .direction(direction)
                .openDate(date)
                .entrySpread(row.spreadPrice())
                .entryPrice(Double.NaN)
                .size(0.0)
                .investedCapital(capital)
                .entryCost(cost)
                .scheduledCloseDate(scheduledClose)
                .pendingPnl(outcomePnl(direction, capital, row))
                .lastSpreadPrice(row.spreadPrice())
                .build();
    }

    private double outcomePnl(Direction direction, double capital, SignalRow row) {
        boolean correct = direction == Direction.LONG
                ? row.targetDirection() == 1
                : row.targetDirection() == 0;
        double magnitude = capital * Math.abs(row.targetReturn());
        return correct ? magnitude : -magnitude;
    }

    private double spreadPnl(Position position, double spread) {
        double exitPrice = costModel.exitPrice(position.getDirection(), spread);
        return (exitPrice - position.getEntryPrice()) * position.getSize() * position.getDirection().sign();
    }

    private Optional<Position> skip(LocalDate date, String pairId, String reason) {
        skippedEntries++;
        log.debug("event=entry_skipped date={} pair={} reason={} open={} available={}",
                date, pairId, reason, openPositions.size(), availableCapital);
        return Optional.empty();
    }
}
