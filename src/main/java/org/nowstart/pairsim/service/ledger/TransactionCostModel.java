package org.nowstart.pairsim.service.ledger;

import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.Direction;

/**
 * Transaction frictions in the two forms the simulator needs: a flat-plus-proportional amount for
 * outcome-labelled trades and a direction-aware price adjustment for spread-priced trades.
 */
public final class TransactionCostModel {

    private static final double DAYS_PER_YEAR = 365.0;

    private final double slippagePct;
    private final double spreadPct;
    private final double annualBorrowRate;
    private final double transactionCostPct;

    public TransactionCostModel(double slippagePct, double spreadPct, double annualBorrowRate, double transactionCostPct) {
        this.slippagePct = slippagePct;
        this.spreadPct = spreadPct;
        this.annualBorrowRate = annualBorrowRate;
        this.transactionCostPct = transactionCostPct;
    }

    public static TransactionCostModel from(BacktestProperties properties) {
        return new TransactionCostModel(
                properties.slippagePct(),
                properties.spreadPct(),
                properties.annualBorrowRate(),
                properties.transactionCostPct()
        );
    }

    public double totalCost(Direction direction, double capital, double commission, long holdingDays) {
        double cost = commission + capital * slippagePct + capital * spreadPct;
        if (direction == Direction.SHORT) {
            cost += borrowCost(capital, holdingDays);
        }
        return cost;
    }

    public double borrowCost(double capital, long holdingDays) {
        return capital * annualBorrowRate * holdingDays / DAYS_PER_YEAR;
    }

    /**
     * Longs buy above the quoted spread, shorts sell below it. The markup scales with |spread| so
     * it stays a cost when the spread is negative.
     */
    public double entryPrice(Direction direction, double spread) {
        return spread + direction.sign() * transactionCostPct * Math.abs(spread);
    }

    public double exitPrice(Direction direction, double spread) {
        return spread - direction.sign() * transactionCostPct * Math.abs(spread);
    }
}
