package org.nowstart.pairsim.service.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.pairsim.data.type.Direction;

class TransactionCostModelTest {

    private final TransactionCostModel costModel = new TransactionCostModel(0.0005, 0.0005, 0.03, 0.004);

    @Test
    void totalCost_longIsCommissionPlusProportionalFrictions() {
        double cost = costModel.totalCost(Direction.LONG, 1000.0, 1.0, 14);

        assertThat(cost).isCloseTo(1.0 + 0.5 + 0.5, within(1e-9));
    }

    @Test
    void totalCost_shortAddsProratedBorrow() {
        double cost = costModel.totalCost(Direction.SHORT, 1000.0, 1.0, 365);

        assertThat(cost).isCloseTo(2.0 + 30.0, within(1e-9));
    }

    @Test
    void borrowCost_zeroDaysIsFree() {
        assertThat(costModel.borrowCost(1000.0, 0)).isZero();
    }

    @Test
    void entryAndExitPrice_adjustAgainstTheTrade() {
        assertThat(costModel.entryPrice(Direction.LONG, 100.0)).isCloseTo(100.4, within(1e-9));
        assertThat(costModel.exitPrice(Direction.LONG, 100.0)).isCloseTo(99.6, within(1e-9));
        assertThat(costModel.entryPrice(Direction.SHORT, 100.0)).isCloseTo(99.6, within(1e-9));
        assertThat(costModel.exitPrice(Direction.SHORT, 100.0)).isCloseTo(100.4, within(1e-9));
    }

    @Test
    void entryPrice_negativeSpreadStillCostsTheLong() {
        assertThat(costModel.entryPrice(Direction.LONG, -50.0)).isCloseTo(-49.8, within(1e-9));
        assertThat(costModel.exitPrice(Direction.LONG, -50.0)).isCloseTo(-50.2, within(1e-9));
    }
}
