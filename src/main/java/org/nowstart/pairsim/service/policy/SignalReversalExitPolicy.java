package org.nowstart.pairsim.service.policy;

import java.time.LocalDate;
import java.util.Optional;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.nowstart.pairsim.service.ledger.Position;
import org.springframework.stereotype.Component;

@Component
public class SignalReversalExitPolicy implements ExitPolicy {

    @Override
    public SimulationMode mode() {
        return SimulationMode.SPREAD_PRICE;
    }

    @Override
    public Optional<CloseDecision> evaluate(Position position, LocalDate date, SignalRow row, BacktestProperties properties) {
        if (row == null || !row.hasZScore() || !row.hasSpreadPrice()) {
            return Optional.empty();
        }
        if (Math.abs(row.zScore()) < properties.exitZThreshold()) {
            return Optional.of(new CloseDecision(CloseReason.MEAN_REVERSION, row.spreadPrice()));
        }
        return Optional.empty();
    }
}
