package org.nowstart.pairsim.service.policy;

import java.time.LocalDate;
import java.util.Optional;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.nowstart.pairsim.service.ledger.Position;
import org.springframework.stereotype.Component;

/**
 * Closes once the scheduled close date is reached. Dates missing from the stream (holidays) are
 * caught up on the next processed date.
 */
@Component
public class FixedHorizonExitPolicy implements ExitPolicy {

    @Override
    public SimulationMode mode() {
        return SimulationMode.TARGET_OUTCOME;
    }

    @Override
    public Optional<CloseDecision> evaluate(Position position, LocalDate date, SignalRow row, BacktestProperties properties) {
        LocalDate scheduled = position.getScheduledCloseDate();
        if (scheduled == null || date.isBefore(scheduled)) {
            return Optional.empty();
        }
        return Optional.of(new CloseDecision(CloseReason.HORIZON, Double.NaN));
    }
}
