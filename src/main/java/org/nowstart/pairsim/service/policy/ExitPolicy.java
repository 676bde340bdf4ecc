package org.nowstart.pairsim.service.policy;

import java.time.LocalDate;
import java.util.Optional;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.nowstart.pairsim.service.ledger.Position;

/**
 * Decides whether an open position has to close on a given date.
 */
public interface ExitPolicy {

    SimulationMode mode();

    /**
     * @param position   the open position
     * @param date       date being processed
     * @param row        the pair's row for {@code date}, or {@code null} when the stream has none
     * @param properties run configuration
     * @return the close reason when the position must close today
     */
    Optional<CloseDecision> evaluate(Position position, LocalDate date, SignalRow row, BacktestProperties properties);
}
