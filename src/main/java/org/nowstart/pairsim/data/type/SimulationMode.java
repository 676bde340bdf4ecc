package org.nowstart.pairsim.data.type;

/**
 * How a signal stream turns into PnL.
 *
 * <p>{@link #SPREAD_PRICE} marks positions against the daily spread and exits on Z-score reversion.
 * {@link #TARGET_OUTCOME} holds for a fixed number of trading days and realizes the forward outcome
 * labelled on the entry row.
 */
public enum SimulationMode {
    SPREAD_PRICE,
    TARGET_OUTCOME
}
