package org.nowstart.pairsim.data.type;

public enum CloseReason {
    MEAN_REVERSION,
    HORIZON,
    END_OF_BACKTEST
}
