package org.nowstart.pairsim.data.type;

public enum TradeEventType {
    ENTRY,
    EXIT
}
