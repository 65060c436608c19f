package com.algoanalytics.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Direction of an open lot. A BUY fill opens LONG lots, a SELL fill opens SHORT lots. */
@Getter
@RequiredArgsConstructor
public enum LotDirection {
    LONG(1),
    SHORT(-1);

    /** Multiplier applied to (exit - entry) to obtain gross P&L. */
    private final int sign;

    public static LotDirection openedBy(OrderSide side) {
        return side == OrderSide.BUY ? LONG : SHORT;
    }
}
