package com.lob.protocol;

public enum Side {
    BUY, SELL;

    /**
     * True if {@code price} is at least as aggressive as {@code reference} on this side:
     * higher-or-equal for bids, lower-or-equal for asks.
     */
    public boolean atLeastAsAggressive(long price, long reference) {
        return this == BUY ? price >= reference : price <= reference;
    }
}
