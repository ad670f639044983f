package com.lob.engine.book;

import com.lob.protocol.RejectReason;

/** A configured allocation budget (orders, price levels, index entries) is exhausted. */
public final class CapacityExceededException extends OrderBookException {

    private final String resource;
    private final long limit;

    public CapacityExceededException(String resource, long limit) {
        super(RejectReason.CAPACITY_EXCEEDED, resource + " exhausted (limit " + limit + ")");
        this.resource = resource;
        this.limit = limit;
    }

    public String resource() { return resource; }

    public long limit() { return limit; }
}
