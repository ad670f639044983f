package com.lob.engine.book;

/** Point-in-time aggregates of one price level. */
public record LimitView(long price, long qty, int orderCount) {

    public boolean isEmpty() { return orderCount == 0; }
}
