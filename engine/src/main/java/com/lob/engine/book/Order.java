package com.lob.engine.book;

import com.lob.protocol.Side;

/**
 * A resting limit order. Identity fields are fixed at creation. The owning level is
 * attached once, after the order id has been claimed; queue links change afterwards
 * only under that {@link Limit}'s lock.
 */
public final class Order {

    public final long id;
    public final Side side;
    public final long qty;
    public final long price;
    public final long entryTime;
    public final long eventTime;

    // Back-pointer to the level this order belongs to (for fast cancel); guarded by this
    private volatile Limit limit;
    volatile boolean cancelled;

    // Intrusive doubly-linked list within a Limit; guarded by limit's monitor
    Order prev;
    Order next;
    boolean linked;

    Order(long id, Side side, long qty, long price, long entryTime, long eventTime) {
        this.id = id;
        this.side = side;
        this.qty = qty;
        this.price = price;
        this.entryTime = entryTime;
        this.eventTime = eventTime;
    }

    /** Level this order rests in, or {@code null} until it has been attached. */
    public Limit limit() { return limit; }

    /**
     * Binds the order to its level unless it was cancelled first.
     *
     * @return false if a cancel got here before the level was known
     */
    synchronized boolean attach(Limit level) {
        if (cancelled) return false;
        limit = level;
        return true;
    }

    /**
     * Marks the order cancelled.
     *
     * @return the level to unlink it from, or {@code null} if it was never attached
     */
    synchronized Limit detach() {
        cancelled = true;
        return limit;
    }

    @Override
    public String toString() {
        return "Order{id=" + id + ", side=" + side + ", qty=" + qty + ", price=" + price + '}';
    }
}
