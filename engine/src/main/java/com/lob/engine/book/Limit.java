package com.lob.engine.book;

import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * A price level: a node of the side's price tree and the FIFO queue of orders
 * resting at that price. Head = oldest (first to match). Tail = newest.
 *
 * Tree links are published lock-free through {@link #LEFT}/{@link #RIGHT} CAS and are
 * never changed once set. Queue mutation is serialized on this object's monitor;
 * {@code orderCount} and {@code totalQty} are written under it and may be read
 * without it.
 */
public final class Limit {

    static final VarHandle LEFT;
    static final VarHandle RIGHT;
    static {
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            LEFT  = lookup.findVarHandle(Limit.class, "left", Limit.class);
            RIGHT = lookup.findVarHandle(Limit.class, "right", Limit.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    public final long price;

    private volatile int orderCount;
    private volatile long totalQty;

    // Intrusive tree links
    volatile Limit left;
    volatile Limit right;
    volatile Limit parent;

    private Order head;
    private Order tail;

    Limit(long price) {
        this.price = price;
    }

    /**
     * Links {@code o} at the tail unless it was cancelled before it got here.
     *
     * @return true if the order is now resting in this level
     */
    synchronized boolean append(Order o) {
        if (o.cancelled) return false;
        o.prev = tail;
        o.next = null;
        if (tail != null) tail.next = o;
        else head = o;
        tail = o;
        o.linked = true;
        orderCount++;
        totalQty += o.qty;
        return true;
    }

    /**
     * Unlinks {@code o}. An order that has been claimed but not yet appended is marked
     * cancelled so that the pending {@link #append} skips it.
     */
    synchronized void remove(Order o) {
        if (!o.linked) {
            o.cancelled = true;
            return;
        }
        if (o.prev != null) o.prev.next = o.next;
        else head = o.next;
        if (o.next != null) o.next.prev = o.prev;
        else tail = o.prev;
        o.prev = null;
        o.next = null;
        o.linked = false;
        o.cancelled = true;
        orderCount--;
        totalQty -= o.qty;
    }

    public int orderCount() { return orderCount; }

    public long totalQty() { return totalQty; }

    public boolean isEmpty() { return orderCount == 0; }

    /** Count and quantity read together, so they always describe the same queue. */
    public synchronized LimitView view() {
        return new LimitView(price, totalQty, orderCount);
    }

    /** Order ids in time priority. */
    public synchronized LongArrayList orderIds() {
        LongArrayList ids = new LongArrayList(orderCount);
        for (Order o = head; o != null; o = o.next) ids.add(o.id);
        return ids;
    }

    /**
     * Checks the queue links and that the aggregates match the linked orders.
     *
     * @throws IllegalStateException on the first inconsistency found
     */
    synchronized void verify() {
        int count = 0;
        long qty = 0;
        Order prev = null;
        for (Order o = head; o != null; o = o.next) {
            if (o.prev != prev) throw corrupt("broken prev link at order " + o.id);
            if (o.limit() != this) throw corrupt("order " + o.id + " attached to " + o.limit());
            if (!o.linked) throw corrupt("unlinked order " + o.id + " still queued");
            count++;
            qty += o.qty;
            prev = o;
        }
        if (tail != prev) throw corrupt("tail is not the last queued order");
        if (count != orderCount) throw corrupt("orderCount " + orderCount + " but " + count + " queued");
        if (qty != totalQty) throw corrupt("totalQty " + totalQty + " but " + qty + " queued");
    }

    private IllegalStateException corrupt(String detail) {
        return new IllegalStateException("Level " + price + ": " + detail);
    }

    @Override
    public String toString() {
        return "Limit{price=" + price + ", qty=" + totalQty + ", orders=" + orderCount + '}';
    }
}
