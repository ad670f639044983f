package com.lob.engine.book;

import com.lob.common.BookConfig;
import com.lob.protocol.RejectReason;
import com.lob.protocol.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Concurrent index of the resting orders of a single instrument.
 *
 * Data structures:
 *   - levels: {@link PriceLevelIndex}, one lock-free price tree per side with cached
 *     inside pointers
 *   - orders: {@link IdentifierIndex} order id -> Order for O(1) cancel lookup
 *
 * Any number of threads may call any method concurrently. The price trees and the
 * indexes never block; queue mutation within one level is serialized on that level.
 * Memory is reclaimed by the garbage collector once nothing references a node, so
 * cancelled orders and empty levels stay safe to read from other threads.
 *
 * Order ids are unique among resting orders: a new order whose id is still resting is
 * rejected. An id becomes reusable once its order is cancelled.
 */
public final class OrderBook {

    private static final Logger log = LoggerFactory.getLogger(OrderBook.class);

    private final PriceLevelIndex levels;
    private final IdentifierIndex<Order> orders;
    private final int maxRestingOrders;
    private final AtomicInteger resting = new AtomicInteger();

    public OrderBook(BookConfig cfg) {
        this(cfg.orderIndexBuckets, cfg.maxOrderIndexEntries, cfg.priceIndexBuckets,
                cfg.maxPriceLevels, cfg.maxRestingOrders);
    }

    public OrderBook(int orderIndexBuckets, long maxOrderIndexEntries,
                     int priceIndexBuckets, int maxPriceLevels, int maxRestingOrders) {
        if (maxRestingOrders <= 0) throw new IllegalArgumentException("maxRestingOrders must be positive");
        this.levels = new PriceLevelIndex(priceIndexBuckets, maxPriceLevels);
        this.orders = new IdentifierIndex<>("order", orderIndexBuckets, maxOrderIndexEntries);
        this.maxRestingOrders = maxRestingOrders;
    }

    /**
     * Rests a new order at the back of its price level's queue.
     *
     * @throws InvalidOrderException      if side is null or qty is not positive
     * @throws DuplicateOrderIdException  if an order with this id is still resting
     * @throws CapacityExceededException  if an order, level or index budget is exhausted
     */
    public void onNewOrder(long id, Side side, long qty, long price, long entryTime, long eventTime) {
        if (side == null) {
            throw reject(new InvalidOrderException(RejectReason.INVALID_SIDE, "Order " + id + " has no side"));
        }
        if (qty <= 0) {
            throw reject(new InvalidOrderException(RejectReason.INVALID_QTY, "Order " + id + " qty " + qty));
        }
        if (resting.incrementAndGet() > maxRestingOrders) {
            resting.decrementAndGet();
            throw reject(new CapacityExceededException("resting orders", maxRestingOrders));
        }

        // Claim the id first so a rejected request never creates a level
        Order order = new Order(id, side, qty, price, entryTime, eventTime);
        try {
            if (orders.insertIfAbsent(id, order) != null) {
                throw new DuplicateOrderIdException(id);
            }
        } catch (OrderBookException e) {
            resting.decrementAndGet();
            throw reject(e);
        }

        Limit limit;
        try {
            limit = levels.findOrInsertLimit(side, price);
        } catch (CapacityExceededException e) {
            // A cancel that already took the order has released its capacity
            if (orders.remove(id, order)) resting.decrementAndGet();
            throw reject(e);
        }

        // A cancel may already have claimed the order from the index; it then never
        // enters the queue and the cancel has released the capacity.
        if (order.attach(limit)) {
            limit.append(order);
        }
    }

    /**
     * Removes a resting order.
     *
     * @return the cancelled order, or {@code null} if no order with this id is resting
     */
    public Order onCancel(long id) {
        Order o = orders.erase(id);
        if (o == null) {
            log.debug("Cancel for unknown order {}", id);
            return null;
        }
        Limit limit = o.detach();
        if (limit != null) {
            limit.remove(o);
        }
        resting.decrementAndGet();
        return o;
    }

    /** Highest bid ever inserted (may have no resting orders), or {@code null}. */
    public LimitView bestBid() { return viewOf(levels.inside(Side.BUY)); }

    /** Lowest ask ever inserted (may have no resting orders), or {@code null}. */
    public LimitView bestAsk() { return viewOf(levels.inside(Side.SELL)); }

    /** Highest bid with resting orders, or {@code null}. */
    public LimitView bestLiveBid() { return viewOf(levels.bestLive(Side.BUY)); }

    /** Lowest ask with resting orders, or {@code null}. */
    public LimitView bestLiveAsk() { return viewOf(levels.bestLive(Side.SELL)); }

    public LimitView findLimit(Side side, long price) {
        return viewOf(levels.find(side, price));
    }

    /**
     * Up to {@code maxLevels} non-empty levels, best price first.
     *
     * @throws IllegalArgumentException if {@code maxLevels} is negative
     */
    public List<LimitView> depth(Side side, int maxLevels) {
        if (maxLevels < 0) throw new IllegalArgumentException("maxLevels must not be negative: " + maxLevels);
        List<LimitView> out = new ArrayList<>(Math.min(maxLevels, 64));
        if (maxLevels == 0) return out;
        levels.forEachLevelWhile(side, l -> {
            LimitView v = l.view();
            if (!v.isEmpty()) out.add(v);
            return out.size() < maxLevels;
        });
        return out;
    }

    /** Order ids resting at one level in time priority; empty if the level does not exist. */
    public long[] queue(Side side, long price) {
        Limit l = levels.find(side, price);
        return l == null ? new long[0] : l.orderIds().toLongArray();
    }

    public Order findOrder(long id) { return orders.find(id); }

    public int restingOrderCount() { return resting.get(); }

    PriceLevelIndex levels() { return levels; }

    /**
     * Checks every level's queue against its aggregates. Intended for quiescent books;
     * under concurrent mutation each level is still checked atomically.
     *
     * @throws IllegalStateException if any level is inconsistent
     */
    public void verifyIntegrity() {
        for (Side side : Side.values()) {
            levels.forEachLevel(side, Limit::verify);
        }
    }

    private static LimitView viewOf(Limit l) {
        return l == null ? null : l.view();
    }

    private static OrderBookException reject(OrderBookException e) {
        log.warn("Rejected: {} ({})", e.getMessage(), e.reason());
        return e;
    }
}
