package com.lob.engine.book;

import com.lob.protocol.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LimitTest {

    private static final long PRICE = 100;

    private Limit limit;

    @BeforeEach
    void setUp() {
        limit = new Limit(PRICE);
    }

    @Test
    void testAppendKeepsArrivalOrder() {
        limit.append(order(3, 10));
        limit.append(order(4, 20));
        assertArrayEquals(new long[]{3, 4}, limit.orderIds().toLongArray());

        limit.append(order(5, 30));
        assertArrayEquals(new long[]{3, 4, 5}, limit.orderIds().toLongArray());
        assertEquals(new LimitView(PRICE, 60, 3), limit.view());
        limit.verify();
    }

    @Test
    void testRemoveHeadMiddleTail() {
        Order a = order(1, 10);
        Order b = order(2, 20);
        Order c = order(3, 30);
        Order d = order(4, 40);
        limit.append(a);
        limit.append(b);
        limit.append(c);
        limit.append(d);

        limit.remove(b);
        assertArrayEquals(new long[]{1, 3, 4}, limit.orderIds().toLongArray());
        limit.remove(a);
        assertArrayEquals(new long[]{3, 4}, limit.orderIds().toLongArray());
        limit.remove(d);
        assertArrayEquals(new long[]{3}, limit.orderIds().toLongArray());
        assertEquals(new LimitView(PRICE, 30, 1), limit.view());
        limit.verify();

        limit.remove(c);
        assertTrue(limit.isEmpty());
        assertEquals(0, limit.totalQty());
        limit.verify();

        // Queue still usable after draining
        limit.append(order(9, 5));
        assertArrayEquals(new long[]{9}, limit.orderIds().toLongArray());
        limit.verify();
    }

    @Test
    void testRemoveBeforeAppendSkipsAppend() {
        Order o = order(1, 10);
        limit.remove(o);
        assertFalse(limit.append(o), "Cancelled order must not be queued");
        assertTrue(limit.isEmpty());
        limit.verify();
    }

    @Test
    void testVerifyDetectsCorruptAggregate() {
        Order o = order(1, 10);
        limit.append(o);
        // Corrupt the queue behind the aggregates' back
        o.next = order(2, 99);

        IllegalStateException e = assertThrows(IllegalStateException.class, limit::verify);
        assertTrue(e.getMessage().startsWith("Level 100"), e.getMessage());
    }

    private Order order(long id, long qty) {
        Order o = new Order(id, Side.BUY, qty, PRICE, 0, 0);
        o.attach(limit);
        return o;
    }
}
