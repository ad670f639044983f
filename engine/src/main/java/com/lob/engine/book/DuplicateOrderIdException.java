package com.lob.engine.book;

import com.lob.protocol.RejectReason;

public final class DuplicateOrderIdException extends OrderBookException {

    private final long orderId;

    public DuplicateOrderIdException(long orderId) {
        super(RejectReason.DUPLICATE_ORDER_ID, "Order id already resting: " + orderId);
        this.orderId = orderId;
    }

    public long orderId() { return orderId; }
}
