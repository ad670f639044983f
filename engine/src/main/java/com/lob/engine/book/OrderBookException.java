package com.lob.engine.book;

import com.lob.protocol.RejectReason;

/**
 * Base type for requests the book refuses. When one is thrown the request has added no
 * order and no price level, and has moved no inside pointer.
 */
public class OrderBookException extends RuntimeException {

    private final RejectReason reason;

    public OrderBookException(RejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectReason reason() { return reason; }
}
