package com.lob.engine.book;

import com.lob.protocol.RejectReason;

public final class InvalidOrderException extends OrderBookException {

    public InvalidOrderException(RejectReason reason, String message) {
        super(reason, message);
    }
}
