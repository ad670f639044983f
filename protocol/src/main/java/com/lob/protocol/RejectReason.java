package com.lob.protocol;

/** Why the book refused a request. */
public enum RejectReason {
    DUPLICATE_ORDER_ID,
    ORDER_NOT_FOUND,
    INVALID_SIDE,
    INVALID_QTY,
    CAPACITY_EXCEEDED
}
