package com.partsmarket.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every failure the API reports, with the problem kind and HTTP status it maps to.
 *
 * <h3>Kind vs. code</h3>
 * The {@link ErrorKind} is the coarse category clients branch on. The code name is the
 * precise reason and appears as the {@code code} property of the problem body. Several
 * codes share a kind; for example all three "not found" codes map to {@code NOT_FOUND}.
 *
 * <h3>Ownership</h3>
 * Reads of another user's order answer {@link #ORDER_ACCESS_DENIED}. Reads of another
 * user's payment answer {@link #PAYMENT_NOT_FOUND} so payment ids cannot be enumerated.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    /** Malformed request: failed bean validation, unreadable body, or a rule on the input values. */
    INVALID_INPUT(ErrorKind.BAD_REQUEST, HttpStatus.BAD_REQUEST, "Invalid input value"),
    /** Optimistic lock still lost after the retries were used up. */
    CONCURRENT_MODIFICATION(ErrorKind.CONFLICT, HttpStatus.CONFLICT,
            "The resource was modified concurrently. Please retry"),
    /** Anything unexpected; details stay in the log. */
    INTERNAL_ERROR(ErrorKind.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Part
    /** A line references a part id that is not in the catalog. */
    PART_NOT_FOUND(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND, "Part not found"),
    /** Not enough units left at write time; nothing of the order was reserved. */
    INSUFFICIENT_STOCK(ErrorKind.INSUFFICIENT_STOCK, HttpStatus.BAD_REQUEST, "Insufficient stock"),

    // Order
    ORDER_NOT_FOUND(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND, "Order not found"),
    /** The order exists but belongs to another user. */
    ORDER_ACCESS_DENIED(ErrorKind.FORBIDDEN, HttpStatus.FORBIDDEN, "You do not have access to this order"),
    /** The order's current status does not allow the requested step. */
    INVALID_ORDER_STATUS(ErrorKind.INVALID_STATE, HttpStatus.BAD_REQUEST, "Invalid order status transition"),

    // Payment
    /** Unknown payment, or a payment of someone else's order. */
    PAYMENT_NOT_FOUND(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND, "Payment not found"),
    /** Payment opened against an order the requester does not own. */
    PAYMENT_ORDER_MISMATCH(ErrorKind.BAD_REQUEST, HttpStatus.BAD_REQUEST, "You do not own this order"),
    /** Payment amount differs from the order total. */
    PAYMENT_AMOUNT_MISMATCH(ErrorKind.BAD_REQUEST, HttpStatus.BAD_REQUEST,
            "Payment amount does not match order total"),
    /** Payment already settled in a way that rules out the requested status. */
    INVALID_PAYMENT_STATUS(ErrorKind.INVALID_STATE, HttpStatus.BAD_REQUEST, "Invalid payment status transition");

    private final ErrorKind kind;
    private final HttpStatus status;
    /** Default detail, used when the thrower gives no message of its own. */
    private final String message;
}
