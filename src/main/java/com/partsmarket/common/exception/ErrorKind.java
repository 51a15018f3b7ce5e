package com.partsmarket.common.exception;

/**
 * Coarse failure category shared by every {@link ErrorCode}.
 * Clients branch on the kind; the code names the exact rule that was broken.
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    INVALID_STATE,
    INSUFFICIENT_STOCK,
    CONFLICT,
    BAD_REQUEST,
    INTERNAL
}
