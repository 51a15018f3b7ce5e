package com.partsmarket.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for domain rule violations.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, "Insufficient stock for \"Brake pad\"");
 * </pre>
 *
 * Thrown inside a {@code @Transactional} workflow it rolls the whole unit of work back.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }
}
