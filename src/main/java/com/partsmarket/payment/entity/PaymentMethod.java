package com.partsmarket.payment.entity;

public enum PaymentMethod {
    CARD,
    MOBILE_MONEY,
    BANK_TRANSFER,
    CASH_ON_PICKUP
}
