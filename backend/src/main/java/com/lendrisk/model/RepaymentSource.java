package com.lendrisk.model;

public enum RepaymentSource {
    BORROWER,
    LIQUIDATION
}
