package com.lendrisk.model;

public enum LoanStatus {
    OPEN,
    PARTIALLY_LIQUIDATED,
    CLOSED;

    public boolean isActive() {
        return this != CLOSED;
    }
}
