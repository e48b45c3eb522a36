package com.lendrisk.exception;

/**
 * Failure kinds reported by protocol operations. Every operation either commits fully
 * or fails with exactly one of these.
 */
public enum ErrorCode {
    INSUFFICIENT_LIQUIDITY,
    EXCEEDS_MAX_BORROW,
    NOT_LIQUIDATABLE,
    EXCEEDS_LIQUIDATION_LIMIT,
    /** Collateral does not cover the seizure; signals bad debt. */
    PARTIAL_SEIZURE_SHORTFALL,
    UNKNOWN_ASSET,
    UNKNOWN_LOAN,
    UNKNOWN_USER,

    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,
    OUTSTANDING_LOAN,
    LOAN_CLOSED,
    NOT_LOAN_HOLDER,
    HEALTH_NOT_IMPROVED,
    DUPLICATE_ACCOUNT,
    RESOURCE_BUSY,
    UNAUTHORIZED,
    CUSTODY_FAILURE
}
