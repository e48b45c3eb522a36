package com.lendrisk.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/** One entry of a credit record's repayment history. */
@Value
@Builder
public class RepaymentEvent {
    String loanId;
    String assetId;
    BigDecimal amount;
    /** Debt left on the loan after this repayment. */
    BigDecimal remainingBalance;
    RepaymentSource source;
    int scoreAwarded;
    Instant ts;
}
