package com.lendrisk.risk;

import java.math.BigDecimal;

/** Risk limits that apply to one borrower after the credit-score adjustment. */
public record RiskTerms(BigDecimal maxLoanToValue, BigDecimal liquidationThreshold, BigDecimal interestDiscount) {}
