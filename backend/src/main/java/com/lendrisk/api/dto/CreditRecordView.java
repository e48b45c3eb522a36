package com.lendrisk.api.dto;

import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.RepaymentEvent;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder
public class CreditRecordView {
    private String userId;
    private String accountAddress;
    private Instant registeredAt;

    private Map<String, BigDecimal> deposits;
    /** Free collateral only. */
    private Map<String, BigDecimal> collateral;
    private Set<String> loanIds;

    private int creditScore;
    private int paidOff;
    private int defaults;
    private List<RepaymentEvent> repaymentHistory;

    public static CreditRecordView from(CreditRecord r) {
        return CreditRecordView.builder()
                .userId(r.getUserId())
                .accountAddress(r.getAccountAddress())
                .registeredAt(r.getRegisteredAt())
                .deposits(r.getDeposits())
                .collateral(r.getCollateral())
                .loanIds(r.getLoanIds())
                .creditScore(r.getCreditScore())
                .paidOff(r.getPaidOff())
                .defaults(r.getDefaults())
                .repaymentHistory(r.getRepaymentHistory())
                .build();
    }
}
