package com.lendrisk.exception;

/** Rejection of a protocol operation. No state was changed when this is thrown. */
public class LendingException extends RuntimeException {

    private final ErrorCode code;

    public LendingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LendingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static LendingException unknownAsset(String assetId) {
        return new LendingException(ErrorCode.UNKNOWN_ASSET, "Unknown asset: " + assetId);
    }

    public static LendingException unknownUser(String userId) {
        return new LendingException(ErrorCode.UNKNOWN_USER, "Unknown user: " + userId);
    }

    public static LendingException unknownLoan(String loanId) {
        return new LendingException(ErrorCode.UNKNOWN_LOAN, "Unknown loan: " + loanId);
    }
}
