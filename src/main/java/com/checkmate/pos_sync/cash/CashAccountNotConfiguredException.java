package com.checkmate.pos_sync.cash;

/**
 * The cash placeholder account is missing from the roster. This is a deployment
 * problem: it fails cash items only and never aborts a batch.
 */
public class CashAccountNotConfiguredException extends RuntimeException {

    public static final String ERROR_CODE = "CASH_STUDENT_NOT_CONFIGURED";
    public static final String ERROR_MESSAGE =
        "Cash Student account not configured in database. Contact administrator.";

    public CashAccountNotConfiguredException() {
        super(ERROR_MESSAGE);
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }
}
