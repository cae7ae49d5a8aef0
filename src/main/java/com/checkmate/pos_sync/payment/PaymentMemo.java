package com.checkmate.pos_sync.payment;

import java.util.Locale;

/**
 * Memo text stored with a payment. Reporting reads the payment method back
 * from it for payments recorded before the method had its own column.
 */
public final class PaymentMemo {

    static final String CHECK_PREFIX = "CHK ";
    static final int CHECK_DETAIL_LENGTH = 14;

    private PaymentMemo() {
    }

    /**
     * {@code "CHK "} followed by the first 14 characters of the memo, or of the
     * check number when the memo is blank.
     */
    public static String forCheck(String memo, String checkNumber) {
        String detail = memo != null && !memo.isBlank()
            ? memo.trim()
            : checkNumber != null ? checkNumber.trim() : "";
        if (detail.length() > CHECK_DETAIL_LENGTH) {
            detail = detail.substring(0, CHECK_DETAIL_LENGTH);
        }
        return CHECK_PREFIX + detail;
    }

    /**
     * Meal type and last digit of the line number, e.g. {@code "L2 CASH"} for line 12.
     */
    public static String forCash(String mealType, int lineNum) {
        return mealType.trim().toUpperCase(Locale.ROOT) + (lineNum % 10) + " CASH";
    }

    public static String of(PaymentMethod method, String memo, String checkNumber, String mealType, int lineNum) {
        return method == PaymentMethod.CHECK ? forCheck(memo, checkNumber) : forCash(mealType, lineNum);
    }

    /**
     * CHECK if the memo mentions "CHK" anywhere, else CASH.
     */
    public static PaymentMethod methodOf(String memo) {
        return memo != null && memo.toUpperCase(Locale.ROOT).contains(CHECK_PREFIX.trim())
            ? PaymentMethod.CHECK
            : PaymentMethod.CASH;
    }
}
