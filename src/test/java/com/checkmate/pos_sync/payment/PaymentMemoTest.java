package com.checkmate.pos_sync.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaymentMemoTest {

    @Nested
    @DisplayName("Check memos")
    class CheckMemos {

        @Test
        @DisplayName("Memo text wins over the check number")
        void usesMemo() {
            assertEquals("CHK lunch money", PaymentMemo.forCheck("lunch money", "1001"));
        }

        @Test
        @DisplayName("Blank memo falls back to the check number")
        void fallsBackToCheckNumber() {
            assertEquals("CHK 1001", PaymentMemo.forCheck("  ", "1001"));
            assertEquals("CHK ", PaymentMemo.forCheck(null, null));
        }

        @Test
        @DisplayName("Detail is cut to 14 characters")
        void truncatesDetail() {
            assertEquals("CHK 12345678901234", PaymentMemo.forCheck("1234567890123456789", null));
        }
    }

    @Test
    @DisplayName("Cash memo uses the meal letter and the last digit of the line number")
    void cashMemo() {
        assertEquals("L2 CASH", PaymentMemo.forCash("l", 12));
        assertEquals("B5 CASH", PaymentMemo.forCash("B", 5));
    }

    @Test
    @DisplayName("Method is read back from the memo")
    void methodFromMemo() {
        assertEquals(PaymentMethod.CHECK, PaymentMemo.methodOf("CHK 1001"));
        assertEquals(PaymentMethod.CHECK, PaymentMemo.methodOf("paid by chk"));
        assertEquals(PaymentMethod.CASH, PaymentMemo.methodOf("L1 CASH"));
        assertEquals(PaymentMethod.CASH, PaymentMemo.methodOf(null));
    }

    @Test
    @DisplayName("Payment type parses in any case")
    void parsesPaymentType() {
        assertEquals(PaymentMethod.CASH, PaymentMethod.parse("Cash"));
        assertEquals(PaymentMethod.CHECK, PaymentMethod.parse("CHECK"));
        assertThrows(IllegalArgumentException.class, () -> PaymentMethod.parse("card"));
        assertThrows(IllegalArgumentException.class, () -> PaymentMethod.parse(""));
    }
}
