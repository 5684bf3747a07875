package com.payguard.agent.payment;

import com.payguard.agent.lock.LockDemand;
import com.payguard.agent.lock.LockReason;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PaymentLockPolicyTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 1);

    private final PaymentLockPolicy policy =
            new PaymentLockPolicy(2, 30, MutableClock.startingAt("2026-10-01T10:00:00Z"));

    @ParameterizedTest
    @CsvSource({
            "ACTIVE, 10, 0, ",
            "ACTIVE, 3, 0, ",
            "ACTIVE, 2, 0, SOFT",
            "ACTIVE, 0, 0, SOFT",
            "ACTIVE, -1, 0, HARD",
            "OVERDUE, -5, 5, HARD",
            "OVERDUE, -29, 0, HARD",
            "OVERDUE, -30, 0, PERMANENT",
            "OVERDUE, -2, 45, PERMANENT",
            "DEFAULTED, -90, 90, PERMANENT",
            "PAID, -3, 3, "
    })
    void demandFor_followsLoanStanding(LoanState state, int dueInDays, int daysOverdue, LockType expected) {
        LoanStatus loan = new LoanStatus("loan-1", "device-1", state, TODAY.plusDays(dueInDays), daysOverdue);

        Optional<LockDemand> demand = policy.demandFor(loan);

        assertThat(demand.map(LockDemand::type).orElse(null)).isEqualTo(expected);
    }

    @Test
    void defaulted_isPermanentWithDefaultReason() {
        LoanStatus loan = new LoanStatus("loan-1", "device-1", LoanState.DEFAULTED, null, 0);

        LockDemand demand = policy.demandFor(loan).orElseThrow();

        assertThat(demand.type()).isEqualTo(LockType.PERMANENT);
        assertThat(demand.reason()).isEqualTo(LockReason.PAYMENT_DEFAULT);
    }

    @Test
    void overdue_isHardWithOverdueReason() {
        LoanStatus loan = new LoanStatus("loan-1", "device-1", LoanState.OVERDUE, null, 4);

        LockDemand demand = policy.demandFor(loan).orElseThrow();

        assertThat(demand.reason()).isEqualTo(LockReason.PAYMENT_OVERDUE);
        assertThat(demand.message()).contains("4 day(s) overdue");
    }

    @Test
    void activeWithoutDueDate_demandsNothing() {
        LoanStatus loan = new LoanStatus("loan-1", "device-1", LoanState.ACTIVE, null, 0);

        assertThat(policy.demandFor(loan)).isEmpty();
    }

    @Test
    void onlyPaidReleasesPaymentLock() {
        for (LoanState state : LoanState.values()) {
            LoanStatus loan = new LoanStatus("loan-1", "device-1", state, TODAY, 0);
            assertThat(policy.releasesPaymentLock(loan)).isEqualTo(state == LoanState.PAID);
        }
    }

    @Test
    void loanStatus_rejectsNegativeDaysOverdue() {
        assertThatThrownBy(() -> new LoanStatus("loan-1", "device-1", LoanState.OVERDUE, TODAY, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
