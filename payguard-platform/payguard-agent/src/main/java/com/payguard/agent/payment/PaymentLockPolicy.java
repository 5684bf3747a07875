package com.payguard.agent.payment;

import com.payguard.agent.lock.LockDemand;
import com.payguard.agent.lock.LockReason;
import com.payguard.agent.lock.LockType;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps loan standing to a payment lock demand.
 *
 * <ul>
 *   <li>ACTIVE, due within the reminder window (due today included): SOFT reminder</li>
 *   <li>ACTIVE past due, or OVERDUE below the default threshold: HARD</li>
 *   <li>OVERDUE at or past the threshold, or DEFAULTED: PERMANENT</li>
 *   <li>PAID: no demand, and any payment lock is released</li>
 * </ul>
 */
public class PaymentLockPolicy {

    private final int reminderWindowDays;
    private final int defaultThresholdDays;
    private final Clock clock;

    public PaymentLockPolicy(int reminderWindowDays, int defaultThresholdDays, Clock clock) {
        if (reminderWindowDays < 0) {
            throw new IllegalArgumentException("Reminder window cannot be negative");
        }
        if (defaultThresholdDays < 1) {
            throw new IllegalArgumentException("Default threshold must be positive");
        }
        this.reminderWindowDays = reminderWindowDays;
        this.defaultThresholdDays = defaultThresholdDays;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public Optional<LockDemand> demandFor(LoanStatus loan) {
        Objects.requireNonNull(loan, "Loan cannot be null");
        return switch (loan.state()) {
            case PAID -> Optional.empty();
            case DEFAULTED -> Optional.of(defaulted());
            case OVERDUE -> {
                int days = effectiveDaysOverdue(loan);
                yield Optional.of(days >= defaultThresholdDays ? defaulted() : overdue(days));
            }
            case ACTIVE -> activeDemand(loan);
        };
    }

    public boolean releasesPaymentLock(LoanStatus loan) {
        return loan != null && loan.state() == LoanState.PAID;
    }

    private Optional<LockDemand> activeDemand(LoanStatus loan) {
        if (loan.dueDate() == null) {
            return Optional.empty();
        }
        long daysUntilDue = ChronoUnit.DAYS.between(today(), loan.dueDate());
        if (daysUntilDue < 0) {
            return Optional.of(overdue((int) -daysUntilDue));
        }
        if (daysUntilDue <= reminderWindowDays) {
            String when = daysUntilDue == 0 ? "today" : "in " + daysUntilDue + " day(s)";
            return Optional.of(new LockDemand(LockType.SOFT, LockReason.PAYMENT_OVERDUE,
                    "Your payment is due " + when + "."));
        }
        return Optional.empty();
    }

    private int effectiveDaysOverdue(LoanStatus loan) {
        int fromDueDate = 0;
        if (loan.dueDate() != null) {
            fromDueDate = (int) Math.max(0, ChronoUnit.DAYS.between(loan.dueDate(), today()));
        }
        return Math.max(loan.daysOverdue(), fromDueDate);
    }

    private LockDemand overdue(int days) {
        return new LockDemand(LockType.HARD, LockReason.PAYMENT_OVERDUE,
                "Payment is " + days + " day(s) overdue. Pay now or contact support to unlock.");
    }

    private LockDemand defaulted() {
        return new LockDemand(LockType.PERMANENT, LockReason.PAYMENT_DEFAULT,
                "The loan is in default. Contact support to restore access.");
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    public int reminderWindowDays() {
        return reminderWindowDays;
    }

    public int defaultThresholdDays() {
        return defaultThresholdDays;
    }
}
