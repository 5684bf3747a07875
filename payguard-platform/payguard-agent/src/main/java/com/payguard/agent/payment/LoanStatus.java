package com.payguard.agent.payment;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Loan standing of the device owner as last reported by the backend.
 *
 * @param dueDate next installment due date, null when none is scheduled
 * @param daysOverdue days past due according to the backend
 */
public record LoanStatus(
        String loanId,
        String deviceId,
        LoanState state,
        LocalDate dueDate,
        int daysOverdue
) {
    public LoanStatus {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(state, "Loan state cannot be null");
        if (daysOverdue < 0) {
            throw new IllegalArgumentException("daysOverdue cannot be negative");
        }
    }
}
