package com.payguard.agent.payment;

public enum LoanState {
    ACTIVE,
    OVERDUE,
    PAID,
    DEFAULTED
}
