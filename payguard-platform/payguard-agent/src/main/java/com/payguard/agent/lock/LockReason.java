package com.payguard.agent.lock;

public enum LockReason {
    TAMPER,
    PAYMENT_OVERDUE,
    PAYMENT_DEFAULT;

    public boolean paymentRelated() {
        return this != TAMPER;
    }
}
