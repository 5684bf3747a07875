package com.payguard.agent.lock;

/**
 * Output of lock evaluation: the winning demand plus both inputs, so the ledger can record
 * which source was outvoted.
 *
 * @param lockType winning type, null when nothing demands a lock
 * @param releasePaymentLock the loan is PAID, so a payment-origin lock may be lifted
 */
public record LockDecision(
        String deviceId,
        LockType lockType,
        LockReason reason,
        boolean pinRequired,
        String message,
        LockDemand tamperDemand,
        LockDemand paymentDemand,
        boolean releasePaymentLock
) {

    public boolean requiresLock() {
        return lockType != null;
    }

    public LockDemand winningDemand() {
        return lockType == null ? null : new LockDemand(lockType, reason, message);
    }

    /**
     * The demand that lost to the winner, if both sources asked for a lock.
     */
    public LockDemand outvotedDemand() {
        if (tamperDemand == null || paymentDemand == null) {
            return null;
        }
        return reason == LockReason.TAMPER ? paymentDemand : tamperDemand;
    }
}
