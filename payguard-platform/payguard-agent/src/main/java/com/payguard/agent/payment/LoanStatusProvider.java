package com.payguard.agent.payment;

import java.util.Optional;

/**
 * Source of the current loan standing (backend cache, payment SDK).
 */
public interface LoanStatusProvider {

    /**
     * @return the loan for the device, empty when the device carries no loan
     */
    Optional<LoanStatus> currentLoan(String deviceId);
}
