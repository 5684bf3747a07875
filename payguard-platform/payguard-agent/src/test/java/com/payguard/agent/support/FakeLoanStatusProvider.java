package com.payguard.agent.support;

import com.payguard.agent.payment.LoanState;
import com.payguard.agent.payment.LoanStatus;
import com.payguard.agent.payment.LoanStatusProvider;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class FakeLoanStatusProvider implements LoanStatusProvider {

    private final Map<String, LoanStatus> loans = new ConcurrentHashMap<>();
    private volatile boolean unavailable;

    public void set(String deviceId, LoanState state, LocalDate dueDate, int daysOverdue) {
        loans.put(deviceId, new LoanStatus("loan-" + deviceId, deviceId, state, dueDate, daysOverdue));
    }

    public void clear(String deviceId) {
        loans.remove(deviceId);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public Optional<LoanStatus> currentLoan(String deviceId) {
        if (unavailable) {
            throw new IllegalStateException("loan service unreachable");
        }
        return Optional.ofNullable(loans.get(deviceId));
    }
}
