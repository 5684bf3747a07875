package com.payguard.agent.lock;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.Result;
import com.payguard.agent.escalation.EscalationState;
import com.payguard.agent.escalation.EscalationStateStore;
import com.payguard.agent.payment.LoanStatus;
import com.payguard.agent.payment.LoanStatusProvider;
import com.payguard.agent.payment.PaymentLockPolicy;
import com.payguard.agent.platform.PrivilegeGateway;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides and applies the device lock from the tamper and payment demands.
 *
 * <p>{@link #evaluate} is pure over the current inputs: the strictest demand wins and a HARD
 * tie goes to TAMPER. {@link #apply} is idempotent and only ever escalates on its own;
 * a lock is lowered or lifted only by an explicit release (offline PIN, backend, SOFT
 * dismissal or expiry) or, for payment locks, by the loan being PAID.</p>
 *
 * <p>A released demand is remembered as acknowledged so the next cycle does not lock the
 * device again for the same reason.</p>
 */
public class LockEnforcementManager {

    private static final Logger log = LoggerFactory.getLogger(LockEnforcementManager.class);

    private static final String LEDGER_KEY = "lock.ledger.";
    private static final String PIN_KEY = "lock.pin.";
    static final int MIN_PIN_ATTEMPTS = 3;
    static final int MAX_PIN_ATTEMPTS = 5;

    private final StateRepository repository;
    private final EscalationStateStore escalationStore;
    private final LoanStatusProvider loanStatusProvider;
    private final PaymentLockPolicy paymentPolicy;
    private final PrivilegeGateway privilegeGateway;
    private final AuditLog auditLog;
    private final Clock clock;
    private final PinHasher pinHasher = new PinHasher();
    private final int maxPinAttempts;
    private final Duration softLockTtl;
    private final Map<String, LockLedger> ledgers = new ConcurrentHashMap<>();

    public LockEnforcementManager(
            StateRepository repository,
            EscalationStateStore escalationStore,
            LoanStatusProvider loanStatusProvider,
            PaymentLockPolicy paymentPolicy,
            PrivilegeGateway privilegeGateway,
            AuditLog auditLog,
            Clock clock,
            int maxPinAttempts,
            Duration softLockTtl) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.escalationStore = Objects.requireNonNull(escalationStore, "Escalation store cannot be null");
        this.loanStatusProvider = Objects.requireNonNull(loanStatusProvider, "Loan status provider cannot be null");
        this.paymentPolicy = Objects.requireNonNull(paymentPolicy, "Payment policy cannot be null");
        this.privilegeGateway = Objects.requireNonNull(privilegeGateway, "Privilege gateway cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.maxPinAttempts = Math.max(MIN_PIN_ATTEMPTS, Math.min(MAX_PIN_ATTEMPTS, maxPinAttempts));
        this.softLockTtl = Objects.requireNonNull(softLockTtl, "Soft lock TTL cannot be null");
    }

    // ==================== Evaluation ====================

    /**
     * Computes the lock decision from the escalation state and the loan standing.
     * Has no side effects.
     */
    public LockDecision evaluate(String deviceId) {
        EscalationState escalation = escalationStore.load(deviceId);
        LockDemand tamperDemand = escalation.tamperLockDemand() == null ? null
                : new LockDemand(escalation.tamperLockDemand(), LockReason.TAMPER,
                        "Security violation detected on this device. Contact support.");

        Optional<LoanStatus> loan;
        try {
            loan = loanStatusProvider.currentLoan(deviceId);
        } catch (RuntimeException e) {
            log.warn("Loan status unavailable for {}, keeping current payment lock: {}", deviceId, e.getMessage());
            loan = Optional.empty();
        }

        LockDemand paymentDemand = loan.flatMap(paymentPolicy::demandFor).orElse(null);
        boolean releasePaymentLock = loan.map(paymentPolicy::releasesPaymentLock).orElse(false);
        return decide(deviceId, tamperDemand, paymentDemand, releasePaymentLock);
    }

    static LockDecision decide(String deviceId, LockDemand tamperDemand, LockDemand paymentDemand,
                               boolean releasePaymentLock) {
        LockDemand winner;
        if (tamperDemand == null) {
            winner = paymentDemand;
        } else if (paymentDemand == null) {
            winner = tamperDemand;
        } else {
            winner = paymentDemand.type().stricterThan(tamperDemand.type()) ? paymentDemand : tamperDemand;
        }

        if (winner == null) {
            return new LockDecision(deviceId, null, null, false, null,
                    tamperDemand, paymentDemand, releasePaymentLock);
        }
        return new LockDecision(deviceId, winner.type(), winner.reason(), winner.type() == LockType.HARD,
                winner.message(), tamperDemand, paymentDemand, releasePaymentLock);
    }

    // ==================== Enforcement ====================

    /**
     * Evaluates and applies in one step.
     */
    public boolean enforce(String deviceId) {
        return apply(evaluate(deviceId));
    }

    /**
     * Brings the ledger and the platform lock in line with the decision.
     *
     * @return true when the lock in force (if any) is confirmed by the platform
     */
    public synchronized boolean apply(LockDecision decision) {
        Objects.requireNonNull(decision, "Decision cannot be null");
        String deviceId = decision.deviceId();
        Instant now = clock.instant();
        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        LockDemand demand = decision.winningDemand();

        if (current != null && current.reason().paymentRelated() && decision.releasePaymentLock()) {
            ledger = release(ledger, current, now, "PAYMENT_SETTLED", null);
            current = null;
            save(deviceId, ledger);
        }

        if (current == null) {
            LockDemand acknowledged = ledger.acknowledgedDemand();
            if (demand == null || !demand.sameAs(acknowledged)) {
                if (acknowledged != null) {
                    ledger = ledger.withAcknowledged(null);
                    save(deviceId, ledger);
                }
            }
            if (demand == null || demand.sameAs(ledger.acknowledgedDemand())) {
                return true;
            }
            LockRecord record = lock(deviceId, demand, otherDemand(decision, demand), now);
            save(deviceId, new LockLedger(record, null, ledger.history()));
            return record.enforced();
        }

        if (demand != null && demand.type().stricterThan(current.lockType())) {
            LockLedger retired = ledger.retire(current.released(now, "SUPERSEDED"), null);
            auditLog.logLockReleased(deviceId, current.lockId(), current.lockType().name(), "SUPERSEDED");
            LockRecord record = lock(deviceId, demand, otherDemand(decision, demand), now);
            save(deviceId, retired.withActive(record));
            return record.enforced();
        }

        LockRecord updated = current;
        LockDemand suppressed = otherDemand(decision, current.demand());
        if (!Objects.equals(suppressed, current.suppressedDemand())) {
            updated = updated.withSuppressedDemand(suppressed);
        }
        if (!updated.enforced()) {
            log.info("Retrying platform lock for {} ({})", deviceId, updated.lockType());
            updated = updated.withEnforced(privilegeGateway.lockDevice().isOk());
        }
        if (!updated.equals(current)) {
            save(deviceId, ledger.withActive(updated));
        }
        return updated.enforced();
    }

    /**
     * Releases SOFT locks whose display period is over.
     *
     * @return true when a lock expired
     */
    public synchronized boolean expireSoftLocks(String deviceId) {
        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        if (current == null || current.lockType() != LockType.SOFT || current.expiresAt() == null) {
            return false;
        }
        Instant now = clock.instant();
        if (now.isBefore(current.expiresAt())) {
            return false;
        }
        save(deviceId, release(ledger, current, now, "EXPIRED", current.demand()));
        return true;
    }

    // ==================== Unlock ====================

    /**
     * Attempts an offline unlock. Only SOFT and HARD locks accept a PIN; each wrong PIN
     * uses one attempt and the last one moves the lock to PIN_EXHAUSTED.
     */
    public synchronized UnlockResult unlockWithPin(String deviceId, String pin) {
        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        if (current == null) {
            return UnlockResult.rejected(0, LockStatus.RELEASED, "No active lock");
        }
        if (!current.lockType().pinUnlockable()) {
            return UnlockResult.rejected(0, current.status(), "This lock can only be released by support");
        }
        if (current.status() == LockStatus.PIN_EXHAUSTED) {
            return UnlockResult.rejected(0, LockStatus.PIN_EXHAUSTED,
                    "Maximum PIN attempts exceeded. Contact support to unlock.");
        }
        if (!current.hasPin()) {
            return UnlockResult.rejected(current.remainingAttempts(), current.status(),
                    "No offline unlock PIN has been issued for this device");
        }

        Instant now = clock.instant();
        if (pinHasher.matches(pin, current.pinHash(), current.pinSalt())) {
            save(deviceId, release(ledger, current, now, "PIN", current.demand()));
            auditLog.logUnlockAttempt(deviceId, current.lockId(), true, current.remainingAttempts());
            log.info("Device {} unlocked with offline PIN", deviceId);
            return new UnlockResult(true, current.remainingAttempts(), LockStatus.RELEASED, "Device unlocked");
        }

        int failed = current.failedAttempts() + 1;
        LockStatus status = failed >= current.maxAttempts() ? LockStatus.PIN_EXHAUSTED : LockStatus.ACTIVE;
        LockRecord updated = current.withFailedAttempt(failed, status);
        save(deviceId, ledger.withActive(updated));
        auditLog.logUnlockAttempt(deviceId, current.lockId(), false, updated.remainingAttempts());
        log.warn("Incorrect unlock PIN for {}, {} attempt(s) left", deviceId, updated.remainingAttempts());

        String message = status == LockStatus.PIN_EXHAUSTED
                ? "Maximum PIN attempts exceeded. Contact support to unlock."
                : "Incorrect PIN. " + updated.remainingAttempts() + " attempt(s) remaining.";
        return UnlockResult.rejected(updated.remainingAttempts(), status, message);
    }

    /**
     * Releases any lock on backend authorization. Always succeeds locally; a failing
     * platform release is audited by the gateway.
     */
    public synchronized boolean unlockFromBackend(String deviceId, String authorization) {
        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        if (current == null) {
            return true;
        }
        String by = "BACKEND" + (authorization != null && !authorization.isBlank() ? ":" + authorization : "");
        save(deviceId, release(ledger, current, clock.instant(), by, current.demand()));
        log.info("Device {} unlocked by backend ({})", deviceId, authorization);
        return true;
    }

    /**
     * Dismisses a SOFT lock. Has no effect on stricter locks.
     */
    public synchronized boolean dismissSoftLock(String deviceId) {
        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        if (current == null || current.lockType() != LockType.SOFT) {
            return false;
        }
        save(deviceId, release(ledger, current, clock.instant(), "USER_DISMISSED", current.demand()));
        return true;
    }

    /**
     * Stores the offline unlock PIN issued by the backend and attaches it to the active lock.
     */
    public synchronized void provisionUnlockPin(String deviceId, String pin) {
        PinCredential credential = pinHasher.hash(pin);
        repository.write(PIN_KEY + deviceId, credential);

        LockLedger ledger = ledger(deviceId);
        LockRecord current = ledger.active();
        if (current != null && current.lockType().pinUnlockable()) {
            save(deviceId, ledger.withActive(current.withPin(credential)));
        }
        log.debug("Offline unlock PIN provisioned for {}", deviceId);
    }

    /**
     * Forgets an earlier release of this reason's demand, so the next enforcement locks again.
     * Called when a new incident repeats a demand the user already unlocked once.
     */
    public synchronized void renewDemand(String deviceId, LockReason reason) {
        LockLedger ledger = ledger(deviceId);
        LockDemand acknowledged = ledger.acknowledgedDemand();
        if (acknowledged != null && acknowledged.reason() == reason) {
            save(deviceId, ledger.withAcknowledged(null));
        }
    }

    // ==================== Queries ====================

    public Optional<LockRecord> activeLock(String deviceId) {
        return Optional.ofNullable(ledger(deviceId).active());
    }

    public boolean isLocked(String deviceId) {
        return ledger(deviceId).active() != null;
    }

    public List<LockRecord> history(String deviceId) {
        return ledger(deviceId).history();
    }

    public int maxPinAttempts() {
        return maxPinAttempts;
    }

    // ==================== Private Methods ====================

    private LockRecord lock(String deviceId, LockDemand demand, LockDemand suppressed, Instant now) {
        PinCredential pin = demand.type().pinUnlockable()
                ? repository.read(PIN_KEY + deviceId, PinCredential.class).orElse(null)
                : null;
        Instant expiresAt = demand.type() == LockType.SOFT ? now.plus(softLockTtl) : null;

        boolean enforced = true;
        if (demand.type() != LockType.SOFT) {
            Result<Void> result = privilegeGateway.lockDevice();
            enforced = result.isOk();
        }

        LockRecord record = new LockRecord(
                UUID.randomUUID().toString(),
                deviceId,
                demand.type(),
                demand.reason(),
                demand.message(),
                pin != null ? pin.hash() : null,
                pin != null ? pin.salt() : null,
                maxPinAttempts,
                0,
                now,
                expiresAt,
                LockStatus.ACTIVE,
                enforced,
                suppressed,
                null,
                null
        );
        auditLog.logLockApplied(deviceId, record.lockId(), record.lockType().name(), record.reason().name(), enforced);
        log.warn("{} lock applied to {} for {} (platform confirmed: {})",
                record.lockType(), deviceId, record.reason(), enforced);
        return record;
    }

    private LockLedger release(LockLedger ledger, LockRecord record, Instant now, String by, LockDemand acknowledge) {
        if (record.lockType() != LockType.SOFT && record.enforced()) {
            privilegeGateway.releaseLock();
        }
        auditLog.logLockReleased(record.deviceId(), record.lockId(), record.lockType().name(), by);
        return ledger.retire(record.released(now, by), acknowledge);
    }

    private static LockDemand otherDemand(LockDecision decision, LockDemand inForce) {
        if (decision.tamperDemand() != null && !decision.tamperDemand().sameAs(inForce)) {
            return decision.tamperDemand();
        }
        if (decision.paymentDemand() != null && !decision.paymentDemand().sameAs(inForce)) {
            return decision.paymentDemand();
        }
        return null;
    }

    private LockLedger ledger(String deviceId) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        return ledgers.computeIfAbsent(deviceId,
                id -> repository.read(LEDGER_KEY + id, LockLedger.class).orElseGet(LockLedger::empty));
    }

    private void save(String deviceId, LockLedger ledger) {
        repository.write(LEDGER_KEY + deviceId, ledger);
        ledgers.put(deviceId, ledger);
    }
}
