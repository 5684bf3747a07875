package com.payguard.agent.lock;

import com.payguard.agent.escalation.EscalationState;
import com.payguard.agent.escalation.ResponseAction;
import com.payguard.agent.payment.LoanState;
import com.payguard.agent.store.InMemoryStateStore;
import com.payguard.agent.support.MutableClock;
import com.payguard.agent.support.TestAgent;
import com.payguard.agent.trust.TamperSeverity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static com.payguard.agent.support.TestAgent.DEVICE;
import static org.assertj.core.api.Assertions.*;

class LockEnforcementManagerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 1);

    private InMemoryStateStore store;
    private MutableClock clock;
    private TestAgent agent;
    private LockEnforcementManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        clock = MutableClock.startingAt("2026-10-01T10:00:00Z");
        agent = new TestAgent(store, clock);
        manager = agent.lockManager;
    }

    @AfterEach
    void tearDown() {
        agent.close();
    }

    private void demandTamperLock(LockType type) {
        agent.escalationStore.save(new EscalationState(DEVICE, 1, TamperSeverity.HIGH,
                ResponseAction.LOCK_AND_RESTRICT, clock.instant(), type));
    }

    private void clearTamperDemand() {
        agent.escalationStore.save(EscalationState.initial(DEVICE));
    }

    // ==================== Evaluation ====================

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        void nothingDemanded_noLock() {
            LockDecision decision = manager.evaluate(DEVICE);

            assertThat(decision.requiresLock()).isFalse();
            assertThat(decision.winningDemand()).isNull();
        }

        @Test
        void defaultedLoan_demandsPermanentPaymentDefaultWithoutPin() {
            // Given
            agent.loans.set(DEVICE, LoanState.DEFAULTED, TODAY.minusDays(60), 60);

            // When
            LockDecision decision = manager.evaluate(DEVICE);

            // Then
            assertThat(decision.lockType()).isEqualTo(LockType.PERMANENT);
            assertThat(decision.reason()).isEqualTo(LockReason.PAYMENT_DEFAULT);
            assertThat(decision.pinRequired()).isFalse();
        }

        @Test
        void hardTie_goesToTamper() {
            // Given
            demandTamperLock(LockType.HARD);
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(5), 5);

            // When
            LockDecision decision = manager.evaluate(DEVICE);

            // Then
            assertThat(decision.lockType()).isEqualTo(LockType.HARD);
            assertThat(decision.reason()).isEqualTo(LockReason.TAMPER);
            assertThat(decision.pinRequired()).isTrue();
            assertThat(decision.outvotedDemand().reason()).isEqualTo(LockReason.PAYMENT_OVERDUE);
        }

        @Test
        void permanentPayment_outranksHardTamper() {
            demandTamperLock(LockType.HARD);
            agent.loans.set(DEVICE, LoanState.DEFAULTED, null, 0);

            LockDecision decision = manager.evaluate(DEVICE);

            assertThat(decision.reason()).isEqualTo(LockReason.PAYMENT_DEFAULT);
            assertThat(decision.outvotedDemand().reason()).isEqualTo(LockReason.TAMPER);
        }

        @Test
        void loanProviderFailure_contributesNoDemand() {
            agent.loans.setUnavailable(true);

            LockDecision decision = manager.evaluate(DEVICE);

            assertThat(decision.paymentDemand()).isNull();
            assertThat(decision.releasePaymentLock()).isFalse();
        }
    }

    // ==================== Enforcement ====================

    @Nested
    @DisplayName("Enforcement")
    class Enforcement {

        @Test
        void hardLock_callsPlatformAndRecordsSuppressedDemand() {
            // Given
            demandTamperLock(LockType.HARD);
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(3), 3);

            // When
            boolean enforced = manager.enforce(DEVICE);

            // Then
            assertThat(enforced).isTrue();
            assertThat(agent.privileges.locked()).isTrue();
            LockRecord lock = manager.activeLock(DEVICE).orElseThrow();
            assertThat(lock.reason()).isEqualTo(LockReason.TAMPER);
            assertThat(lock.suppressedDemand().reason()).isEqualTo(LockReason.PAYMENT_OVERDUE);
        }

        @Test
        void softLock_needsNoPlatformCallAndExpires() {
            // Given
            agent.loans.set(DEVICE, LoanState.ACTIVE, TODAY.plusDays(1), 0);

            // When
            manager.enforce(DEVICE);

            // Then
            LockRecord lock = manager.activeLock(DEVICE).orElseThrow();
            assertThat(lock.lockType()).isEqualTo(LockType.SOFT);
            assertThat(lock.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
            assertThat(agent.privileges.count("lockDevice")).isZero();

            clock.advance(Duration.ofHours(23));
            assertThat(manager.expireSoftLocks(DEVICE)).isFalse();

            clock.advance(Duration.ofHours(2));
            assertThat(manager.expireSoftLocks(DEVICE)).isTrue();
            assertThat(manager.isLocked(DEVICE)).isFalse();

            // Same reminder does not come back
            manager.enforce(DEVICE);
            assertThat(manager.isLocked(DEVICE)).isFalse();
        }

        @Test
        void dismissedReminder_stricterDemandStillLocks() {
            // Given
            agent.loans.set(DEVICE, LoanState.ACTIVE, TODAY.plusDays(1), 0);
            manager.enforce(DEVICE);
            assertThat(manager.dismissSoftLock(DEVICE)).isTrue();
            manager.enforce(DEVICE);
            assertThat(manager.isLocked(DEVICE)).isFalse();

            // When
            clock.advance(Duration.ofDays(3));
            manager.enforce(DEVICE);

            // Then
            assertThat(manager.activeLock(DEVICE).orElseThrow().lockType()).isEqualTo(LockType.HARD);
        }

        @Test
        void dismissSoftLock_ignoresStricterLocks() {
            demandTamperLock(LockType.HARD);
            manager.enforce(DEVICE);

            assertThat(manager.dismissSoftLock(DEVICE)).isFalse();
            assertThat(manager.isLocked(DEVICE)).isTrue();
        }

        @Test
        void stricterDemand_supersedesActiveLock() {
            // Given
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(5), 5);
            manager.enforce(DEVICE);

            // When
            agent.loans.set(DEVICE, LoanState.DEFAULTED, TODAY.minusDays(5), 40);
            manager.enforce(DEVICE);

            // Then
            assertThat(manager.activeLock(DEVICE).orElseThrow().lockType()).isEqualTo(LockType.PERMANENT);
            assertThat(manager.history(DEVICE))
                    .extracting(LockRecord::lockType, LockRecord::releasedBy)
                    .containsExactly(tuple(LockType.HARD, "SUPERSEDED"));
        }

        @Test
        void weakerDemand_neverLowersLock() {
            // Given
            agent.loans.set(DEVICE, LoanState.DEFAULTED, TODAY.minusDays(60), 60);
            manager.enforce(DEVICE);

            // When
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(3), 3);
            manager.enforce(DEVICE);
            agent.loans.clear(DEVICE);
            manager.enforce(DEVICE);

            // Then
            assertThat(manager.activeLock(DEVICE).orElseThrow().lockType()).isEqualTo(LockType.PERMANENT);
            assertThat(manager.history(DEVICE)).isEmpty();
        }

        @Test
        void paidLoan_releasesPaymentLock() {
            // Given
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(5), 5);
            manager.enforce(DEVICE);
            assertThat(agent.privileges.locked()).isTrue();

            // When
            agent.loans.set(DEVICE, LoanState.PAID, null, 0);
            manager.enforce(DEVICE);

            // Then
            assertThat(manager.isLocked(DEVICE)).isFalse();
            assertThat(agent.privileges.locked()).isFalse();
            assertThat(manager.history(DEVICE).get(0).releasedBy()).isEqualTo("PAYMENT_SETTLED");
        }

        @Test
        void paidLoan_keepsTamperLock() {
            demandTamperLock(LockType.HARD);
            manager.enforce(DEVICE);

            agent.loans.set(DEVICE, LoanState.PAID, null, 0);
            manager.enforce(DEVICE);

            assertThat(manager.activeLock(DEVICE).orElseThrow().reason()).isEqualTo(LockReason.TAMPER);
        }

        @Test
        void loanProviderFailure_keepsPaymentLock() {
            agent.loans.set(DEVICE, LoanState.OVERDUE, TODAY.minusDays(5), 5);
            manager.enforce(DEVICE);

            agent.loans.setUnavailable(true);
            manager.enforce(DEVICE);

            assertThat(manager.activeLock(DEVICE).orElseThrow().reason()).isEqualTo(LockReason.PAYMENT_OVERDUE);
        }

        @Test
        void failedPlatformLock_isRetriedOnNextEnforcement() {
            // Given
            agent.privileges.fail("lockDevice");
            demandTamperLock(LockType.HARD);

            // When
            boolean first = manager.enforce(DEVICE);

            // Then
            assertThat(first).isFalse();
            assertThat(manager.activeLock(DEVICE).orElseThrow().enforced()).isFalse();

            agent.privileges.recover("lockDevice");
            assertThat(manager.enforce(DEVICE)).isTrue();
            assertThat(manager.activeLock(DEVICE).orElseThrow().enforced()).isTrue();
            assertThat(agent.privileges.locked()).isTrue();
        }

        @Test
        void ledger_survivesRestart() {
            demandTamperLock(LockType.HARD);
            manager.enforce(DEVICE);
            String lockId = manager.activeLock(DEVICE).orElseThrow().lockId();

            try (TestAgent restarted = new TestAgent(store, clock)) {
                assertThat(restarted.lockManager.activeLock(DEVICE))
                        .get()
                        .extracting(LockRecord::lockId)
                        .isEqualTo(lockId);
            }
        }
    }

    // ==================== Unlock ====================

    @Nested
    @DisplayName("Unlock")
    class Unlock {

        @BeforeEach
        void lockDevice() {
            demandTamperLock(LockType.HARD);
            manager.enforce(DEVICE);
            manager.provisionUnlockPin(DEVICE, "4321");
        }

        @Test
        void correctPin_releasesLock() {
            UnlockResult result = manager.unlockWithPin(DEVICE, "4321");

            assertThat(result.success()).isTrue();
            assertThat(result.status()).isEqualTo(LockStatus.RELEASED);
            assertThat(manager.isLocked(DEVICE)).isFalse();
            assertThat(agent.privileges.count("releaseLock")).isEqualTo(1);
        }

        @Test
        void exhaustedAttempts_onlyBackendCanUnlock() {
            // When
            UnlockResult first = manager.unlockWithPin(DEVICE, "0000");
            UnlockResult second = manager.unlockWithPin(DEVICE, "1111");
            UnlockResult third = manager.unlockWithPin(DEVICE, "2222");
            UnlockResult fourth = manager.unlockWithPin(DEVICE, "3333");

            // Then
            assertThat(first.remainingAttempts()).isEqualTo(2);
            assertThat(second.remainingAttempts()).isEqualTo(1);
            assertThat(third.status()).isEqualTo(LockStatus.PIN_EXHAUSTED);
            assertThat(fourth.success()).isFalse();
            assertThat(fourth.status()).isEqualTo(LockStatus.PIN_EXHAUSTED);

            UnlockResult correct = manager.unlockWithPin(DEVICE, "4321");
            assertThat(correct.success()).isFalse();
            assertThat(manager.isLocked(DEVICE)).isTrue();

            assertThat(manager.unlockFromBackend(DEVICE, "ticket-7")).isTrue();
            assertThat(manager.isLocked(DEVICE)).isFalse();
            assertThat(manager.history(DEVICE).get(0).releasedBy()).isEqualTo("BACKEND:ticket-7");
        }

        @Test
        void attemptCounter_survivesRestart() {
            manager.unlockWithPin(DEVICE, "0000");
            manager.unlockWithPin(DEVICE, "1111");

            try (TestAgent restarted = new TestAgent(store, clock)) {
                UnlockResult result = restarted.lockManager.unlockWithPin(DEVICE, "2222");
                assertThat(result.status()).isEqualTo(LockStatus.PIN_EXHAUSTED);
            }
        }

        @Test
        void releasedTamperDemand_doesNotRelockUntilRenewed() {
            // Given
            manager.unlockWithPin(DEVICE, "4321");

            // When
            manager.enforce(DEVICE);

            // Then
            assertThat(manager.isLocked(DEVICE)).isFalse();

            manager.renewDemand(DEVICE, LockReason.TAMPER);
            manager.enforce(DEVICE);
            assertThat(manager.isLocked(DEVICE)).isTrue();
        }

        @Test
        void clearedTamperDemand_forgetsAcknowledgement() {
            manager.unlockWithPin(DEVICE, "4321");
            clearTamperDemand();
            manager.enforce(DEVICE);

            demandTamperLock(LockType.HARD);
            manager.enforce(DEVICE);

            assertThat(manager.isLocked(DEVICE)).isTrue();
        }
    }

    @Test
    void permanentLock_rejectsPin() {
        agent.loans.set(DEVICE, LoanState.DEFAULTED, null, 0);
        manager.enforce(DEVICE);
        manager.provisionUnlockPin(DEVICE, "4321");

        UnlockResult result = manager.unlockWithPin(DEVICE, "4321");

        assertThat(result.success()).isFalse();
        assertThat(manager.isLocked(DEVICE)).isTrue();
    }

    @Test
    void unlockWithoutLock_isRejected() {
        UnlockResult result = manager.unlockWithPin(DEVICE, "4321");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("No active lock");
    }
}
