package com.payguard.agent.escalation;

import com.payguard.agent.lock.LockReason;
import com.payguard.agent.lock.LockRecord;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.payment.LoanState;
import com.payguard.agent.queue.AlertSeverity;
import com.payguard.agent.queue.QueuedAlert;
import com.payguard.agent.removal.IncidentTicket;
import com.payguard.agent.store.InMemoryStateStore;
import com.payguard.agent.support.MutableClock;
import com.payguard.agent.support.TestAgent;
import com.payguard.agent.trust.TamperSeverity;
import com.payguard.agent.trust.TamperStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static com.payguard.agent.support.TestAgent.DEVICE;
import static org.assertj.core.api.Assertions.*;

class EscalationStateMachineTest {

    private MutableClock clock;
    private TestAgent agent;
    private EscalationStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-10-01T10:00:00Z");
        agent = new TestAgent(new InMemoryStateStore(), clock);
        machine = agent.escalation;
    }

    @AfterEach
    void tearDown() {
        agent.close();
    }

    private TamperStatus status(TamperSeverity severity, String... flags) {
        return TamperStatus.of(severity, List.of(flags), clock.instant());
    }

    private EscalationOutcome pollIncident(TamperSeverity severity, String... flags) {
        TamperStatus status = status(severity, flags);
        IncidentTicket ticket = agent.incidentRecorder.observePoll(DEVICE, status);
        return machine.transition(DEVICE, status, ticket);
    }

    @Test
    void rootedDevice_locksRestrictsAndAlerts() {
        // When
        EscalationOutcome outcome = pollIncident(TamperSeverity.HIGH, "ROOTED");

        // Then
        assertThat(outcome.action()).isEqualTo(ResponseAction.LOCK_AND_RESTRICT);
        assertThat(outcome.current().consecutiveIncidents()).isEqualTo(1);
        assertThat(outcome.current().tamperLockDemand()).isEqualTo(LockType.HARD);
        assertThat(outcome.failedSteps()).isEmpty();

        LockRecord lock = agent.lockManager.activeLock(DEVICE).orElseThrow();
        assertThat(lock.lockType()).isEqualTo(LockType.HARD);
        assertThat(lock.reason()).isEqualTo(LockReason.TAMPER);
        assertThat(agent.privileges.locked()).isTrue();
        assertThat(agent.privileges.cameraDisabled()).isTrue();
        assertThat(agent.privileges.usbDisabled()).isTrue();
        assertThat(agent.privileges.developerOptionsDisabled()).isTrue();
        assertThat(agent.cadence.raised(DEVICE)).isTrue();

        List<QueuedAlert> pending = agent.alertQueue.pending(DEVICE);
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).severity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(pending.get(0).deviceLocked()).isTrue();
        assertThat(pending.get(0).flags()).containsExactly("ROOTED");
    }

    @Test
    void hardLock_precedesFeatureRestrictions() {
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        List<String> calls = agent.privileges.calls();
        assertThat(calls.indexOf("lockDevice")).isLessThan(calls.indexOf("disableCamera"));
        assertThat(calls.indexOf("lockDevice")).isLessThan(calls.indexOf("disableUSB"));
    }

    @Test
    void mediumIncident_alertsAndAcceleratesWithoutLocking() {
        // When
        EscalationOutcome outcome = pollIncident(TamperSeverity.MEDIUM, "DEVELOPER_MODE");

        // Then
        assertThat(outcome.action()).isEqualTo(ResponseAction.ALERT_AND_MONITOR);
        assertThat(agent.lockManager.isLocked(DEVICE)).isFalse();
        assertThat(agent.cadence.intervalFor(DEVICE)).isEqualTo(Duration.ofSeconds(15));
        assertThat(agent.alertQueue.pending(DEVICE))
                .extracting(QueuedAlert::severity)
                .containsExactly(AlertSeverity.WARNING);
    }

    @Test
    void lowIncident_isRecordedOnly() {
        EscalationOutcome outcome = pollIncident(TamperSeverity.LOW, "PROTECTION_SETTING_CHANGED");

        assertThat(outcome.action()).isEqualTo(ResponseAction.RECORD_ONLY);
        assertThat(outcome.executed(ResponseStep.RECORD)).isTrue();
        assertThat(agent.alertQueue.pending(DEVICE)).isEmpty();
        assertThat(agent.privileges.calls()).isEmpty();
    }

    @Test
    void criticalIncident_wipesSensitiveData() {
        EscalationOutcome outcome = pollIncident(TamperSeverity.CRITICAL, "HARDWARE_SERIAL");

        assertThat(outcome.action()).isEqualTo(ResponseAction.LOCK_RESTRICT_AND_WIPE);
        assertThat(outcome.succeeded(ResponseStep.WIPE_SENSITIVE_DATA)).isTrue();
        assertThat(agent.privileges.wipes()).isEqualTo(1);
        assertThat(agent.privileges.locked()).isTrue();
        assertThat(agent.alertQueue.pending(DEVICE).get(0).severity()).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    void failingStep_doesNotBlockRemainingSteps() {
        // Given
        agent.privileges.fail("disableCamera");

        // When
        EscalationOutcome outcome = pollIncident(TamperSeverity.HIGH, "ROOTED");

        // Then
        assertThat(outcome.failedSteps())
                .extracting(EscalationOutcome.StepResult::step)
                .containsExactly(ResponseStep.DISABLE_CAMERA);
        assertThat(agent.privileges.locked()).isTrue();
        assertThat(agent.privileges.usbDisabled()).isTrue();
        assertThat(agent.alertQueue.pending(DEVICE)).hasSize(1);
    }

    @Test
    void cleanVerification_resetsCounterButKeepsLockDemand() {
        // Given
        pollIncident(TamperSeverity.HIGH, "ROOTED");
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        // When
        EscalationOutcome outcome = pollIncident(TamperSeverity.NONE);

        // Then
        assertThat(outcome.previous().consecutiveIncidents()).isEqualTo(2);
        assertThat(outcome.current().consecutiveIncidents()).isZero();
        assertThat(outcome.current().tamperLockDemand()).isEqualTo(LockType.HARD);
        assertThat(agent.cadence.raised(DEVICE)).isFalse();
        assertThat(agent.lockManager.isLocked(DEVICE)).isTrue();
    }

    @Test
    void repeatedIncidents_raiseAlertEscalationLevel() {
        for (int i = 0; i < 4; i++) {
            pollIncident(TamperSeverity.MEDIUM, "USB_DEBUGGING");
        }

        assertThat(agent.alertQueue.pending(DEVICE))
                .extracting(QueuedAlert::escalationLevel)
                .containsExactly(0, 1, 2, 3);
    }

    @Test
    void newIncident_relocksAfterPinUnlock() {
        // Given
        pollIncident(TamperSeverity.HIGH, "ROOTED");
        agent.lockManager.provisionUnlockPin(DEVICE, "2468");
        assertThat(agent.lockManager.unlockWithPin(DEVICE, "2468").success()).isTrue();

        // When
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        // Then
        assertThat(agent.lockManager.isLocked(DEVICE)).isTrue();
    }

    @Test
    void clear_releasesTamperLockAndRestoresFeatures() {
        // Given
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        // When
        EscalationOutcome outcome = machine.clear(DEVICE, "ticket-1");

        // Then
        assertThat(outcome.action()).isEqualTo(ResponseAction.CLEARED);
        assertThat(outcome.current().consecutiveIncidents()).isZero();
        assertThat(outcome.current().tamperLockDemand()).isNull();
        assertThat(agent.lockManager.isLocked(DEVICE)).isFalse();
        assertThat(agent.privileges.cameraDisabled()).isFalse();
        assertThat(agent.privileges.usbDisabled()).isFalse();
        assertThat(agent.privileges.developerOptionsDisabled()).isFalse();
    }

    @Test
    void clear_leavesPaymentLockInForce() {
        // Given
        agent.loans.set(DEVICE, LoanState.OVERDUE, LocalDate.of(2026, 9, 25), 6);
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        // When
        machine.clear(DEVICE, "ticket-2");

        // Then
        LockRecord lock = agent.lockManager.activeLock(DEVICE).orElseThrow();
        assertThat(lock.reason()).isEqualTo(LockReason.PAYMENT_OVERDUE);
        assertThat(lock.lockType()).isEqualTo(LockType.HARD);
    }

    @Test
    void reset_zeroesCounterAndKeepsLock() {
        pollIncident(TamperSeverity.HIGH, "ROOTED");

        EscalationState state = machine.reset(DEVICE, "support call");

        assertThat(state.consecutiveIncidents()).isZero();
        assertThat(state.lastActionTaken()).isEqualTo(ResponseAction.MANUAL_RESET);
        assertThat(state.tamperLockDemand()).isEqualTo(LockType.HARD);
        assertThat(agent.lockManager.isLocked(DEVICE)).isTrue();
    }

    @Test
    void demandLock_appliesBackendRequestedLock() {
        EscalationOutcome outcome = machine.demandLock(DEVICE, LockType.PERMANENT);

        assertThat(outcome.action()).isEqualTo(ResponseAction.BACKEND_LOCK);
        assertThat(outcome.current().tamperLockDemand()).isEqualTo(LockType.PERMANENT);
        assertThat(agent.lockManager.activeLock(DEVICE).orElseThrow().lockType()).isEqualTo(LockType.PERMANENT);
    }

    @Test
    void state_survivesRestart() {
        pollIncident(TamperSeverity.MEDIUM, "DEVELOPER_MODE");
        pollIncident(TamperSeverity.MEDIUM, "DEVELOPER_MODE");

        try (TestAgent restarted = new TestAgent(agent.store, clock)) {
            assertThat(restarted.escalation.current(DEVICE).consecutiveIncidents()).isEqualTo(2);
        }
    }
}
