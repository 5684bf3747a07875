package com.payguard.agent.support;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.baseline.BaselineStore;
import com.payguard.agent.command.CommandExecutor;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.escalation.EscalationStateMachine;
import com.payguard.agent.escalation.EscalationStateStore;
import com.payguard.agent.escalation.MonitoringCadence;
import com.payguard.agent.kernel.DeviceMutex;
import com.payguard.agent.kernel.ProtectionEngine;
import com.payguard.agent.kernel.event.EventBus;
import com.payguard.agent.lock.LockEnforcementManager;
import com.payguard.agent.payment.PaymentLockPolicy;
import com.payguard.agent.platform.PrivilegeGateway;
import com.payguard.agent.protection.ProtectionSelfCheck;
import com.payguard.agent.queue.OfflineAlertQueue;
import com.payguard.agent.removal.IncidentRecorder;
import com.payguard.agent.snapshot.SecurityPostureProbe;
import com.payguard.agent.snapshot.SnapshotCollector;
import com.payguard.agent.store.StateRepository;
import com.payguard.agent.store.StateStore;
import com.payguard.agent.sync.AlertDeliveryClient;
import com.payguard.agent.sync.HeartbeatClient;
import com.payguard.agent.trust.ComparisonEngine;
import com.payguard.agent.trust.SeverityClassifier;

import java.time.Duration;

/**
 * Fully wired agent over in-memory fakes. Components share one store, so a second
 * TestAgent over the same store behaves like the agent after a restart.
 */
public class TestAgent implements AutoCloseable {

    public static final String DEVICE = "device-1";

    public final MutableClock clock;
    public final StateStore store;
    public final StateRepository repository;
    public final AuditLog auditLog;
    public final FakeDeviceStateSource source;
    public final FakePrivilegeController privileges;
    public final FakeLoanStatusProvider loans;
    public final FakeBackendTransport backend;
    public final FakeProtectionProbe protectionProbe;
    public final BoundedCall boundedCall;
    public final SnapshotCollector collector;
    public final BaselineStore baselineStore;
    public final PrivilegeGateway privilegeGateway;
    public final EscalationStateStore escalationStore;
    public final LockEnforcementManager lockManager;
    public final MonitoringCadence cadence;
    public final OfflineAlertQueue alertQueue;
    public final EscalationStateMachine escalation;
    public final IncidentRecorder incidentRecorder;
    public final CommandExecutor commandExecutor;
    public final HeartbeatClient heartbeatClient;
    public final ProtectionSelfCheck selfCheck;
    public final EventBus eventBus;
    public final ProtectionEngine engine;

    public TestAgent(StateStore store, MutableClock clock) {
        this.clock = clock;
        this.store = store;
        this.repository = new StateRepository(store);
        this.auditLog = new AuditLog("test-agent", entry -> { }, clock);
        this.source = new FakeDeviceStateSource(DEVICE);
        this.privileges = new FakePrivilegeController();
        this.loans = new FakeLoanStatusProvider();
        this.backend = new FakeBackendTransport();
        this.protectionProbe = new FakeProtectionProbe();
        this.boundedCall = new BoundedCall(Duration.ofSeconds(2));

        this.collector = new SnapshotCollector(source, new SecurityPostureProbe(), Duration.ofMillis(800), clock);
        this.baselineStore = new BaselineStore(repository, auditLog, clock);
        this.privilegeGateway = new PrivilegeGateway(privileges, privileges, boundedCall, auditLog);
        this.escalationStore = new EscalationStateStore(repository);
        this.lockManager = new LockEnforcementManager(repository, escalationStore, loans,
                new PaymentLockPolicy(2, 30, clock), privilegeGateway, auditLog, clock, 3, Duration.ofHours(24));
        this.cadence = new MonitoringCadence(Duration.ofSeconds(60), Duration.ofSeconds(15));
        this.alertQueue = new OfflineAlertQueue(repository,
                new AlertDeliveryClient(backend, repository.mapper(), boundedCall), auditLog, clock, 100, 50);
        this.escalation = new EscalationStateMachine(escalationStore, lockManager, privilegeGateway,
                alertQueue, cadence, auditLog, clock);
        this.incidentRecorder = new IncidentRecorder(repository, auditLog);
        this.commandExecutor = new CommandExecutor(repository, escalation, privilegeGateway, auditLog, 500);
        this.heartbeatClient = new HeartbeatClient(backend, repository.mapper(), boundedCall);
        this.selfCheck = new ProtectionSelfCheck(protectionProbe, auditLog, repository, boundedCall, clock);
        this.eventBus = new EventBus();
        this.engine = new ProtectionEngine(collector, baselineStore, new ComparisonEngine(), new SeverityClassifier(),
                incidentRecorder, escalation, lockManager, alertQueue, heartbeatClient, commandExecutor,
                selfCheck, new DeviceMutex(), eventBus, auditLog, clock);
    }

    @Override
    public void close() {
        collector.close();
        boundedCall.close();
        eventBus.shutdown();
    }
}
