package com.payguard.agent.config;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.audit.AuditSink;
import com.payguard.agent.audit.Slf4jAuditSink;
import com.payguard.agent.baseline.BaselineStore;
import com.payguard.agent.command.CommandExecutor;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.escalation.EscalationStateMachine;
import com.payguard.agent.escalation.EscalationStateStore;
import com.payguard.agent.escalation.MonitoringCadence;
import com.payguard.agent.kernel.AgentKernel;
import com.payguard.agent.kernel.DeviceMutex;
import com.payguard.agent.kernel.PollScheduler;
import com.payguard.agent.kernel.ProtectionEngine;
import com.payguard.agent.kernel.event.EventBus;
import com.payguard.agent.lock.LockEnforcementManager;
import com.payguard.agent.payment.LoanStatusProvider;
import com.payguard.agent.payment.PaymentLockPolicy;
import com.payguard.agent.platform.DevicePrivilegeController;
import com.payguard.agent.platform.PrivilegeGateway;
import com.payguard.agent.platform.SensitiveDataWiper;
import com.payguard.agent.protection.ProtectionProbe;
import com.payguard.agent.protection.ProtectionSelfCheck;
import com.payguard.agent.queue.AlertDispatcher;
import com.payguard.agent.queue.OfflineAlertQueue;
import com.payguard.agent.removal.IncidentRecorder;
import com.payguard.agent.snapshot.DeviceStateSource;
import com.payguard.agent.snapshot.SecurityPostureProbe;
import com.payguard.agent.snapshot.SnapshotCollector;
import com.payguard.agent.store.FileStateStore;
import com.payguard.agent.store.StateRepository;
import com.payguard.agent.store.StateStore;
import com.payguard.agent.sync.AlertDeliveryClient;
import com.payguard.agent.sync.BackendTransport;
import com.payguard.agent.sync.HeartbeatClient;
import com.payguard.agent.trust.ComparisonEngine;
import com.payguard.agent.trust.SeverityClassifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the agent. Platform seams ({@link DeviceStateSource}, {@link DevicePrivilegeController},
 * {@link SensitiveDataWiper}, {@link LoanStatusProvider}, {@link BackendTransport},
 * {@link ProtectionProbe}) are supplied by the host application.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfiguration {

    // ==================== Infrastructure ====================

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public StateStore stateStore(AgentProperties properties) {
        return new FileStateStore(Path.of(properties.getStateDirectory()));
    }

    @Bean
    public StateRepository stateRepository(StateStore stateStore) {
        return new StateRepository(stateStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new Slf4jAuditSink();
    }

    @Bean
    public AuditLog auditLog(AgentProperties properties, AuditSink auditSink, Clock clock) {
        return new AuditLog(agentId(properties), auditSink, clock, properties.getAuditRetention());
    }

    @Bean
    public BoundedCall boundedCall(AgentProperties properties) {
        return new BoundedCall(properties.getCallTimeout());
    }

    @Bean
    public DeviceMutex deviceMutex() {
        return new DeviceMutex();
    }

    @Bean(destroyMethod = "shutdown")
    public EventBus eventBus() {
        return new EventBus();
    }

    // ==================== Verification ====================

    @Bean
    public SnapshotCollector snapshotCollector(DeviceStateSource source, AgentProperties properties, Clock clock) {
        return new SnapshotCollector(source, new SecurityPostureProbe(), properties.getCaptureTimeout(), clock);
    }

    @Bean
    public BaselineStore baselineStore(StateRepository repository, AuditLog auditLog, Clock clock) {
        return new BaselineStore(repository, auditLog, clock);
    }

    @Bean
    public ComparisonEngine comparisonEngine() {
        return new ComparisonEngine();
    }

    @Bean
    public SeverityClassifier severityClassifier() {
        return new SeverityClassifier();
    }

    // ==================== Response ====================

    @Bean
    public PrivilegeGateway privilegeGateway(DevicePrivilegeController controller, SensitiveDataWiper wiper,
                                             BoundedCall boundedCall, AuditLog auditLog) {
        return new PrivilegeGateway(controller, wiper, boundedCall, auditLog);
    }

    @Bean
    public EscalationStateStore escalationStateStore(StateRepository repository) {
        return new EscalationStateStore(repository);
    }

    @Bean
    public PaymentLockPolicy paymentLockPolicy(AgentProperties properties, Clock clock) {
        return new PaymentLockPolicy(properties.getPayment().getReminderWindowDays(),
                properties.getPayment().getDefaultThresholdDays(), clock);
    }

    @Bean
    public LockEnforcementManager lockEnforcementManager(
            StateRepository repository, EscalationStateStore escalationStore, LoanStatusProvider loanStatusProvider,
            PaymentLockPolicy paymentPolicy, PrivilegeGateway privilegeGateway, AuditLog auditLog, Clock clock,
            AgentProperties properties) {
        return new LockEnforcementManager(repository, escalationStore, loanStatusProvider, paymentPolicy,
                privilegeGateway, auditLog, clock, properties.getPinMaxAttempts(), properties.getSoftLockTtl());
    }

    @Bean
    public MonitoringCadence monitoringCadence(AgentProperties properties) {
        return new MonitoringCadence(properties.getPollInterval(), properties.getAcceleratedPollInterval());
    }

    @Bean
    public AlertDispatcher alertDispatcher(BackendTransport transport, StateRepository repository,
                                           BoundedCall boundedCall) {
        return new AlertDeliveryClient(transport, repository.mapper(), boundedCall);
    }

    @Bean
    public OfflineAlertQueue offlineAlertQueue(StateRepository repository, AlertDispatcher dispatcher,
                                               AuditLog auditLog, Clock clock, AgentProperties properties) {
        return new OfflineAlertQueue(repository, dispatcher, auditLog, clock,
                properties.getAlertQueue().getMaxRetained(), properties.getAlertQueue().getDeliveredHistory());
    }

    @Bean
    public EscalationStateMachine escalationStateMachine(
            EscalationStateStore store, LockEnforcementManager lockManager, PrivilegeGateway privilegeGateway,
            OfflineAlertQueue alertQueue, MonitoringCadence cadence, AuditLog auditLog, Clock clock) {
        return new EscalationStateMachine(store, lockManager, privilegeGateway, alertQueue, cadence, auditLog, clock);
    }

    @Bean
    public IncidentRecorder incidentRecorder(StateRepository repository, AuditLog auditLog) {
        return new IncidentRecorder(repository, auditLog);
    }

    @Bean
    public CommandExecutor commandExecutor(StateRepository repository, EscalationStateMachine escalation,
                                           PrivilegeGateway privilegeGateway, AuditLog auditLog,
                                           AgentProperties properties) {
        return new CommandExecutor(repository, escalation, privilegeGateway, auditLog,
                properties.getExecutedCommands().getMaxRetained());
    }

    // ==================== Sync and Kernel ====================

    @Bean
    public HeartbeatClient heartbeatClient(BackendTransport transport, StateRepository repository,
                                           BoundedCall boundedCall) {
        return new HeartbeatClient(transport, repository.mapper(), boundedCall);
    }

    @Bean
    public ProtectionSelfCheck protectionSelfCheck(ProtectionProbe probe, AuditLog auditLog,
                                                   StateRepository repository, BoundedCall boundedCall, Clock clock) {
        return new ProtectionSelfCheck(probe, auditLog, repository, boundedCall, clock);
    }

    @Bean
    public ProtectionEngine protectionEngine(
            SnapshotCollector collector, BaselineStore baselineStore, ComparisonEngine comparisonEngine,
            SeverityClassifier classifier, IncidentRecorder incidentRecorder, EscalationStateMachine escalation,
            LockEnforcementManager lockManager, OfflineAlertQueue alertQueue, HeartbeatClient heartbeatClient,
            CommandExecutor commandExecutor, ProtectionSelfCheck selfCheck, DeviceMutex mutex, EventBus eventBus,
            AuditLog auditLog, Clock clock) {
        return new ProtectionEngine(collector, baselineStore, comparisonEngine, classifier, incidentRecorder,
                escalation, lockManager, alertQueue, heartbeatClient, commandExecutor, selfCheck, mutex,
                eventBus, auditLog, clock);
    }

    @Bean
    public PollScheduler pollScheduler(MonitoringCadence cadence) {
        return new PollScheduler(cadence, 2);
    }

    @Bean
    public AgentKernel agentKernel(AgentProperties properties, EventBus eventBus, PollScheduler pollScheduler,
                                   ProtectionEngine engine, BaselineStore baselineStore, AuditLog auditLog,
                                   Clock clock) {
        return new AgentKernel(agentId(properties), List.of(deviceId(properties)), eventBus, pollScheduler,
                engine, baselineStore, auditLog, properties.isAutoEnroll(), properties.getShutdownGrace(), clock);
    }

    @Bean
    public AgentLifecycle agentLifecycle(AgentKernel kernel, AgentProperties properties) {
        return new AgentLifecycle(kernel, properties.isAutostart());
    }

    private static String deviceId(AgentProperties properties) {
        String deviceId = properties.getDeviceId();
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalStateException("payguard.agent.device-id must be set");
        }
        return deviceId;
    }

    private static String agentId(AgentProperties properties) {
        return "payguard-agent-" + deviceId(properties);
    }
}
