package com.payguard.agent.command;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import com.payguard.agent.escalation.EscalationOutcome;
import com.payguard.agent.escalation.EscalationStateMachine;
import com.payguard.agent.escalation.ResponseStep;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.platform.PrivilegeGateway;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executes backend commands at most once per command id.
 *
 * The id is persisted as executed before the command runs, so a crash mid-command never
 * leads to a second execution after restart. The remembered ids are bounded; the oldest
 * are forgotten first.
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);
    private static final String KEY = "commands.executed.";

    private final StateRepository repository;
    private final EscalationStateMachine escalation;
    private final PrivilegeGateway privilegeGateway;
    private final AuditLog auditLog;
    private final int maxRetained;

    public CommandExecutor(StateRepository repository, EscalationStateMachine escalation,
                           PrivilegeGateway privilegeGateway, AuditLog auditLog, int maxRetained) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.escalation = Objects.requireNonNull(escalation, "Escalation cannot be null");
        this.privilegeGateway = Objects.requireNonNull(privilegeGateway, "Privilege gateway cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be positive");
        }
        this.maxRetained = maxRetained;
    }

    /**
     * Executes a command unless its id has been seen before. Callers hold the device mutex.
     */
    public CommandResult execute(String deviceId, BackendCommand command) {
        Objects.requireNonNull(command, "Command cannot be null");
        if (command.commandId() == null || command.commandId().isBlank() || command.type() == null) {
            log.warn("Ignoring malformed command for {}: {}", deviceId, command);
            return new CommandResult(command.commandId(), command.type(), CommandOutcome.REJECTED,
                    "Command id and type are required");
        }

        ExecutedCommands executed = load(deviceId);
        if (executed.commandIds().contains(command.commandId())) {
            log.debug("Command {} already executed on {}", command.commandId(), deviceId);
            return new CommandResult(command.commandId(), command.type(), CommandOutcome.DUPLICATE,
                    "Command already executed");
        }

        Set<String> ids = new LinkedHashSet<>(executed.commandIds());
        ids.add(command.commandId());
        List<String> retained = new ArrayList<>(ids);
        while (retained.size() > maxRetained) {
            retained.remove(0);
        }
        repository.write(KEY + deviceId, new ExecutedCommands(retained));

        Result<?> result = run(deviceId, command);
        CommandOutcome outcome = result.isOk() ? CommandOutcome.EXECUTED : CommandOutcome.FAILED;

        auditLog.record(AuditLog.EventType.COMMAND_EXECUTED,
                result.isOk() ? AuditLog.Severity.MEDIUM : AuditLog.Severity.HIGH,
                "Backend command " + command.type(),
                Map.of(
                        "deviceId", deviceId,
                        "commandId", command.commandId(),
                        "type", command.type().name(),
                        "outcome", outcome.name()
                ));
        log.info("Command {} ({}) on {}: {}", command.commandId(), command.type(), deviceId, outcome);
        return new CommandResult(command.commandId(), command.type(), outcome,
                result.isOk() ? "Executed" : result.message());
    }

    public boolean alreadyExecuted(String deviceId, String commandId) {
        return load(deviceId).commandIds().contains(commandId);
    }

    private Result<?> run(String deviceId, BackendCommand command) {
        return switch (command.type()) {
            case LOCK_DEVICE -> {
                LockType type = parseLockType(command.parameter("lockType", LockType.HARD.name()));
                EscalationOutcome outcome = escalation.demandLock(deviceId, type);
                if (outcome.succeeded(ResponseStep.HARD_LOCK)) {
                    yield Result.ok();
                }
                yield Result.<Void>failure(ErrorKind.PRIVILEGE_ACTION_FAILURE, "Platform did not confirm the lock");
            }
            case DISABLE_FEATURES -> firstFailure(List.of(
                    privilegeGateway.setCameraDisabled(true),
                    privilegeGateway.setUsbDisabled(true),
                    privilegeGateway.setDeveloperOptionsDisabled(true)));
            case WIPE_DATA -> privilegeGateway.wipeSensitiveData();
            case ALERT_ONLY -> Result.ok();
            case DISABLE_CAMERA -> privilegeGateway.setCameraDisabled(true);
            case DISABLE_USB -> privilegeGateway.setUsbDisabled(true);
            case DISABLE_DEVELOPER_MODE -> privilegeGateway.setDeveloperOptionsDisabled(true);
            case RESTRICT_NETWORK -> privilegeGateway.setNetworkRestricted(true);
        };
    }

    private static LockType parseLockType(String value) {
        try {
            return LockType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown lock type '{}' in command, using HARD", value);
            return LockType.HARD;
        }
    }

    private static Result<Void> firstFailure(List<Result<Void>> results) {
        return results.stream().filter(Result::isFailure).findFirst().orElse(Result.ok());
    }

    private ExecutedCommands load(String deviceId) {
        return repository.read(KEY + deviceId, ExecutedCommands.class)
                .orElseGet(() -> new ExecutedCommands(List.of()));
    }

    // ==================== Inner Types ====================

    public enum CommandOutcome {
        EXECUTED,
        FAILED,
        DUPLICATE,
        REJECTED
    }

    public record CommandResult(
            String commandId,
            CommandType type,
            CommandOutcome outcome,
            String message
    ) {}

    public record ExecutedCommands(List<String> commandIds) {
        public ExecutedCommands {
            commandIds = commandIds != null ? List.copyOf(commandIds) : List.of();
        }
    }
}
