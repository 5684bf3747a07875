package com.payguard.agent.command;

import com.payguard.agent.store.InMemoryStateStore;
import com.payguard.agent.support.MutableClock;
import com.payguard.agent.support.TestAgent;
import net.jqwik.api.*;
import net.jqwik.api.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.payguard.agent.support.TestAgent.DEVICE;
import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for at-most-once command execution.
 */
class CommandExecutorPropertyTest {

    private static final Instant ISSUED = Instant.parse("2026-10-01T09:00:00Z");

    @Property(tries = 30)
    void eachCommandId_executesAtMostOnce(@ForAll("commandIds") @Size(min = 1, max = 20) List<String> ids) {
        try (TestAgent agent = new TestAgent(new InMemoryStateStore(),
                MutableClock.startingAt("2026-10-01T10:00:00Z"))) {
            long executed = 0;
            for (String id : ids) {
                CommandExecutor.CommandResult result = agent.commandExecutor.execute(DEVICE,
                        new BackendCommand(id, CommandType.WIPE_DATA, Map.of(), ISSUED));
                if (result.outcome() == CommandExecutor.CommandOutcome.EXECUTED) {
                    executed++;
                }
            }

            long distinct = ids.stream().distinct().count();
            assertThat(executed).isEqualTo(distinct);
            assertThat(agent.privileges.wipes()).isEqualTo((int) distinct);
        }
    }

    @Property(tries = 20)
    void dedup_survivesRestart(@ForAll("commandIds") @Size(min = 1, max = 10) List<String> ids) {
        InMemoryStateStore store = new InMemoryStateStore();
        MutableClock clock = MutableClock.startingAt("2026-10-01T10:00:00Z");
        try (TestAgent before = new TestAgent(store, clock)) {
            ids.forEach(id -> before.commandExecutor.execute(DEVICE,
                    new BackendCommand(id, CommandType.ALERT_ONLY, Map.of(), ISSUED)));
        }

        try (TestAgent after = new TestAgent(store, clock)) {
            for (String id : ids) {
                CommandExecutor.CommandResult result = after.commandExecutor.execute(DEVICE,
                        new BackendCommand(id, CommandType.ALERT_ONLY, Map.of(), ISSUED));
                assertThat(result.outcome()).isEqualTo(CommandExecutor.CommandOutcome.DUPLICATE);
            }
        }
    }

    @Provide
    Arbitrary<List<String>> commandIds() {
        return Arbitraries.of("cmd-1", "cmd-2", "cmd-3", "cmd-4", "cmd-5").list();
    }
}
