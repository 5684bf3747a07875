package com.payguard.agent.config;

import com.payguard.agent.kernel.AgentKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Boots the kernel with the application context and stops it on shutdown.
 */
public class AgentLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycle.class);

    private final AgentKernel kernel;
    private final boolean autostart;

    public AgentLifecycle(AgentKernel kernel, boolean autostart) {
        this.kernel = kernel;
        this.autostart = autostart;
    }

    @Override
    public void start() {
        kernel.start().whenComplete((result, error) -> {
            if (error != null) {
                log.error("Agent boot failed", error);
            } else {
                log.info("Agent boot: {}", result.message());
            }
        });
    }

    @Override
    public void stop() {
        kernel.stop().join();
    }

    @Override
    public boolean isRunning() {
        return kernel.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autostart;
    }
}
