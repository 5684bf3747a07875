package com.payguard.agent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Agent settings bound from {@code payguard.agent.*}.
 */
@ConfigurationProperties(prefix = "payguard.agent")
public class AgentProperties {

    private String deviceId;
    private String stateDirectory = "./payguard-state";
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration acceleratedPollInterval = Duration.ofSeconds(15);
    private Duration captureTimeout = Duration.ofMillis(800);
    private Duration callTimeout = Duration.ofSeconds(5);
    private Duration shutdownGrace = Duration.ofSeconds(10);
    private int pinMaxAttempts = 3;
    private Duration softLockTtl = Duration.ofHours(24);
    private int auditRetention = 1000;
    private boolean autoEnroll = false;
    private boolean autostart = true;
    private final Payment payment = new Payment();
    private final AlertQueue alertQueue = new AlertQueue();
    private final ExecutedCommands executedCommands = new ExecutedCommands();

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }
    public String getStateDirectory() { return stateDirectory; }
    public void setStateDirectory(String stateDirectory) { this.stateDirectory = stateDirectory; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getAcceleratedPollInterval() { return acceleratedPollInterval; }
    public void setAcceleratedPollInterval(Duration interval) { this.acceleratedPollInterval = interval; }
    public Duration getCaptureTimeout() { return captureTimeout; }
    public void setCaptureTimeout(Duration captureTimeout) { this.captureTimeout = captureTimeout; }
    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    public int getPinMaxAttempts() { return pinMaxAttempts; }
    public void setPinMaxAttempts(int pinMaxAttempts) { this.pinMaxAttempts = pinMaxAttempts; }
    public Duration getSoftLockTtl() { return softLockTtl; }
    public void setSoftLockTtl(Duration softLockTtl) { this.softLockTtl = softLockTtl; }
    public int getAuditRetention() { return auditRetention; }
    public void setAuditRetention(int auditRetention) { this.auditRetention = auditRetention; }
    public boolean isAutoEnroll() { return autoEnroll; }
    public void setAutoEnroll(boolean autoEnroll) { this.autoEnroll = autoEnroll; }
    public boolean isAutostart() { return autostart; }
    public void setAutostart(boolean autostart) { this.autostart = autostart; }
    public Payment getPayment() { return payment; }
    public AlertQueue getAlertQueue() { return alertQueue; }
    public ExecutedCommands getExecutedCommands() { return executedCommands; }

    public static class Payment {
        private int reminderWindowDays = 2;
        private int defaultThresholdDays = 30;

        public int getReminderWindowDays() { return reminderWindowDays; }
        public void setReminderWindowDays(int days) { this.reminderWindowDays = days; }
        public int getDefaultThresholdDays() { return defaultThresholdDays; }
        public void setDefaultThresholdDays(int days) { this.defaultThresholdDays = days; }
    }

    public static class AlertQueue {
        private int maxRetained = 100;
        private int deliveredHistory = 50;

        public int getMaxRetained() { return maxRetained; }
        public void setMaxRetained(int maxRetained) { this.maxRetained = maxRetained; }
        public int getDeliveredHistory() { return deliveredHistory; }
        public void setDeliveredHistory(int deliveredHistory) { this.deliveredHistory = deliveredHistory; }
    }

    public static class ExecutedCommands {
        private int maxRetained = 500;

        public int getMaxRetained() { return maxRetained; }
        public void setMaxRetained(int maxRetained) { this.maxRetained = maxRetained; }
    }
}
