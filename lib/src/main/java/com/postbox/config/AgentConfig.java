package com.postbox.config;

import com.postbox.cancellation.CancellationToken;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.config.MailboxConfig;
import com.postbox.mailbox.config.MailboxProvider;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Configuration for a single agent.
 * Unset executors fall back to pools shared by all agents.
 */
public class AgentConfig {
    /** Reply timeout value meaning "wait until replied or cancelled". Any negative duration works too. */
    public static final Duration INFINITE_TIMEOUT = Duration.ofMillis(-1);

    public static final Duration DEFAULT_REPLY_TIMEOUT = INFINITE_TIMEOUT;
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(1);

    private String name;
    private CancellationToken cancellationToken;
    private MailboxConfig mailboxConfig;
    private WorkloadType workloadType;
    private MailboxProvider<?> mailboxProvider;
    private Duration defaultReplyTimeout;
    private Duration shutdownGracePeriod;
    private ExecutorService executor;
    private ScheduledExecutorService scheduler;

    /**
     * Creates a new AgentConfig with default values.
     */
    public AgentConfig() {
        this.mailboxConfig = new MailboxConfig();
        this.defaultReplyTimeout = DEFAULT_REPLY_TIMEOUT;
        this.shutdownGracePeriod = DEFAULT_SHUTDOWN_GRACE_PERIOD;
    }

    public AgentConfig setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Sets the token governing the agent's mailbox. When unset the agent creates its own.
     *
     * @param cancellationToken The token
     * @return This AgentConfig instance
     */
    public AgentConfig setCancellationToken(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
        return this;
    }

    public AgentConfig setMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = Objects.requireNonNull(mailboxConfig, "mailboxConfig cannot be null");
        return this;
    }

    public AgentConfig setWorkloadType(WorkloadType workloadType) {
        this.workloadType = workloadType;
        return this;
    }

    public AgentConfig setMailboxProvider(MailboxProvider<?> mailboxProvider) {
        this.mailboxProvider = mailboxProvider;
        return this;
    }

    public AgentConfig setDefaultReplyTimeout(Duration defaultReplyTimeout) {
        this.defaultReplyTimeout = Objects.requireNonNull(defaultReplyTimeout, "defaultReplyTimeout cannot be null");
        return this;
    }

    /**
     * Sets how long {@code close()} waits for the worker before giving up.
     *
     * @param shutdownGracePeriod The grace period, zero or positive
     * @return This AgentConfig instance
     */
    public AgentConfig setShutdownGracePeriod(Duration shutdownGracePeriod) {
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod cannot be null");
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("Shutdown grace period cannot be negative, was " + shutdownGracePeriod);
        }
        this.shutdownGracePeriod = shutdownGracePeriod;
        return this;
    }

    public AgentConfig setExecutor(ExecutorService executor) {
        this.executor = executor;
        return this;
    }

    public AgentConfig setScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public String getName() {
        return name;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public WorkloadType getWorkloadType() {
        return workloadType;
    }

    public MailboxProvider<?> getMailboxProvider() {
        return mailboxProvider;
    }

    public Duration getDefaultReplyTimeout() {
        return defaultReplyTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public ExecutorService getExecutor() {
        return executor;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }
}
