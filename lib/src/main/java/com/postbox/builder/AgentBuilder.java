package com.postbox.builder;

import com.postbox.Agent;
import com.postbox.AgentBody;
import com.postbox.cancellation.CancellationToken;
import com.postbox.config.AgentConfig;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.config.MailboxConfig;
import com.postbox.mailbox.config.MailboxProvider;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builder for creating agents with a fluent API.
 *
 * @param <T> The type of messages the agent accepts
 */
public class AgentBuilder<T> {

    private final AgentBody<T> body;
    private final AgentConfig config;

    /**
     * Creates a new AgentBuilder for the given body.
     *
     * @param body The body the agent runs
     */
    public AgentBuilder(AgentBody<T> body) {
        this.body = Objects.requireNonNull(body, "body cannot be null");
        this.config = new AgentConfig();
    }

    /**
     * Sets the agent name used in log messages.
     *
     * @param name The name
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withName(String name) {
        config.setName(name);
        return this;
    }

    /**
     * Sets the cancellation token governing the agent's mailbox.
     *
     * @param cancellationToken The token
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withCancellationToken(CancellationToken cancellationToken) {
        config.setCancellationToken(cancellationToken);
        return this;
    }

    /**
     * Bounds the mailbox. Posting to a full mailbox waits for space.
     *
     * @param capacity The maximum number of queued messages
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withCapacity(int capacity) {
        config.setMailboxConfig(MailboxConfig.bounded(capacity));
        return this;
    }

    /**
     * Sets the mailbox configuration.
     *
     * @param mailboxConfig The mailbox configuration
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withMailboxConfig(MailboxConfig mailboxConfig) {
        config.setMailboxConfig(mailboxConfig);
        return this;
    }

    /**
     * Sets the workload hint used to choose a mailbox implementation.
     *
     * @param workloadType The workload type
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withWorkloadType(WorkloadType workloadType) {
        config.setWorkloadType(workloadType);
        return this;
    }

    /**
     * Sets the mailbox provider.
     *
     * @param mailboxProvider The mailbox provider
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withMailboxProvider(MailboxProvider<T> mailboxProvider) {
        config.setMailboxProvider(mailboxProvider);
        return this;
    }

    /**
     * Sets the timeout for {@code postAndReply} calls that do not pass one.
     *
     * @param timeout The timeout, negative for none
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withDefaultReplyTimeout(Duration timeout) {
        config.setDefaultReplyTimeout(timeout);
        return this;
    }

    /**
     * Sets how long {@link Agent#close()} waits for the worker.
     *
     * @param gracePeriod The grace period, zero or positive
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withShutdownGracePeriod(Duration gracePeriod) {
        config.setShutdownGracePeriod(gracePeriod);
        return this;
    }

    /**
     * Sets the executor the worker runs on.
     *
     * @param executor The executor
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withExecutor(ExecutorService executor) {
        config.setExecutor(executor);
        return this;
    }

    /**
     * Sets the scheduler running reply timeouts.
     *
     * @param scheduler The scheduler
     * @return This builder for method chaining
     */
    public AgentBuilder<T> withScheduler(ScheduledExecutorService scheduler) {
        config.setScheduler(scheduler);
        return this;
    }

    /**
     * Creates the agent without starting it.
     *
     * @return An idle agent
     */
    public Agent<T> build() {
        return new Agent<>(body, config);
    }

    /**
     * Creates and starts the agent.
     *
     * @return A running agent
     */
    public Agent<T> spawn() {
        Agent<T> agent = build();
        agent.start();
        return agent;
    }
}
