package com.postbox;

import com.postbox.builder.AgentBuilder;
import com.postbox.cancellation.CancellationToken;
import com.postbox.config.AgentConfig;
import com.postbox.event.EventStream;
import com.postbox.exception.AgentAlreadyStartedException;
import com.postbox.exception.AgentException;
import com.postbox.exception.OperationCancelledException;
import com.postbox.exception.ReplyTimeoutException;
import com.postbox.internal.SharedExecutors;
import com.postbox.mailbox.Mailbox;
import com.postbox.mailbox.config.DefaultMailboxProvider;
import com.postbox.mailbox.config.MailboxConfig;
import com.postbox.mailbox.config.MailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * A background worker with a private mailbox.
 * <p>
 * Any thread may {@link #post} messages. The {@link AgentBody} runs on a worker thread once the agent
 * is {@link #start() started} and drains the mailbox with {@link #receive()}. Exceptions escaping the
 * body are published on {@link #errors()}; the agent then returns to idle and does not restart itself.
 * <p>
 * Lifecycle: an agent is idle until started and running until its body completes or it is stopped.
 * Starting a running agent fails with {@link AgentAlreadyStartedException}. Stopping closes the
 * mailbox, so a body blocked in {@code receive()} ends with a cancellation exception.
 *
 * <pre>{@code
 * record Add(int amount, ReplyChannel<Integer> total) {}
 *
 * Agent<Add> counter = Agent.<Add>builder(agent -> {
 *     int total = 0;
 *     while (true) {
 *         Add add = agent.receive();
 *         total += add.amount();
 *         add.total().reply(total);
 *     }
 * }).spawn();
 *
 * int total = counter.postAndReply(channel -> new Add(5, channel), Duration.ofSeconds(1));
 * counter.stop();
 * }</pre>
 *
 * @param <T> The type of messages this agent accepts
 */
public class Agent<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Agent.class);
    private static final AtomicInteger NAME_SEQUENCE = new AtomicInteger();

    private final String name;
    private final AgentBody<T> body;
    private final Mailbox<T> mailbox;
    private final CancellationToken cancellationToken;
    private final EventStream<Throwable> errors = new EventStream<>();
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final Duration shutdownGracePeriod;

    // Present while running. Lifecycle state and worker handle change together, by CAS only.
    private final AtomicReference<CompletableFuture<Void>> worker = new AtomicReference<>();

    private volatile Duration defaultReplyTimeout;

    /**
     * Creates an idle agent with an unbounded mailbox and its own cancellation token.
     *
     * @param body The body to run once started
     */
    public Agent(AgentBody<T> body) {
        this(body, new AgentConfig());
    }

    /**
     * Creates an idle agent with an unbounded mailbox observing the given token.
     *
     * @param body The body to run once started
     * @param cancellationToken The token governing the mailbox
     */
    public Agent(AgentBody<T> body, CancellationToken cancellationToken) {
        this(body, new AgentConfig().setCancellationToken(cancellationToken));
    }

    /**
     * Creates an idle agent with a bounded mailbox observing the given token.
     *
     * @param body The body to run once started
     * @param cancellationToken The token governing the mailbox
     * @param capacity The mailbox capacity
     */
    public Agent(AgentBody<T> body, CancellationToken cancellationToken, int capacity) {
        this(body, new AgentConfig()
                .setCancellationToken(cancellationToken)
                .setMailboxConfig(MailboxConfig.bounded(capacity)));
    }

    /**
     * Creates an idle agent from a full configuration.
     *
     * @param body The body to run once started
     * @param config The agent configuration
     */
    @SuppressWarnings("unchecked")
    public Agent(AgentBody<T> body, AgentConfig config) {
        this.body = Objects.requireNonNull(body, "body cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        this.name = config.getName() != null ? config.getName() : "agent-" + NAME_SEQUENCE.incrementAndGet();
        this.cancellationToken = config.getCancellationToken() != null
                ? config.getCancellationToken()
                : CancellationToken.create();
        MailboxProvider<T> provider = config.getMailboxProvider() != null
                ? (MailboxProvider<T>) config.getMailboxProvider()
                : new DefaultMailboxProvider<>();
        this.mailbox = provider.createMailbox(config.getMailboxConfig(), cancellationToken, config.getWorkloadType());
        this.executor = config.getExecutor() != null ? config.getExecutor() : SharedExecutors.workers();
        this.scheduler = config.getScheduler() != null ? config.getScheduler() : SharedExecutors.scheduler();
        this.shutdownGracePeriod = config.getShutdownGracePeriod();
        this.defaultReplyTimeout = config.getDefaultReplyTimeout();
    }

    /**
     * Creates a builder for an agent running the given body.
     *
     * @param body The body to run once started
     * @param <T> The message type
     * @return a new builder
     */
    public static <T> AgentBuilder<T> builder(AgentBody<T> body) {
        return new AgentBuilder<>(body);
    }

    /**
     * Starts the body on a worker thread.
     *
     * @throws AgentAlreadyStartedException if the agent is already running
     * @throws RejectedExecutionException if the executor refuses the worker; the agent stays idle
     */
    public void start() {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        if (!worker.compareAndSet(null, completion)) {
            throw new AgentAlreadyStartedException(name);
        }
        logger.info("Starting agent {}", name);
        try {
            executor.execute(() -> runWorker(completion));
        } catch (RejectedExecutionException e) {
            worker.compareAndSet(completion, null);
            completion.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Stops the agent and waits for its worker to finish. Has no effect if the agent is not running.
     * <p>
     * A worker ending with a cancellation exception is the expected outcome and is not reported.
     * Any other failure of the worker is rethrown.
     *
     * @throws AgentException if the body failed with a checked exception
     * @throws InterruptedException if interrupted while waiting
     */
    public void stop() throws InterruptedException {
        CompletableFuture<Void> completion = beginStop();
        if (completion != null) {
            awaitWorker(completion, -1);
        }
    }

    /**
     * Stops the agent and waits up to the given time for its worker to finish.
     *
     * @param timeout the maximum time to wait, a negative value is treated as zero
     * @return true if the worker finished (or the agent was not running), false if the time elapsed
     * @throws AgentException if the body failed with a checked exception
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        CompletableFuture<Void> completion = beginStop();
        if (completion == null) {
            return true;
        }
        return awaitWorker(completion, Math.max(0L, timeout.toNanos()));
    }

    /**
     * Stops the agent, waiting at most the configured grace period. Returns even if the worker is still running.
     */
    @Override
    public void close() {
        try {
            if (!stop(shutdownGracePeriod)) {
                logger.warn("Agent {} did not stop within {}ms", name, shutdownGracePeriod.toMillis());
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while closing agent {}", name);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns true if the agent is started and its cancellation token has not fired.
     *
     * @return true if running
     */
    public boolean isRunning() {
        return worker.get() != null && !cancellationToken.isCancelled();
    }

    /**
     * Posts a message, waiting for space if the mailbox is bounded and full.
     *
     * @param message the message
     * @throws OperationCancelledException if the agent is not running and the mailbox refused the message
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void post(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        try {
            mailbox.post(message);
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    /**
     * Posts a message carrying a fresh reply channel and waits for the reply, using the default reply timeout.
     *
     * @param messageFactory builds the message from the reply channel
     * @param <R> the reply type
     * @return the reply
     * @throws ReplyTimeoutException if no reply arrived in time
     * @throws OperationCancelledException if the agent was cancelled or stopped
     * @throws InterruptedException if interrupted while waiting
     */
    public <R> R postAndReply(Function<ReplyChannel<R>, T> messageFactory) throws InterruptedException {
        return postAndReply(messageFactory, null);
    }

    /**
     * Posts a message carrying a fresh reply channel and waits for the reply.
     *
     * @param messageFactory builds the message from the reply channel
     * @param timeout the timeout, null for the default, negative for none
     * @param <R> the reply type
     * @return the reply
     * @throws ReplyTimeoutException if no reply arrived in time
     * @throws OperationCancelledException if the agent was cancelled or stopped
     * @throws InterruptedException if interrupted while waiting
     */
    public <R> R postAndReply(Function<ReplyChannel<R>, T> messageFactory, Duration timeout) throws InterruptedException {
        CompletableFuture<R> reply = postAndReplyAsync(messageFactory, timeout);
        try {
            return reply.get();
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (InterruptedException e) {
            reply.cancel(false);
            throw e;
        }
    }

    /**
     * Posts a message carrying a fresh reply channel, using the default reply timeout.
     *
     * @param messageFactory builds the message from the reply channel
     * @param <R> the reply type
     * @return a future completed with the reply, or failed when the reply scope is cancelled
     * @throws InterruptedException if interrupted while waiting for mailbox space
     */
    public <R> CompletableFuture<R> postAndReplyAsync(Function<ReplyChannel<R>, T> messageFactory) throws InterruptedException {
        return postAndReplyAsync(messageFactory, null);
    }

    /**
     * Posts a message carrying a fresh reply channel.
     * <p>
     * The returned future fails with {@link ReplyTimeoutException} when the timeout expires first,
     * or with {@link OperationCancelledException} when the agent's token fires first.
     * Only posting may block; waiting for the reply does not involve the mailbox.
     *
     * @param messageFactory builds the message from the reply channel
     * @param timeout the timeout, null for the default, negative for none
     * @param <R> the reply type
     * @return a future completed with the reply
     * @throws InterruptedException if interrupted while waiting for mailbox space
     */
    public <R> CompletableFuture<R> postAndReplyAsync(Function<ReplyChannel<R>, T> messageFactory, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(messageFactory, "messageFactory cannot be null");
        Duration effectiveTimeout = timeout != null ? timeout : defaultReplyTimeout;

        CompletableFuture<R> reply = new CompletableFuture<>();
        CancellationToken replyScope = cancellationToken.createLinked();
        replyScope.onCancel(() -> reply.completeExceptionally(cancellationToken.isCancelled()
                ? new OperationCancelledException(cancellationToken)
                : new ReplyTimeoutException(effectiveTimeout, replyScope)));
        reply.whenComplete((value, error) -> replyScope.close());
        if (!effectiveTimeout.isNegative()) {
            replyScope.cancelAfter(effectiveTimeout, scheduler);
        }

        try {
            post(messageFactory.apply(reply::complete));
        } catch (InterruptedException | RuntimeException e) {
            replyScope.close();
            throw e;
        }
        return reply;
    }

    /**
     * Waits for the next message. Intended to be called by the body.
     *
     * @return the next message
     * @throws OperationCancelledException if the agent is stopped or cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public T receive() throws InterruptedException {
        try {
            return mailbox.receive();
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    /**
     * Returns the next message if one is queued, without waiting.
     *
     * @return the next message, or empty
     */
    public Optional<T> tryReceive() {
        return mailbox.tryReceive();
    }

    /**
     * Waits up to the given time for the next message.
     *
     * @param timeout the maximum time to wait
     * @return the next message, or empty if none arrived in time
     * @throws OperationCancelledException if the agent is stopped or cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<T> tryReceive(Duration timeout) throws InterruptedException {
        try {
            return mailbox.tryReceive(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    /**
     * Returns the stream unhandled body failures are published on.
     *
     * @return the error stream
     */
    public EventStream<Throwable> errors() {
        return errors;
    }

    /**
     * Publishes an error to every {@link #errors()} subscriber.
     *
     * @param error the error
     */
    public void reportError(Throwable error) {
        errors.emit(error);
    }

    public String getName() {
        return name;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Duration getDefaultReplyTimeout() {
        return defaultReplyTimeout;
    }

    /**
     * Sets the timeout used by {@code postAndReply} calls that do not pass one.
     *
     * @param defaultReplyTimeout the timeout, negative for none
     */
    public void setDefaultReplyTimeout(Duration defaultReplyTimeout) {
        this.defaultReplyTimeout = Objects.requireNonNull(defaultReplyTimeout, "defaultReplyTimeout cannot be null");
    }

    /**
     * Gets the current number of messages in the mailbox.
     */
    public int getMailboxSize() {
        return mailbox.size();
    }

    private void runWorker(CompletableFuture<Void> completion) {
        Throwable failure = null;
        try {
            cancellationToken.throwIfCancelled();
            body.run(this);
        } catch (Throwable e) {
            failure = e;
            publishFailure(e);
        } finally {
            worker.compareAndSet(completion, null);
            if (failure == null) {
                logger.debug("Agent {} body completed", name);
                completion.complete(null);
            } else {
                completion.completeExceptionally(failure);
            }
        }
    }

    private void publishFailure(Throwable failure) {
        if (failure instanceof CancellationException && !isRunning()) {
            logger.debug("Agent {} body ended by shutdown: {}", name, failure.getMessage());
            return;
        }
        logger.error("Agent {} body failed", name, failure);
        try {
            errors.emit(failure);
        } catch (RuntimeException observerFailure) {
            logger.warn("Agent {} error observer failed: {}", name, observerFailure.getMessage(), observerFailure);
            failure.addSuppressed(observerFailure);
        }
    }

    // Returns the worker to wait for if this call performed the Running -> Idle transition
    private CompletableFuture<Void> beginStop() {
        CompletableFuture<Void> completion = worker.get();
        if (completion == null || !worker.compareAndSet(completion, null)) {
            return null;
        }
        logger.info("Stopping agent {}", name);
        mailbox.stop();
        return completion;
    }

    private boolean awaitWorker(CompletableFuture<Void> completion, long timeoutNanos) throws InterruptedException {
        try {
            if (timeoutNanos < 0) {
                completion.get();
            } else {
                completion.get(timeoutNanos, TimeUnit.NANOSECONDS);
            }
        } catch (CancellationException e) {
            logger.debug("Agent {} stopped: {}", name, e.getMessage());
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (TimeoutException e) {
            return false;
        }
        logger.info("Agent {} stopped", name);
        return true;
    }

    private RuntimeException translate(RuntimeException failure) {
        if (isRunning()) {
            return failure;
        }
        if (failure instanceof OperationCancelledException
                && ((OperationCancelledException) failure).getToken() == cancellationToken) {
            return failure;
        }
        // Shutdown is shutdown, whatever the mailbox reported
        return new OperationCancelledException(cancellationToken, failure);
    }

    private RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new AgentException("Agent " + name + " failed", failure, name);
    }
}
