package com.postbox.mailbox;

import com.postbox.cancellation.CancellationToken;
import com.postbox.exception.MailboxClosedException;
import com.postbox.exception.OperationCancelledException;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * High-throughput mailbox implementation using JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing
 * - Minimal allocation overhead
 *
 * Recommended for:
 * - Agents with many concurrent posters
 * - CPU-bound workloads
 *
 * Trade-offs:
 * - Unbounded: {@link #post} never blocks for space
 * - Consumer-side operations take a lock, so only the waiting path pays for blocking
 * - A post racing with {@link #stop()} may land after closure; such a message is never delivered
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(MpscMailbox.class);

    private final MpscUnboundedArrayQueue<T> queue;
    private final CancellationToken cancellationToken;
    private final CancellationToken.Registration cancellationRegistration;
    private final ReentrantLock consumerLock = new ReentrantLock();
    private final Condition notEmpty = consumerLock.newCondition();
    private final int chunkSize;

    private volatile boolean closed = false;
    private volatile boolean hasWaitingConsumer = false;

    /**
     * Creates an MPSC mailbox with default chunk size (128) that can only be closed with {@link #stop()}.
     */
    public MpscMailbox() {
        this(128, CancellationToken.none());
    }

    /**
     * Creates an MPSC mailbox observing the given token.
     *
     * Note: This is unbounded - the chunk size only controls how the queue grows.
     *
     * @param chunkSize the chunk size, rounded up to a power of 2
     * @param cancellationToken the token that cancels pending operations
     */
    public MpscMailbox(int chunkSize, CancellationToken cancellationToken) {
        // JCTools requires at least 2
        int safeChunkSize = chunkSize <= 1 ? 2 : chunkSize;
        this.chunkSize = nextPowerOfTwo(safeChunkSize);
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken cannot be null");
        this.cancellationRegistration = cancellationToken.onCancel(this::wakeConsumer);
    }

    @Override
    public void post(T message) {
        offer(message);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        ensureOpen();
        queue.offer(message);
        // StoreLoad between the enqueue and the waiter check
        VarHandle.fullFence();
        if (hasWaitingConsumer) {
            wakeConsumer();
        }
        return true;
    }

    @Override
    public T receive() throws InterruptedException {
        consumerLock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                ensureOpen();
                T message = queue.poll();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            hasWaitingConsumer = false;
            consumerLock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive() {
        if (closed || cancellationToken.isCancelled()) {
            return Optional.empty();
        }
        consumerLock.lock();
        try {
            return Optional.ofNullable(queue.poll());
        } finally {
            consumerLock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        consumerLock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                ensureOpen();
                T message = queue.poll();
                if (message != null) {
                    return Optional.of(message);
                }
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            hasWaitingConsumer = false;
            consumerLock.unlock();
        }
    }

    @Override
    public void stop() {
        if (closed) {
            return;
        }
        closed = true;
        logger.debug("Mailbox stopped with {} unconsumed message(s)", queue.size());
        wakeConsumer();
        cancellationRegistration.close();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        // Unbounded queue
        return Integer.MAX_VALUE;
    }

    @Override
    public int capacity() {
        // Unbounded
        return Integer.MAX_VALUE;
    }

    /**
     * Returns the chunk size the underlying queue grows by.
     *
     * @return the chunk size
     */
    public int getChunkSize() {
        return chunkSize;
    }

    private void ensureOpen() {
        if (cancellationToken.isCancelled()) {
            throw new OperationCancelledException(cancellationToken);
        }
        if (closed) {
            throw new MailboxClosedException();
        }
    }

    private void wakeConsumer() {
        consumerLock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            consumerLock.unlock();
        }
    }

    /**
     * Rounds up to the next power of 2.
     */
    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value; // Already power of 2
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
