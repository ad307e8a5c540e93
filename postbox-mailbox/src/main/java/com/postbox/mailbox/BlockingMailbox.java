package com.postbox.mailbox;

import com.postbox.cancellation.CancellationToken;
import com.postbox.exception.MailboxClosedException;
import com.postbox.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default mailbox implementation: an {@link ArrayDeque} guarded by one lock with
 * {@code notEmpty} and {@code notFull} conditions.
 *
 * Recommended for:
 * - General-purpose agent mailboxes
 * - When backpressure/bounded capacity is needed
 *
 * Closing and cancellation wake every waiter on both conditions, so no producer or consumer
 * stays blocked on a mailbox that can no longer make progress.
 *
 * @param <T> The type of messages
 */
public class BlockingMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(BlockingMailbox.class);

    private final ArrayDeque<T> queue;
    private final int capacity;
    private final CancellationToken cancellationToken;
    private final CancellationToken.Registration cancellationRegistration;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;

    /**
     * Creates an unbounded mailbox that can only be closed with {@link #stop()}.
     */
    public BlockingMailbox() {
        this(Integer.MAX_VALUE, CancellationToken.none());
    }

    /**
     * Creates a bounded mailbox with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public BlockingMailbox(int capacity) {
        this(capacity, CancellationToken.none());
    }

    /**
     * Creates a mailbox observing the given token.
     *
     * @param capacity the maximum number of messages, Integer.MAX_VALUE for unbounded
     * @param cancellationToken the token that cancels pending operations
     */
    public BlockingMailbox(int capacity, CancellationToken cancellationToken) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken cannot be null");
        this.queue = new ArrayDeque<>(Math.min(capacity, 16));
        this.cancellationRegistration = cancellationToken.onCancel(this::wakeAll);
    }

    @Override
    public void post(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                if (queue.size() < capacity) {
                    enqueue(message);
                    return;
                }
                notFull.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            ensureOpen();
            if (queue.size() >= capacity) {
                return false;
            }
            enqueue(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                T message = dequeue();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive() {
        lock.lock();
        try {
            if (closed || cancellationToken.isCancelled()) {
                return Optional.empty();
            }
            return Optional.ofNullable(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureOpen();
                T message = dequeue();
                if (message != null) {
                    return Optional.of(message);
                }
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            logger.debug("Mailbox stopped with {} unconsumed message(s)", queue.size());
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        cancellationRegistration.close();
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int remainingCapacity() {
        if (capacity == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        lock.lock();
        try {
            return capacity - queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    // Must hold lock
    private void ensureOpen() {
        if (cancellationToken.isCancelled()) {
            throw new OperationCancelledException(cancellationToken);
        }
        if (closed) {
            throw new MailboxClosedException();
        }
    }

    // Must hold lock
    private void enqueue(T message) {
        queue.addLast(message);
        notEmpty.signal();
    }

    // Must hold lock
    private T dequeue() {
        T message = queue.pollFirst();
        if (message != null) {
            notFull.signal();
        }
        return message;
    }

    private void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
