package com.postbox.mailbox;

import com.postbox.cancellation.CancellationToken;
import com.postbox.exception.MailboxClosedException;
import com.postbox.exception.OperationCancelledException;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A cancellable, optionally bounded FIFO queue feeding a single consumer.
 * <p>
 * Every mailbox observes a {@link CancellationToken}. Once the token fires, pending and future
 * blocking operations fail with {@link OperationCancelledException}. {@link #stop()} is a second,
 * independent way to close the mailbox; afterwards operations fail with
 * {@link MailboxClosedException}. When both hold, cancellation is reported.
 * <p>
 * A message is either delivered exactly once to a receive call, or rejected when it is posted.
 * Messages still queued when the mailbox closes become unreachable.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message, waiting if necessary for space to become available.
     *
     * @param message the message to add
     * @throws MailboxClosedException if the mailbox is stopped, before or while waiting
     * @throws OperationCancelledException if the token fires, before or while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    void post(T message) throws InterruptedException;

    /**
     * Inserts the specified message if it is possible to do so immediately without exceeding
     * capacity.
     *
     * @param message the message to add
     * @return true if the message was added, false if the mailbox is full
     * @throws MailboxClosedException if the mailbox is stopped
     * @throws OperationCancelledException if the token has fired
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, waiting if necessary until a message
     * becomes available.
     *
     * @return the head of this mailbox
     * @throws MailboxClosedException if the mailbox is stopped, before or while waiting
     * @throws OperationCancelledException if the token fires, before or while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    T receive() throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox if one is queued. Never blocks or throws
     * because of closure: a closed or cancelled mailbox reports no message.
     *
     * @return the head of this mailbox, or empty
     */
    Optional<T> tryReceive();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the specified time for a
     * message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or empty if the timeout elapsed
     * @throws MailboxClosedException if the mailbox is stopped, before or while waiting
     * @throws OperationCancelledException if the token fires, before or while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> tryReceive(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Closes this mailbox and releases every waiting producer and consumer. Idempotent.
     */
    void stop();

    /**
     * Returns true once {@link #stop()} has been called.
     *
     * @return true if stopped
     */
    boolean isClosed();

    /**
     * Returns the token this mailbox observes.
     *
     * @return the cancellation token
     */
    CancellationToken cancellationToken();

    /**
     * Returns the number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the number of additional messages this mailbox can accept
     * without blocking, or Integer.MAX_VALUE if unbounded.
     *
     * @return the remaining capacity
     */
    int remainingCapacity();

    /**
     * Returns the total capacity of this mailbox (size + remaining capacity).
     * Returns Integer.MAX_VALUE if unbounded.
     *
     * @return the total capacity
     */
    default int capacity() {
        int size = size();
        int remaining = remainingCapacity();
        if (remaining == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return size + remaining;
    }
}
