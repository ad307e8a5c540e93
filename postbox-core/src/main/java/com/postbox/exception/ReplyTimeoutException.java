package com.postbox.exception;

import com.postbox.cancellation.CancellationToken;

import java.time.Duration;

/**
 * Thrown when a reply was not delivered before its timeout expired.
 * A specialization of {@link OperationCancelledException}: the derived reply scope fired on its timer.
 */
public class ReplyTimeoutException extends OperationCancelledException {

    private final Duration timeout;

    public ReplyTimeoutException(Duration timeout, CancellationToken token) {
        super("No reply within " + timeout.toMillis() + "ms", token);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
