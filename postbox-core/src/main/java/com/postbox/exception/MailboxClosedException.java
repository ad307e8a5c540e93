package com.postbox.exception;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a mailbox operation is attempted after the mailbox has been stopped.
 * Always shutdown-related.
 */
public class MailboxClosedException extends CancellationException {

    public MailboxClosedException() {
        super("Mailbox is closed");
    }

    public MailboxClosedException(String message) {
        super(message);
    }
}
