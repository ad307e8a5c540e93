package com.postbox.mailbox.config;

import com.postbox.cancellation.CancellationToken;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.Mailbox;

/**
 * Creates the mailbox an agent owns.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox.
     *
     * @param config The mailbox configuration, or null for defaults
     * @param cancellationToken The token the mailbox observes
     * @param workloadTypeHint Optional hint for choosing an implementation, may be null
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config, CancellationToken cancellationToken, WorkloadType workloadTypeHint);
}
