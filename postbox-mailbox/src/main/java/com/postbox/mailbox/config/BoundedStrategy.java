package com.postbox.mailbox.config;

import com.postbox.cancellation.CancellationToken;
import com.postbox.mailbox.BlockingMailbox;
import com.postbox.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * General-purpose mailbox creation strategy.
 * Uses BlockingMailbox, which honors the configured capacity.
 *
 * @param <M> The message type
 */
public class BoundedStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config, CancellationToken cancellationToken) {
        logger.debug("Creating BlockingMailbox with {}", config);
        return new BlockingMailbox<>(config.getCapacity(), cancellationToken);
    }
}
