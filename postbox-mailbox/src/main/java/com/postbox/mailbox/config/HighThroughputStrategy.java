package com.postbox.mailbox.config;

import com.postbox.cancellation.CancellationToken;
import com.postbox.mailbox.Mailbox;
import com.postbox.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mailbox creation strategy optimized for CPU-bound workloads with many posters.
 * Uses MpscMailbox for lock-free posting. MpscMailbox is unbounded, so a bounded
 * configuration falls back to the given strategy.
 *
 * @param <M> The message type
 */
public class HighThroughputStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(HighThroughputStrategy.class);

    private final MailboxCreationStrategy<M> boundedFallback;

    public HighThroughputStrategy(MailboxCreationStrategy<M> boundedFallback) {
        this.boundedFallback = boundedFallback;
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config, CancellationToken cancellationToken) {
        if (config.isBounded()) {
            logger.debug("Bounded capacity {} requested, MpscMailbox is unbounded; using fallback strategy",
                    config.getCapacity());
            return boundedFallback.createMailbox(config, cancellationToken);
        }
        logger.debug("Creating MpscMailbox with chunk size: {}", config.getChunkSize());
        return new MpscMailbox<>(config.getChunkSize(), cancellationToken);
    }
}
