package com.postbox.mailbox.config;

import com.postbox.cancellation.CancellationToken;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default mailbox provider that picks a mailbox implementation from a workload hint,
 * using the Strategy pattern.
 *
 * - CPU_BOUND: MpscMailbox when unbounded, BlockingMailbox otherwise
 * - IO_BOUND, MIXED and no hint: BlockingMailbox
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<WorkloadType, MailboxCreationStrategy<M>> strategies;
    private final MailboxCreationStrategy<M> defaultStrategy;

    public DefaultMailboxProvider() {
        this.defaultStrategy = new BoundedStrategy<>();
        this.strategies = new EnumMap<>(WorkloadType.class);
        this.strategies.put(WorkloadType.IO_BOUND, defaultStrategy);
        this.strategies.put(WorkloadType.CPU_BOUND, new HighThroughputStrategy<>(defaultStrategy));
        this.strategies.put(WorkloadType.MIXED, defaultStrategy);
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config, CancellationToken cancellationToken, WorkloadType workloadTypeHint) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        CancellationToken effectiveToken = (cancellationToken != null) ? cancellationToken : CancellationToken.none();

        logger.debug("DefaultMailboxProvider creating mailbox - config: {}, workloadHint: {}",
                effectiveConfig, workloadTypeHint);

        MailboxCreationStrategy<M> strategy = (workloadTypeHint != null)
                ? strategies.getOrDefault(workloadTypeHint, defaultStrategy)
                : defaultStrategy;

        return strategy.createMailbox(effectiveConfig, effectiveToken);
    }
}
