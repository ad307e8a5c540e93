package com.postbox;

/**
 * Write-once capability a message carries so the agent can answer the poster that asked.
 * Only the first reply is delivered; later calls have no effect.
 *
 * @param <R> The reply type
 */
@FunctionalInterface
public interface ReplyChannel<R> {

    /**
     * Delivers the reply.
     *
     * @param value the reply value
     * @return true if this call delivered the reply, false if a reply was already delivered
     *         or the poster stopped waiting
     */
    boolean reply(R value);
}
