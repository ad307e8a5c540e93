package com.postbox.mailbox.config;

/**
 * Configuration for agent mailbox settings.
 */
public class MailboxConfig {
    /** Capacity value meaning the mailbox never blocks a poster for space. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final int DEFAULT_CAPACITY = UNBOUNDED;
    public static final int DEFAULT_CHUNK_SIZE = 128;

    private int capacity;
    private int chunkSize;

    /**
     * Creates a new MailboxConfig with default values (unbounded).
     */
    public MailboxConfig() {
        this.capacity = DEFAULT_CAPACITY;
        this.chunkSize = DEFAULT_CHUNK_SIZE;
    }

    /**
     * Creates a bounded MailboxConfig.
     *
     * @param capacity The maximum number of queued messages
     * @return A new MailboxConfig
     */
    public static MailboxConfig bounded(int capacity) {
        return new MailboxConfig().setCapacity(capacity);
    }

    /**
     * Sets the maximum number of queued messages.
     *
     * @param capacity The capacity, at least 1
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * Sets the chunk size used by array-backed unbounded mailboxes.
     *
     * @param chunkSize The chunk size
     * @return This MailboxConfig instance
     */
    public MailboxConfig setChunkSize(int chunkSize) {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("Chunk size must be at least 2, was " + chunkSize);
        }
        this.chunkSize = chunkSize;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    @Override
    public String toString() {
        return "MailboxConfig{capacity=" + (isBounded() ? capacity : "unbounded") + ", chunkSize=" + chunkSize + "}";
    }
}
