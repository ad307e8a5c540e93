package com.postbox.internal;

import com.postbox.config.ThreadPoolFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Lazily created pools shared by agents that do not configure their own.
 * Threads are daemon threads, so the pools never keep the JVM alive.
 */
public final class SharedExecutors {

    private SharedExecutors() {
    }

    public static ExecutorService workers() {
        return Workers.INSTANCE;
    }

    public static ScheduledExecutorService scheduler() {
        return Scheduler.INSTANCE;
    }

    private static final class Workers {
        static final ExecutorService INSTANCE = new ThreadPoolFactory().createExecutorService("postbox-agent");
    }

    private static final class Scheduler {
        static final ScheduledExecutorService INSTANCE = new ThreadPoolFactory().createScheduledExecutorService("postbox-reply");
    }
}
