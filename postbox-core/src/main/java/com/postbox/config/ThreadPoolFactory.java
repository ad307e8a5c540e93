package com.postbox.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the thread pools agents run on.
 * This class provides centralized creation and configuration for the worker pool and the
 * scheduler used for reply timeouts, making it easier to tune resource usage.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_SCHEDULER_THREADS = 1;
    private static final boolean DEFAULT_USE_NAMED_THREADS = true;
    private static final boolean DEFAULT_DAEMON_THREADS = true;

    // Scheduler configuration
    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private boolean useNamedThreads = DEFAULT_USE_NAMED_THREADS;
    private boolean daemonThreads = DEFAULT_DAEMON_THREADS;

    // Thread pool type configuration
    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * Grows on demand and reuses idle threads.
         * An agent body holds its thread for as long as it runs, so this is the default.
         */
        CACHED,

        /**
         * Uses a fixed thread pool with a specified number of threads.
         * Limits the number of agents that can run at the same time to the pool size.
         */
        FIXED
    }

    /**
     * Enum defining the types of workloads an agent can be optimized for.
     * Used as a hint when choosing a mailbox implementation.
     */
    public enum WorkloadType {
        /**
         * Agents doing mostly IO operations.
         */
        IO_BOUND,

        /**
         * Agents doing intensive computation with many producers.
         */
        CPU_BOUND,

        /**
         * A mix of IO and CPU operations.
         */
        MIXED
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates a scheduled executor service based on the current configuration.
     *
     * Timers cancelled before they fire are removed from the queue right away.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(schedulerThreads, createThreadFactory(poolName + "-scheduler"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return Executors.newCachedThreadPool(createThreadFactory(poolName + "-worker"));
            case FIXED:
                return Executors.newFixedThreadPool(fixedPoolSize, createThreadFactory(poolName + "-worker"));
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory
     */
    public ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);
            private final ThreadFactory defaults = Executors.defaultThreadFactory();

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = defaults.newThread(r);
                if (useNamedThreads) {
                    thread.setName(prefix + "-" + threadNumber.getAndIncrement());
                }
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    // Getters and setters

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }
}
