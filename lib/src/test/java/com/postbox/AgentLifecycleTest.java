package com.postbox;

import com.postbox.cancellation.CancellationToken;
import com.postbox.config.AgentConfig;
import com.postbox.exception.AgentAlreadyStartedException;
import com.postbox.exception.AgentException;
import com.postbox.exception.MailboxClosedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for starting, stopping and failing agents.
 */
class AgentLifecycleTest {

    private List<Throwable> errors;
    private Agent<String> agent;

    @BeforeEach
    void setUp() {
        errors = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (agent != null) {
            agent.close();
        }
    }

    private Agent<String> create(AgentBody<String> body) {
        agent = new Agent<>(body);
        agent.errors().subscribe(errors::add);
        return agent;
    }

    private static void receiveForever(Agent<String> self) throws InterruptedException {
        while (true) {
            self.receive();
        }
    }

    private static void awaitIdle(Agent<?> agent) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (agent.isRunning()) {
            if (System.nanoTime() > deadline) {
                fail("Agent " + agent.getName() + " still running");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testNewAgentIsIdle() {
        create(AgentLifecycleTest::receiveForever);
        assertFalse(agent.isRunning());
        assertTrue(agent.getName().startsWith("agent-"));
    }

    @Test
    void testStartMakesAgentRunning() {
        create(AgentLifecycleTest::receiveForever).start();
        assertTrue(agent.isRunning());
    }

    @Test
    void testSecondStartFails() {
        create(AgentLifecycleTest::receiveForever).start();

        AgentAlreadyStartedException thrown = assertThrows(AgentAlreadyStartedException.class, agent::start);

        assertEquals(agent.getName(), thrown.getAgentName());
        assertTrue(agent.isRunning());
    }

    @Test
    @Timeout(5)
    void testBodyRunsOnlyOncePerStart() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        create(self -> {
            runs.incrementAndGet();
            receiveForever(self);
        }).start();
        assertThrows(AgentAlreadyStartedException.class, agent::start);

        agent.stop();

        assertEquals(1, runs.get());
    }

    @Test
    @Timeout(5)
    void testStopEndsBlockedBodyQuietly() throws Exception {
        CountDownLatch receiving = new CountDownLatch(1);
        AtomicBoolean sawCancellation = new AtomicBoolean();
        create(self -> {
            receiving.countDown();
            try {
                self.receive();
            } catch (CancellationException e) {
                sawCancellation.set(true);
                throw e;
            }
        }).start();
        assertTrue(receiving.await(1, TimeUnit.SECONDS));

        agent.stop();

        assertFalse(agent.isRunning());
        assertTrue(sawCancellation.get());
        assertTrue(errors.isEmpty(), "Shutdown must not be reported as an error: " + errors);
    }

    @Test
    void testStopWhenIdleIsNoOp() throws Exception {
        create(AgentLifecycleTest::receiveForever);

        assertDoesNotThrow(() -> agent.stop());
        assertTrue(agent.stop(Duration.ofMillis(10)));
        assertFalse(agent.isRunning());
    }

    @Test
    @Timeout(10)
    void testConcurrentStopIsIdempotent() throws Exception {
        create(AgentLifecycleTest::receiveForever).start();
        int stoppers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(stoppers);
        CountDownLatch go = new CountDownLatch(1);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(stoppers);
        try {
            for (int i = 0; i < stoppers; i++) {
                executor.execute(() -> {
                    try {
                        go.await();
                        agent.stop();
                    } catch (Throwable e) {
                        failures.add(e);
                    }
                    done.countDown();
                });
            }
            go.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(failures.isEmpty(), "Concurrent stop failed: " + failures);
        assertFalse(agent.isRunning());
        assertTrue(errors.isEmpty());
    }

    @Test
    @Timeout(5)
    void testBodyFailureReportedOnceAndAgentCanRestart() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        create(self -> {
            runs.incrementAndGet();
            while (true) {
                if ("boom".equals(self.receive())) {
                    throw new IllegalStateException("boom");
                }
            }
        }).start();

        agent.post("boom");
        awaitIdle(agent);
        Thread.sleep(50);

        assertEquals(1, errors.size());
        assertEquals("boom", errors.get(0).getMessage());

        agent.start();
        assertTrue(agent.isRunning());
        agent.post("boom");
        awaitIdle(agent);

        assertEquals(2, runs.get());
        assertEquals(2, errors.size());
    }

    @Test
    @Timeout(5)
    void testBodyCompletingNormallyReturnsToIdle() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        create(self -> ran.countDown()).start();

        assertTrue(ran.await(1, TimeUnit.SECONDS));
        awaitIdle(agent);

        assertTrue(errors.isEmpty());
        agent.start();
        awaitIdle(agent);
    }

    @Test
    @Timeout(5)
    void testFailingErrorObserverDoesNotWedgeAgent() throws Exception {
        create(self -> {
            throw new IllegalArgumentException("body failed");
        });
        agent.errors().subscribe(error -> {
            throw new IllegalStateException("observer failed");
        });

        agent.start();
        awaitIdle(agent);

        assertEquals(1, errors.size());
        Throwable reported = errors.get(0);
        assertEquals(1, reported.getSuppressed().length);
        assertEquals("observer failed", reported.getSuppressed()[0].getMessage());
    }

    @Test
    @Timeout(5)
    void testStopRethrowsCheckedCleanupFailure() throws Exception {
        CountDownLatch receiving = new CountDownLatch(1);
        create(self -> {
            receiving.countDown();
            try {
                self.receive();
            } catch (CancellationException e) {
                throw new IOException("flush failed");
            }
        }).start();
        assertTrue(receiving.await(1, TimeUnit.SECONDS));

        AgentException thrown = assertThrows(AgentException.class, agent::stop);

        assertInstanceOf(IOException.class, thrown.getCause());
        assertEquals(agent.getName(), thrown.getAgentName());
        assertEquals(1, errors.size());
    }

    @Test
    @Timeout(5)
    void testStopRethrowsRuntimeFailureUnchanged() throws Exception {
        CountDownLatch receiving = new CountDownLatch(1);
        create(self -> {
            receiving.countDown();
            try {
                self.receive();
            } catch (CancellationException e) {
                throw new IllegalStateException("cleanup failed");
            }
        }).start();
        assertTrue(receiving.await(1, TimeUnit.SECONDS));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, agent::stop);
        assertEquals("cleanup failed", thrown.getMessage());
    }

    @Test
    @Timeout(5)
    void testCancellingTokenStopsAgent() throws Exception {
        CancellationToken token = CancellationToken.create();
        CountDownLatch ended = new CountDownLatch(1);
        agent = new Agent<>(self -> {
            try {
                receiveForever(self);
            } finally {
                ended.countDown();
            }
        }, token);
        agent.errors().subscribe(errors::add);
        agent.start();

        token.cancel();

        assertFalse(agent.isRunning());
        assertTrue(ended.await(1, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertTrue(errors.isEmpty());
    }

    @Test
    @Timeout(5)
    void testStartWithCancelledTokenSkipsBody() throws Exception {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicBoolean ran = new AtomicBoolean();
        agent = new Agent<>(self -> ran.set(true), token);

        agent.start();
        assertFalse(agent.isRunning());
        agent.stop();

        assertFalse(ran.get());
    }

    @Test
    @Timeout(5)
    void testRestartAfterStopSeesClosedMailbox() throws Exception {
        create(AgentLifecycleTest::receiveForever).start();
        agent.stop();

        agent.start();
        awaitIdle(agent);

        assertEquals(1, errors.size());
        assertInstanceOf(MailboxClosedException.class, errors.get(0));
    }

    @Test
    @Timeout(5)
    void testCloseGivesUpAfterGracePeriod() throws Exception {
        AtomicBoolean release = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        agent = new Agent<>(self -> {
            started.countDown();
            while (!release.get()) {
                Thread.sleep(10);
            }
        }, new AgentConfig().setShutdownGracePeriod(Duration.ofMillis(100)));
        agent.start();
        assertTrue(started.await(1, TimeUnit.SECONDS));

        long start = System.nanoTime();
        agent.close();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 90, "Returned before grace period: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 2000, "Did not give up: " + elapsedMs + "ms");
        assertFalse(agent.isRunning());
        release.set(true);
    }

    @Test
    @Timeout(5)
    void testNegativeStopTimeoutDoesNotWait() throws Exception {
        AtomicBoolean release = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        agent = new Agent<>(self -> {
            started.countDown();
            while (!release.get()) {
                Thread.sleep(10);
            }
        });
        agent.start();
        assertTrue(started.await(1, TimeUnit.SECONDS));

        long start = System.nanoTime();
        boolean finished = agent.stop(Duration.ofSeconds(-1));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(finished);
        assertTrue(elapsedMs < 1000, "Waited on a negative timeout: " + elapsedMs + "ms");
        assertFalse(agent.isRunning());
        release.set(true);
    }

    @Test
    void testNegativeGracePeriodRejected() {
        AgentConfig config = new AgentConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setShutdownGracePeriod(Duration.ofMillis(-1)));
        assertEquals(AgentConfig.DEFAULT_SHUTDOWN_GRACE_PERIOD, config.getShutdownGracePeriod());
        assertDoesNotThrow(() -> config.setShutdownGracePeriod(Duration.ZERO));
    }

    @Test
    void testRejectedStartLeavesAgentIdle() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        agent = new Agent<>(AgentLifecycleTest::receiveForever, new AgentConfig().setExecutor(executor));

        assertThrows(RejectedExecutionException.class, agent::start);
        assertFalse(agent.isRunning());
    }

    @Test
    void testReportErrorReachesSubscribers() {
        create(AgentLifecycleTest::receiveForever);
        List<Throwable> second = new ArrayList<>();
        agent.errors().subscribe(second::add);
        IllegalStateException error = new IllegalStateException("reported");

        agent.reportError(error);

        assertEquals(List.of(error), errors);
        assertEquals(List.of(error), second);
    }
}
