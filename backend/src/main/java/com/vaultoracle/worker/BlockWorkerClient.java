package com.vaultoracle.worker;

import com.vaultoracle.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrator side of the worker boundary. Owns the worker thread and its queues. Block requests and shutdown hold
 * the same exchange lock for their whole request/reply round trip, so only one caller ever reads the reply queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockWorkerClient {

    @Qualifier(AsyncConfig.WORKER_EXECUTOR)
    private final AsyncTaskExecutor workerExecutor;
    private final WorkerInitializer workerInitializer;
    private final BlockProcessor blockProcessor;

    private final ReentrantLock exchangeLock = new ReentrantLock();
    private volatile BlockingQueue<WorkerRequest> requests;
    private volatile BlockingQueue<WorkerReply> replies;
    private volatile Future<?> workerFuture;
    private volatile boolean running;

    /**
     * Spawn the worker and block until it reports initialization.
     *
     * @return checkpoint lastProcessedBlock reported by the worker
     * @throws WorkerStartupException on startup error, premature exit or timeout
     */
    public long startAndAwaitInitialized(Duration timeout) {
        synchronized (this) {
            if (running) {
                throw new IllegalStateException("Worker already running");
            }
            requests = new LinkedBlockingQueue<>();
            replies = new LinkedBlockingQueue<>();
            workerFuture = workerExecutor.submit(new BlockWorker(workerInitializer, blockProcessor, requests, replies));
            running = true;
        }
        WorkerReply reply = awaitReply(timeout);
        if (reply instanceof WorkerReply.Initialized initialized) {
            log.info("Worker initialized, lastProcessedBlock={}", initialized.lastProcessedBlock());
            return initialized.lastProcessedBlock();
        }
        kill();
        if (reply == null) {
            throw new WorkerStartupException("Worker did not initialize within " + timeout.toMillis() + " ms");
        }
        if (reply instanceof WorkerReply.Error error) {
            throw new WorkerStartupException(error.message());
        }
        throw new WorkerStartupException("Worker exited during startup: " + reply);
    }

    /**
     * Send one block to the worker and wait for its reply.
     *
     * @throws WorkerTimeoutException    no reply within timeout
     * @throws WorkerExitedException     worker exited (or was not running) with the request outstanding
     * @throws BlockProcessingException  worker reported an error; the worker stays usable
     */
    public WorkerReply.Success processBlock(long targetHeight, Duration timeout) {
        exchangeLock.lock();
        try {
            return exchangeBlock(targetHeight, timeout);
        } finally {
            exchangeLock.unlock();
        }
    }

    private WorkerReply.Success exchangeBlock(long targetHeight, Duration timeout) {
        if (!running) {
            throw new WorkerExitedException(-1, "Worker is not running");
        }
        requests.add(new WorkerRequest.ProcessBlock(targetHeight));
        WorkerReply reply = awaitReply(timeout);
        if (reply == null) {
            throw new WorkerTimeoutException(targetHeight, timeout);
        }
        if (reply instanceof WorkerReply.Success success) {
            return success;
        }
        if (reply instanceof WorkerReply.Error error) {
            throw new BlockProcessingException(targetHeight, error.message());
        }
        if (reply instanceof WorkerReply.Exited exited) {
            running = false;
            throw new WorkerExitedException(exited.exitCode(),
                    "Worker exited with code " + exited.exitCode() + " while processing block " + targetHeight);
        }
        throw new FatalWorkerException("Unexpected worker reply " + reply + " for block " + targetHeight);
    }

    /**
     * Ask the worker to exit and wait for its exit signal. A block in flight is allowed to finish first; the timeout
     * covers both the wait for it and the wait for the exit signal.
     *
     * @return true if the worker exited (or was not running) within timeout
     */
    public boolean shutdown(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!exchangeLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Block still processing after {} ms, worker not shut down", timeout.toMillis());
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the in-flight block before shutdown");
            return false;
        }
        try {
            return exchangeShutdown(deadline, timeout);
        } finally {
            exchangeLock.unlock();
        }
    }

    private boolean exchangeShutdown(long deadline, Duration timeout) {
        if (!running) {
            return true;
        }
        requests.add(new WorkerRequest.Shutdown());
        while (true) {
            long remaining = deadline - System.nanoTime();
            WorkerReply reply = awaitReply(Duration.ofNanos(Math.max(0, remaining)));
            if (reply instanceof WorkerReply.Exited exited) {
                running = false;
                log.info("Worker exited with code {}", exited.exitCode());
                return true;
            }
            if (reply == null) {
                log.warn("Worker did not exit within {} ms", timeout.toMillis());
                return false;
            }
            log.warn("Unexpected worker reply {} while shutting down", reply);
        }
    }

    /**
     * Interrupt the worker thread. Does not wait: a stuck compute may ignore the interrupt, which is why fatal paths
     * also exit the process.
     */
    public void kill() {
        Future<?> future = workerFuture;
        if (future != null) {
            future.cancel(true);
        }
        running = false;
        log.warn("Worker killed");
    }

    public boolean isRunning() {
        return running;
    }

    private WorkerReply awaitReply(Duration timeout) {
        try {
            return replies.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalWorkerException("Interrupted while waiting for worker", e);
        }
    }
}
