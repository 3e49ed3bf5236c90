package com.vaultoracle.orchestrator;

import com.vaultoracle.config.SchedulerConfig;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.ingestion.adapter.ChainReader;
import com.vaultoracle.orchestrator.config.OrchestratorProperties;
import com.vaultoracle.worker.BlockWorkerClient;
import com.vaultoracle.worker.FatalWorkerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the chain head and hands each new height to the worker. One pending timer at a time; the next check is armed
 * only after the previous one finished. The local watermark advances only when the worker reports success.
 * <p>
 * A worker that times out or exits mid-request is killed and the process exits with code 1 after a grace delay,
 * unless {@link #stop()} was already called: a worker killed by a shutdown that outlasted the cycle is not escalated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockWatchOrchestrator {

    private final ChainReader chainReader;
    private final BlockWorkerClient workerClient;
    private final OrchestratorProperties orchestratorProperties;
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    private final TaskScheduler taskScheduler;
    private final ProcessTerminator processTerminator;

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private volatile long currentBlockHeight;
    private volatile boolean watching;
    private ScheduledFuture<?> pendingCheck;

    /**
     * Start watching from initialWatermark. No-op if already watching.
     */
    public synchronized void start(long initialWatermark) {
        if (watching) {
            log.info("Orchestrator already watching");
            return;
        }
        currentBlockHeight = initialWatermark;
        watching = true;
        log.info("Watching for new blocks above {}", initialWatermark);
        scheduleNextCheck();
    }

    /**
     * Cancel the pending check. An in-flight cycle is not interrupted. Idempotent.
     */
    public synchronized void stop() {
        if (pendingCheck != null) {
            pendingCheck.cancel(false);
            pendingCheck = null;
        }
        if (watching) {
            watching = false;
            log.info("Orchestrator stopped");
        }
    }

    synchronized void scheduleNextCheck() {
        if (!watching) {
            return;
        }
        pendingCheck = taskScheduler.schedule(this::runScheduledCheck,
                Instant.now().plusMillis(orchestratorProperties.getCheckIntervalMs()));
    }

    void runScheduledCheck() {
        try {
            checkNewBlock();
        } catch (FatalWorkerException e) {
            log.error("Block check aborted: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Block check failed: {}", e.getMessage(), e);
        } finally {
            scheduleNextCheck();
        }
    }

    /**
     * Process the chain head if it is above the watermark. A call while another is in flight returns immediately.
     *
     * @return events that changed a vault; empty if nothing was processed
     */
    public List<ChainEvent> checkNewBlock() {
        if (!processing.compareAndSet(false, true)) {
            log.debug("Previous block still processing, skipping check");
            return List.of();
        }
        try {
            long head = chainReader.getHeadHeight();
            if (head <= currentBlockHeight) {
                return List.of();
            }
            log.info("New block detected: {}", head);
            List<ChainEvent> events = handleNewBlock(head);
            currentBlockHeight = head;
            return events;
        } finally {
            processing.set(false);
        }
    }

    /**
     * @throws com.vaultoracle.worker.BlockProcessingException if the worker reported an error
     * @throws FatalWorkerException after scheduling process exit, or as is once stopped
     */
    List<ChainEvent> handleNewBlock(long blockHeight) {
        try {
            return workerClient.processBlock(blockHeight,
                    Duration.ofMillis(orchestratorProperties.getProcessTimeoutMs())).events();
        } catch (FatalWorkerException e) {
            if (watching) {
                escalate(e);
            } else {
                log.warn("Worker failed while the pipeline was stopping: {}", e.getMessage());
            }
            throw e;
        }
    }

    private void escalate(FatalWorkerException e) {
        log.error("Fatal worker failure, exiting in {} ms: {}", orchestratorProperties.getFatalExitGraceMs(), e.getMessage());
        stop();
        workerClient.kill();
        taskScheduler.schedule(() -> processTerminator.terminate(1),
                Instant.now().plusMillis(orchestratorProperties.getFatalExitGraceMs()));
    }

    public long getCurrentBlockHeight() {
        return currentBlockHeight;
    }

    public boolean isWatching() {
        return watching;
    }
}
