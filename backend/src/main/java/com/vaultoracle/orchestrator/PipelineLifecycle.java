package com.vaultoracle.orchestrator;

import com.vaultoracle.orchestrator.config.OrchestratorProperties;
import com.vaultoracle.worker.BlockWorkerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the worker and the watch loop with the context and shuts both down with it. A worker that fails to start
 * fails the context, so the process exits non-zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineLifecycle implements SmartLifecycle {

    private final BlockWorkerClient workerClient;
    private final BlockWatchOrchestrator orchestrator;
    private final OrchestratorProperties orchestratorProperties;

    private volatile boolean running;

    @Override
    public void start() {
        long lastProcessedBlock = workerClient.startAndAwaitInitialized(
                Duration.ofMillis(orchestratorProperties.getStartupTimeoutMs()));
        orchestrator.start(lastProcessedBlock);
        running = true;
    }

    @Override
    public void stop() {
        orchestrator.stop();
        if (!workerClient.shutdown(Duration.ofMillis(orchestratorProperties.getShutdownTimeoutMs()))) {
            workerClient.kill();
        }
        running = false;
        log.info("Pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return orchestratorProperties.isAutoStart();
    }
}
