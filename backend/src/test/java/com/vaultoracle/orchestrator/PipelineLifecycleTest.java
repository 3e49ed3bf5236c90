package com.vaultoracle.orchestrator;

import com.vaultoracle.orchestrator.config.OrchestratorProperties;
import com.vaultoracle.worker.BlockWorkerClient;
import com.vaultoracle.worker.WorkerStartupException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineLifecycleTest {

    @Mock
    BlockWorkerClient workerClient;
    @Mock
    BlockWatchOrchestrator orchestrator;

    OrchestratorProperties properties;
    PipelineLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        lifecycle = new PipelineLifecycle(workerClient, orchestrator, properties);
    }

    @Test
    void start_seedsOrchestratorFromWorker() {
        when(workerClient.startAndAwaitInitialized(Duration.ofMillis(properties.getStartupTimeoutMs()))).thenReturn(250L);

        lifecycle.start();

        verify(orchestrator).start(250L);
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    void start_workerFailure_propagates() {
        when(workerClient.startAndAwaitInitialized(any(Duration.class)))
                .thenThrow(new WorkerStartupException("Worker initialization failed: prover down"));

        assertThatThrownBy(() -> lifecycle.start()).isInstanceOf(WorkerStartupException.class);

        verify(orchestrator, never()).start(anyLong());
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void stop_killsWorkerThatDoesNotExit() {
        when(workerClient.shutdown(any(Duration.class))).thenReturn(false);

        lifecycle.stop();

        verify(orchestrator).stop();
        verify(workerClient).kill();
    }

    @Test
    void stop_cleanExit_noKill() {
        when(workerClient.shutdown(any(Duration.class))).thenReturn(true);

        lifecycle.stop();

        verify(workerClient, never()).kill();
    }

    @Test
    void autoStartup_followsProperty() {
        properties.setAutoStart(false);

        assertThat(lifecycle.isAutoStartup()).isFalse();
    }
}
