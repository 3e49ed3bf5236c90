package com.vaultoracle.worker;

/**
 * Orchestrator to worker messages.
 */
public sealed interface WorkerRequest permits WorkerRequest.ProcessBlock, WorkerRequest.Shutdown {

    record ProcessBlock(long targetHeight) implements WorkerRequest {
    }

    /** Release resources and exit with code 0. */
    record Shutdown() implements WorkerRequest {
    }
}
