package com.vaultoracle.worker;

import com.vaultoracle.domain.ChainEvent;

import java.util.List;

/**
 * Worker to orchestrator messages. {@link Initialized} is sent once after startup; {@link Exited} is always the
 * last message of a worker's life.
 */
public sealed interface WorkerReply
        permits WorkerReply.Initialized, WorkerReply.Success, WorkerReply.Error, WorkerReply.Exited {

    record Initialized(long lastProcessedBlock) implements WorkerReply {
    }

    /**
     * @param events events that changed a vault while processing the block
     */
    record Success(long targetHeight, List<ChainEvent> events) implements WorkerReply {
        public Success {
            events = List.copyOf(events);
        }
    }

    record Error(String message) implements WorkerReply {
    }

    record Exited(int exitCode) implements WorkerReply {
    }
}
