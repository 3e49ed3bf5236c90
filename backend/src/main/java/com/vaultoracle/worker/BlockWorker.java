package com.vaultoracle.worker;

import com.vaultoracle.common.PipelineException;
import com.vaultoracle.domain.ChainEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Worker loop. Runs on its own thread and talks to the orchestrator only through the two queues; requests are
 * handled strictly one at a time. The last reply is always {@link WorkerReply.Exited}.
 */
@Slf4j
class BlockWorker implements Runnable {

    private final WorkerInitializer initializer;
    private final BlockProcessor processor;
    private final BlockingQueue<WorkerRequest> requests;
    private final BlockingQueue<WorkerReply> replies;

    BlockWorker(WorkerInitializer initializer, BlockProcessor processor,
                BlockingQueue<WorkerRequest> requests, BlockingQueue<WorkerReply> replies) {
        this.initializer = initializer;
        this.processor = processor;
        this.requests = requests;
        this.replies = replies;
    }

    @Override
    public void run() {
        int exitCode = 1;
        try {
            long lastProcessedBlock;
            try {
                lastProcessedBlock = initializer.initialize();
            } catch (RuntimeException e) {
                log.error("Worker initialization failed", e);
                replies.add(new WorkerReply.Error("Worker initialization failed: " + e.getMessage()));
                return;
            }
            replies.add(new WorkerReply.Initialized(lastProcessedBlock));
            exitCode = loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted, exiting");
        } catch (Throwable t) {
            log.error("Worker crashed", t);
        } finally {
            replies.add(new WorkerReply.Exited(exitCode));
        }
    }

    private int loop() throws InterruptedException {
        while (true) {
            WorkerRequest request = requests.take();
            if (request instanceof WorkerRequest.Shutdown) {
                log.info("Worker shutting down");
                return 0;
            }
            if (request instanceof WorkerRequest.ProcessBlock processBlock) {
                replies.add(process(processBlock.targetHeight()));
            } else {
                throw new IllegalStateException("Unsupported worker request " + request);
            }
        }
    }

    private WorkerReply process(long targetHeight) {
        try {
            List<ChainEvent> events = processor.handleBlock(targetHeight);
            return new WorkerReply.Success(targetHeight, events);
        } catch (PipelineException e) {
            log.error("Block {} failed: {}", targetHeight, e.describe(), e);
            return new WorkerReply.Error(e.describe());
        } catch (RuntimeException e) {
            log.error("Block {} failed", targetHeight, e);
            return new WorkerReply.Error(String.valueOf(e.getMessage()));
        }
    }
}
