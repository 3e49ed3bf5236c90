package com.vaultoracle.worker;

import lombok.Getter;

import java.time.Duration;

@Getter
public class WorkerTimeoutException extends FatalWorkerException {

    private final long targetHeight;

    public WorkerTimeoutException(long targetHeight, Duration timeout) {
        super("Block " + targetHeight + " not processed within " + timeout.toMillis() + " ms");
        this.targetHeight = targetHeight;
    }
}
