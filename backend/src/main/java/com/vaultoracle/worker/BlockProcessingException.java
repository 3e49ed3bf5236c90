package com.vaultoracle.worker;

import lombok.Getter;

/**
 * The worker reported an error for a block. Not fatal: the watermark stays put and the next tick retries.
 */
@Getter
public class BlockProcessingException extends RuntimeException {

    private final long targetHeight;

    public BlockProcessingException(long targetHeight, String message) {
        super("Block " + targetHeight + " failed: " + message);
        this.targetHeight = targetHeight;
    }
}
