package com.vaultoracle.common;

/**
 * Stable failure categories surfaced by the block pipeline. Lower-level errors are wrapped into one of these
 * before they leave the worker.
 */
public enum PipelineFailure {
    COLLECTION_FAILED,
    PROOF_GENERATION_FAILED,
    /** Proof was computed but could not be stored. Not retried within the cycle. */
    PROOF_PERSISTENCE_FAILED,
    RECONCILIATION_FAILED
}
