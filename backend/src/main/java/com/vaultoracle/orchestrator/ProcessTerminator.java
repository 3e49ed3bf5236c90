package com.vaultoracle.orchestrator;

/**
 * Ends the process. Restarting is left to the process supervisor.
 */
public interface ProcessTerminator {

    void terminate(int exitCode);
}
