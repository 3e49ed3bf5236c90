package com.vaultoracle.ingestion.adapter;

import com.vaultoracle.domain.ChainEvent;

import java.util.List;

/**
 * Chain read collaborator: head height for polling, engine events for reconciliation.
 */
public interface ChainReader {

    /**
     * Current best-chain height.
     *
     * @throws ChainReadException if the node cannot be queried
     */
    long getHeadHeight();

    /**
     * All engine events with height &gt;= fromHeight up to the current head, in chain order. No upper bound and no
     * pagination: one call returns the whole backlog.
     *
     * @throws ChainReadException if the archive cannot be queried or returns an error
     */
    List<ChainEvent> fetchEvents(long fromHeight);
}
