package com.example.auditchain.access;

import com.example.auditchain.models.AuditLogItem;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only audit chain. Implementations persist finalized links
 * and return the latest one so the logger can resume its cursor after a restart.
 */
public interface AuditLogAccess {

    /**
     * Persists one link. Must either store it completely or throw.
     */
    void put(AuditLogItem item);

    Optional<AuditLogItem> findLatest(String chainId);

    /**
     * Finds every link of a chain, ordered by sequence ascending.
     *
     * @param chainId the chain to read
     * @return the chain in append order
     */
    List<AuditLogItem> findAllByChainId(String chainId);
}
