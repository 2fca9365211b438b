package com.example.auditchain.service;

import com.example.auditchain.access.AuditLogAccess;
import com.example.auditchain.models.AuditLogItem;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

class InMemoryAuditLogAccess implements AuditLogAccess {

    private final ConcurrentHashMap<String, AuditLogItem> items = new ConcurrentHashMap<>();

    @Override
    public void put(AuditLogItem item) {
        String key = item.getChainId() + "#" + item.getSequence();
        if (items.putIfAbsent(key, item) != null) {
            throw new IllegalStateException("Link already exists: " + key);
        }
    }

    @Override
    public Optional<AuditLogItem> findLatest(String chainId) {
        return items.values().stream()
                .filter(i -> i.getChainId().equals(chainId))
                .max(Comparator.comparing(AuditLogItem::getSequence));
    }

    @Override
    public List<AuditLogItem> findAllByChainId(String chainId) {
        return items.values().stream()
                .filter(i -> i.getChainId().equals(chainId))
                .sorted(Comparator.comparing(AuditLogItem::getSequence))
                .collect(Collectors.toList());
    }

    public int size() {
        return items.size();
    }
}
