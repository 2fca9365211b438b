package com.example.auditchain.access;

import com.example.auditchain.config.AuditChainProperties;
import com.example.auditchain.models.AuditLogItem;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
@ConditionalOnProperty(value = "audit.chain.store", havingValue = "dynamo")
public class DynamoAuditLogAccess implements AuditLogAccess {

    private final DynamoDbTable<AuditLogItem> table;

    @Autowired
    public DynamoAuditLogAccess(DynamoDbEnhancedClient enhancedClient, AuditChainProperties properties) {
        this(enhancedClient, properties.getDynamoTable());
    }

    public DynamoAuditLogAccess(DynamoDbEnhancedClient enhancedClient, String tableName) {
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(AuditLogItem.class));
    }

    @Override
    public void put(AuditLogItem item) {
        // A link is never overwritten; a second writer on the same sequence fails instead.
        Expression notExists = Expression.builder()
                .expression("attribute_not_exists(chain_id)")
                .build();
        table.putItem(PutItemEnhancedRequest.builder(AuditLogItem.class)
                .item(item)
                .conditionExpression(notExists)
                .build());
    }

    @Override
    public Optional<AuditLogItem> findLatest(String chainId) {
        // Query the partition in reverse sequence order so the first item is the chain head.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(chainId)))
                        .limit(1)
                        .scanIndexForward(false))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<AuditLogItem> findAllByChainId(String chainId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(chainId)))
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    private Key buildKey(String chainId) {
        return Key.builder().partitionValue(chainId).build();
    }
}
