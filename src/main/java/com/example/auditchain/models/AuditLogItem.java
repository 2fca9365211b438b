package com.example.auditchain.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Persisted form of one chain link: the finalized entry plus its position in the chain.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditLogItem {

    @NonNull private String chainId;     // PK
    @NonNull private Long sequence;      // SK, 0 for the first link
    @NonNull private String traceId;
    @NonNull private String logHash;
    @NonNull private String previousHash;
    @NonNull private Long recordedAt;
    @NonNull private AuditEntry entry;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_id")
    public String getChainId() { return chainId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("trace_id")
    public String getTraceId() { return traceId; }

    @DynamoDbAttribute("log_hash")
    public String getLogHash() { return logHash; }

    @DynamoDbAttribute("previous_hash")
    public String getPreviousHash() { return previousHash; }

    @DynamoDbAttribute("recorded_at")
    public Long getRecordedAt() { return recordedAt; }

    @DynamoDbConvertedBy(AuditEntryAttributeConverter.class)
    @DynamoDbAttribute("entry")
    public AuditEntry getEntry() { return entry; }

    public static AuditLogItem of(String chainId, long sequence, long recordedAt, AuditEntry entry) {
        return AuditLogItem.builder()
                .chainId(chainId)
                .sequence(sequence)
                .traceId(entry.getId())
                .logHash(entry.getIntegrity().getLogHash())
                .previousHash(entry.getIntegrity().getPreviousHash())
                .recordedAt(recordedAt)
                .entry(entry)
                .build();
    }
}
