package com.example.auditchain.models;

import com.example.auditchain.util.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores the whole entry document as one JSON string attribute so it reads back byte-for-byte
 * equivalent for hash recomputation.
 */
public class AuditEntryAttributeConverter implements AttributeConverter<AuditEntry> {

    private static final ObjectMapper MAPPER = CanonicalJson.mapper();

    @Override
    public AttributeValue transformFrom(AuditEntry input) {
        try {
            return AttributeValue.builder().s(MAPPER.writeValueAsString(input)).build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit entry", e);
        }
    }

    @Override
    public AuditEntry transformTo(AttributeValue attributeValue) {
        try {
            return MAPPER.readValue(attributeValue.s(), AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in entry attribute", e);
        }
    }

    @Override
    public EnhancedType<AuditEntry> type() {
        return EnhancedType.of(AuditEntry.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S; // stored as a JSON string
    }
}
