package com.example.auditchain.http;

import com.example.auditchain.models.AuditEntry;
import com.example.auditchain.requests.RecordInteractionHttpRequest;
import com.example.auditchain.requests.RecordInteractionServiceRequest;
import com.example.auditchain.service.InteractionAuditService;
import jakarta.validation.Valid;
import java.util.Base64;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for recording interactions. Converts the HTTP payload into a service command
 * carrying the filter-resolved trace id and returns the signed chain entry.
 */
@RestController
public class InteractionController {

    private final InteractionAuditService interactionAuditService;

    public InteractionController(InteractionAuditService interactionAuditService) {
        this.interactionAuditService = interactionAuditService;
    }

    @PostMapping("/interactions")
    public ResponseEntity<AuditEntry> recordInteraction(
            @RequestAttribute(TraceIdFilter.ATTRIBUTE) String traceId,
            @Valid @RequestBody RecordInteractionHttpRequest request
    ) {
        byte[] attachment = request.attachmentBase64() == null
                ? null
                : Base64.getDecoder().decode(request.attachmentBase64());

        RecordInteractionServiceRequest command = new RecordInteractionServiceRequest(
                traceId,
                request.method(),
                request.model(),
                request.language(),
                request.prompt(),
                request.response(),
                request.status(),
                request.tokens(),
                attachment
        );

        return ResponseEntity.ok(interactionAuditService.recordInteraction(command));
    }
}
