package com.example.iam.audit;

import com.example.iam.authz.model.Decision;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes audit events as structured JSON to the {@code IAM_AUDIT} logger.
 * Allowed decisions log at INFO, denials at WARN and fail-closed errors at ERROR.
 */
public class LoggingAuditEmitter implements AuditEmitter {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("IAM_AUDIT");

    private final ObjectMapper objectMapper;
    private final AuditRecordHasher hasher;

    public LoggingAuditEmitter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.hasher = new AuditRecordHasher(objectMapper);
    }

    @Override
    public void emit(@NonNull Decision decision) {
        Map<String, Object> record = toStructuredLog(decision);
        try {
            String json = seal(record);
            if (decision.error()) {
                AUDIT_LOG.error(json);
            } else if (decision.isAllowed()) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize decision audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("AuthZ {} - decision={}, subject={}, resource={}/{}, action={}, reasons={}",
                    decision.outcome(),
                    decision.id(),
                    StringSanitizer.forLog(decision.subjectId()),
                    StringSanitizer.forLog(decision.resourceType()),
                    StringSanitizer.forLog(decision.resourceId()),
                    StringSanitizer.forLog(decision.action()),
                    StringSanitizer.forLog(decision.reasons().toString(), 256));
        }
    }

    @Override
    public void emit(@NonNull TokenEvent event) {
        Map<String, Object> record = toStructuredLog(event);
        try {
            String json = seal(record);
            if (event.type().isSecuritySignal()) {
                AUDIT_LOG.warn(json);
            } else {
                AUDIT_LOG.info(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize token audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Token {} - subject={}, session={}, version={}",
                    event.type(),
                    StringSanitizer.forLog(event.subjectId()),
                    StringSanitizer.forLog(event.sessionId()),
                    event.tokenVersion());
        }
    }

    private String seal(Map<String, Object> record) throws JsonProcessingException {
        record.put(AuditRecordHasher.HASH_FIELD, hasher.hash(record));
        return objectMapper.writeValueAsString(record);
    }

    static Map<String, Object> toStructuredLog(Decision decision) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("event_type", "authz_decision");
        record.put("event_id", decision.id());
        record.put("timestamp", String.valueOf(decision.timestamp()));
        record.put("outcome", decision.outcome().name());
        record.put("error", decision.error());
        record.put("subject_id", nullToEmpty(decision.subjectId()));
        record.put("action", nullToEmpty(decision.action()));
        record.put("resource_type", nullToEmpty(decision.resourceType()));
        record.put("resource_id", nullToEmpty(decision.resourceId()));
        record.put("role_graph_version", decision.roleGraphVersion());
        record.put("policy_store_version", decision.policyStoreVersion());
        record.put("reasons", reasons(decision.reasons()));
        return record;
    }

    static Map<String, Object> toStructuredLog(TokenEvent event) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("event_type", "token_" + event.type().name().toLowerCase());
        record.put("event_id", event.eventId());
        record.put("timestamp", String.valueOf(event.timestamp()));
        record.put("subject_id", nullToEmpty(event.subjectId()));
        record.put("session_id", nullToEmpty(event.sessionId()));
        record.put("token_version", event.tokenVersion());
        record.put("detail", nullToEmpty(event.detail()));
        return record;
    }

    private static List<Map<String, Object>> reasons(List<ReasonEntry> reasons) {
        return reasons.stream()
                .map(reason -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("kind", reason.kind().name());
                    entry.put("source_id", nullToEmpty(reason.sourceId()));
                    entry.put("version", reason.version());
                    entry.put("detail", nullToEmpty(reason.detail()));
                    return entry;
                })
                .toList();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
