package com.example.iam.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.lang.NonNull;

import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 integrity hash over an audit record. Keys are sorted so the hash does not
 * depend on map iteration order.
 */
public class AuditRecordHasher {

    public static final String HASH_FIELD = "integrity_hash";

    private final ObjectMapper objectMapper;

    public AuditRecordHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @NonNull
    public String hash(@NonNull Map<String, Object> record) throws JsonProcessingException {
        Map<String, Object> canonical = new TreeMap<>(record);
        canonical.remove(HASH_FIELD);
        return DigestUtils.sha256Hex(objectMapper.writeValueAsString(canonical));
    }

    public boolean verify(@NonNull Map<String, Object> record) throws JsonProcessingException {
        Object stored = record.get(HASH_FIELD);
        return stored != null && stored.equals(hash(record));
    }
}
