package com.example.iam.audit;

import com.example.iam.authz.model.Decision;

/**
 * Receiver of audit events. Storage and retention are the implementation's concern.
 *
 * <p>Implementations may throw; callers go through {@link AuditPublisher}, which never
 * lets an emission failure affect a decision.
 */
public interface AuditEmitter {

    void emit(Decision decision);

    void emit(TokenEvent event);
}
