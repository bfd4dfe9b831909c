package com.example.iam.audit;

import com.example.iam.authz.model.Decision;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.observability.metrics.IamMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Guards the configured {@link AuditEmitter}. An emission failure is logged and counted
 * but never reaches the caller, so it cannot change a decision or a token operation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditPublisher {

    private final AuditEmitter emitter;
    private final IamMetrics metrics;

    public void publish(@NonNull Decision decision) {
        try {
            emitter.emit(decision);
        } catch (RuntimeException e) {
            metrics.recordAuditEmitFailure();
            log.error("Audit emitter rejected decision {} ({} {} on {}/{}): {}",
                    decision.id(), decision.outcome(), StringSanitizer.forLog(decision.action()),
                    StringSanitizer.forLog(decision.resourceType()), StringSanitizer.forLog(decision.resourceId()),
                    StringSanitizer.forLog(e.getMessage()), e);
        }
    }

    public void publish(@NonNull TokenEvent event) {
        try {
            emitter.emit(event);
        } catch (RuntimeException e) {
            metrics.recordAuditEmitFailure();
            log.error("Audit emitter rejected token event {} ({} for session {}): {}",
                    event.eventId(), event.type(), StringSanitizer.forLog(event.sessionId()),
                    StringSanitizer.forLog(e.getMessage()), e);
        }
    }
}
