package com.spending.fraud.alert;

import com.spending.fraud.core.model.EntityKind;

import java.util.Objects;

/**
 * What a rule asks the {@link AlertEngine} to create.
 *
 * @param alertType   rule-defined type, e.g. {@code contract_splitting}
 * @param entityKind  kind of the flagged entity, may be null for alerts without a subject
 * @param entityId    id of the flagged entity, may be null
 * @param evidence    typed evidence, serialized on insert
 */
public record AlertRequest(
        String alertType,
        AlertSeverity severity,
        String title,
        String description,
        EntityKind entityKind,
        Long entityId,
        AlertEvidence evidence
) {
    public AlertRequest {
        Objects.requireNonNull(alertType, "alertType is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(title, "title is required");
        if (alertType.isBlank()) {
            throw new IllegalArgumentException("alertType must not be blank");
        }
    }

    /**
     * Duplicate suppression needs a subject; requests without one are always inserted.
     */
    public boolean hasSubject() {
        return entityKind != null && entityId != null;
    }

    public String dedupKey() {
        return alertType + "|" + entityKind + "|" + entityId;
    }
}
