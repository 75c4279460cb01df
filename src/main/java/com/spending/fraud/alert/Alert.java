package com.spending.fraud.alert;

import com.spending.fraud.core.model.EntityKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored alert. Evidence is the serialized form of the request's typed evidence.
 */
public record Alert(
        long id,
        String alertType,
        AlertSeverity severity,
        String title,
        String description,
        EntityKind entityKind,
        Long entityId,
        Map<String, Object> evidence,
        AlertStatus status,
        Instant createdAt
) {
    public Alert {
        Objects.requireNonNull(alertType, "alertType is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        evidence = evidence != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(evidence))
                : Map.of();
    }

    public Alert withStatus(AlertStatus newStatus) {
        return new Alert(id, alertType, severity, title, description, entityKind, entityId,
                evidence, newStatus, createdAt);
    }

    /**
     * True if this alert is open and concerns the given type and entity.
     */
    public boolean blocks(String type, EntityKind kind, Long entity) {
        return status.isOpen()
                && alertType.equals(type)
                && entityKind == kind
                && Objects.equals(entityId, entity);
    }
}
