package com.spending.fraud.alert;

import com.spending.fraud.core.model.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Storage for alerts. The engine serializes check-then-insert per duplicate key, so
 * implementations only need thread-safe single operations.
 */
public interface AlertRepository {

    /**
     * Stores a new alert, assigning its id. The id of the passed alert is ignored.
     */
    Alert insert(Alert alert);

    Optional<Alert> findById(long id);

    /**
     * The open alert for the type and entity, if any.
     */
    Optional<Alert> findOpen(String alertType, EntityKind entityKind, Long entityId);

    Optional<Alert> updateStatus(long id, AlertStatus status);

    List<Alert> findAll();

    List<Alert> findByType(String alertType);

    int count();
}
